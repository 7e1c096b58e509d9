package com.specguard.core.ir;

/**
 * Raised when an IR document cannot be decoded.
 */
public class IrParseException extends RuntimeException {

    public IrParseException(String message) {
        super(message);
    }

    public IrParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
