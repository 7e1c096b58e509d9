package com.specguard.core.trace;

import java.util.Locale;

/** Where a symbolic value comes from. */
public enum ValueSource {
    PARAMETER,
    COMPUTED,
    LITERAL;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
