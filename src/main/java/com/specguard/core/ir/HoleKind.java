package com.specguard.core.ir;

import java.util.Locale;

/**
 * Semantic purpose of a typed hole.
 *
 * INTENT         - unresolved part of the stated intent
 * SIGNATURE      - unknown parameter or return type
 * EFFECT         - unknown step in the effect narrative
 * ASSERTION      - unknown predicate detail
 * IMPLEMENTATION - left open for the code generator
 */
public enum HoleKind {
    INTENT,
    SIGNATURE,
    EFFECT,
    ASSERTION,
    IMPLEMENTATION;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static HoleKind fromCode(String code) {
        if (code == null || code.isBlank()) return INTENT;
        return HoleKind.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
