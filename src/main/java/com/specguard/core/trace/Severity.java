package com.specguard.core.trace;

import java.util.Locale;

/**
 * Severity of a semantic issue.
 *
 * ERROR   - blocks code generation (unresolvable return, confirmed type error,
 *           confirmed incomplete branch coverage)
 * WARNING - advisory only; never blocks generation
 */
public enum Severity {
    ERROR,
    WARNING;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
