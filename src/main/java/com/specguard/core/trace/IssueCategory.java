package com.specguard.core.trace;

import java.util.Locale;

/**
 * Closed vocabulary of issue categories. {@link #code()} is the stable snake_case
 * identifier surfaced to callers and used as half of the deduplication key.
 */
public enum IssueCategory {
    MISSING_RETURN,
    MISSING_RETURN_PATH,
    OFF_BY_ONE,
    INVALID_LOGIC,
    UNREACHABLE_CODE,
    TYPE_MISMATCH,
    UNUSED_PARAMETER,
    VARIABLE_SHADOWING,
    UNDEFINED_VARIABLE,
    INCOMPLETE_BRANCH,
    ASSERTION_COVERAGE,
    LOOP_TERMINATION,
    PARSE_FAILURE,
    INTERNAL_ERROR;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
