package com.specguard.core.trace;

import java.util.Objects;

/**
 * SemanticIssue: one detected defect or risk.
 *
 * Pure data. Two issues are duplicates when category and message match; see
 * {@link #dedupKey()}. Severity, effect index and suggestion do not take part.
 */
public class SemanticIssue {

    private final Severity severity;
    private final IssueCategory category;
    private final String message;
    private final Integer effectIndex;
    private final String suggestion;

    public SemanticIssue(
            Severity severity,
            IssueCategory category,
            String message,
            Integer effectIndex,
            String suggestion
    ) {
        this.severity    = Objects.requireNonNull(severity, "severity");
        this.category    = Objects.requireNonNull(category, "category");
        this.message     = message != null ? message : "";
        this.effectIndex = effectIndex;
        this.suggestion  = suggestion;
    }

    public static SemanticIssue error(IssueCategory category, String message, Integer effectIndex, String suggestion) {
        return new SemanticIssue(Severity.ERROR, category, message, effectIndex, suggestion);
    }

    public static SemanticIssue warning(IssueCategory category, String message, Integer effectIndex, String suggestion) {
        return new SemanticIssue(Severity.WARNING, category, message, effectIndex, suggestion);
    }

    public Severity getSeverity()      { return severity; }
    public IssueCategory getCategory() { return category; }
    public String getMessage()         { return message; }
    public Integer getEffectIndex()    { return effectIndex; }
    public String getSuggestion()      { return suggestion; }

    public boolean isError()   { return severity == Severity.ERROR; }
    public boolean isWarning() { return severity == Severity.WARNING; }

    /** Deduplication key: {@code category|message}. */
    public String dedupKey() {
        return category.code() + "|" + message;
    }

    @Override
    public String toString() {
        String prefix   = isError() ? "[ERROR]" : "[WARNING]";
        String location = effectIndex != null ? " (effect " + effectIndex + ")" : "";
        return prefix + " " + message + location;
    }
}
