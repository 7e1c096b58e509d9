package com.specguard.interpreter.report;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Serializable view of an interpretation result.
 */
public class InterpretationReport {

    private final String function;
    private final boolean proceed;
    private final int errorCount;
    private final int warningCount;
    private final List<String> operations;
    private final String returnValue;
    private final List<IssueView> issues;

    public InterpretationReport(
            String function,
            boolean proceed,
            int errorCount,
            int warningCount,
            List<String> operations,
            String returnValue,
            List<IssueView> issues
    ) {
        this.function     = function;
        this.proceed      = proceed;
        this.errorCount   = errorCount;
        this.warningCount = warningCount;
        this.operations   = List.copyOf(operations);
        this.returnValue  = returnValue;
        this.issues       = List.copyOf(issues);
    }

    @JsonProperty("function")
    public String getFunction() { return function; }

    @JsonProperty("proceed")
    public boolean isProceed() { return proceed; }

    @JsonProperty("error_count")
    public int getErrorCount() { return errorCount; }

    @JsonProperty("warning_count")
    public int getWarningCount() { return warningCount; }

    @JsonProperty("operations")
    public List<String> getOperations() { return operations; }

    @JsonProperty("return_value")
    public String getReturnValue() { return returnValue; }

    @JsonProperty("issues")
    public List<IssueView> getIssues() { return issues; }

    public static class IssueView {

        private final String severity;
        private final String category;
        private final String message;
        private final Integer effectIndex;
        private final String suggestion;

        public IssueView(String severity, String category, String message, Integer effectIndex, String suggestion) {
            this.severity    = severity;
            this.category    = category;
            this.message     = message;
            this.effectIndex = effectIndex;
            this.suggestion  = suggestion;
        }

        @JsonProperty("severity")
        public String getSeverity() { return severity; }

        @JsonProperty("category")
        public String getCategory() { return category; }

        @JsonProperty("message")
        public String getMessage() { return message; }

        @JsonProperty("effect_index")
        public Integer getEffectIndex() { return effectIndex; }

        @JsonProperty("suggestion")
        public String getSuggestion() { return suggestion; }
    }
}
