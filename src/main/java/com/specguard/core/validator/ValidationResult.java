package com.specguard.core.validator;

import java.util.List;
import java.util.stream.Collectors;

import com.specguard.core.trace.SemanticIssue;

/**
 * Outcome of the semantic validation pass: all issues plus the error/warning split.
 * {@code passed} is true when no error-level issue was found.
 */
public class ValidationResult {

    private final boolean passed;
    private final List<SemanticIssue> issues;
    private final List<SemanticIssue> errors;
    private final List<SemanticIssue> warnings;

    public ValidationResult(
            boolean passed,
            List<SemanticIssue> issues,
            List<SemanticIssue> errors,
            List<SemanticIssue> warnings
    ) {
        this.passed   = passed;
        this.issues   = issues != null ? List.copyOf(issues) : List.of();
        this.errors   = errors != null ? List.copyOf(errors) : List.of();
        this.warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static ValidationResult of(List<SemanticIssue> issues) {
        List<SemanticIssue> errors = issues.stream()
                .filter(SemanticIssue::isError)
                .collect(Collectors.toList());
        List<SemanticIssue> warnings = issues.stream()
                .filter(SemanticIssue::isWarning)
                .collect(Collectors.toList());
        return new ValidationResult(errors.isEmpty(), issues, errors, warnings);
    }

    public boolean isPassed()               { return passed; }
    public List<SemanticIssue> getIssues()   { return issues; }
    public List<SemanticIssue> getErrors()   { return errors; }
    public List<SemanticIssue> getWarnings() { return warnings; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Semantic Validation: ")
                .append(passed ? "PASSED" : "FAILED");
        if (!errors.isEmpty()) {
            sb.append("\n\nErrors (").append(errors.size()).append("):");
            errors.forEach(e -> sb.append("\n  ").append(e));
        }
        if (!warnings.isEmpty()) {
            sb.append("\n\nWarnings (").append(warnings.size()).append("):");
            warnings.forEach(w -> sb.append("\n  ").append(w));
        }
        return sb.toString();
    }
}
