package com.specguard.interpreter;

import java.util.List;
import java.util.stream.Collectors;

import com.specguard.core.ir.IntermediateRepresentation;
import com.specguard.core.trace.ExecutionTrace;
import com.specguard.core.trace.SemanticIssue;
import com.specguard.core.validator.ValidationResult;

/**
 * Output of one interpret call: the input IR, its trace, the validator's verdict and
 * the deduplicated union of every issue found.
 *
 * Results from different IRs are independent and are never merged.
 */
public class InterpretationResult {

    private final IntermediateRepresentation ir;
    private final ExecutionTrace trace;
    private final ValidationResult validation;
    private final List<SemanticIssue> allIssues;

    public InterpretationResult(
            IntermediateRepresentation ir,
            ExecutionTrace trace,
            ValidationResult validation,
            List<SemanticIssue> allIssues
    ) {
        this.ir         = ir;
        this.trace      = trace;
        this.validation = validation;
        this.allIssues  = allIssues != null ? List.copyOf(allIssues) : List.of();
    }

    public IntermediateRepresentation getIr() { return ir; }
    public ExecutionTrace getTrace()          { return trace; }
    public ValidationResult getValidation()   { return validation; }
    public List<SemanticIssue> getAllIssues() { return allIssues; }

    public boolean hasErrors() {
        return allIssues.stream().anyMatch(SemanticIssue::isError);
    }

    public boolean hasWarnings() {
        return allIssues.stream().anyMatch(SemanticIssue::isWarning);
    }

    public List<SemanticIssue> getErrors() {
        return allIssues.stream().filter(SemanticIssue::isError).collect(Collectors.toList());
    }

    public List<SemanticIssue> getWarnings() {
        return allIssues.stream().filter(SemanticIssue::isWarning).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("IR Interpretation: ")
                .append(hasErrors() ? "FAILED" : "PASSED");

        List<SemanticIssue> errors = getErrors();
        if (!errors.isEmpty()) {
            sb.append("\n\nErrors (").append(errors.size()).append("):");
            errors.forEach(e -> sb.append("\n  ").append(e));
        }

        List<SemanticIssue> warnings = getWarnings();
        if (!warnings.isEmpty()) {
            sb.append("\n\nWarnings (").append(warnings.size()).append("):");
            warnings.forEach(w -> sb.append("\n  ").append(w));
        }

        sb.append("\n\nExecution Trace:");
        sb.append("\n  Values: ").append(trace.getValues().size());
        sb.append("\n  Operations: ").append(trace.getOperations().isEmpty()
                ? "None" : String.join(", ", trace.getOperations()));
        sb.append("\n  Return: ").append(trace.hasReturnValue() ? trace.getReturnValue() : "None");
        return sb.toString();
    }
}
