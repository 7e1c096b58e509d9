package com.specguard.core.validator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.specguard.core.ir.AssertClause;
import com.specguard.core.ir.EffectClause;
import com.specguard.core.ir.IntermediateRepresentation;
import com.specguard.core.ir.Parameter;
import com.specguard.core.trace.ExecutionTrace;
import com.specguard.core.trace.IssueCategory;
import com.specguard.core.trace.SemanticIssue;
import com.specguard.core.trace.SymbolicValue;

/**
 * SemanticValidator: structural consistency between the IR and its trace.
 *
 * Checks:
 *   - return consistency: declared return type vs. inferred type of the returned value
 *   - parameter usage: every parameter is mentioned (by name or type synonym) in the effects
 *   - assertion coverage: result-like assertions refer to something the trace knows about
 *
 * Advisory only: every issue raised here is a warning. The result also carries the
 * issues the analyzer already attached to the trace.
 */
@Component
public class SemanticValidator {

    private static final Logger log = LoggerFactory.getLogger(SemanticValidator.class);

    private static final List<String> RETURN_REFERENCES = List.of("return", "result", "output");
    private static final List<String> RESULT_VOCABULARY = List.of("result", "output", "computed", "calculated");

    public ValidationResult validate(IntermediateRepresentation ir, ExecutionTrace trace) {
        List<SemanticIssue> issues = new ArrayList<>(trace.getIssues());

        issues.addAll(validateReturnConsistency(ir, trace));
        issues.addAll(validateParameterUsage(ir, trace));
        issues.addAll(validateAssertionCoverage(ir, trace));

        ValidationResult result = ValidationResult.of(issues);
        log.debug("[Validator] {} → passed={}, errors={}, warnings={}",
                ir.getSignature().getName(), result.isPassed(),
                result.getErrors().size(), result.getWarnings().size());
        return result;
    }

    public List<SemanticIssue> validateReturnConsistency(IntermediateRepresentation ir, ExecutionTrace trace) {
        List<SemanticIssue> issues = new ArrayList<>();

        // Missing return is reported by the analyzer; only type agreement is checked here
        if (!ir.getSignature().declaresReturn() || !trace.hasReturnValue()) {
            return issues;
        }

        String expected = ir.getSignature().getReturns();
        String actual   = trace.getReturnValue().getTypeHint();

        if (!TypeCompatibility.compatible(expected, actual)) {
            issues.add(SemanticIssue.warning(
                    IssueCategory.TYPE_MISMATCH,
                    "Return type mismatch: signature says '" + expected
                            + "' but effect chain returns '" + actual + "'",
                    trace.getReturnValue().getEffectIndex(),
                    "Update effects to produce " + expected + ", or update signature"
            ));
        }
        return issues;
    }

    public List<SemanticIssue> validateParameterUsage(IntermediateRepresentation ir, ExecutionTrace trace) {
        List<SemanticIssue> issues = new ArrayList<>();

        String effectText = ir.getEffects().stream()
                .map(EffectClause::getDescription)
                .map(d -> d.toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));

        for (Parameter param : ir.getSignature().getParameters()) {
            if (effectText.contains(param.getName().toLowerCase(Locale.ROOT))) {
                continue;
            }
            boolean referencedByType = TypeCompatibility.synonymsFor(param.getTypeHint()).stream()
                    .anyMatch(effectText::contains);
            if (!referencedByType) {
                issues.add(SemanticIssue.warning(
                        IssueCategory.UNUSED_PARAMETER,
                        "Parameter '" + param.getName() + "' may not be used in effects",
                        null,
                        "Add effect that uses '" + param.getName() + "' or remove parameter from signature"
                ));
            }
        }
        return issues;
    }

    public List<SemanticIssue> validateAssertionCoverage(IntermediateRepresentation ir, ExecutionTrace trace) {
        List<SemanticIssue> issues = new ArrayList<>();
        if (ir.getAssertions().isEmpty()) {
            return issues;
        }

        Set<String> valueNames = trace.getValues().keySet();

        for (AssertClause assertion : ir.getAssertions()) {
            String predicate = assertion.getPredicate().toLowerCase(Locale.ROOT);

            boolean referencesKnownValue = Arrays.stream(predicate.split("\\s+"))
                    .map(token -> token.replaceAll("[^\\w]", ""))
                    .anyMatch(valueNames::contains);
            if (referencesKnownValue) {
                continue;
            }

            if (referencesReturnValue(predicate, trace.getReturnValue())) {
                continue;
            }

            if (RESULT_VOCABULARY.stream().anyMatch(predicate::contains)) {
                issues.add(SemanticIssue.warning(
                        IssueCategory.ASSERTION_COVERAGE,
                        "Assertion '" + assertion.getPredicate() + "' may reference non-existent values",
                        null,
                        "Ensure effects produce values needed for assertions"
                ));
            }
        }
        return issues;
    }

    private boolean referencesReturnValue(String predicate, SymbolicValue returnValue) {
        if (returnValue == null) return false;
        if (RETURN_REFERENCES.stream().anyMatch(predicate::contains)) return true;
        return predicate.contains(returnValue.getName().toLowerCase(Locale.ROOT));
    }
}
