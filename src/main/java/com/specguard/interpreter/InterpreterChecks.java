package com.specguard.interpreter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;

import com.specguard.core.analyzer.OperationVocabulary;
import com.specguard.core.detector.Wording;
import com.specguard.core.ir.IntermediateRepresentation;
import com.specguard.core.ir.Parameter;
import com.specguard.core.trace.ExecutionTrace;
import com.specguard.core.trace.IssueCategory;
import com.specguard.core.trace.SemanticIssue;
import com.specguard.core.trace.SymbolicValue;

/**
 * InterpreterChecks: cross-cutting checks run by the interpreter on the finished trace.
 *
 *   returnRevalidation  - a return is mentioned but nothing was resolved (error)
 *   loopTermination     - iteration without any stop/condition wording (warning)
 *   variableShadowing   - a computed value reuses a parameter name (warning)
 *   typeConsistency     - count/index values that are not int (error)
 *   controlFlow         - if without else: incomplete branch (warning),
 *                         unproven return on every path (error)
 *
 * returnRevalidation only fires when the trace holds no return value at all. The
 * analyzer records a placeholder for every effect worded as a return, even an
 * unresolved one, so in practice this means the return effect itself failed to
 * parse (a parse_failure warning sits next to it). Ordinary unresolved returns
 * stay the analyzer's missing_return / undefined_variable warnings.
 */
@Component
public class InterpreterChecks {

    private static final List<String> TERMINATION_WORDS =
            List.of("until", "while", "when", "if", "condition", "each", "every", "all", "end", "break");

    private static final List<String> ELSE_WORDS = List.of("else", "otherwise");
    private static final List<String> CONDITION_WORDS = List.of("if", "when");

    public List<SemanticIssue> runAll(IntermediateRepresentation ir, ExecutionTrace trace) {
        List<SemanticIssue> issues = new ArrayList<>();
        issues.addAll(returnRevalidation(ir, trace));
        issues.addAll(loopTermination(ir, trace));
        issues.addAll(variableShadowing(ir, trace));
        issues.addAll(typeConsistency(ir, trace));
        issues.addAll(controlFlow(ir, trace));
        return issues;
    }

    // =========================================================================
    // (a) Return re-validation
    // =========================================================================

    public List<SemanticIssue> returnRevalidation(IntermediateRepresentation ir, ExecutionTrace trace) {
        if (!ir.getSignature().declaresReturn() || trace.hasReturnValue()) {
            return List.of();
        }

        List<String> effects = Wording.effectTexts(ir);
        for (int i = 0; i < effects.size(); i++) {
            if (Wording.hasWord(effects.get(i), "return")) {
                return List.of(SemanticIssue.error(
                        IssueCategory.MISSING_RETURN,
                        "Effect " + (i + 1) + " mentions a return but no returned value could be resolved "
                                + "for return type '" + ir.getSignature().getReturns() + "'",
                        i,
                        "Name the returned value explicitly, e.g. 'Return the result'"
                ));
            }
        }
        return List.of();
    }

    // =========================================================================
    // (b) Loop termination
    // =========================================================================

    public List<SemanticIssue> loopTermination(IntermediateRepresentation ir, ExecutionTrace trace) {
        if (!trace.hasOperation(OperationVocabulary.ITERATE)) {
            return List.of();
        }

        List<String> effects = Wording.effectTexts(ir);
        if (Wording.hasAnyWord(String.join(" ", effects), TERMINATION_WORDS)) {
            return List.of();
        }

        Integer loopIndex = null;
        for (int i = 0; i < effects.size(); i++) {
            if (OperationVocabulary.ITERATE.equals(OperationVocabulary.detect(effects.get(i)))) {
                loopIndex = i;
                break;
            }
        }

        return List.of(SemanticIssue.warning(
                IssueCategory.LOOP_TERMINATION,
                "Effects iterate but never state when the loop stops",
                loopIndex,
                "Add a condition, e.g. 'Stop when the target is found' or 'Iterate over each item'"
        ));
    }

    // =========================================================================
    // (c) Variable shadowing
    // =========================================================================

    public List<SemanticIssue> variableShadowing(IntermediateRepresentation ir, ExecutionTrace trace) {
        List<SemanticIssue> issues = new ArrayList<>();
        for (Parameter param : ir.getSignature().getParameters()) {
            SymbolicValue current = trace.getValue(param.getName());
            if (current == null || !current.isComputed()) continue;

            Integer at = current.getEffectIndex();
            issues.add(SemanticIssue.warning(
                    IssueCategory.VARIABLE_SHADOWING,
                    "Computed value '" + current.getName() + "'"
                            + (at != null ? " (effect " + (at + 1) + ")" : "")
                            + " shadows the parameter of the same name",
                    at,
                    "Store the computed value under a new name, e.g. '" + current.getName() + "_result'"
            ));
        }
        return issues;
    }

    // =========================================================================
    // (d) Type consistency
    // =========================================================================

    public List<SemanticIssue> typeConsistency(IntermediateRepresentation ir, ExecutionTrace trace) {
        List<SemanticIssue> issues = new ArrayList<>();
        for (SymbolicValue value : trace.getComputedValues()) {
            if (!isIntegerNamed(value.getName())) continue;

            String type = value.getTypeHint();
            if (SymbolicValue.ANY_TYPE.equals(type) || "int".equals(type)) continue;

            issues.add(SemanticIssue.error(
                    IssueCategory.TYPE_MISMATCH,
                    "Value '" + value.getName() + "' is a count or index but resolves to '" + type + "'",
                    value.getEffectIndex(),
                    "Make '" + value.getName() + "' an int or rename it"
            ));
        }
        return issues;
    }

    private boolean isIntegerNamed(String name) {
        String n = name.toLowerCase(Locale.ROOT);
        return n.equals("count") || n.endsWith("_count")
                || n.equals("index") || n.endsWith("_index");
    }

    // =========================================================================
    // (e) Control-flow completeness
    // =========================================================================

    public List<SemanticIssue> controlFlow(IntermediateRepresentation ir, ExecutionTrace trace) {
        if (!trace.hasOperation(OperationVocabulary.IF)) {
            return List.of();
        }

        List<String> effects = Wording.effectTexts(ir);
        boolean hasElse = trace.hasOperation(OperationVocabulary.ELSE)
                || Wording.hasAnyWord(String.join(" ", effects), ELSE_WORDS);
        if (hasElse) {
            return List.of();
        }

        Integer ifIndex = null;
        for (int i = 0; i < effects.size(); i++) {
            if (OperationVocabulary.IF.equals(OperationVocabulary.detect(effects.get(i)))) {
                ifIndex = i;
                break;
            }
        }

        List<SemanticIssue> issues = new ArrayList<>();

        boolean returnsInsideCondition = effects.stream().anyMatch(e ->
                OperationVocabulary.isReturnEffect(e) && Wording.hasAnyWord(e, CONDITION_WORDS));

        if (!returnsInsideCondition) {
            issues.add(SemanticIssue.warning(
                    IssueCategory.INCOMPLETE_BRANCH,
                    "Conditional step has no else branch and no return inside the condition",
                    ifIndex,
                    "Describe what happens when the condition is false"
            ));
        }

        if (ir.getSignature().declaresReturn() && trace.hasReturnValue()) {
            issues.add(SemanticIssue.error(
                    IssueCategory.MISSING_RETURN_PATH,
                    "Function returns '" + ir.getSignature().getReturns()
                            + "' but not every path is shown to return: conditional step has no else branch",
                    ifIndex,
                    "Add effect: 'Otherwise, return <default value>'"
            ));
        }
        return issues;
    }
}
