package com.specguard.core.detector;

import java.util.List;

import org.springframework.stereotype.Component;

import com.specguard.core.ir.IntermediateRepresentation;
import com.specguard.core.trace.ExecutionTrace;
import com.specguard.core.trace.IssueCategory;
import com.specguard.core.trace.SemanticIssue;

/**
 * Effects listed after an unconditional return can never run.
 * Conditional returns ("if", "when", "else", "otherwise") are skipped when looking
 * for the terminating effect.
 */
@Component
public class UnreachableCodeDetector implements LogicPatternDetector {

    private static final List<String> RETURN_WORDING = List.of("return", "output", "yield", "give back");
    private static final List<String> CONDITIONAL_WORDS = List.of("if", "when", "else", "otherwise");

    @Override
    public String getName() {
        return "unreachable-code";
    }

    @Override
    public List<SemanticIssue> detect(IntermediateRepresentation ir, ExecutionTrace trace) {
        List<String> effects = Wording.effectTexts(ir);

        for (int i = 0; i < effects.size(); i++) {
            String effect = effects.get(i);
            if (!Wording.containsAny(effect, RETURN_WORDING)) continue;
            if (Wording.hasAnyWord(effect, CONDITIONAL_WORDS)) continue;

            int remaining = effects.size() - i - 1;
            if (remaining == 0) {
                return List.of();
            }
            return List.of(SemanticIssue.warning(
                    IssueCategory.UNREACHABLE_CODE,
                    "Effect " + (i + 1) + " returns a value, but " + remaining
                            + " effect(s) appear after it. These effects will never execute.",
                    i,
                    "Remove effects after return, or make return conditional"
            ));
        }
        return List.of();
    }
}
