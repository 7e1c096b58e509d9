package com.specguard.core.detector;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.specguard.core.ir.IntermediateRepresentation;
import com.specguard.core.trace.ExecutionTrace;
import com.specguard.core.trace.IssueCategory;
import com.specguard.core.trace.SemanticIssue;

/**
 * First/last confusion in search loops.
 *
 * "first" intent + loop without an immediate return → the loop may run to the end
 * and hand back the LAST match. "last" intent + immediate return → the FIRST match
 * may be returned instead.
 */
@Component
public class OffByOneDetector implements LogicPatternDetector {

    private static final List<String> IMMEDIATE_WORDS = List.of("when", "if", "immediately");
    private static final List<String> LOOP_WORDS = List.of("iterate", "loop", "for", "while", "through");

    @Override
    public String getName() {
        return "off-by-one";
    }

    @Override
    public List<SemanticIssue> detect(IntermediateRepresentation ir, ExecutionTrace trace) {
        List<SemanticIssue> issues = new ArrayList<>();

        String intent = Wording.intentText(ir);
        List<String> effects = Wording.effectTexts(ir);
        String allEffects = String.join(" ", effects);

        boolean hasImmediateReturn = effects.stream().anyMatch(this::isImmediateReturn);

        if (Wording.hasWord(intent, "first") && !hasImmediateReturn) {

            if (allEffects.contains("enumerate")) {
                issues.add(SemanticIssue.warning(
                        IssueCategory.OFF_BY_ONE,
                        "Intent says 'first' but enumerate loop may return LAST match instead. "
                                + "Ensure you return immediately when found, not after loop completes.",
                        null,
                        "Add effect: 'Return the index immediately when found' "
                                + "or 'Break loop after finding first match'"
                ));
            }

            if (Wording.hasAnyWord(allEffects, LOOP_WORDS) || trace.hasOperation("iterate")) {
                issues.add(SemanticIssue.warning(
                        IssueCategory.OFF_BY_ONE,
                        "Intent says 'first' but effects don't specify immediate return. "
                                + "May return last occurrence instead of first.",
                        null,
                        "Add effect: 'Return immediately when found' to ensure first match is returned"
                ));
            }
        }

        if (Wording.hasWord(intent, "last") && hasImmediateReturn) {
            issues.add(SemanticIssue.warning(
                    IssueCategory.OFF_BY_ONE,
                    "Intent says 'last' but effects specify immediate return. "
                            + "May return first occurrence instead of last.",
                    null,
                    "Remove immediate return, or store index and return after loop completes"
            ));
        }

        return issues;
    }

    private boolean isImmediateReturn(String effect) {
        return effect.contains("return") && Wording.hasAnyWord(effect, IMMEDIATE_WORDS);
    }
}
