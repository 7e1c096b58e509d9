package com.specguard.core.detector;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.specguard.core.ir.IntermediateRepresentation;
import com.specguard.core.trace.ExecutionTrace;
import com.specguard.core.trace.IssueCategory;
import com.specguard.core.trace.SemanticIssue;

/**
 * Validation predicates that check too little.
 *
 * Only runs when the intent uses a validation verb. Domains:
 *   email    - needs an '@' check, a '.' check and the dot-after-@ ordering
 *   phone    - needs a digit or length check
 *   password - needs a minimum-length check
 *
 * Best effort: the ordering check is keyword co-occurrence ("after" next to '@'),
 * not a structural reading of the effect, and can over- or under-trigger.
 */
@Component
public class IncompleteValidationDetector implements LogicPatternDetector {

    private static final List<String> VALIDATION_VERBS = List.of("valid", "validate", "check", "verify", "ensure");

    // A '.' that stands alone or is quoted, so sentence-final periods do not count
    private static final Pattern STANDALONE_DOT = Pattern.compile("(^|[\\s'\"`(])\\.($|[\\s'\"`)])");

    @Override
    public String getName() {
        return "incomplete-validation";
    }

    @Override
    public List<SemanticIssue> detect(IntermediateRepresentation ir, ExecutionTrace trace) {
        List<SemanticIssue> issues = new ArrayList<>();

        String intent = Wording.intentText(ir);
        if (!Wording.containsAny(intent, VALIDATION_VERBS)) {
            return issues;
        }

        List<String> effects = Wording.effectTexts(ir);
        String allEffects = String.join(" ", effects);

        if (intent.contains("email")) {
            issues.addAll(checkEmail(effects, allEffects));
        }
        if (intent.contains("phone")) {
            issues.addAll(checkPhone(effects));
        }
        if (intent.contains("password")) {
            issues.addAll(checkPassword(effects));
        }
        return issues;
    }

    // =========================================================================
    // Email
    // =========================================================================

    private List<SemanticIssue> checkEmail(List<String> effects, String allEffects) {
        List<SemanticIssue> issues = new ArrayList<>();

        boolean hasAtCheck  = allEffects.contains("@") || allEffects.contains("at sign");
        boolean hasDotCheck = STANDALONE_DOT.matcher(allEffects).find()
                || Wording.hasAnyWord(allEffects, List.of("dot", "period"));

        if (hasAtCheck && hasDotCheck) {
            boolean hasOrderingCheck = effects.stream().anyMatch(e ->
                    Wording.hasWord(e, "after") && (e.contains("@") || Wording.hasWord(e, "at")));

            if (!hasOrderingCheck) {
                issues.add(SemanticIssue.warning(
                        IssueCategory.INVALID_LOGIC,
                        "Email validation checks for @ and . but doesn't verify the dot comes after the @. "
                                + "This would accept invalid emails like 'test@.com' or 'test.@com'",
                        null,
                        "Add effect: 'Check that dot position is after @ position' "
                                + "or 'Ensure domain has at least one character before dot'"
                ));
            }

            boolean hasDomainCheck = effects.stream().anyMatch(e ->
                    e.contains("domain") || e.contains("after @"));

            if (!hasDomainCheck) {
                issues.add(SemanticIssue.warning(
                        IssueCategory.INVALID_LOGIC,
                        "Email validation doesn't check domain validity. "
                                + "This would accept emails like 'test@.com' or 'test@domain.'",
                        null,
                        "Add effect: 'Check domain has characters before and after dot'"
                ));
            }

        } else if (hasAtCheck) {
            issues.add(SemanticIssue.error(
                    IssueCategory.INVALID_LOGIC,
                    "Email validation only checks for @, not for dot. "
                            + "This would accept invalid emails like 'test@domain'",
                    null,
                    "Add effect: 'Check for dot in domain part after @'"
            ));

        } else if (hasDotCheck) {
            issues.add(SemanticIssue.error(
                    IssueCategory.INVALID_LOGIC,
                    "Email validation only checks for dot, not for @. "
                            + "This would accept invalid emails like 'test.domain.com'",
                    null,
                    "Add effect: 'Check for @ symbol'"
            ));

        } else {
            issues.add(SemanticIssue.warning(
                    IssueCategory.INVALID_LOGIC,
                    "Email validation doesn't describe any @ or dot check",
                    null,
                    "Add effects: 'Check for @ symbol' and 'Check that a dot appears after @'"
            ));
        }
        return issues;
    }

    // =========================================================================
    // Phone
    // =========================================================================

    private List<SemanticIssue> checkPhone(List<String> effects) {
        boolean hasDigitCheck  = effects.stream().anyMatch(e -> e.contains("digit") || e.contains("number"));
        boolean hasLengthCheck = effects.stream().anyMatch(e -> e.contains("length") || e.contains("digits"));

        if (hasDigitCheck || hasLengthCheck) {
            return List.of();
        }
        return List.of(SemanticIssue.warning(
                IssueCategory.INVALID_LOGIC,
                "Phone validation doesn't check for digits or length",
                null,
                "Add effect: 'Check that phone number contains only digits and has correct length'"
        ));
    }

    // =========================================================================
    // Password
    // =========================================================================

    private List<SemanticIssue> checkPassword(List<String> effects) {
        boolean hasLengthCheck = effects.stream().anyMatch(e -> e.contains("length"));
        if (hasLengthCheck) {
            return List.of();
        }
        return List.of(SemanticIssue.warning(
                IssueCategory.INVALID_LOGIC,
                "Password validation doesn't check minimum length",
                null,
                "Add effect: 'Check password length is at least N characters'"
        ));
    }
}
