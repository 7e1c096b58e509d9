package com.specguard.core.analyzer;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.specguard.core.ir.EffectClause;
import com.specguard.core.ir.IntermediateRepresentation;
import com.specguard.core.ir.Parameter;
import com.specguard.core.trace.ExecutionTrace;
import com.specguard.core.trace.IssueCategory;
import com.specguard.core.trace.SemanticIssue;
import com.specguard.core.trace.SymbolicValue;

/**
 * EffectChainAnalyzer: symbolic execution over the effect narrative.
 *
 * Steps:
 *   1. Seed the trace with one PARAMETER value per declared parameter.
 *   2. For each effect in order: record the first matching operation tag, then let
 *      exactly one rule consume the effect:
 *        a) return wording  → resolve the returned value (or a placeholder)
 *        b) "... into X"    → computed X, type inferred from wording
 *        c) "count the ..." → computed count:int
 *        d) "find ... index/value" → computed index:int / value:Any
 *        e) "calculate/compute ..." → computed result
 *   3. If the signature declares a return type and nothing was returned, record
 *      a missing_return warning.
 *
 * Never throws for sparse input. A failure while parsing a single effect becomes a
 * parse_failure warning and analysis continues with the next effect.
 */
@Component
public class EffectChainAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(EffectChainAnalyzer.class);

    private static final Pattern RETURN_TARGET =
            Pattern.compile("return\\s+(?:the\\s+)?(\\w+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern INTO_TARGET =
            Pattern.compile("into\\s+(?:a\\s+)?(?:the\\s+)?(\\w+(?:\\s+\\w+)?)");

    private static final Pattern COUNT_WORD = Pattern.compile("\\bcount(?:s|ing)?\\b");
    private static final Pattern THE_WORD   = Pattern.compile("\\bthe\\b");
    private static final Pattern FIND_WORD  = Pattern.compile("\\bfind(?:s|ing)?\\b");
    private static final Pattern CALC_WORD  = Pattern.compile("\\b(?:calculate|compute)\\w*");

    private static final List<String> STOP_WORDS = List.of("the", "a", "an", "this", "that", "new");

    private static final int PROVENANCE_SNIPPET = 50;

    public ExecutionTrace analyze(IntermediateRepresentation ir) {
        if (ir == null) {
            throw new IllegalArgumentException("IR cannot be null");
        }

        ExecutionTrace trace = new ExecutionTrace();

        initializeParameters(ir, trace);

        List<EffectClause> effects = ir.getEffects();
        for (int i = 0; i < effects.size(); i++) {
            String description = effects.get(i).getDescription();
            try {
                parseEffect(description, i, trace);
            } catch (RuntimeException e) {
                log.warn("[Analyzer] Could not parse effect {} '{}': {}", i, description, e.toString());
                trace.addIssue(SemanticIssue.warning(
                        IssueCategory.PARSE_FAILURE,
                        "Effect " + (i + 1) + " could not be analyzed",
                        i,
                        "Rephrase the effect as a single imperative step"
                ));
            }
        }

        checkReturnValue(ir, trace);

        log.debug("[Analyzer] {} → values={}, operations={}, return={}",
                ir.getSignature().getName(), trace.getValues().keySet(),
                trace.getOperations(), trace.getReturnValue());

        return trace;
    }

    // =========================================================================
    // Step 1: parameters
    // =========================================================================

    private void initializeParameters(IntermediateRepresentation ir, ExecutionTrace trace) {
        for (Parameter param : ir.getSignature().getParameters()) {
            trace.addValue(SymbolicValue.parameter(param.getName(), param.getTypeHint()));
        }
    }

    // =========================================================================
    // Step 2: effects
    // =========================================================================

    void parseEffect(String description, int effectIndex, ExecutionTrace trace) {
        String lowered = description.toLowerCase(Locale.ROOT);

        String operation = OperationVocabulary.detect(lowered);
        if (operation != null) {
            trace.addOperation(operation);
            log.debug("[Analyzer] effect {} → operation {}", effectIndex, operation);
        }

        if (OperationVocabulary.isReturnEffect(lowered)) {
            handleReturn(description, effectIndex, trace);
            return;
        }

        SymbolicValue produced = extractProducedValue(description, lowered, effectIndex);
        if (produced != null) {
            trace.addValue(produced);
            log.debug("[Analyzer] effect {} → produced {}", effectIndex, produced);
        }
    }

    /**
     * Resolve what a return effect returns. A value that is already resolved is
     * never replaced; a placeholder may be upgraded by a later resolved return.
     */
    private void handleReturn(String description, int effectIndex, ExecutionTrace trace) {
        SymbolicValue current = trace.getReturnValue();
        boolean alreadyResolved = current != null && !current.isPlaceholder();

        SymbolicValue resolved = null;
        String named = null;

        Matcher m = RETURN_TARGET.matcher(description);
        if (m.find()) {
            named = m.group(1);
            resolved = trace.getValue(named);
            if (resolved == null) {
                resolved = trace.getValue(named.toLowerCase(Locale.ROOT));
            }
        }

        if (resolved != null) {
            if (!alreadyResolved) {
                trace.setReturnValue(resolved);
            }
            return;
        }

        if (named != null && named.contains("_")) {
            trace.addIssue(SemanticIssue.warning(
                    IssueCategory.UNDEFINED_VARIABLE,
                    "Effect " + (effectIndex + 1) + " returns '" + named
                            + "' but no earlier effect produces it",
                    effectIndex,
                    "Add an effect that computes '" + named + "' before returning it"
            ));
        }

        if (current == null) {
            trace.setReturnValue(SymbolicValue.returnPlaceholder(effectIndex));
        }
    }

    private SymbolicValue extractProducedValue(String description, String lowered, int effectIndex) {

        // Rule b: "... into <name>"
        Matcher into = INTO_TARGET.matcher(lowered);
        if (into.find()) {
            String phrase = into.group(1).trim();
            return SymbolicValue.computed(
                    variableName(phrase),
                    TypeInference.infer(lowered, phrase),
                    "effect " + effectIndex + ": " + snippet(description),
                    effectIndex
            );
        }

        // Rule c: "count the ..."
        if (COUNT_WORD.matcher(lowered).find() && THE_WORD.matcher(lowered).find()) {
            return SymbolicValue.computed("count", "int", "effect " + effectIndex + ": counting", effectIndex);
        }

        // Rule d: "find the ... index/value"
        if (FIND_WORD.matcher(lowered).find()) {
            if (lowered.contains("index")) {
                return SymbolicValue.computed("index", "int", "effect " + effectIndex + ": finding index", effectIndex);
            }
            if (lowered.contains("value")) {
                return SymbolicValue.computed("value", SymbolicValue.ANY_TYPE,
                        "effect " + effectIndex + ": finding value", effectIndex);
            }
        }

        // Rule e: "calculate/compute ..."
        if (CALC_WORD.matcher(lowered).find()) {
            return SymbolicValue.computed(
                    "result",
                    TypeInference.infer(lowered, "result"),
                    "effect " + effectIndex + ": calculation",
                    effectIndex
            );
        }

        return null;
    }

    static String variableName(String phrase) {
        String joined = Arrays.stream(phrase.split("\\s+"))
                .filter(w -> !w.isEmpty() && !STOP_WORDS.contains(w))
                .collect(Collectors.joining("_"))
                .replaceAll("[^\\w]", "");
        return joined.isEmpty() ? "value" : joined;
    }

    private static String snippet(String description) {
        return description.length() > PROVENANCE_SNIPPET
                ? description.substring(0, PROVENANCE_SNIPPET) + "..."
                : description;
    }

    // =========================================================================
    // Step 3: missing return
    // =========================================================================

    private void checkReturnValue(IntermediateRepresentation ir, ExecutionTrace trace) {
        if (!ir.getSignature().declaresReturn() || trace.hasReturnValue()) {
            return;
        }

        String returns = ir.getSignature().getReturns();
        List<SymbolicValue> computed = trace.getComputedValues();

        if (!computed.isEmpty()) {
            String produced = computed.stream()
                    .map(v -> "'" + v.getName() + "'")
                    .collect(Collectors.joining(", "));
            trace.addIssue(SemanticIssue.warning(
                    IssueCategory.MISSING_RETURN,
                    "Function returns '" + returns + "' but effect chain doesn't return anything. "
                            + "Produced values: " + produced,
                    null,
                    "Add effect: 'Return the " + computed.get(computed.size() - 1).getName() + "'"
            ));
        } else {
            // Effect lists are often abbreviated; stay advisory
            trace.addIssue(SemanticIssue.warning(
                    IssueCategory.MISSING_RETURN,
                    "Function returns '" + returns + "' but effect chain produces no value",
                    null,
                    "Add effects to compute and return the result"
            ));
        }
    }
}
