package com.specguard.core.detector;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.specguard.core.ir.EffectClause;
import com.specguard.core.ir.IntermediateRepresentation;

/**
 * Text helpers shared by the detectors and interpreter checks.
 */
public final class Wording {

    private static final Map<String, Pattern> WORD_PATTERNS = new ConcurrentHashMap<>();

    private Wording() {}

    /** Lower-cased effect descriptions, in order. */
    public static List<String> effectTexts(IntermediateRepresentation ir) {
        return ir.getEffects().stream()
                .map(EffectClause::getDescription)
                .map(d -> d.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
    }

    public static String intentText(IntermediateRepresentation ir) {
        return ir.getIntent().getSummary().toLowerCase(Locale.ROOT);
    }

    /** True when {@code word} occurs in {@code text} as a whole word. */
    public static boolean hasWord(String text, String word) {
        Pattern p = WORD_PATTERNS.computeIfAbsent(word,
                w -> Pattern.compile("\\b" + Pattern.quote(w) + "\\b"));
        return p.matcher(text).find();
    }

    public static boolean hasAnyWord(String text, List<String> words) {
        for (String word : words) {
            if (hasWord(text, word)) return true;
        }
        return false;
    }

    public static boolean containsAny(String text, List<String> fragments) {
        for (String fragment : fragments) {
            if (text.contains(fragment)) return true;
        }
        return false;
    }
}
