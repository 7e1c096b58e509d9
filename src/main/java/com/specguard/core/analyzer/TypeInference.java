package com.specguard.core.analyzer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import com.specguard.core.trace.SymbolicValue;

/**
 * TypeInference: closed keyword → type table used to guess the type of a
 * computed value from its effect wording.
 *
 * Keywords match as whole words, with an optional plural "s", so "into" does not
 * count as "int" and "words" counts as "word".
 *
 * Precedence:
 *   1. collection wording → list[T], T taken from the scalar table (str, then int), else Any
 *   2. first scalar group that matches: int, str, bool, float, dict, tuple
 *   3. Any
 */
public final class TypeInference {

    private static final Map<String, List<Pattern>> SCALAR_TYPES;
    private static final List<Pattern> COLLECTION_WORDS;

    static {
        Map<String, List<Pattern>> scalars = new LinkedHashMap<>();
        scalars.put("int",   words("integer", "int", "number", "count", "index"));
        scalars.put("str",   words("string", "str", "text", "word", "character"));
        scalars.put("bool",  words("boolean", "bool", "true", "false"));
        scalars.put("float", words("float", "decimal", "real number"));
        scalars.put("dict",  words("dict", "dictionary", "map", "object"));
        scalars.put("tuple", words("tuple", "pair"));
        SCALAR_TYPES     = Collections.unmodifiableMap(scalars);
        COLLECTION_WORDS = words("list", "array", "collection", "element", "item", "split");
    }

    private TypeInference() {}

    /**
     * @param description effect description
     * @param context     extra wording such as the candidate value name; may be empty
     */
    public static String infer(String description, String context) {
        String text = (description + " " + (context != null ? context : "")).toLowerCase(Locale.ROOT);

        if (anyMatch(text, COLLECTION_WORDS)) {
            if (anyMatch(text, SCALAR_TYPES.get("str"))) return "list[str]";
            if (anyMatch(text, SCALAR_TYPES.get("int"))) return "list[int]";
            return "list[Any]";
        }

        for (Map.Entry<String, List<Pattern>> entry : SCALAR_TYPES.entrySet()) {
            if (anyMatch(text, entry.getValue())) {
                return entry.getKey();
            }
        }
        return SymbolicValue.ANY_TYPE;
    }

    private static boolean anyMatch(String text, List<Pattern> patterns) {
        for (Pattern p : patterns) {
            if (p.matcher(text).find()) return true;
        }
        return false;
    }

    private static List<Pattern> words(String... keywords) {
        Pattern[] patterns = new Pattern[keywords.length];
        for (int i = 0; i < keywords.length; i++) {
            patterns[i] = Pattern.compile("\\b" + Pattern.quote(keywords[i]) + "s?\\b");
        }
        return List.of(patterns);
    }
}
