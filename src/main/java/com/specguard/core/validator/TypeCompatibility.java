package com.specguard.core.validator;

import java.util.List;
import java.util.Locale;

import com.specguard.core.trace.SymbolicValue;

/**
 * Type-compatibility relation between a declared return type and the type the
 * trace inferred for the returned value.
 *
 * Rules, in order:
 *   - identical strings match
 *   - Any on either side matches anything
 *   - any two list[...] annotations are compatible
 *   - any two dict... annotations are compatible
 *   - float/number accept int, float and number
 *   - str/string and bool/boolean are aliases
 */
public final class TypeCompatibility {

    private static final List<String> NUMERIC = List.of("int", "float", "number");
    private static final List<String> STRINGS = List.of("str", "string");
    private static final List<String> BOOLEANS = List.of("bool", "boolean");

    private TypeCompatibility() {}

    public static boolean compatible(String expected, String actual) {
        if (expected == null || actual == null) return true;
        if (expected.equals(actual)) return true;

        if (SymbolicValue.ANY_TYPE.equals(expected) || SymbolicValue.ANY_TYPE.equals(actual)) {
            return true;
        }

        String e = expected.toLowerCase(Locale.ROOT);
        String a = actual.toLowerCase(Locale.ROOT);

        if (e.contains("list") && a.contains("list")) return true;
        if (e.contains("dict") && a.contains("dict")) return true;

        if ((e.equals("float") || e.equals("number")) && NUMERIC.contains(a)) return true;
        if (STRINGS.contains(e) && STRINGS.contains(a)) return true;
        if (BOOLEANS.contains(e) && BOOLEANS.contains(a)) return true;

        return false;
    }

    /**
     * Words an effect may use to refer to a value of the given type, e.g. a
     * {@code str} parameter may appear as "the input string" or "the text".
     */
    public static List<String> synonymsFor(String typeHint) {
        String t = typeHint != null ? typeHint.toLowerCase(Locale.ROOT) : "";

        if (t.contains("str") || t.contains("string")) {
            return List.of("string", "text", "word", "character");
        } else if (t.contains("int") || t.contains("integer")) {
            return List.of("integer", "number", "count", "index");
        } else if (t.contains("bool")) {
            return List.of("boolean", "true", "false", "flag");
        } else if (t.contains("float") || t.contains("decimal")) {
            return List.of("float", "decimal", "number");
        } else if (t.contains("list") || t.contains("array")) {
            return List.of("list", "array", "collection", "items", "elements");
        } else if (t.contains("dict") || t.contains("map")) {
            return List.of("dict", "dictionary", "map", "object");
        }
        return List.of();
    }
}
