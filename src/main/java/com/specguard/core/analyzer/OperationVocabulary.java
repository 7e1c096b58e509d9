package com.specguard.core.analyzer;

import java.util.List;

/**
 * OperationVocabulary: ordered synonym groups mapping effect wording to an
 * operation tag.
 *
 * Groups are evaluated top to bottom and the first group with a keyword contained
 * in the (lower-cased) description wins. Matching is by substring, so "returns"
 * and "returned" count as "return". Order is part of the contract: data
 * transformation verbs outrank iteration, which outranks computation, data access
 * and finally control flow.
 */
public final class OperationVocabulary {

    public static final String SPLIT     = "split";
    public static final String JOIN      = "join";
    public static final String FILTER    = "filter";
    public static final String MAP       = "map";
    public static final String REDUCE    = "reduce";
    public static final String ITERATE   = "iterate";
    public static final String COUNT     = "count";
    public static final String CALCULATE = "calculate";
    public static final String CHECK     = "check";
    public static final String GET       = "get";
    public static final String FIND      = "find";
    public static final String RETURN    = "return";
    public static final String IF        = "if";
    public static final String ELSE      = "else";

    /** Wording that marks an effect as returning a value. */
    public static final List<String> RETURN_KEYWORDS =
            List.of("return", "output", "yield", "give back", "send back");

    private static final List<OperationRule> RULES = List.of(
            // Data transformation
            new OperationRule(SPLIT,     List.of("split", "divide", "separate", "break")),
            new OperationRule(JOIN,      List.of("join", "combine", "concatenate", "merge")),
            new OperationRule(FILTER,    List.of("filter", "select", "keep", "exclude")),
            new OperationRule(MAP,       List.of("map", "transform", "convert", "apply")),
            new OperationRule(REDUCE,    List.of("reduce", "aggregate", "accumulate")),
            // Iteration
            new OperationRule(ITERATE,   List.of("iterate", "loop", "traverse", "walk through", "go through")),
            // Computation
            new OperationRule(COUNT,     List.of("count", "tally", "sum", "total")),
            new OperationRule(CALCULATE, List.of("calculate", "compute", "determine", "find")),
            new OperationRule(CHECK,     List.of("check", "test", "verify", "validate")),
            // Data access
            new OperationRule(GET,       List.of("get", "retrieve", "fetch", "extract", "obtain")),
            new OperationRule(FIND,      List.of("find", "search", "locate", "look for")),
            // Control flow
            new OperationRule(RETURN,    List.of("return", "output", "yield", "give back")),
            new OperationRule(IF,        List.of("if", "when", "in case")),
            new OperationRule(ELSE,      List.of("else", "otherwise"))
    );

    private OperationVocabulary() {}

    /**
     * Tag of the first matching group, or {@code null} when no group matches.
     *
     * @param lowered effect description, already lower-cased
     */
    public static String detect(String lowered) {
        for (OperationRule rule : RULES) {
            if (rule.matches(lowered)) {
                return rule.getTag();
            }
        }
        return null;
    }

    public static boolean isReturnEffect(String lowered) {
        return containsAny(lowered, RETURN_KEYWORDS);
    }

    public static List<OperationRule> rules() {
        return RULES;
    }

    static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) return true;
        }
        return false;
    }

    public static final class OperationRule {

        private final String tag;
        private final List<String> keywords;

        OperationRule(String tag, List<String> keywords) {
            this.tag      = tag;
            this.keywords = List.copyOf(keywords);
        }

        public String getTag()            { return tag; }
        public List<String> getKeywords() { return keywords; }

        boolean matches(String lowered) {
            return containsAny(lowered, keywords);
        }
    }
}
