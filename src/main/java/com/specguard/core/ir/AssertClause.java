package com.specguard.core.ir;

import java.util.List;

public class AssertClause {

    private final String predicate;
    private final String rationale;
    private final List<TypedHole> holes;

    public AssertClause(String predicate, String rationale, List<TypedHole> holes) {
        this.predicate = predicate != null ? predicate : "";
        this.rationale = rationale;
        this.holes     = holes != null ? List.copyOf(holes) : List.of();
    }

    public AssertClause(String predicate) {
        this(predicate, null, List.of());
    }

    public String getPredicate()      { return predicate; }
    public String getRationale()      { return rationale; }
    public List<TypedHole> getHoles() { return holes; }
}
