package com.specguard.core.ir;

import java.util.List;

public class IntentClause {

    private final String summary;
    private final String rationale;
    private final List<TypedHole> holes;

    public IntentClause(String summary, String rationale, List<TypedHole> holes) {
        if (summary == null) {
            throw new IllegalArgumentException("Intent summary cannot be null");
        }
        this.summary   = summary;
        this.rationale = rationale;
        this.holes     = holes != null ? List.copyOf(holes) : List.of();
    }

    public IntentClause(String summary, String rationale) {
        this(summary, rationale, List.of());
    }

    public String getSummary()        { return summary; }
    public String getRationale()      { return rationale; }
    public List<TypedHole> getHoles() { return holes; }
}
