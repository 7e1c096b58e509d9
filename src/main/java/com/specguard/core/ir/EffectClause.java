package com.specguard.core.ir;

import java.util.List;

/** One natural-language step of the function, in execution order. */
public class EffectClause {

    private final String description;
    private final List<TypedHole> holes;

    public EffectClause(String description, List<TypedHole> holes) {
        this.description = description != null ? description : "";
        this.holes       = holes != null ? List.copyOf(holes) : List.of();
    }

    public EffectClause(String description) {
        this(description, List.of());
    }

    public String getDescription()    { return description; }
    public List<TypedHole> getHoles() { return holes; }

    @Override
    public String toString() {
        return description;
    }
}
