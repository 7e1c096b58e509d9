package com.specguard.core.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Explicit placeholder for a value the IR has not resolved yet.
 * Holes are produced and consumed outside the validation core; they are carried here
 * so an IR can be decoded and re-encoded without loss.
 */
public class TypedHole {

    private final String identifier;
    private final String typeHint;
    private final String description;
    private final Map<String, String> constraints;
    private final HoleKind kind;

    public TypedHole(
            String identifier,
            String typeHint,
            String description,
            Map<String, String> constraints,
            HoleKind kind
    ) {
        this.identifier  = identifier;
        this.typeHint    = typeHint;
        this.description = description != null ? description : "";
        this.constraints = constraints != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(constraints))
                : Map.of();
        this.kind        = kind != null ? kind : HoleKind.INTENT;
    }

    public String getIdentifier()            { return identifier; }
    public String getTypeHint()              { return typeHint; }
    public String getDescription()           { return description; }
    public Map<String, String> getConstraints() { return constraints; }
    public HoleKind getKind()                { return kind; }

    /** Human-friendly label, e.g. {@code <?limit: int?>}. */
    public String label() {
        return "<?" + identifier + ": " + typeHint + "?>";
    }

    @Override
    public String toString() {
        return label();
    }
}
