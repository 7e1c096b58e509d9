package com.specguard.core.trace;

import java.util.List;

/**
 * SymbolicValue: a named, typed placeholder for a parameter or an inferred
 * computed quantity.
 *
 * Immutable. A later effect that recomputes the same name produces a new record;
 * the trace keeps the superseded one in its shadow history.
 */
public class SymbolicValue {

    /** Name given to a return that was detected but whose source could not be resolved. */
    public static final String RETURN_PLACEHOLDER = "<return_value>";

    public static final String ANY_TYPE = "Any";

    private final String name;
    private final String typeHint;
    private final ValueSource source;
    private final List<String> provenance;
    private final Integer effectIndex;

    public SymbolicValue(
            String name,
            String typeHint,
            ValueSource source,
            List<String> provenance,
            Integer effectIndex
    ) {
        this.name        = name;
        this.typeHint    = typeHint != null && !typeHint.isBlank() ? typeHint : ANY_TYPE;
        this.source      = source;
        this.provenance  = provenance != null ? List.copyOf(provenance) : List.of();
        this.effectIndex = effectIndex;
    }

    public static SymbolicValue parameter(String name, String typeHint) {
        return new SymbolicValue(name, typeHint, ValueSource.PARAMETER,
                List.of("parameter " + name), null);
    }

    public static SymbolicValue computed(String name, String typeHint, String step, int effectIndex) {
        return new SymbolicValue(name, typeHint, ValueSource.COMPUTED, List.of(step), effectIndex);
    }

    public static SymbolicValue returnPlaceholder(int effectIndex) {
        return new SymbolicValue(RETURN_PLACEHOLDER, ANY_TYPE, ValueSource.COMPUTED,
                List.of("return statement"), effectIndex);
    }

    public String getName()             { return name; }
    public String getTypeHint()         { return typeHint; }
    public ValueSource getSource()      { return source; }
    public List<String> getProvenance() { return provenance; }
    /** Index of the effect that produced this value; {@code null} for parameters. */
    public Integer getEffectIndex()     { return effectIndex; }

    public boolean isParameter() { return source == ValueSource.PARAMETER; }
    public boolean isComputed()  { return source == ValueSource.COMPUTED; }
    public boolean isPlaceholder() { return RETURN_PLACEHOLDER.equals(name); }

    @Override
    public String toString() {
        return name + ":" + typeHint + " (" + source.code() + ")";
    }
}
