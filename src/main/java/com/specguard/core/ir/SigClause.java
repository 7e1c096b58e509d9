package com.specguard.core.ir;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Function signature: name, ordered parameters and an optional return type hint.
 *
 * INVARIANT: parameter names are unique within one signature.
 */
public class SigClause {

    private final String name;
    private final List<Parameter> parameters;
    private final String returns;
    private final List<TypedHole> holes;

    public SigClause(String name, List<Parameter> parameters, String returns, List<TypedHole> holes) {
        if (name == null) {
            throw new IllegalArgumentException("Signature name cannot be null");
        }
        this.name       = name;
        this.parameters = parameters != null ? List.copyOf(parameters) : List.of();
        this.returns    = returns != null && !returns.isBlank() ? returns : null;
        this.holes      = holes != null ? List.copyOf(holes) : List.of();

        Set<String> seen = new HashSet<>();
        for (Parameter p : this.parameters) {
            if (!seen.add(p.getName())) {
                throw new IllegalArgumentException(
                        "Duplicate parameter '" + p.getName() + "' in signature " + name);
            }
        }
    }

    public SigClause(String name, List<Parameter> parameters, String returns) {
        this(name, parameters, returns, List.of());
    }

    public String getName()              { return name; }
    public List<Parameter> getParameters() { return parameters; }
    /** Declared return type hint, or {@code null} when the function returns nothing. */
    public String getReturns()           { return returns; }
    public List<TypedHole> getHoles()    { return holes; }

    public boolean declaresReturn() {
        return returns != null;
    }
}
