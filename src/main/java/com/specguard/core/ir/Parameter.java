package com.specguard.core.ir;

public class Parameter {

    private final String name;
    private final String typeHint;
    private final String description;

    public Parameter(String name, String typeHint, String description) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Parameter name cannot be empty");
        }
        this.name        = name;
        this.typeHint    = typeHint;
        this.description = description;
    }

    public Parameter(String name, String typeHint) {
        this(name, typeHint, null);
    }

    public String getName()        { return name; }
    public String getTypeHint()    { return typeHint; }
    public String getDescription() { return description; }

    @Override
    public String toString() {
        return name + ": " + (typeHint != null ? typeHint : "Any");
    }
}
