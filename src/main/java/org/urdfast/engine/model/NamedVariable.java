package org.urdfast.engine.model;

import java.util.Objects;

/**
 * A named intermediate value.
 *
 * Definition order is the position in the enclosing statement list; a value
 * may only reference variables defined earlier and free symbols.
 *
 * @param name  Variable name
 * @param value Expression in source syntax
 * @param kind  Shape of the value
 */
public record NamedVariable(String name, String value, VariableKind kind) implements Statement {

    public NamedVariable {
        Objects.requireNonNull(name, "Variable name cannot be null");
        Objects.requireNonNull(value, "Variable value cannot be null");
        Objects.requireNonNull(kind, "Variable kind cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Variable name cannot be blank");
        }
    }

    public static NamedVariable scalar(String name, String value) {
        return new NamedVariable(name, value, VariableKind.SCALAR);
    }

    @Override
    public String toString() {
        return name + " = " + value;
    }
}
