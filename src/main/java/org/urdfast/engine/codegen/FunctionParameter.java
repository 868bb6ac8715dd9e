package org.urdfast.engine.codegen;

import org.urdfast.engine.model.VariableKind;

import java.util.Objects;

/**
 * A parameter of a generated function.
 *
 * @param name        Parameter name, a free symbol of the expressions
 * @param kind        Shape of the argument
 * @param description Free text for the docstring, may be empty
 */
public record FunctionParameter(String name, VariableKind kind, String description) {

    public FunctionParameter {
        Objects.requireNonNull(name, "Parameter name cannot be null");
        Objects.requireNonNull(kind, "Parameter kind cannot be null");
        description = description == null ? "" : description;
    }

    public static FunctionParameter scalar(String name, String description) {
        return new FunctionParameter(name, VariableKind.SCALAR, description);
    }
}
