package org.urdfast.engine.codegen;

import org.urdfast.engine.model.ExpressionGrid;
import org.urdfast.engine.model.Statement;

import java.util.List;
import java.util.Objects;

/**
 * Everything needed to emit one function, in source syntax.
 *
 * @param name          Function name
 * @param parameters    Parameters, in signature order
 * @param body          Variable definitions and loop markers, in order
 * @param result        Returned value: a 1x1 grid for a scalar, a matrix
 *                      literal otherwise
 * @param description   Docstring text, null for no docstring
 * @param inputAsVector Collapse the parameters into one vector {@code q}
 *                      whose elements replace them
 */
public record FunctionSpec(
        String name,
        List<FunctionParameter> parameters,
        List<Statement> body,
        ExpressionGrid result,
        String description,
        boolean inputAsVector) {

    public FunctionSpec {
        Objects.requireNonNull(name, "Function name cannot be null");
        Objects.requireNonNull(result, "Function result cannot be null");
        parameters = List.copyOf(parameters);
        body = List.copyOf(body);
    }

    public static FunctionSpec of(String name, List<FunctionParameter> parameters, ExpressionGrid result) {
        return new FunctionSpec(name, parameters, List.of(), result, null, false);
    }

    public FunctionSpec withBody(List<Statement> body) {
        return new FunctionSpec(name, parameters, body, result, description, inputAsVector);
    }

    public FunctionSpec withDescription(String description) {
        return new FunctionSpec(name, parameters, body, result, description, inputAsVector);
    }

    public FunctionSpec withInputAsVector(boolean inputAsVector) {
        return new FunctionSpec(name, parameters, body, result, description, inputAsVector);
    }

    public boolean hasDocstring() {
        return description != null;
    }
}
