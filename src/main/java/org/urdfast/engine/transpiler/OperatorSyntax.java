package org.urdfast.engine.transpiler;

import java.util.List;
import java.util.Objects;

/**
 * How one operator is written in a target syntax: an infix token
 * ({@code "^"}, {@code ".*"}) or a call template with positional placeholders
 * ({@code "dot({0}, {1})"}).
 *
 * Call templates are binary; an n-ary chain nests to the left:
 * {@code a*b*c} with {@code "mul({0}, {1})"} becomes
 * {@code mul(mul(a, b), c)}.
 */
public record OperatorSyntax(String text, boolean call) {

    public OperatorSyntax {
        Objects.requireNonNull(text, "Operator syntax cannot be null");
    }

    public static OperatorSyntax infix(String token) {
        return new OperatorSyntax(token, false);
    }

    public static OperatorSyntax call(String template) {
        return new OperatorSyntax(template, true);
    }

    /**
     * Applies the syntax to rendered operands. A single operand is a sign.
     */
    public String apply(List<String> operands) {
        if (operands.isEmpty()) {
            throw new IllegalArgumentException("Operator requires at least one operand");
        }
        if (!call) {
            return operands.size() == 1 ? text + operands.get(0) : String.join(text, operands);
        }
        if (operands.size() == 1) {
            return Templates.positional(text, operands);
        }
        String result = Templates.positional(text, List.of(operands.get(0), operands.get(1)));
        for (int i = 2; i < operands.size(); i++) {
            result = Templates.positional(text, List.of(result, operands.get(i)));
        }
        return result;
    }
}
