package org.urdfast.engine.optimizer;

import org.urdfast.engine.model.NamedVariable;

import java.util.List;

/**
 * Output of common subexpression elimination.
 *
 * @param variables   Variables in definition order: the input variables,
 *                    rewritten, interleaved with the extracted ones
 * @param expressions Simplified terminal expressions, in input order
 * @param extracted   Number of variables introduced by the optimizer
 */
public record OptimizationResult(List<NamedVariable> variables, List<String> expressions, int extracted) {

    public OptimizationResult {
        variables = List.copyOf(variables);
        expressions = List.copyOf(expressions);
    }

    /**
     * @return The only terminal expression
     * @throws IllegalStateException if there are several
     */
    public String expression() {
        if (expressions.size() != 1) {
            throw new IllegalStateException("Result holds " + expressions.size() + " expressions");
        }
        return expressions.get(0);
    }

    public boolean isIdentity() {
        return extracted == 0;
    }
}
