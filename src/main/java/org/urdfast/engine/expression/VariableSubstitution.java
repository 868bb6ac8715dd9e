package org.urdfast.engine.expression;

import org.urdfast.engine.expression.ExpressionRenderer.Rewrites;
import org.urdfast.engine.expression.ExpressionRenderer.Substitute;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Replaces symbols by expressions.
 *
 * The target expression is parsed and re-rendered rather than spliced as text,
 * so parentheses follow the precedence of the replacement at each site:
 *
 * <pre>
 * substitute("a*b", "a", "x+y")  -> "(x+y)*b"
 * substitute("a+b", "a", "q[0]") -> "q[0]+b"
 * </pre>
 */
public final class VariableSubstitution {

    private VariableSubstitution() {
    }

    /**
     * Replaces every leaf equal to {@code symbol}.
     *
     * @param expression  Expression to rewrite
     * @param symbol      Symbol to replace
     * @param replacement Expression to put in its place
     * @return The canonical rendering of the rewritten expression
     * @throws ExpressionParseException if either expression is malformed
     */
    public static String substitute(String expression, String symbol, String replacement) {
        return substituteAll(expression, Map.of(symbol, replacement));
    }

    /**
     * Replaces several symbols at once. Replacements are not rewritten again,
     * so {@code {a -> b, b -> a}} swaps the two symbols.
     */
    public static String substituteAll(String expression, Map<String, String> replacements) {
        Objects.requireNonNull(replacements, "Replacements cannot be null");
        ExpressionForest forest = ExpressionForest.parse(expression);
        Map<String, Substitute> substitutes = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : replacements.entrySet()) {
            substitutes.put(ExpressionForest.normalize(entry.getKey()), substituteFor(entry.getValue()));
        }
        return ExpressionRenderer.CANONICAL.render(forest, 0, Rewrites.substituting(substitutes)).text();
    }

    /**
     * Parses a replacement expression once, keeping the precedence of its
     * root.
     */
    public static Substitute substituteFor(String replacement) {
        ExpressionForest forest = ExpressionForest.parse(replacement);
        int root = forest.root(0);
        if (root < 0) {
            return new Substitute(forest.atomText(0), null);
        }
        OperationRecord record = forest.record(root);
        return new Substitute(record.span().text(forest.source(0)), record.precedenceOperator());
    }
}
