package org.urdfast.engine.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reconstructs flat expression text from an {@link ExpressionForest}.
 *
 * The base class produces the canonical source syntax, which is also the key
 * used to compare subexpressions. Parentheses are inserted only where the
 * precedence table requires them. Subclasses change the concrete syntax by
 * overriding the {@code format*} hooks; parenthesization stays here.
 */
public class ExpressionRenderer {

    /**
     * Renderer for the canonical, whitespace-free source syntax.
     */
    public static final ExpressionRenderer CANONICAL = new ExpressionRenderer();

    protected ExpressionRenderer() {
    }

    // ==================== Entry points ====================

    /**
     * Parses and re-renders one expression.
     *
     * @throws ExpressionParseException if the expression is malformed
     */
    public String render(String expression) {
        return render(ExpressionForest.parse(expression), 0, Rewrites.NONE).text();
    }

    /**
     * Renders the whole expression {@code source} of a forest.
     */
    public Rendered render(ExpressionForest forest, int source, Rewrites rewrites) {
        int root = forest.root(source);
        if (root < 0) {
            return leaf(forest.atomText(source), rewrites);
        }
        return renderRecord(forest, root, rewrites, true);
    }

    /**
     * Renders the subtree of one record, replacing named descendants (and the
     * record itself, when {@code nameSelf} is set) by their names.
     */
    public Rendered renderRecord(ExpressionForest forest, int record, Rewrites rewrites, boolean nameSelf) {
        Objects.requireNonNull(rewrites, "Rewrites cannot be null");
        if (nameSelf) {
            String name = rewrites.namedRecords().get(record);
            if (name != null) {
                return new Rendered(name, null, null);
            }
        }

        OperationRecord op = forest.record(record);
        List<Rendered> operands = new ArrayList<>(op.operandCount());
        for (int k = 0; k < op.operandCount(); k++) {
            int child = forest.child(record, k);
            if (child >= 0) {
                operands.add(renderRecord(forest, child, rewrites, true));
            } else if (op.operands().get(k).isEmpty()) {
                operands.add(new Rendered("", null, null));
            } else {
                operands.add(leaf(forest.leafText(record, k), rewrites));
            }
        }

        return switch (op.kind()) {
            case BINARY -> binary(op.operator(), operands);
            case UNARY -> {
                Rendered operand = operands.get(0);
                String text = needsParentheses(op.operator(), 0, 1, operand)
                        ? "(" + operand.text() + ")"
                        : operand.text();
                yield new Rendered(formatUnary(op.operator(), text), op.operator(), OperationKind.UNARY);
            }
            case FUNCTION -> new Rendered(formatFunction(op.name(), texts(operands)), null, OperationKind.FUNCTION);
            case SUBSCRIPT -> new Rendered(formatSubscript(op.name(), operands), null, OperationKind.SUBSCRIPT);
            case LIST -> new Rendered(formatList(texts(operands)), null, OperationKind.LIST);
            case SLICE -> new Rendered(formatSlice(operands.get(0).text(), operands.get(1).text()), null,
                    OperationKind.SLICE);
        };
    }

    private Rendered binary(Operator operator, List<Rendered> operands) {
        boolean call = rendersAsCall(operator);
        List<String> texts = new ArrayList<>(operands.size());
        for (int k = 0; k < operands.size(); k++) {
            Rendered operand = operands.get(k);
            if (!call && needsParentheses(operator, k, operands.size(), operand)) {
                texts.add("(" + operand.text() + ")");
            } else {
                texts.add(operand.text());
            }
        }
        return new Rendered(formatBinary(operator, texts), call ? null : operator, OperationKind.BINARY);
    }

    private Rendered leaf(String text, Rewrites rewrites) {
        Substitute substitute = rewrites.leafSubstitutions().get(text);
        if (substitute != null) {
            return new Rendered(substitute.text(), substitute.rootOperator(), null);
        }
        return new Rendered(formatLeaf(text), null, null);
    }

    // ==================== Parenthesization ====================

    /**
     * Decides whether operand {@code position} of {@code parent} must be
     * wrapped.
     *
     * A child is wrapped when the parent strictly outranks it. A child of the
     * same class is wrapped only where dropping the parentheses would change
     * the value: the right-hand operands of {@code -}, {@code /} and
     * {@code @}, the left operand of {@code **}, and a sign applied to a sign.
     * The right operand of {@code **} may be a bare sign ({@code a**-b}).
     * A sign after the first operand of {@code +} or {@code -} is always
     * wrapped, so that {@code a-(-b)} never renders as the {@code --} token.
     */
    protected boolean needsParentheses(Operator parent, int position, int count, Rendered child) {
        Operator inner = child.operator();
        if (inner == null) {
            return false;
        }
        if (parent == Operator.POWER && inner.isUnary() && position == count - 1) {
            return false;
        }
        if ((parent == Operator.ADD || parent == Operator.SUBTRACT) && inner.isUnary() && position > 0) {
            return true;
        }
        if (parent.outranks(inner)) {
            return true;
        }
        if (!parent.sameClass(inner)) {
            return false;
        }
        if (parent.isUnary()) {
            return true;
        }
        if (parent == inner && parent.isCommutative()) {
            return false;
        }
        if (parent.isRightAssociative()) {
            return position == 0;
        }
        return position > 0;
    }

    // ==================== Syntax hooks ====================

    /**
     * @return true if the operator renders as a call, whose own brackets
     *         delimit the operands
     */
    protected boolean rendersAsCall(Operator operator) {
        return false;
    }

    protected String formatBinary(Operator operator, List<String> operands) {
        return String.join(operator.symbol(), operands);
    }

    protected String formatUnary(Operator operator, String operand) {
        return operator.symbol() + operand;
    }

    protected String formatFunction(String name, List<String> arguments) {
        return name + "(" + String.join(",", arguments) + ")";
    }

    /**
     * Subscript arguments arrive as {@link Rendered} so that subclasses can
     * tell plain indices from slices and compound index expressions.
     */
    protected String formatSubscript(String name, List<Rendered> arguments) {
        return name + "[" + String.join(",", texts(arguments)) + "]";
    }

    protected String formatList(List<String> elements) {
        return "[" + String.join(",", elements) + "]";
    }

    /**
     * @param lower Lower bound, empty if omitted
     * @param upper Upper bound, empty if omitted
     */
    protected String formatSlice(String lower, String upper) {
        return lower + ":" + upper;
    }

    protected String formatLeaf(String text) {
        return text;
    }

    protected static List<String> texts(List<Rendered> rendered) {
        List<String> result = new ArrayList<>(rendered.size());
        for (Rendered r : rendered) {
            result.add(r.text());
        }
        return result;
    }

    // ==================== Result types ====================

    /**
     * Rendered text of a subtree.
     *
     * @param text     The text
     * @param operator Root operator for parenthesization, null if the text is
     *                 atomic (leaf, name, call, subscript, list)
     * @param kind     Kind of the rendered record, null for leaves and names
     */
    public record Rendered(String text, Operator operator, OperationKind kind) {
        public Rendered {
            Objects.requireNonNull(text, "Text cannot be null");
        }
    }

    /**
     * Replacement text for a leaf, together with the precedence of its root.
     */
    public record Substitute(String text, Operator rootOperator) {
        public Substitute {
            Objects.requireNonNull(text, "Text cannot be null");
        }
    }

    /**
     * Changes applied while rendering.
     *
     * @param namedRecords      Records replaced by a variable name, by record
     *                          index
     * @param leafSubstitutions Leaves replaced by another expression, by leaf
     *                          text
     */
    public record Rewrites(Map<Integer, String> namedRecords, Map<String, Substitute> leafSubstitutions) {

        public static final Rewrites NONE = new Rewrites(Map.of(), Map.of());

        public Rewrites {
            namedRecords = Map.copyOf(namedRecords);
            leafSubstitutions = Map.copyOf(leafSubstitutions);
        }

        public static Rewrites naming(Map<Integer, String> namedRecords) {
            return new Rewrites(namedRecords, Map.of());
        }

        public static Rewrites substituting(Map<String, Substitute> leafSubstitutions) {
            return new Rewrites(Map.of(), leafSubstitutions);
        }
    }
}
