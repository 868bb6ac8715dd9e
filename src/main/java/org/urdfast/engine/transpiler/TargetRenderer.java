package org.urdfast.engine.transpiler;

import org.urdfast.engine.expression.ExpressionForest;
import org.urdfast.engine.expression.ExpressionRenderer;
import org.urdfast.engine.expression.OperationKind;
import org.urdfast.engine.expression.Operator;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Renders source expressions in the syntax of a {@link SyntaxProfile}.
 *
 * On top of the token and template replacement, the renderer
 * <ul>
 * <li>shifts every subscript index by the profile's indexing base;</li>
 * <li>converts slice bounds to the profile's convention;</li>
 * <li>writes scientific literals in plain decimal notation.</li>
 * </ul>
 * Parenthesization is inherited from {@link ExpressionRenderer}: operators
 * written as calls delimit their own operands.
 */
public final class TargetRenderer extends ExpressionRenderer {

    private static final Pattern INTEGER = Pattern.compile("\\d+");
    private static final Pattern SCIENTIFIC = Pattern.compile("(\\d+\\.?\\d*|\\.\\d+)[eE][+-]?\\d+");

    private final SyntaxProfile profile;

    public TargetRenderer(SyntaxProfile profile) {
        this.profile = Objects.requireNonNull(profile, "Profile cannot be null");
    }

    public SyntaxProfile profile() {
        return profile;
    }

    /**
     * Converts a source expression to the target syntax.
     *
     * @throws org.urdfast.engine.expression.ExpressionParseException if the
     *         expression is malformed
     * @throws CodegenConfigurationException if the profile cannot express it
     */
    public String convert(String expression) {
        return render(ExpressionForest.parse(expression), 0, Rewrites.NONE).text();
    }

    // ==================== Syntax hooks ====================

    @Override
    protected boolean rendersAsCall(Operator operator) {
        return profile.operatorSyntax(operator).call();
    }

    @Override
    protected String formatBinary(Operator operator, List<String> operands) {
        return profile.operatorSyntax(operator).apply(operands);
    }

    @Override
    protected String formatUnary(Operator operator, String operand) {
        return profile.operatorSyntax(operator).apply(List.of(operand));
    }

    @Override
    protected String formatFunction(String name, List<String> arguments) {
        String template = profile.functionTemplate(name);
        if (template != null && Templates.arity(template) == arguments.size()) {
            return Templates.positional(template, arguments);
        }
        return name + "(" + String.join(profile.argumentSeparator(), arguments) + ")";
    }

    @Override
    protected String formatSubscript(String name, List<Rendered> arguments) {
        List<String> indices = new ArrayList<>(arguments.size());
        for (Rendered argument : arguments) {
            indices.add(argument.kind() == OperationKind.SLICE
                    ? argument.text()
                    : shift(argument.text(), profile.indexingBase()));
        }
        return name + profile.subscriptOpen() + String.join(profile.argumentSeparator(), indices)
                + profile.subscriptClose();
    }

    @Override
    protected String formatList(List<String> elements) {
        String open = profile.listOpen().replace("{size}", String.valueOf(elements.size()));
        return open + String.join(profile.argumentSeparator(), elements) + profile.listClose();
    }

    /**
     * Source slices are 0-based with an exclusive upper bound.
     */
    @Override
    protected String formatSlice(String lower, String upper) {
        if (!profile.supportsSlices()) {
            throw new CodegenConfigurationException(
                    "Profile '" + profile.name() + "' does not support slices: " + lower + ":" + upper);
        }
        if (lower.isEmpty() && upper.isEmpty()) {
            return ":";
        }
        int base = profile.indexingBase();
        String first = lower.isEmpty() ? (base == 0 ? "" : String.valueOf(base)) : shift(lower, base);
        String last = upper.isEmpty()
                ? profile.sliceOpenEnd()
                : shift(upper, profile.sliceUpperInclusive() ? base - 1 : base);
        return first + ":" + last;
    }

    @Override
    protected String formatLeaf(String text) {
        if (SCIENTIFIC.matcher(text).matches()) {
            return new BigDecimal(text).toPlainString();
        }
        return text;
    }

    // ==================== Index arithmetic ====================

    /**
     * Adds a constant to an index. Integer literals are folded; other indices
     * get a trailing {@code +n} or {@code -n}, which never needs parentheses
     * since additive operators bind loosest.
     */
    public static String shift(String index, int delta) {
        if (delta == 0) {
            return index;
        }
        if (INTEGER.matcher(index).matches()) {
            return String.valueOf(Long.parseLong(index) + delta);
        }
        return delta > 0 ? index + "+" + delta : index + "-" + (-delta);
    }
}
