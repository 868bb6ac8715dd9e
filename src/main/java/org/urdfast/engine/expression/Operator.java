package org.urdfast.engine.expression;

/**
 * Precedence table of the expression language.
 *
 * Every operator belongs to one precedence class; a smaller class index binds
 * tighter. The order mirrors Python's, with the refinement that {@code /}
 * outranks {@code *} and {@code -} outranks {@code +}, which lets the operand
 * resolver treat the commutative operators as flat n-ary chains.
 *
 * <pre>
 * class 0 : subscripts, calls, list literals (atomic)
 * class 1 : **        (right-associative)
 * class 2 : +u -u     (unary)
 * class 3 : /
 * class 4 : *         (commutative)
 * class 5 : @
 * class 6 : -
 * class 7 : +         (commutative)
 * </pre>
 */
public enum Operator {

    SUBSCRIPT("[]", "[]", 0, false, false, false),
    POWER("**", "**", 1, false, true, false),
    UNARY_PLUS("+", "+u", 2, false, false, true),
    UNARY_MINUS("-", "-u", 2, false, false, true),
    DIVIDE("/", "/", 3, false, false, false),
    MULTIPLY("*", "*", 4, true, false, false),
    MATMUL("@", "@", 5, false, false, false),
    SUBTRACT("-", "-", 6, false, false, false),
    ADD("+", "+", 7, true, false, false);

    private final String symbol;
    private final String key;
    private final int precedence;
    private final boolean commutative;
    private final boolean rightAssociative;
    private final boolean unary;

    Operator(String symbol, String key, int precedence, boolean commutative, boolean rightAssociative,
            boolean unary) {
        this.symbol = symbol;
        this.key = key;
        this.precedence = precedence;
        this.commutative = commutative;
        this.rightAssociative = rightAssociative;
        this.unary = unary;
    }

    /**
     * @return The source token, e.g. {@code "**"} or {@code "-"}
     */
    public String symbol() {
        return symbol;
    }

    /**
     * @return A key unique per operator; unary operators carry a {@code u}
     *         suffix ({@code "-u"})
     */
    public String key() {
        return key;
    }

    public int precedence() {
        return precedence;
    }

    public boolean isCommutative() {
        return commutative;
    }

    public boolean isRightAssociative() {
        return rightAssociative;
    }

    public boolean isUnary() {
        return unary;
    }

    /**
     * @return true if this operator binds strictly tighter than {@code other}
     */
    public boolean outranks(Operator other) {
        return precedence < other.precedence;
    }

    public boolean sameClass(Operator other) {
        return precedence == other.precedence;
    }

    /**
     * Resolves a binary operator token.
     *
     * @return The operator, or null if the token is not a binary operator
     */
    public static Operator binary(String token) {
        return switch (token) {
            case "**" -> POWER;
            case "/" -> DIVIDE;
            case "*" -> MULTIPLY;
            case "@" -> MATMUL;
            case "-" -> SUBTRACT;
            case "+" -> ADD;
            default -> null;
        };
    }

    /**
     * Resolves a unary sign.
     */
    public static Operator unary(char sign) {
        return sign == '-' ? UNARY_MINUS : UNARY_PLUS;
    }

    /**
     * Looks an operator up by its {@link #key()}.
     *
     * @throws IllegalArgumentException if no operator has this key
     */
    public static Operator fromKey(String key) {
        for (Operator op : values()) {
            if (op.key.equals(key)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown operator key: " + key);
    }
}
