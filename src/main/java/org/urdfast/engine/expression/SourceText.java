package org.urdfast.engine.expression;

/**
 * A validated, whitespace-free expression with precomputed bracket partners.
 *
 * Construction rejects characters outside the expression alphabet,
 * unsupported operator tokens and unbalanced brackets, so the scanning passes
 * can assume every non-operand character is a bracket, a separator or a
 * supported operator.
 */
final class SourceText {

    private final String text;
    private final int[] partners;

    SourceText(String text) {
        if (text.isEmpty()) {
            throw new ExpressionParseException("Empty expression");
        }
        this.text = text;
        this.partners = new int[text.length()];
        validate();
    }

    String text() {
        return text;
    }

    int length() {
        return text.length();
    }

    char charAt(int index) {
        return text.charAt(index);
    }

    /**
     * @return Index of the bracket matching the one at {@code index}
     */
    int partner(int index) {
        return partners[index];
    }

    // ==================== Character classes ====================

    static boolean isOpening(char c) {
        return c == '(' || c == '[' || c == '{';
    }

    static boolean isClosing(char c) {
        return c == ')' || c == ']' || c == '}';
    }

    static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }

    private static boolean isOperatorChar(char c) {
        return c == '+' || c == '-' || c == '*' || c == '/' || c == '@';
    }

    /**
     * @return true if the character at {@code index} belongs to an operand:
     *         identifier and number characters, and the sign of a numeric
     *         literal's exponent
     */
    boolean isOperandChar(int index) {
        return isIdentifierChar(text.charAt(index)) || isExponentSign(index);
    }

    /**
     * Detects the sign in {@code 1.5e-3}: preceded by {@code e}/{@code E} that
     * closes a run of digits and points, followed by a digit.
     */
    boolean isExponentSign(int index) {
        char c = text.charAt(index);
        if ((c != '+' && c != '-') || index < 2 || index + 1 >= text.length()) {
            return false;
        }
        char e = text.charAt(index - 1);
        if ((e != 'e' && e != 'E') || !Character.isDigit(text.charAt(index + 1))) {
            return false;
        }
        int j = index - 2;
        boolean sawDigit = false;
        while (j >= 0 && (Character.isDigit(text.charAt(j)) || text.charAt(j) == '.')) {
            sawDigit |= Character.isDigit(text.charAt(j));
            j--;
        }
        return sawDigit && j < index - 2 && (j < 0 || !isIdentifierChar(text.charAt(j)));
    }

    /**
     * A {@code +} or {@code -} is unary when nothing operand-like precedes it.
     */
    boolean isUnaryAt(int index) {
        if (index == 0) {
            return true;
        }
        char left = text.charAt(index - 1);
        return !(isIdentifierChar(left) || isClosing(left));
    }

    // ==================== Operator tokens ====================

    /**
     * Resolves the whole operator token starting at {@code index}.
     */
    OperatorToken tokenStartingAt(int index) {
        char c = text.charAt(index);
        if (c == '*' && index + 1 < text.length() && text.charAt(index + 1) == '*') {
            return new OperatorToken(Operator.POWER, index, 2);
        }
        return new OperatorToken(singleCharOperator(index), index, 1);
    }

    /**
     * Resolves the whole operator token ending at {@code index} (inclusive).
     */
    OperatorToken tokenEndingAt(int index) {
        char c = text.charAt(index);
        if (c == '*' && index > 0 && text.charAt(index - 1) == '*') {
            return new OperatorToken(Operator.POWER, index - 1, 2);
        }
        return new OperatorToken(singleCharOperator(index), index, 1);
    }

    private Operator singleCharOperator(int index) {
        char c = text.charAt(index);
        if ((c == '+' || c == '-') && isUnaryAt(index)) {
            return Operator.unary(c);
        }
        Operator op = Operator.binary(String.valueOf(c));
        if (op == null) {
            throw new ExpressionParseException("Unrecognized operator token '" + c + "'", text, index);
        }
        return op;
    }

    // ==================== Spans ====================

    /**
     * Removes grouping parentheses enclosing the whole span: {@code ((a+b))}
     * becomes {@code a+b}.
     */
    Span stripGrouping(Span span) {
        Span current = span;
        while (current.length() >= 2
                && text.charAt(current.start()) == '('
                && partners[current.start()] == current.end() - 1) {
            current = new Span(current.start() + 1, current.end() - 1);
        }
        return current;
    }

    // ==================== Validation ====================

    private void validate() {
        int[] stack = new int[text.length()];
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (isOpening(c)) {
                stack[depth++] = i;
            } else if (isClosing(c)) {
                if (depth == 0) {
                    throw new ExpressionParseException("Unbalanced bracket '" + c + "'", text, i);
                }
                int open = stack[--depth];
                if (closingFor(text.charAt(open)) != c) {
                    throw new ExpressionParseException("Mismatched bracket '" + c + "'", text, i);
                }
                partners[open] = i;
                partners[i] = open;
            } else if (c == '*') {
                if (i + 2 < text.length() && text.charAt(i + 1) == '*' && text.charAt(i + 2) == '*') {
                    throw new ExpressionParseException("Unrecognized operator token '***'", text, i);
                }
            } else if (c == '/') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '/') {
                    throw new ExpressionParseException("Unrecognized operator token '//'", text, i);
                }
            } else if (!isIdentifierChar(c) && !isOperatorChar(c) && c != ',' && c != ':') {
                throw new ExpressionParseException("Unrecognized operator token '" + c + "'", text, i);
            }
        }
        if (depth > 0) {
            int open = stack[depth - 1];
            throw new ExpressionParseException("Unbalanced bracket '" + text.charAt(open) + "'", text, open);
        }
    }

    private static char closingFor(char opening) {
        return switch (opening) {
            case '(' -> ')';
            case '[' -> ']';
            default -> '}';
        };
    }

    /**
     * An operator occurrence: the operator and the range of its token.
     */
    record OperatorToken(Operator operator, int start, int length) {
        int end() {
            return start + length;
        }
    }
}
