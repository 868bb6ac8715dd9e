package org.urdfast.engine.expression;

/**
 * Exception thrown when an expression cannot be parsed: unbalanced brackets,
 * an unrecognized operator token or a missing operand.
 * Includes the offending position in the normalized expression when known.
 */
public class ExpressionParseException extends RuntimeException {

    private final int position;
    private final String expression;

    public ExpressionParseException(String message) {
        super(message);
        this.position = -1;
        this.expression = null;
    }

    public ExpressionParseException(String message, String expression, int position) {
        super(message + " at position " + position + " in '" + expression + "'");
        this.position = position;
        this.expression = expression;
    }

    public ExpressionParseException(String message, Throwable cause) {
        super(message, cause);
        this.position = -1;
        this.expression = null;
    }

    public int getPosition() {
        return position;
    }

    public String getExpression() {
        return expression;
    }

    public boolean hasLocation() {
        return position >= 0;
    }
}
