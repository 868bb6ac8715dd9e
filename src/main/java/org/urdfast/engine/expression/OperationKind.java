package org.urdfast.engine.expression;

/**
 * Shape of an {@link OperationRecord}.
 */
public enum OperationKind {
    BINARY, // a+b, a*b*c (n-ary when commutative)
    UNARY, // -a
    FUNCTION, // cos(x)
    SUBSCRIPT, // q[0]
    LIST, // [a,b]
    SLICE; // 0:3 inside a subscript

    /**
     * @return true for call-like constructs whose brackets already delimit the
     *         operands
     */
    public boolean isFunction() {
        return this == FUNCTION || this == SUBSCRIPT;
    }

    /**
     * @return true if the construct renders as one unit that never needs
     *         parentheses
     */
    public boolean isAtomic() {
        return this != BINARY && this != UNARY;
    }
}
