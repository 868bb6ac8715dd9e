package org.urdfast.engine.expression;

import java.util.List;
import java.util.Objects;

/**
 * One operation detected in a normalized expression.
 *
 * Operand spans are disjoint and strictly increasing; together with the
 * operator token(s), brackets and separators they cover {@link #span()}.
 * Parent/child links are not stored here: they live in the
 * {@link ExpressionForest} arena as integer indices.
 *
 * @param kind         Shape of the operation
 * @param name         Operator key ({@code "+"}, {@code "-u"}), function or
 *                     subscripted object name, {@code "[]"} for list literals,
 *                     {@code ":"} for slices
 * @param operator     Precedence entry, null for functions and slices
 * @param source       Index of the expression in its forest
 * @param span         Total span of the operation
 * @param operands     Operand spans, in order
 * @param operandTexts Operand texts, in order
 */
public record OperationRecord(
        OperationKind kind,
        String name,
        Operator operator,
        int source,
        Span span,
        List<Span> operands,
        List<String> operandTexts) {

    public OperationRecord {
        Objects.requireNonNull(kind, "Kind cannot be null");
        Objects.requireNonNull(name, "Name cannot be null");
        operands = List.copyOf(operands);
        operandTexts = List.copyOf(operandTexts);
        if (operands.size() != operandTexts.size()) {
            throw new IllegalArgumentException("Operand spans and texts differ in size");
        }
    }

    public boolean isFunction() {
        return kind.isFunction();
    }

    public int operandCount() {
        return operands.size();
    }

    /**
     * @return The operator to use for parenthesization decisions, or null when
     *         the record renders atomically
     */
    public Operator precedenceOperator() {
        return kind.isAtomic() ? null : operator;
    }

    @Override
    public String toString() {
        return kind + "(" + name + ")" + span + operandTexts;
    }
}
