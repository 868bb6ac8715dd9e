package org.urdfast.engine.expression;

import org.urdfast.engine.expression.SourceText.OperatorToken;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Finds the exact operand boundaries of one operator occurrence.
 *
 * Walks outward from the operator token, skipping whole bracketed groups, and
 * stops at the first operator that binds looser than the current one:
 * <ul>
 * <li>the same commutative operator adds an operand to an n-ary chain
 * ({@code a+b+c} is one node with three operands);</li>
 * <li>the same right-associative operator bounds the left operand
 * ({@code a**b**c} is {@code a**(b**c)});</li>
 * <li>operators of a higher or equal precedence class are part of the
 * operand;</li>
 * <li>opening brackets, commas and slice colons always bound the operand.</li>
 * </ul>
 */
final class OperandResolver {

    private final SourceText text;
    private final int source;

    OperandResolver(SourceText text, int source) {
        this.text = text;
        this.source = source;
    }

    OperationRecord resolveBinary(OperatorToken token) {
        Operator op = token.operator();
        List<Integer> cuts = new ArrayList<>();
        cuts.add(token.start());

        int leftStart = findLeftBoundary(token, cuts);
        int rightEnd = findRightBoundary(token, cuts);
        Collections.sort(cuts);

        List<Span> operands = new ArrayList<>();
        int begin = leftStart;
        for (int cut : cuts) {
            operands.add(operand(begin, cut, token));
            begin = cut + token.length();
        }
        operands.add(operand(begin, rightEnd, token));

        Span total = new Span(leftStart, rightEnd);
        return new OperationRecord(OperationKind.BINARY, op.key(), op, source, total, operands, texts(operands));
    }

    OperationRecord resolveUnary(OperatorToken token) {
        Operator op = token.operator();
        int rightEnd = findRightBoundary(token, new ArrayList<>());
        Span operand = operand(token.end(), rightEnd, token);
        Span total = new Span(token.start(), rightEnd);
        return new OperationRecord(OperationKind.UNARY, op.key(), op, source, total, List.of(operand),
                texts(List.of(operand)));
    }

    private int findLeftBoundary(OperatorToken token, List<Integer> cuts) {
        Operator op = token.operator();
        int i = token.start() - 1;
        while (i >= 0) {
            char c = text.charAt(i);
            if (SourceText.isClosing(c)) {
                i = text.partner(i) - 1;
                continue;
            }
            if (text.isOperandChar(i)) {
                i--;
                continue;
            }
            if (SourceText.isOpening(c) || c == ',' || c == ':') {
                return i + 1;
            }
            OperatorToken found = text.tokenEndingAt(i);
            Operator other = found.operator();
            if (other == op && op.isCommutative()) {
                cuts.add(found.start());
            } else if (other == op && op.isRightAssociative()) {
                return i + 1;
            } else if (!other.outranks(op) && !other.sameClass(op)) {
                return i + 1;
            }
            i = found.start() - 1;
        }
        return 0;
    }

    private int findRightBoundary(OperatorToken token, List<Integer> cuts) {
        Operator op = token.operator();
        int i = token.end();
        while (i < text.length()) {
            char c = text.charAt(i);
            if (SourceText.isOpening(c)) {
                i = text.partner(i) + 1;
                continue;
            }
            if (text.isOperandChar(i)) {
                i++;
                continue;
            }
            if (SourceText.isClosing(c) || c == ',' || c == ':') {
                return i;
            }
            OperatorToken found = text.tokenStartingAt(i);
            Operator other = found.operator();
            // a sign can only open a nested operand (a*-b, a**-b), so it never bounds
            if (!other.isUnary()) {
                if (other == op && op.isCommutative()) {
                    cuts.add(i);
                } else if (other == op && !op.isRightAssociative()) {
                    return i;
                } else if (!other.outranks(op) && !other.sameClass(op)) {
                    return i;
                }
            }
            i = found.end();
        }
        return text.length();
    }

    private Span operand(int begin, int end, OperatorToken token) {
        if (begin >= end) {
            throw new ExpressionParseException("Missing operand for '" + token.operator().symbol() + "'",
                    text.text(), token.start());
        }
        return new Span(begin, end);
    }

    private List<String> texts(List<Span> spans) {
        List<String> result = new ArrayList<>(spans.size());
        for (Span span : spans) {
            result.add(span.text(text.text()));
        }
        return result;
    }
}
