package org.urdfast.engine.expression;

import org.urdfast.engine.expression.SourceText.OperatorToken;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Locates every call, subscript, list literal, slice and operator occurrence
 * in one normalized expression.
 *
 * Bracketed constructs are found first, then every operator token is handed
 * to the {@link OperandResolver}. Detections of the same span (the n-ary
 * {@code +} chain {@code a+b+c} is found once per {@code +}) collapse to one
 * record.
 */
public final class ExpressionScanner {

    private final SourceText text;
    private final int source;
    private final OperandResolver resolver;

    ExpressionScanner(SourceText text, int source) {
        this.text = text;
        this.source = source;
        this.resolver = new OperandResolver(text, source);
    }

    /**
     * Scans a normalized expression.
     *
     * @param expression Expression without whitespace
     * @return Every operation of the expression, one per distinct span
     * @throws ExpressionParseException if the expression is malformed
     */
    public static List<OperationRecord> scan(String expression) {
        return new ExpressionScanner(new SourceText(expression), 0).scan();
    }

    List<OperationRecord> scan() {
        Map<Span, OperationRecord> bySpan = new LinkedHashMap<>();
        Set<Integer> sliceColons = new HashSet<>();

        scanBrackets(bySpan, sliceColons);
        checkColons(sliceColons);
        scanOperators(bySpan);

        return new ArrayList<>(bySpan.values());
    }

    // ==================== Calls, subscripts, lists ====================

    private void scanBrackets(Map<Span, OperationRecord> bySpan, Set<Integer> sliceColons) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c != '(' && c != '[') {
                continue;
            }
            int nameStart = identifierStart(i);
            if (nameStart >= 0 && Character.isDigit(text.charAt(nameStart))) {
                throw new ExpressionParseException("Unexpected '" + c + "' after numeric literal", text.text(), i);
            }
            if (nameStart < 0 && i > 0 && SourceText.isClosing(text.charAt(i - 1))) {
                throw new ExpressionParseException("Unsupported call or subscript on a bracketed expression",
                        text.text(), i);
            }

            if (c == '(') {
                if (nameStart >= 0) {
                    add(bySpan, bracketed(OperationKind.FUNCTION, nameStart, i));
                }
            } else if (nameStart >= 0) {
                OperationRecord subscript = bracketed(OperationKind.SUBSCRIPT, nameStart, i);
                add(bySpan, subscript);
                for (Span argument : subscript.operands()) {
                    scanSlice(argument, bySpan, sliceColons);
                }
            } else {
                add(bySpan, bracketed(OperationKind.LIST, i, i));
            }
        }
    }

    private OperationRecord bracketed(OperationKind kind, int nameStart, int open) {
        int close = text.partner(open);
        List<Span> arguments = splitArguments(open, close);
        String name = kind == OperationKind.LIST ? "[]" : text.text().substring(nameStart, open);
        Operator operator = kind == OperationKind.FUNCTION ? null : Operator.SUBSCRIPT;
        return new OperationRecord(kind, name, operator, source, new Span(nameStart, close + 1), arguments,
                texts(arguments));
    }

    private List<Span> splitArguments(int open, int close) {
        List<Span> arguments = new ArrayList<>();
        if (close == open + 1) {
            return arguments;
        }
        int begin = open + 1;
        int j = begin;
        while (j < close) {
            char c = text.charAt(j);
            if (SourceText.isOpening(c)) {
                j = text.partner(j) + 1;
                continue;
            }
            if (c == ',') {
                arguments.add(argument(begin, j));
                begin = j + 1;
            }
            j++;
        }
        arguments.add(argument(begin, close));
        return arguments;
    }

    private Span argument(int begin, int end) {
        if (begin == end) {
            throw new ExpressionParseException("Empty argument", text.text(), begin);
        }
        return new Span(begin, end);
    }

    private void scanSlice(Span argument, Map<Span, OperationRecord> bySpan, Set<Integer> sliceColons) {
        int colon = -1;
        int j = argument.start();
        while (j < argument.end()) {
            char c = text.charAt(j);
            if (SourceText.isOpening(c)) {
                j = text.partner(j) + 1;
                continue;
            }
            if (c == ':') {
                if (colon >= 0) {
                    throw new ExpressionParseException("Unsupported slice step", text.text(), j);
                }
                colon = j;
            }
            j++;
        }
        if (colon < 0) {
            return;
        }
        sliceColons.add(colon);
        List<Span> bounds = List.of(new Span(argument.start(), colon), new Span(colon + 1, argument.end()));
        add(bySpan, new OperationRecord(OperationKind.SLICE, ":", null, source, argument, bounds, texts(bounds)));
    }

    private void checkColons(Set<Integer> sliceColons) {
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == ':' && !sliceColons.contains(i)) {
                throw new ExpressionParseException("Unexpected ':' outside a subscript", text.text(), i);
            }
        }
    }

    /**
     * @return Start of the identifier run that ends right before {@code index},
     *         or -1 if there is none
     */
    private int identifierStart(int index) {
        int j = index - 1;
        while (j >= 0 && SourceText.isIdentifierChar(text.charAt(j))) {
            j--;
        }
        return j == index - 1 ? -1 : j + 1;
    }

    // ==================== Operators ====================

    private void scanOperators(Map<Span, OperationRecord> bySpan) {
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if ("+-*/@".indexOf(c) < 0 || text.isExponentSign(i)) {
                i++;
                continue;
            }
            OperatorToken token = text.tokenStartingAt(i);
            OperationRecord record = token.operator().isUnary()
                    ? resolver.resolveUnary(token)
                    : resolver.resolveBinary(token);
            add(bySpan, record);
            i = token.end();
        }
    }

    private static void add(Map<Span, OperationRecord> bySpan, OperationRecord record) {
        bySpan.putIfAbsent(record.span(), record);
    }

    private List<String> texts(List<Span> spans) {
        List<String> result = new ArrayList<>(spans.size());
        for (Span span : spans) {
            result.add(span.text(text.text()));
        }
        return result;
    }
}
