package org.urdfast.engine.expression;

/**
 * Half-open character range {@code [start, end)} in a normalized expression.
 */
public record Span(int start, int end) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public String text(String source) {
        return source.substring(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + "," + end + ")";
    }
}
