package org.urdfast.engine.transpiler;

import java.util.Objects;

/**
 * Layout of generated function documentation.
 *
 * @param placement           Before the signature or as the first lines of the
 *                            body
 * @param open                Opening delimiter line, empty for none
 * @param close               Closing delimiter line, empty for none
 * @param linePrefix          Prefix of every documentation line ({@code "% "},
 *                            {@code " * "}), empty for none
 * @param includeSignature    Repeat the signature as the first line
 * @param includeFunctionName Repeat the bare function name after it
 * @param escapeBackslashes   Double backslashes (for string-literal docstrings
 *                            that interpret escapes)
 */
public record DocstringStyle(
        Placement placement,
        String open,
        String close,
        String linePrefix,
        boolean includeSignature,
        boolean includeFunctionName,
        boolean escapeBackslashes) {

    public enum Placement {
        BEFORE,
        AFTER
    }

    public DocstringStyle {
        Objects.requireNonNull(placement, "Placement cannot be null");
        Objects.requireNonNull(open, "Open delimiter cannot be null");
        Objects.requireNonNull(close, "Close delimiter cannot be null");
        Objects.requireNonNull(linePrefix, "Line prefix cannot be null");
    }

    public boolean isBefore() {
        return placement == Placement.BEFORE;
    }
}
