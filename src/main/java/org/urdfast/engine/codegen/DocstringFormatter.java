package org.urdfast.engine.codegen;

import org.urdfast.engine.transpiler.DocstringStyle;
import org.urdfast.engine.transpiler.SyntaxProfile;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Lays out function documentation for one profile.
 *
 * The text has a fixed shape: optional signature and name lines, then a
 * {@code Description} section and a {@code Parameters} section with one block
 * per parameter. Lines longer than the profile's width are wrapped greedily at
 * word boundaries, keeping the line's indentation; continuation lines of a
 * {@code "- "} item are indented under its text.
 */
final class DocstringFormatter {

    private static final String BLOCK_INDENT = "    ";

    private final SyntaxProfile profile;

    DocstringFormatter(SyntaxProfile profile) {
        this.profile = profile;
    }

    /**
     * Builds the documentation block, delimiters and line prefixes included,
     * without body indentation.
     *
     * @param signature  The emitted signature line
     * @param spec       The function
     * @param parameters Parameters as documented (the vector parameter when
     *                   inputs are collapsed)
     */
    List<String> format(String signature, FunctionSpec spec, List<FunctionParameter> parameters) {
        DocstringStyle style = profile.docstring();
        List<String> content = new ArrayList<>();
        if (style.includeSignature()) {
            content.add(BLOCK_INDENT + signatureWithoutKeyword(signature));
        }
        if (style.includeFunctionName()) {
            content.add(spec.name());
        }
        if (!content.isEmpty()) {
            content.add("");
        }

        content.add("Description");
        content.add("-----------");
        content.add("");
        content.addAll(List.of(spec.description().split("\n", -1)));
        content.add("");
        if (!parameters.isEmpty()) {
            content.add("Parameters");
            content.add("----------");
            content.add("");
            for (FunctionParameter parameter : parameters) {
                String type = typeLabel(parameter);
                content.add(type.isEmpty() ? parameter.name() : parameter.name() + " : " + type);
                if (!parameter.description().isEmpty()) {
                    for (String line : parameter.description().split("\n", -1)) {
                        content.add(line.isEmpty() ? "" : BLOCK_INDENT + line);
                    }
                }
                content.add("");
            }
        }
        while (!content.isEmpty() && content.get(content.size() - 1).isEmpty()) {
            content.remove(content.size() - 1);
        }

        int width = profile.maxLineWidth() - style.linePrefix().length()
                - (style.isBefore() ? 0 : profile.indent().length());
        List<String> lines = new ArrayList<>();
        if (!style.open().isEmpty()) {
            lines.add(style.open());
        }
        for (String line : content) {
            String text = style.escapeBackslashes() ? line.replace("\\", "\\\\") : line;
            for (String wrapped : wrap(text, width)) {
                lines.add((style.linePrefix() + wrapped).stripTrailing());
            }
        }
        if (!style.close().isEmpty()) {
            lines.add(style.close());
        }
        return lines;
    }

    private String typeLabel(FunctionParameter parameter) {
        String type = profile.types().typeOf(parameter.kind());
        return type.isEmpty() ? parameter.kind().name().toLowerCase(Locale.ROOT) : type;
    }

    /**
     * Drops the leading keyword: {@code "def f(a):"} documents as
     * {@code "f(a):"}.
     */
    private static String signatureWithoutKeyword(String signature) {
        int space = signature.indexOf(' ');
        return space < 0 ? signature : signature.substring(space + 1);
    }

    // ==================== Wrapping ====================

    /**
     * Wraps one line greedily to {@code width} characters. A single word
     * longer than the width stays on its own line.
     */
    static List<String> wrap(String line, int width) {
        List<String> result = new ArrayList<>();
        if (line.length() <= width) {
            result.add(line);
            return result;
        }
        int indentLength = 0;
        while (indentLength < line.length() && line.charAt(indentLength) == ' ') {
            indentLength++;
        }
        String indent = line.substring(0, indentLength);
        String continuation = line.startsWith("- ", indentLength) ? indent + "  " : indent;

        String[] words = line.substring(indentLength).trim().split(" +");
        StringBuilder current = new StringBuilder(indent);
        boolean empty = true;
        for (String word : words) {
            if (!empty && current.length() + 1 + word.length() > width) {
                result.add(current.toString());
                current = new StringBuilder(continuation);
                empty = true;
            }
            if (!empty) {
                current.append(' ');
            }
            current.append(word);
            empty = false;
        }
        result.add(current.toString());
        return result;
    }
}
