package org.urdfast.engine.codegen;

import org.urdfast.engine.transpiler.SyntaxProfile;

import java.util.Locale;
import java.util.Objects;

/**
 * Assembles a source file: header comment, profile preamble, section titles
 * and functions, separated by blank lines.
 *
 * Titles are sized by the profile's maximum line width:
 *
 * <pre>
 * # ---------------------------------------------------
 * # |             FORWARD TRANSITION MATRICES         |
 * # ---------------------------------------------------
 *
 * # Joint 2 ___________________________________________
 * </pre>
 */
public final class CodeFileBuilder {

    private final SyntaxProfile profile;
    private final String baseName;
    private final StringBuilder body = new StringBuilder();

    public CodeFileBuilder(SyntaxProfile profile, String baseName) {
        this.profile = Objects.requireNonNull(profile, "Profile cannot be null");
        this.baseName = Objects.requireNonNull(baseName, "File name cannot be null");
    }

    /**
     * Adds a framed, upper-cased title.
     */
    public CodeFileBuilder section(String title) {
        appendBlock(title(title, 0));
        return this;
    }

    /**
     * Adds a title underlined up to the line width.
     */
    public CodeFileBuilder subsection(String title) {
        appendBlock(title(title, 1));
        return this;
    }

    public CodeFileBuilder function(String code) {
        appendBlock(code.stripTrailing());
        return this;
    }

    public GeneratedFile build() {
        StringBuilder content = new StringBuilder();
        content.append(profile.comment("Generated by urdfast-codegen")).append('\n');
        if (!profile.preamble().isEmpty()) {
            content.append('\n').append(profile.preamble().stripTrailing()).append('\n');
        }
        content.append(body);
        return new GeneratedFile(baseName + "." + profile.extension(), content.toString());
    }

    /**
     * Renders a title.
     *
     * @param level 0 for a framed banner, 1 for an underlined title
     */
    public String title(String text, int level) {
        String token = profile.commentToken();
        int width = profile.maxLineWidth();
        if (level == 0) {
            String rule = token + " " + "-".repeat(Math.max(0, width - token.length() - 1));
            int inner = Math.max(0, width - token.length() - 3 - text.length());
            String middle = token + " |" + " ".repeat(inner / 2) + text.toUpperCase(Locale.ROOT)
                    + " ".repeat(inner - inner / 2) + "|";
            return rule + "\n" + middle + "\n" + rule;
        }
        return token + " " + text + " " + "_".repeat(Math.max(0, width - token.length() - text.length() - 2));
    }

    private void appendBlock(String block) {
        body.append('\n').append(block).append('\n');
    }
}
