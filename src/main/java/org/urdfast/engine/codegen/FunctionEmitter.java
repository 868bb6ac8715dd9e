package org.urdfast.engine.codegen;

import org.urdfast.engine.expression.VariableSubstitution;
import org.urdfast.engine.model.ExpressionGrid;
import org.urdfast.engine.model.LoopEnd;
import org.urdfast.engine.model.LoopStart;
import org.urdfast.engine.model.NamedVariable;
import org.urdfast.engine.model.Statement;
import org.urdfast.engine.model.VariableKind;
import org.urdfast.engine.transpiler.SyntaxProfile;
import org.urdfast.engine.transpiler.TargetRenderer;
import org.urdfast.engine.transpiler.Templates;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Emits one complete function in the syntax of a {@link SyntaxProfile}.
 *
 * Layout, in order: signature, docstring (before or after the signature as
 * the profile says), one line per body statement, then the return statement.
 * A matrix result is first assigned to a local ({@code mat}, or {@code mat0},
 * {@code mat00}, ... if taken) whose rows are aligned under each other.
 * When inputs are collapsed into a vector only scalar parameters are packed;
 * vector and matrix parameters follow it in the signature.
 *
 * Example:
 *
 * <pre>
 * FunctionEmitter emitter = new FunctionEmitter(SyntaxProfiles.PYTHON);
 * String code = emitter.emit(FunctionSpec.of("f", params, ExpressionGrid.scalar("a+b")));
 * </pre>
 *
 * Everything is rendered before anything is returned, so a parse or
 * configuration error never leaves a partial function behind.
 */
public final class FunctionEmitter {

    static final String VECTOR_PARAMETER = "q";
    private static final String MATRIX_LOCAL = "mat";

    private final SyntaxProfile profile;
    private final TargetRenderer renderer;
    private final DocstringFormatter docstrings;

    public FunctionEmitter(SyntaxProfile profile) {
        this.profile = Objects.requireNonNull(profile, "Profile cannot be null");
        this.renderer = new TargetRenderer(profile);
        this.docstrings = new DocstringFormatter(profile);
    }

    public SyntaxProfile profile() {
        return profile;
    }

    /**
     * Generates the function text, terminated by a newline.
     *
     * @throws org.urdfast.engine.expression.ExpressionParseException if an
     *         expression is malformed
     * @throws org.urdfast.engine.transpiler.CodegenConfigurationException if
     *         the profile cannot express an expression
     * @throws IllegalArgumentException if loop markers are unbalanced
     */
    public String emit(FunctionSpec spec) {
        Objects.requireNonNull(spec, "Function spec cannot be null");
        Map<String, String> elements = spec.inputAsVector() ? vectorElements(spec.parameters()) : Map.of();
        String indent = profile.indent();

        String signature = signature(spec);
        List<String> lines = new ArrayList<>();
        List<String> doc = spec.hasDocstring()
                ? docstrings.format(signature, spec, documentedParameters(spec))
                : List.of();

        if (profile.docstring().isBefore()) {
            lines.addAll(doc);
            lines.add(signature);
        } else {
            lines.add(signature);
            for (String line : doc) {
                lines.add(line.isEmpty() ? "" : indent + line);
            }
            if (!doc.isEmpty()) {
                lines.add("");
            }
        }

        List<String> body = body(spec.body(), elements);
        lines.addAll(body);
        if (!body.isEmpty()) {
            lines.add("");
        }
        lines.addAll(returnStatement(spec, elements));
        if (!profile.functionEnd().isEmpty()) {
            lines.add(profile.functionEnd());
        }
        return String.join("\n", lines) + "\n";
    }

    // ==================== Signature ====================

    private String signature(FunctionSpec spec) {
        List<String> params = new ArrayList<>();
        if (spec.inputAsVector()) {
            params.add(profile.types().declare(VariableKind.VECTOR, VECTOR_PARAMETER));
        }
        for (FunctionParameter parameter : spec.parameters()) {
            if (!spec.inputAsVector() || !isPacked(parameter)) {
                params.add(profile.types().declare(parameter.kind(), parameter.name()));
            }
        }
        VariableKind returnKind = spec.result().isScalar() ? VariableKind.SCALAR : VariableKind.MATRIX;
        Map<String, String> values = new LinkedHashMap<>();
        values.put("name", spec.name());
        values.put("params", String.join(profile.parameterSeparator(), params));
        values.put("returnType", profile.types().typeOf(returnKind));
        return Templates.named(profile.signatureTemplate(), values);
    }

    /**
     * Maps each parameter to its element of the input vector, in source
     * (0-based) syntax.
     */
    private static Map<String, String> vectorElements(List<FunctionParameter> parameters) {
        Map<String, String> elements = new LinkedHashMap<>();
        for (FunctionParameter parameter : packed(parameters)) {
            elements.put(parameter.name(), VECTOR_PARAMETER + "[" + elements.size() + "]");
        }
        return elements;
    }

    private static boolean isPacked(FunctionParameter parameter) {
        return parameter.kind() == VariableKind.SCALAR;
    }

    private static List<FunctionParameter> packed(List<FunctionParameter> parameters) {
        List<FunctionParameter> result = new ArrayList<>();
        for (FunctionParameter parameter : parameters) {
            if (isPacked(parameter)) {
                result.add(parameter);
            }
        }
        return result;
    }

    private List<FunctionParameter> documentedParameters(FunctionSpec spec) {
        if (!spec.inputAsVector()) {
            return spec.parameters();
        }
        StringBuilder description = new StringBuilder("Vector of variables where :");
        List<FunctionParameter> parameters = packed(spec.parameters());
        for (int i = 0; i < parameters.size(); i++) {
            FunctionParameter parameter = parameters.get(i);
            description.append("\n- ").append(renderer.convert(VECTOR_PARAMETER + "[" + i + "]"))
                    .append(" = ").append(parameter.name()).append(" :");
            if (!parameter.description().isEmpty()) {
                description.append("\n      ").append(parameter.description());
            }
        }
        List<FunctionParameter> documented = new ArrayList<>();
        documented.add(new FunctionParameter(VECTOR_PARAMETER, VariableKind.VECTOR, description.toString()));
        for (FunctionParameter parameter : spec.parameters()) {
            if (!isPacked(parameter)) {
                documented.add(parameter);
            }
        }
        return documented;
    }

    // ==================== Body ====================

    private List<String> body(List<Statement> statements, Map<String, String> elements) {
        List<String> lines = new ArrayList<>();
        int depth = 1;
        for (Statement statement : statements) {
            if (statement instanceof NamedVariable variable) {
                String value = renderer.convert(substitute(variable.value(), elements));
                lines.add(profile.indent().repeat(depth) + profile.statement(
                        profile.types().declare(variable.kind(), variable.name()) + " = " + value));
            } else if (statement instanceof LoopStart loop) {
                lines.add(profile.indent().repeat(depth) + loopOpening(loop));
                depth++;
            } else if (statement instanceof LoopEnd) {
                if (depth == 1) {
                    throw new IllegalArgumentException("Loop end without a matching loop start");
                }
                depth--;
                if (!profile.loopClose().isEmpty()) {
                    lines.add(profile.indent().repeat(depth) + profile.loopClose());
                }
            }
        }
        if (depth != 1) {
            throw new IllegalArgumentException("Unclosed loop in function body");
        }
        return lines;
    }

    private String loopOpening(LoopStart loop) {
        int base = profile.indexingBase();
        Map<String, String> values = new LinkedHashMap<>();
        values.put("start", loop.start());
        values.put("stop", loop.stop());
        values.put("first", TargetRenderer.shift(loop.start(), base));
        values.put("last", TargetRenderer.shift(loop.stop(), base - 1));
        return Templates.named(profile.loopOpenTemplate(), values);
    }

    // ==================== Return ====================

    private List<String> returnStatement(FunctionSpec spec, Map<String, String> elements) {
        String indent = profile.indent();
        ExpressionGrid result = spec.result();
        if (result.isScalar()) {
            String value = renderer.convert(substitute(result.cell(0, 0), elements));
            return List.of(indent + profile.statement(returnText(value)));
        }

        List<List<String>> rows = new ArrayList<>();
        for (List<String> row : result.rows()) {
            List<String> cells = new ArrayList<>(row.size());
            for (String cell : row) {
                cells.add(renderer.convert(substitute(cell, elements)));
            }
            rows.add(cells);
        }

        String local = matrixLocal(spec);
        String head = profile.types().declare(VariableKind.MATRIX, local) + " = ";
        String literal = profile.matrix().render(rows, indent.length() + head.length());
        List<String> lines = new ArrayList<>();
        lines.add(indent + profile.comment("Returned Matrix"));
        for (String line : profile.statement(head + literal).split("\n")) {
            lines.add(lines.size() == 1 ? indent + line : line);
        }
        lines.add("");
        lines.add(indent + profile.statement(returnText(local)));
        return lines;
    }

    private String returnText(String value) {
        return Templates.named(profile.returnTemplate(), Map.of("value", value));
    }

    private static String matrixLocal(FunctionSpec spec) {
        Set<String> taken = new HashSet<>();
        for (FunctionParameter parameter : spec.parameters()) {
            taken.add(parameter.name());
        }
        for (Statement statement : spec.body()) {
            if (statement instanceof NamedVariable variable) {
                taken.add(variable.name());
            }
        }
        String name = MATRIX_LOCAL;
        while (taken.contains(name)) {
            name += "0";
        }
        return name;
    }

    private static String substitute(String expression, Map<String, String> elements) {
        return elements.isEmpty() ? expression : VariableSubstitution.substituteAll(expression, elements);
    }
}
