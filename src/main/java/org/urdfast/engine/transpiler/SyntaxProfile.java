package org.urdfast.engine.transpiler;

import org.urdfast.engine.expression.Operator;
import org.urdfast.engine.model.VariableKind;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative description of one output language.
 *
 * A profile is immutable and validated on construction: every operator of the
 * expression language must have a syntax, and the indexing base must be 0 or
 * 1. Use {@link #builder(String)} to assemble one; the built-in profiles live
 * in {@link SyntaxProfiles}.
 *
 * Templates:
 * <ul>
 * <li>function templates: positional, {@code "Matrix(I, {0}, {1})"}</li>
 * <li>signature: {@code {name}}, {@code {params}}, {@code {returnType}}</li>
 * <li>return: {@code {value}}</li>
 * <li>loop opening: {@code {start}}, {@code {stop}} (0-based, exclusive) and
 * {@code {first}}, {@code {last}} (shifted by the base, inclusive)</li>
 * <li>list opening: {@code {size}}; matrix opening: {@code {rows}},
 * {@code {cols}}</li>
 * </ul>
 */
public record SyntaxProfile(
        String name,
        String extension,
        String preamble,
        String commentToken,
        Map<Operator, OperatorSyntax> operators,
        Map<String, String> functionTemplates,
        int indexingBase,
        boolean supportsSlices,
        boolean sliceUpperInclusive,
        String sliceOpenEnd,
        String subscriptOpen,
        String subscriptClose,
        String argumentSeparator,
        String listOpen,
        String listClose,
        MatrixLiteral matrix,
        TypeAnnotations types,
        DocstringStyle docstring,
        String statementTerminator,
        int maxLineWidth,
        String signatureTemplate,
        String parameterSeparator,
        String functionEnd,
        String returnTemplate,
        String loopOpenTemplate,
        String loopClose,
        String indent) {

    public SyntaxProfile {
        Objects.requireNonNull(name, "Profile name cannot be null");
        Objects.requireNonNull(matrix, "Matrix literal cannot be null");
        Objects.requireNonNull(types, "Type annotations cannot be null");
        Objects.requireNonNull(docstring, "Docstring style cannot be null");
        for (Operator op : Operator.values()) {
            if (op != Operator.SUBSCRIPT && !operators.containsKey(op)) {
                throw new CodegenConfigurationException(
                        "Profile '" + name + "' has no syntax for operator '" + op.key() + "'");
            }
        }
        if (indexingBase != 0 && indexingBase != 1) {
            throw new CodegenConfigurationException(
                    "Profile '" + name + "' has an invalid indexing base: " + indexingBase);
        }
        if (maxLineWidth < 20) {
            throw new CodegenConfigurationException(
                    "Profile '" + name + "' has an invalid maximum line width: " + maxLineWidth);
        }
        operators = Map.copyOf(operators);
        functionTemplates = Map.copyOf(functionTemplates);
    }

    public OperatorSyntax operatorSyntax(Operator operator) {
        return operators.get(operator);
    }

    /**
     * @return The call template of a function, or null if the function keeps
     *         its name and argument list
     */
    public String functionTemplate(String function) {
        return functionTemplates.get(function);
    }

    /**
     * Writes a statement: the text followed by the terminator.
     */
    public String statement(String text) {
        return text + statementTerminator;
    }

    /**
     * Writes a single-line comment.
     */
    public String comment(String text) {
        return text.isEmpty() ? commentToken : commentToken + " " + text;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Returns a builder initialized with this profile's settings.
     */
    public Builder toBuilder() {
        Builder b = new Builder(name);
        b.extension = extension;
        b.preamble = preamble;
        b.commentToken = commentToken;
        b.operators.putAll(operators);
        b.functionTemplates.putAll(functionTemplates);
        b.indexingBase = indexingBase;
        b.supportsSlices = supportsSlices;
        b.sliceUpperInclusive = sliceUpperInclusive;
        b.sliceOpenEnd = sliceOpenEnd;
        b.subscriptOpen = subscriptOpen;
        b.subscriptClose = subscriptClose;
        b.argumentSeparator = argumentSeparator;
        b.listOpen = listOpen;
        b.listClose = listClose;
        b.matrix = matrix;
        b.types = types;
        b.docstring = docstring;
        b.statementTerminator = statementTerminator;
        b.maxLineWidth = maxLineWidth;
        b.signatureTemplate = signatureTemplate;
        b.parameterSeparator = parameterSeparator;
        b.functionEnd = functionEnd;
        b.returnTemplate = returnTemplate;
        b.loopOpenTemplate = loopOpenTemplate;
        b.loopClose = loopClose;
        b.indent = indent;
        return b;
    }

    // ==================== Nested records ====================

    /**
     * Delimiters of a 2-D literal.
     *
     * @param open            Opening text; may use {@code {rows}} and
     *                        {@code {cols}}
     * @param close           Closing text
     * @param rowOpen         Text before each row
     * @param rowClose        Text after each row
     * @param columnSeparator Between cells of a row
     * @param rowSeparator    Between rows
     */
    public record MatrixLiteral(
            String open,
            String close,
            String rowOpen,
            String rowClose,
            String columnSeparator,
            String rowSeparator) {

        /**
         * Assembles the literal. Rows after the first start on a new line,
         * aligned under the first row.
         *
         * @param column Column at which the literal starts
         */
        public String render(List<List<String>> rows, int column) {
            int columns = rows.isEmpty() ? 0 : rows.get(0).size();
            String opening = open.replace("{rows}", String.valueOf(rows.size()))
                    .replace("{cols}", String.valueOf(columns));
            String continuation = " ".repeat(column + opening.length());
            StringBuilder sb = new StringBuilder(opening);
            for (int r = 0; r < rows.size(); r++) {
                if (r > 0) {
                    sb.append(rowSeparator).append('\n').append(continuation);
                }
                sb.append(rowOpen).append(String.join(columnSeparator, rows.get(r))).append(rowClose);
            }
            sb.append(close);
            return sb.toString();
        }
    }

    /**
     * Declaration types for typed targets.
     *
     * @param typed  Whether declarations carry a type
     * @param scalar Scalar type
     * @param vector Vector type
     * @param matrix Matrix type
     */
    public record TypeAnnotations(boolean typed, String scalar, String vector, String matrix) {

        public static final TypeAnnotations UNTYPED = new TypeAnnotations(false, "", "", "");

        /**
         * @return The type of a kind, empty when untyped or for
         *         {@link VariableKind#NONE}
         */
        public String typeOf(VariableKind kind) {
            if (!typed) {
                return "";
            }
            return switch (kind) {
                case SCALAR -> scalar;
                case VECTOR -> vector;
                case MATRIX -> matrix;
                case NONE -> "";
            };
        }

        /**
         * Prefixes a name with its type when the target is typed.
         */
        public String declare(VariableKind kind, String name) {
            String type = typeOf(kind);
            return type.isEmpty() ? name : type + " " + name;
        }
    }

    // ==================== Builder ====================

    /**
     * Builder for profiles. Defaults describe an untyped, 0-based language with
     * infix operators and {@code #} comments.
     */
    public static final class Builder {
        private final String name;
        private String extension = "txt";
        private String preamble = "";
        private String commentToken = "#";
        private final Map<Operator, OperatorSyntax> operators = new EnumMap<>(Operator.class);
        private final Map<String, String> functionTemplates = new LinkedHashMap<>();
        private int indexingBase = 0;
        private boolean supportsSlices = true;
        private boolean sliceUpperInclusive = false;
        private String sliceOpenEnd = "";
        private String subscriptOpen = "[";
        private String subscriptClose = "]";
        private String argumentSeparator = ", ";
        private String listOpen = "[";
        private String listClose = "]";
        private MatrixLiteral matrix = new MatrixLiteral("[", "]", "[", "]", ", ", ",");
        private TypeAnnotations types = TypeAnnotations.UNTYPED;
        private DocstringStyle docstring = new DocstringStyle(DocstringStyle.Placement.BEFORE, "", "", "# ",
                false, false, false);
        private String statementTerminator = "";
        private int maxLineWidth = 79;
        private String signatureTemplate = "function {name}({params})";
        private String parameterSeparator = ", ";
        private String functionEnd = "end";
        private String returnTemplate = "return {value}";
        private String loopOpenTemplate = "for i in {start}..{last}";
        private String loopClose = "end";
        private String indent = "    ";

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "Profile name cannot be null");
            for (Operator op : Operator.values()) {
                if (op != Operator.SUBSCRIPT) {
                    operators.put(op, OperatorSyntax.infix(op.symbol()));
                }
            }
        }

        public Builder extension(String extension) {
            this.extension = extension;
            return this;
        }

        public Builder preamble(String preamble) {
            this.preamble = preamble;
            return this;
        }

        public Builder commentToken(String commentToken) {
            this.commentToken = commentToken;
            return this;
        }

        public Builder operator(Operator operator, OperatorSyntax syntax) {
            this.operators.put(operator, syntax);
            return this;
        }

        /**
         * Removes an operator; building then fails. Used to test profile
         * validation.
         */
        public Builder withoutOperator(Operator operator) {
            this.operators.remove(operator);
            return this;
        }

        public Builder function(String function, String template) {
            this.functionTemplates.put(function, template);
            return this;
        }

        public Builder indexingBase(int indexingBase) {
            this.indexingBase = indexingBase;
            return this;
        }

        /**
         * @param upperInclusive Whether a slice's upper bound is included
         * @param openEnd        Token for an omitted upper bound, empty to
         *                       leave it out
         */
        public Builder slices(boolean upperInclusive, String openEnd) {
            this.supportsSlices = true;
            this.sliceUpperInclusive = upperInclusive;
            this.sliceOpenEnd = openEnd;
            return this;
        }

        public Builder noSlices() {
            this.supportsSlices = false;
            return this;
        }

        public Builder subscript(String open, String close) {
            this.subscriptOpen = open;
            this.subscriptClose = close;
            return this;
        }

        public Builder argumentSeparator(String argumentSeparator) {
            this.argumentSeparator = argumentSeparator;
            return this;
        }

        public Builder list(String open, String close) {
            this.listOpen = open;
            this.listClose = close;
            return this;
        }

        public Builder matrix(MatrixLiteral matrix) {
            this.matrix = matrix;
            return this;
        }

        public Builder types(TypeAnnotations types) {
            this.types = types;
            return this;
        }

        public Builder docstring(DocstringStyle docstring) {
            this.docstring = docstring;
            return this;
        }

        public Builder statementTerminator(String statementTerminator) {
            this.statementTerminator = statementTerminator;
            return this;
        }

        public Builder maxLineWidth(int maxLineWidth) {
            this.maxLineWidth = maxLineWidth;
            return this;
        }

        public Builder signature(String template, String parameterSeparator) {
            this.signatureTemplate = template;
            this.parameterSeparator = parameterSeparator;
            return this;
        }

        public Builder functionEnd(String functionEnd) {
            this.functionEnd = functionEnd;
            return this;
        }

        public Builder returnTemplate(String returnTemplate) {
            this.returnTemplate = returnTemplate;
            return this;
        }

        public Builder loop(String openTemplate, String close) {
            this.loopOpenTemplate = openTemplate;
            this.loopClose = close;
            return this;
        }

        public Builder indent(String indent) {
            this.indent = indent;
            return this;
        }

        /**
         * @throws CodegenConfigurationException if the settings are
         *                                       inconsistent
         */
        public SyntaxProfile build() {
            return new SyntaxProfile(name, extension, preamble, commentToken, operators, functionTemplates,
                    indexingBase, supportsSlices, sliceUpperInclusive, sliceOpenEnd, subscriptOpen,
                    subscriptClose, argumentSeparator, listOpen, listClose, matrix, types, docstring,
                    statementTerminator, maxLineWidth, signatureTemplate, parameterSeparator, functionEnd,
                    returnTemplate, loopOpenTemplate, loopClose, indent);
        }
    }
}
