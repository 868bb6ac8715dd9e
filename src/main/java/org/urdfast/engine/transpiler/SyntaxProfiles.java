package org.urdfast.engine.transpiler;

import org.urdfast.engine.expression.Operator;
import org.urdfast.engine.transpiler.DocstringStyle.Placement;
import org.urdfast.engine.transpiler.SyntaxProfile.MatrixLiteral;
import org.urdfast.engine.transpiler.SyntaxProfile.TypeAnnotations;

/**
 * Built-in output profiles.
 *
 * Source expressions follow Python conventions (0-based indexing, exclusive
 * slice ends, {@code **} for powers), so {@link #PYTHON} only renames the
 * matrix product.
 */
public final class SyntaxProfiles {

    private SyntaxProfiles() {
    }

    /**
     * Python with NumPy.
     */
    public static final SyntaxProfile PYTHON = SyntaxProfile.builder("python")
            .extension("py")
            .preamble("from math import cos, sin, pi\nfrom numpy import array, cross, dot, zeros, eye\n")
            .commentToken("#")
            .operator(Operator.MATMUL, OperatorSyntax.call("dot({0}, {1})"))
            .function("eye", "eye({0}, {1})")
            .function("zeros", "zeros(({0}, {1}))")
            .function("cross", "cross({0}, {1})")
            .indexingBase(0)
            .slices(false, "")
            .matrix(new MatrixLiteral("array([", "])", "[", "]", ", ", ","))
            .docstring(new DocstringStyle(Placement.AFTER, "\"\"\"", "\"\"\"", "", false, false, false))
            .maxLineWidth(79)
            .signature("def {name}({params}):", ", ")
            .functionEnd("")
            .returnTemplate("return {value}")
            .loop("for i in range({start}, {stop}):", "")
            .build();

    /**
     * Julia with LinearAlgebra.
     */
    public static final SyntaxProfile JULIA = SyntaxProfile.builder("julia")
            .extension("jl")
            .preamble("using LinearAlgebra\n")
            .commentToken("#")
            .operator(Operator.POWER, OperatorSyntax.infix("^"))
            .operator(Operator.MATMUL, OperatorSyntax.infix("*"))
            .function("eye", "Matrix(I, {0}, {1})")
            .function("zeros", "zeros({0}, {1})")
            .function("cross", "cross({0}, {1})")
            .indexingBase(1)
            .slices(true, "end")
            .matrix(new MatrixLiteral("vcat(", ")", "[", "]", " ", ","))
            .docstring(new DocstringStyle(Placement.BEFORE, "\"\"\"", "\"\"\"", "", true, false, true))
            .maxLineWidth(92)
            .signature("function {name}({params})", ", ")
            .functionEnd("end")
            .returnTemplate("return {value}")
            .loop("for i={first}:{last}", "end")
            .build();

    /**
     * MATLAB, element-wise arithmetic.
     */
    public static final SyntaxProfile MATLAB = SyntaxProfile.builder("matlab")
            .extension("m")
            .preamble("")
            .commentToken("%")
            .operator(Operator.POWER, OperatorSyntax.infix(".^"))
            .operator(Operator.MULTIPLY, OperatorSyntax.infix(".*"))
            .operator(Operator.DIVIDE, OperatorSyntax.infix("./"))
            .operator(Operator.MATMUL, OperatorSyntax.infix("*"))
            .function("eye", "eye({0}, {1})")
            .function("zeros", "zeros({0}, {1})")
            .function("cross", "cross({0}, {1})")
            .indexingBase(1)
            .slices(true, "end")
            .subscript("(", ")")
            .matrix(new MatrixLiteral("[", "]", "", "", ", ", ";"))
            .docstring(new DocstringStyle(Placement.AFTER, "", "", "% ", true, true, false))
            .statementTerminator(";")
            .maxLineWidth(75)
            .signature("function return_value = {name}({params})", ", ")
            .functionEnd("end")
            .returnTemplate("return_value = {value}")
            .loop("for i={first}:{last}", "end")
            .build();

    /**
     * C++ with Eigen. Typed declarations, no slices.
     */
    public static final SyntaxProfile CPP = SyntaxProfile.builder("cpp")
            .extension("cpp")
            .preamble("#include <cmath>\n#include <Eigen/Dense>\n\nusing std::cos;\nusing std::sin;\n")
            .commentToken("//")
            .operator(Operator.POWER, OperatorSyntax.call("pow({0}, {1})"))
            .operator(Operator.MATMUL, OperatorSyntax.infix("*"))
            .function("eye", "Eigen::MatrixXd::Identity({0}, {1})")
            .function("zeros", "Eigen::MatrixXd::Zero({0}, {1})")
            .function("cross", "{0}.cross({1})")
            .indexingBase(0)
            .noSlices()
            .subscript("(", ")")
            .list("(Eigen::VectorXd({size}) << ", ").finished()")
            .matrix(new MatrixLiteral("(Eigen::MatrixXd({rows}, {cols}) << ", ").finished()", "", "", ", ", ","))
            .types(new TypeAnnotations(true, "double", "Eigen::VectorXd", "Eigen::MatrixXd"))
            .docstring(new DocstringStyle(Placement.BEFORE, "/**", " */", " * ", false, false, false))
            .statementTerminator(";")
            .maxLineWidth(80)
            .signature("{returnType} {name}({params}) {", ", ")
            .functionEnd("}")
            .returnTemplate("return {value}")
            .loop("for (int i = {start}; i < {stop}; ++i) {", "}")
            .build();
}
