package org.urdfast.engine.codegen;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.urdfast.engine.expression.ExpressionParseException;
import org.urdfast.engine.model.ExpressionGrid;
import org.urdfast.engine.model.LoopEnd;
import org.urdfast.engine.model.LoopStart;
import org.urdfast.engine.model.NamedVariable;
import org.urdfast.engine.model.VariableKind;
import org.urdfast.engine.transpiler.SyntaxProfile;
import org.urdfast.engine.transpiler.SyntaxProfiles;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for emitting complete functions.
 */
@DisplayName("Function Emitter Tests")
class FunctionEmitterTest {

    private static final List<FunctionParameter> AB = List.of(
            FunctionParameter.scalar("a", ""),
            FunctionParameter.scalar("b", ""));

    private static final ExpressionGrid ROTATION = new ExpressionGrid(List.of(
            List.of("cos(a)", "-sin(a)"),
            List.of("sin(a)", "cos(a)")));

    private static String emit(SyntaxProfile profile, FunctionSpec spec) {
        return new FunctionEmitter(profile).emit(spec);
    }

    static Stream<Arguments> scalarFunctions() {
        return Stream.of(
                Arguments.of(SyntaxProfiles.PYTHON, "def f(a, b):\n    return a+b\n"),
                Arguments.of(SyntaxProfiles.JULIA, "function f(a, b)\n    return a+b\nend\n"),
                Arguments.of(SyntaxProfiles.MATLAB,
                        "function return_value = f(a, b)\n    return_value = a+b;\nend\n"),
                Arguments.of(SyntaxProfiles.CPP, "double f(double a, double b) {\n    return a+b;\n}\n"));
    }

    @ParameterizedTest(name = "{1}")
    @MethodSource("scalarFunctions")
    @DisplayName("Scalar functions in every profile")
    void testScalarFunction(SyntaxProfile profile, String expected) {
        assertEquals(expected, emit(profile, FunctionSpec.of("f", AB, ExpressionGrid.scalar("a+b"))));
    }

    // ==================== Body ====================

    @Nested
    @DisplayName("Body statements")
    class Body {

        @Test
        @DisplayName("Variables are emitted in order before the return")
        void testVariables() {
            FunctionSpec spec = FunctionSpec.of("f", AB, ExpressionGrid.scalar("v_cos*b"))
                    .withBody(List.of(NamedVariable.scalar("v_cos", "cos(a)")));

            assertEquals("def f(a, b):\n    v_cos = cos(a)\n\n    return v_cos*b\n",
                    emit(SyntaxProfiles.PYTHON, spec));
            assertEquals("double f(double a, double b) {\n    double v_cos = cos(a);\n\n    return v_cos*b;\n}\n",
                    emit(SyntaxProfiles.CPP, spec));
        }

        @Test
        @DisplayName("Loop markers indent their body")
        void testLoops() {
            FunctionSpec spec = FunctionSpec.of("f", AB, ExpressionGrid.scalar("s"))
                    .withBody(List.of(new LoopStart("0", "n"), NamedVariable.scalar("s", "s+x[i]"), new LoopEnd()));

            String python = emit(SyntaxProfiles.PYTHON, spec);
            assertTrue(python.contains("    for i in range(0, n):\n        s = s+x[i]\n\n    return s\n"));

            String julia = emit(SyntaxProfiles.JULIA, spec);
            assertTrue(julia.contains("    for i=1:n\n        s = s+x[i+1]\n    end\n"));
        }

        @Test
        @DisplayName("Unbalanced loop markers are rejected")
        void testUnbalancedLoops() {
            FunctionSpec unopened = FunctionSpec.of("f", AB, ExpressionGrid.scalar("a"))
                    .withBody(List.of(new LoopEnd()));
            FunctionSpec unclosed = FunctionSpec.of("f", AB, ExpressionGrid.scalar("a"))
                    .withBody(List.of(new LoopStart("0", "3")));

            assertThrows(IllegalArgumentException.class, () -> emit(SyntaxProfiles.PYTHON, unopened));
            assertThrows(IllegalArgumentException.class, () -> emit(SyntaxProfiles.PYTHON, unclosed));
        }

        @Test
        @DisplayName("Malformed expressions abort the function")
        void testParseError() {
            FunctionSpec spec = FunctionSpec.of("f", AB, ExpressionGrid.scalar("a+"));

            assertThrows(ExpressionParseException.class, () -> emit(SyntaxProfiles.JULIA, spec));
        }
    }

    // ==================== Matrices ====================

    @Nested
    @DisplayName("Matrix results")
    class Matrices {

        @Test
        @DisplayName("Python rows are aligned under the first one")
        void testPythonMatrix() {
            String code = emit(SyntaxProfiles.PYTHON, FunctionSpec.of("T", List.of(FunctionParameter.scalar("a", "")),
                    ROTATION));

            assertEquals("def T(a):\n"
                    + "    # Returned Matrix\n"
                    + "    mat = array([[cos(a), -sin(a)],\n"
                    + "                 [sin(a), cos(a)]])\n"
                    + "\n"
                    + "    return mat\n", code);
        }

        @Test
        @DisplayName("Julia concatenates rows vertically")
        void testJuliaMatrix() {
            String code = emit(SyntaxProfiles.JULIA, FunctionSpec.of("T", List.of(FunctionParameter.scalar("a", "")),
                    ROTATION));

            assertTrue(code.contains("    mat = vcat([cos(a) -sin(a)],\n               [sin(a) cos(a)])\n"));
            assertTrue(code.endsWith("    return mat\nend\n"));
        }

        @Test
        @DisplayName("MATLAB separates rows with semicolons")
        void testMatlabMatrix() {
            String code = emit(SyntaxProfiles.MATLAB, FunctionSpec.of("T", List.of(FunctionParameter.scalar("a", "")),
                    ROTATION));

            assertTrue(code.contains("    % Returned Matrix\n    mat = [cos(a), -sin(a);\n"));
            assertTrue(code.contains("    return_value = mat;\n"));
        }

        @Test
        @DisplayName("C++ uses typed Eigen initialization")
        void testCppMatrix() {
            String code = emit(SyntaxProfiles.CPP, FunctionSpec.of("T", List.of(FunctionParameter.scalar("a", "")),
                    ROTATION));

            assertTrue(code.startsWith("Eigen::MatrixXd T(double a) {\n"));
            assertTrue(code.contains("    Eigen::MatrixXd mat = (Eigen::MatrixXd(2, 2) << cos(a), -sin(a),\n"));
            assertTrue(code.endsWith("    return mat;\n}\n"));
        }

        @Test
        @DisplayName("The matrix local avoids taken names")
        void testMatrixLocalCollision() {
            FunctionSpec spec = FunctionSpec.of("T", List.of(FunctionParameter.scalar("mat", "")),
                    new ExpressionGrid(List.of(List.of("mat", "0"), List.of("0", "mat"))));

            String code = emit(SyntaxProfiles.PYTHON, spec);

            assertTrue(code.contains("    mat0 = array([[mat, 0],\n"));
            assertTrue(code.contains("    return mat0\n"));
        }
    }

    // ==================== Inputs and docstrings ====================

    @Nested
    @DisplayName("Inputs and documentation")
    class Documentation {

        @Test
        @DisplayName("Parameters collapse into one vector")
        void testInputAsVector() {
            FunctionSpec spec = FunctionSpec.of("f", AB, ExpressionGrid.scalar("a*b")).withInputAsVector(true);

            assertEquals("def f(q):\n    return q[0]*q[1]\n", emit(SyntaxProfiles.PYTHON, spec));
            assertEquals("function f(q)\n    return q[1]*q[2]\nend\n", emit(SyntaxProfiles.JULIA, spec));
            assertTrue(emit(SyntaxProfiles.CPP, spec).startsWith("double f(Eigen::VectorXd q) {\n"));
        }

        @Test
        @DisplayName("Python docstrings follow the signature")
        void testPythonDocstring() {
            FunctionSpec spec = FunctionSpec.of("f", List.of(FunctionParameter.scalar("a", "First value.")),
                    ExpressionGrid.scalar("a")).withDescription("Returns a.");

            assertEquals("def f(a):\n"
                    + "    \"\"\"\n"
                    + "    Description\n"
                    + "    -----------\n"
                    + "\n"
                    + "    Returns a.\n"
                    + "\n"
                    + "    Parameters\n"
                    + "    ----------\n"
                    + "\n"
                    + "    a : scalar\n"
                    + "        First value.\n"
                    + "    \"\"\"\n"
                    + "\n"
                    + "    return a\n", emit(SyntaxProfiles.PYTHON, spec));
        }

        @Test
        @DisplayName("Julia docstrings precede the function and repeat the signature")
        void testJuliaDocstring() {
            FunctionSpec spec = FunctionSpec.of("f", List.of(FunctionParameter.scalar("a", "")),
                    ExpressionGrid.scalar("a")).withDescription("Returns a.");

            String code = emit(SyntaxProfiles.JULIA, spec);

            assertTrue(code.startsWith("\"\"\"\n    f(a)\n\nDescription\n"));
            assertTrue(code.contains("\"\"\"\nfunction f(a)\n"));
        }

        @Test
        @DisplayName("MATLAB comments repeat the signature and the name")
        void testMatlabDocstring() {
            FunctionSpec spec = FunctionSpec.of("f", List.of(FunctionParameter.scalar("a", "")),
                    ExpressionGrid.scalar("a")).withDescription("Returns a.");

            String code = emit(SyntaxProfiles.MATLAB, spec);

            assertTrue(code.startsWith("function return_value = f(a)\n    %     return_value = f(a)\n    % f\n"));
            assertTrue(code.contains("    %\n    % Description\n"));
        }

        @Test
        @DisplayName("C++ documentation is a block comment")
        void testCppDocstring() {
            FunctionSpec spec = FunctionSpec.of("f", List.of(FunctionParameter.scalar("a", "")),
                    ExpressionGrid.scalar("a")).withDescription("Returns a.");

            String code = emit(SyntaxProfiles.CPP, spec);

            assertTrue(code.startsWith("/**\n * Description\n * -----------\n *\n * Returns a.\n"));
            assertTrue(code.contains(" * a : double\n */\ndouble f(double a) {\n"));
        }

        @Test
        @DisplayName("Parameters without a description are separated by one blank line")
        void testUndescribedParameters() {
            FunctionSpec spec = FunctionSpec.of("f",
                    List.of(FunctionParameter.scalar("a", ""), FunctionParameter.scalar("b", "")),
                    ExpressionGrid.scalar("a+b")).withDescription("Returns a+b.");

            String code = emit(SyntaxProfiles.CPP, spec);

            assertTrue(code.contains(" * a : double\n *\n * b : double\n */\n"), code);
        }

        @Test
        @DisplayName("Vector and matrix parameters stay out of the input vector")
        void testVectorInputWithVectorParameter() {
            FunctionSpec spec = FunctionSpec.of("f",
                    List.of(FunctionParameter.scalar("k", "Gain."),
                            new FunctionParameter("p", VariableKind.VECTOR, "")),
                    ExpressionGrid.scalar("p[0]*k")).withDescription("Scales p.").withInputAsVector(true);

            String python = emit(SyntaxProfiles.PYTHON, spec);
            String cpp = emit(SyntaxProfiles.CPP, spec.withDescription(null));

            assertTrue(python.startsWith("def f(q, p):\n"));
            assertTrue(python.contains("        - q[0] = k :\n"));
            assertTrue(python.contains("    p : vector\n"));
            assertTrue(python.endsWith("    return p[0]*q[0]\n"));
            assertTrue(cpp.startsWith("double f(Eigen::VectorXd q, Eigen::VectorXd p) {\n"), cpp);
        }

        @Test
        @DisplayName("The vector parameter documents its elements in target indexing")
        void testVectorDocstring() {
            FunctionSpec spec = FunctionSpec.of("f", List.of(FunctionParameter.scalar("a", "Angle.")),
                    ExpressionGrid.scalar("a")).withDescription("Returns a.").withInputAsVector(true);

            String python = emit(SyntaxProfiles.PYTHON, spec);
            assertTrue(python.contains("    q : vector\n        Vector of variables where :\n        - q[0] = a :\n"));

            String julia = emit(SyntaxProfiles.JULIA, spec);
            assertTrue(julia.contains("- q[1] = a :"));
        }

        @Test
        @DisplayName("Long descriptions are wrapped to the line width")
        void testWrapping() {
            String description = "word ".repeat(60).trim();
            FunctionSpec spec = FunctionSpec.of("f", List.of(FunctionParameter.scalar("a", description)),
                    ExpressionGrid.scalar("a")).withDescription(description);

            String code = emit(SyntaxProfiles.MATLAB, spec);

            for (String line : code.split("\n")) {
                assertTrue(line.length() <= SyntaxProfiles.MATLAB.maxLineWidth(), line);
            }
        }
    }
}
