package org.urdfast.engine.codegen;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.urdfast.engine.model.ExpressionGrid;
import org.urdfast.engine.transpiler.SyntaxProfiles;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the optimize-then-emit pipeline.
 */
@DisplayName("Matrix Function Generator Tests")
class MatrixFunctionGeneratorTest {

    private static final ExpressionGrid ROTATION = new ExpressionGrid(List.of(
            List.of("cos(theta_j1)", "-sin(theta_j1)"),
            List.of("sin(theta_j1)", "cos(theta_j1)")));

    @Test
    @DisplayName("Repeated trigonometric terms become variables")
    void testOptimizedMatrix() {
        // GIVEN: A rotation matrix using each term twice
        MatrixFunctionGenerator generator = new MatrixFunctionGenerator(SyntaxProfiles.PYTHON,
                GenerationOptions.DEFAULT);

        // WHEN
        String code = generator.generate("T_j1", ROTATION, "Rotation of j1.");

        // THEN: Variables first, then the matrix built from them
        assertTrue(code.startsWith("def T_j1(theta_j1):\n"));
        assertTrue(code.contains("    v_cos = cos(theta_j1)\n    v_sin = sin(theta_j1)\n"));
        assertTrue(code.contains("    mat = array([[v_cos, -v_sin],\n                 [v_sin, v_cos]])\n"));
        assertTrue(code.contains("theta_j1 : scalar"));
        assertTrue(code.contains("Rotation value (in radians) around the j1 joint axis."));
    }

    @Test
    @DisplayName("Vector input replaces the symbols in every statement")
    void testVectorInput() {
        MatrixFunctionGenerator generator = new MatrixFunctionGenerator(SyntaxProfiles.JULIA,
                GenerationOptions.DEFAULT.withInputAsVector(true));

        String code = generator.generate("T_j1", ROTATION, "Rotation of j1.");

        assertTrue(code.contains("function T_j1(q)\n"));
        assertTrue(code.contains("    v_cos = cos(q[1])\n"));
        assertFalse(code.contains("cos(theta_j1)"));
    }

    @Test
    @DisplayName("Docstrings can be turned off")
    void testNoDocstrings() {
        MatrixFunctionGenerator generator = new MatrixFunctionGenerator(SyntaxProfiles.PYTHON,
                GenerationOptions.DEFAULT.withDocstrings(false));

        String code = generator.generate("f", ExpressionGrid.scalar("x**2+y"), "Ignored.");

        assertEquals("def f(x, y):\n    return x**2+y\n", code);
    }

    @Test
    @DisplayName("Subscripted objects become parameters")
    void testSubscriptedParameter() {
        MatrixFunctionGenerator generator = new MatrixFunctionGenerator(SyntaxProfiles.PYTHON,
                GenerationOptions.DEFAULT.withDocstrings(false));

        String code = generator.generate("f", ExpressionGrid.scalar("cos(p[0])+p[1]*k"), "Ignored.");

        assertEquals("def f(k, p):\n    return cos(p[0])+p[1]*k\n", code);
    }

    @Test
    @DisplayName("A negated operand of a difference compiles as C++")
    void testNegatedOperandInCpp() {
        MatrixFunctionGenerator generator = new MatrixFunctionGenerator(SyntaxProfiles.CPP,
                GenerationOptions.DEFAULT.withDocstrings(false));

        String code = generator.generate("f", ExpressionGrid.scalar("a-(-cos(b))"), "Ignored.");

        assertEquals("double f(double a, double b) {\n    return a-(-cos(b));\n}\n", code);
    }

    @Test
    @DisplayName("Explicit parameters keep their order")
    void testExplicitParameters() {
        MatrixFunctionGenerator generator = new MatrixFunctionGenerator(SyntaxProfiles.CPP,
                GenerationOptions.DEFAULT.withDocstrings(false));

        String code = generator.generate("f",
                List.of(FunctionParameter.scalar("y", ""), FunctionParameter.scalar("x", "")),
                ExpressionGrid.scalar("(x-y)*(x-y)"), null);

        assertEquals("double f(double y, double x) {\n"
                + "    double v_sub = x-y;\n"
                + "\n"
                + "    return v_sub*v_sub;\n"
                + "}\n", code);
    }
}
