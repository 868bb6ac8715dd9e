package org.urdfast.engine.optimizer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.urdfast.engine.model.NamedVariable;
import org.urdfast.engine.model.VariableKind;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for common subexpression elimination.
 */
@DisplayName("Common Subexpression Optimizer Tests")
class CommonSubexpressionOptimizerTest {

    private CommonSubexpressionOptimizer optimizer;

    @BeforeEach
    void setUp() {
        optimizer = new CommonSubexpressionOptimizer();
    }

    // ==================== Extraction ====================

    @Nested
    @DisplayName("Extraction")
    class Extraction {

        @Test
        @DisplayName("Two values containing cos(x-y) share one variable")
        void testSharedCosine() {
            // GIVEN: Two cells using cos(x-y)
            List<String> cells = List.of("cos(x-y)*a", "cos(x-y)+b");

            // WHEN: Optimizing them together
            OptimizationResult result = optimizer.optimize(cells);

            // THEN: Exactly one variable, referenced at both use sites
            assertEquals(1, result.extracted());
            assertEquals(List.of(NamedVariable.scalar("v_cos", "cos(x-y)")), result.variables());
            assertEquals(List.of("v_cos*a", "v_cos+b"), result.expressions());
        }

        @Test
        @DisplayName("Repeated operands of one expression are extracted")
        void testRepeatedWithinOneExpression() {
            OptimizationResult result = optimizer.optimize("sin(t)*sin(t)");

            assertEquals(List.of(NamedVariable.scalar("v_sin", "sin(t)")), result.variables());
            assertEquals("v_sin*v_sin", result.expression());
        }

        @Test
        @DisplayName("Nested repetitions are named innermost first and kept when shared")
        void testNestedRepetitions() {
            // GIVEN: x-y is used inside and outside of the repeated cosine
            List<String> cells = List.of("cos(x-y)", "cos(x-y)*(x-y)");

            // WHEN
            OptimizationResult result = optimizer.optimize(cells);

            // THEN: Both survive, the difference defined first
            assertEquals(2, result.extracted());
            assertEquals(List.of(
                    NamedVariable.scalar("v_sub", "x-y"),
                    NamedVariable.scalar("v_cos", "cos(v_sub)")), result.variables());
            assertEquals(List.of("v_cos", "v_cos*v_sub"), result.expressions());
        }

        @Test
        @DisplayName("Generated names never collide with symbols")
        void testNameCollision() {
            OptimizationResult result = optimizer.optimize(List.of("v_sub+(x-y)", "(x-y)*2"));

            assertEquals(List.of(NamedVariable.scalar("v_sub_0", "x-y")), result.variables());
            assertEquals(List.of("v_sub+v_sub_0", "v_sub_0*2"), result.expressions());
        }

        @Test
        @DisplayName("Reserved names are skipped")
        void testReservedNames() {
            OptimizationResult result = optimizer.optimize(List.of(), List.of("(a/b)*c", "(a/b)*d"),
                    Set.of("v_div"));

            assertEquals("v_div_0", result.variables().get(0).name());
        }

        @Test
        @DisplayName("Existing variables take part and come before their users")
        void testExistingVariables() {
            List<NamedVariable> variables = List.of(NamedVariable.scalar("r", "sqrt(x**2)+1"));

            OptimizationResult result = optimizer.optimize(variables, List.of("r*x**2"));

            assertEquals(List.of(
                    NamedVariable.scalar("v_exp", "x**2"),
                    NamedVariable.scalar("r", "sqrt(v_exp)+1")), result.variables());
            assertEquals("r*v_exp", result.expression());
        }

        @Test
        @DisplayName("Matrix products are extracted as matrices")
        void testMatrixKind() {
            OptimizationResult result = optimizer.optimize(List.of("(A@B)*2", "(A@B)*3"));

            assertEquals(VariableKind.MATRIX, result.variables().get(0).kind());
            assertEquals("v_matmul", result.variables().get(0).name());
        }

        @Test
        @DisplayName("Matrix and vector constructors keep their shape")
        void testConstructorKinds() {
            OptimizationResult identity = optimizer.optimize(List.of("eye(4,4)*a", "eye(4,4)*b"));
            OptimizationResult cross = optimizer.optimize(List.of("cross(u,v)*a", "cross(u,v)*b"));

            assertEquals(List.of(new NamedVariable("v_eye", "eye(4,4)", VariableKind.MATRIX)),
                    identity.variables());
            assertEquals(VariableKind.VECTOR, cross.variables().get(0).kind());
        }

        @Test
        @DisplayName("Two variables holding cos(x-y) share one extracted variable")
        void testSharedAcrossVariables() {
            // GIVEN: Two named variables whose values both contain cos(x-y)
            List<NamedVariable> variables = List.of(
                    NamedVariable.scalar("u", "cos(x-y)*a"),
                    NamedVariable.scalar("w", "cos(x-y)+b"));

            // WHEN
            OptimizationResult result = optimizer.optimize(variables, List.of("u*w"));

            // THEN: One variable, defined before both users
            assertEquals(1, result.extracted());
            assertEquals(List.of(
                    NamedVariable.scalar("v_cos", "cos(x-y)"),
                    NamedVariable.scalar("u", "v_cos*a"),
                    NamedVariable.scalar("w", "v_cos+b")), result.variables());
            assertEquals("u*w", result.expression());
        }
    }

    // ==================== Identity ====================

    @Nested
    @DisplayName("Identity rewrites")
    class Identity {

        @Test
        @DisplayName("Optimizing an optimized set adds nothing")
        void testIdempotence() {
            OptimizationResult first = optimizer.optimize(List.of("cos(x-y)*a", "cos(x-y)+b"));

            OptimizationResult second = optimizer.optimize(first.variables(), first.expressions());

            assertTrue(second.isIdentity());
            assertEquals(first.variables(), second.variables());
            assertEquals(first.expressions(), second.expressions());
        }

        @Test
        @DisplayName("Commutative operations are not compared")
        void testCommutativeExcluded() {
            List<String> cells = List.of("(a+b)*c", "(a+b)*d", "a*b", "a*b");

            OptimizationResult result = optimizer.optimize(cells);

            assertTrue(result.isIdentity());
            assertEquals(cells, result.expressions());
        }

        @Test
        @DisplayName("Signs and subscripts of atoms are not extracted")
        void testTrivialRecords() {
            OptimizationResult result = optimizer.optimize(List.of("-a*q[0]", "-a+q[0]"));

            assertTrue(result.isIdentity());
        }

        @Test
        @DisplayName("Reassigned variables disable the optimization")
        void testReassignment() {
            List<NamedVariable> variables = List.of(
                    NamedVariable.scalar("x", "a-b"),
                    NamedVariable.scalar("x", "a-b"));

            OptimizationResult result = optimizer.optimize(variables, List.of("x"));

            assertTrue(result.isIdentity());
            assertEquals(variables, result.variables());
        }

        @Test
        @DisplayName("No expressions, no work")
        void testEmpty() {
            assertTrue(optimizer.optimize(List.of()).isIdentity());
        }

        @Test
        @DisplayName("List literals are extracted only when enabled")
        void testLists() {
            List<String> cells = List.of("cross([a,b,c],u)", "cross([a,b,c],v)");

            assertTrue(optimizer.optimize(cells).isIdentity());

            OptimizationResult withLists = new CommonSubexpressionOptimizer(true).optimize(cells);
            assertEquals(new NamedVariable("v_vect", "[a,b,c]", VariableKind.VECTOR), withLists.variables().get(0));
            assertEquals(List.of("cross(v_vect,u)", "cross(v_vect,v)"), withLists.expressions());
        }
    }
}
