package org.urdfast.engine.expression;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for parsing expressions into operation forests.
 */
@DisplayName("Expression Forest Tests")
class ExpressionForestTest {

    // ==================== Structure ====================

    @Nested
    @DisplayName("Tree structure")
    class Structure {

        @Test
        @DisplayName("a+b*c has a '+' root whose right operand is a '*' node")
        void testAdditionOverMultiplication() {
            // GIVEN/WHEN: A sum with a product on the right
            ExpressionForest forest = ExpressionForest.parse("a+b*c");

            // THEN: '+' is the root, '*' spans "b*c"
            int root = forest.root(0);
            OperationRecord plus = forest.record(root);
            assertEquals(Operator.ADD, plus.operator());
            assertEquals(List.of("a", "b*c"), plus.operandTexts());
            assertEquals(-1, forest.child(root, 0));

            int product = forest.child(root, 1);
            assertEquals(Operator.MULTIPLY, forest.record(product).operator());
            assertEquals(new Span(2, 5), forest.record(product).span());
            assertEquals(root, forest.parent(product));
        }

        @Test
        @DisplayName("(a+b)*c has a '*' root whose left operand is a '+' node")
        void testGroupedSum() {
            ExpressionForest forest = ExpressionForest.parse("(a+b)*c");

            int root = forest.root(0);
            assertEquals(Operator.MULTIPLY, forest.record(root).operator());
            int sum = forest.child(root, 0);
            assertEquals(Operator.ADD, forest.record(sum).operator());
            assertEquals("a+b", forest.record(sum).span().text(forest.source(0)));
        }

        @Test
        @DisplayName("Commutative chains are one n-ary node")
        void testNaryChain() {
            ExpressionForest forest = ExpressionForest.parse("a+b+c+d");

            OperationRecord root = forest.record(forest.root(0));
            assertEquals(List.of("a", "b", "c", "d"), root.operandTexts());
            assertEquals(1, forest.reachableRecords().size());
        }

        @Test
        @DisplayName("Subtraction chains associate to the left")
        void testSubtractionLeftAssociative() {
            ExpressionForest forest = ExpressionForest.parse("a-b-c");

            OperationRecord root = forest.record(forest.root(0));
            assertEquals(List.of("a-b", "c"), root.operandTexts());
        }

        @Test
        @DisplayName("Powers associate to the right")
        void testPowerRightAssociative() {
            ExpressionForest forest = ExpressionForest.parse("a**b**c");

            OperationRecord root = forest.record(forest.root(0));
            assertEquals(Operator.POWER, root.operator());
            assertEquals(List.of("a", "b**c"), root.operandTexts());
        }

        @Test
        @DisplayName("A sign applies to a whole power")
        void testSignBindsLooserThanPower() {
            ExpressionForest forest = ExpressionForest.parse("-a**b");

            OperationRecord root = forest.record(forest.root(0));
            assertEquals(Operator.UNARY_MINUS, root.operator());
            assertEquals(List.of("a**b"), root.operandTexts());
        }

        @Test
        @DisplayName("A sign after an operator opens a nested operand")
        void testSignAfterOperator() {
            ExpressionForest forest = ExpressionForest.parse("a*-b");

            OperationRecord root = forest.record(forest.root(0));
            assertEquals(Operator.MULTIPLY, root.operator());
            assertEquals(List.of("a", "-b"), root.operandTexts());
            assertEquals(OperationKind.UNARY, forest.record(forest.child(forest.root(0), 1)).kind());
        }

        @Test
        @DisplayName("Functions, subscripts and lists are atomic records")
        void testCallsAndSubscripts() {
            ExpressionForest forest = ExpressionForest.parse("cos(q[0])*[a,b]");

            int root = forest.root(0);
            OperationRecord cos = forest.record(forest.child(root, 0));
            assertEquals(OperationKind.FUNCTION, cos.kind());
            assertEquals("cos", cos.name());
            assertTrue(cos.isFunction());

            OperationRecord subscript = forest.record(forest.child(forest.child(root, 0), 0));
            assertEquals(OperationKind.SUBSCRIPT, subscript.kind());
            assertEquals("q", subscript.name());
            assertEquals(List.of("0"), subscript.operandTexts());

            OperationRecord list = forest.record(forest.child(root, 1));
            assertEquals(OperationKind.LIST, list.kind());
            assertEquals(List.of("a", "b"), list.operandTexts());
        }

        @Test
        @DisplayName("Slices inside subscripts keep empty bounds")
        void testSlices() {
            ExpressionForest forest = ExpressionForest.parse("M[:3,1:]");

            int root = forest.root(0);
            OperationRecord rows = forest.record(forest.child(root, 0));
            assertEquals(OperationKind.SLICE, rows.kind());
            assertEquals(List.of("", "3"), rows.operandTexts());
            OperationRecord columns = forest.record(forest.child(root, 1));
            assertEquals(List.of("1", ""), columns.operandTexts());
        }

        @Test
        @DisplayName("Exponent signs belong to numeric literals")
        void testScientificLiteral() {
            ExpressionForest forest = ExpressionForest.parse("1.5e-3*x");

            OperationRecord root = forest.record(forest.root(0));
            assertEquals(Operator.MULTIPLY, root.operator());
            assertEquals(List.of("1.5e-3", "x"), root.operandTexts());
        }

        @Test
        @DisplayName("Whitespace is ignored and atoms have no root")
        void testAtom() {
            ExpressionForest forest = ExpressionForest.parse("  ( x )  ");

            assertEquals(-1, forest.root(0));
            assertEquals("x", forest.atomText(0));
            assertEquals(List.of("x"), forest.leaves(0));
        }

        @Test
        @DisplayName("Depth and height are measured from the roots")
        void testDepthAndHeight() {
            ExpressionForest forest = ExpressionForest.parse("cos(x-y)*a");

            int root = forest.root(0);
            int cos = forest.child(root, 0);
            int difference = forest.child(cos, 0);
            assertEquals(0, forest.depth(root));
            assertEquals(2, forest.depth(difference));
            assertEquals(2, forest.height(root));
            assertTrue(forest.isAncestor(root, difference));
            assertFalse(forest.isAncestor(difference, root));
        }

        @Test
        @DisplayName("Several expressions share one forest")
        void testForestOfSeveralSources() {
            ExpressionForest forest = ExpressionForest.parse(List.of("a+b", "c", "d*(e-f)"));

            assertEquals(3, forest.sourceCount());
            assertEquals(-1, forest.root(1));
            assertEquals(List.of("d", "e", "f"), forest.leaves(2));
            assertEquals(2, forest.record(forest.root(2)).source());
        }
    }

    // ==================== Errors ====================

    @Nested
    @DisplayName("Parse errors")
    class Errors {

        @Test
        @DisplayName("Unbalanced brackets are reported with their position")
        void testUnbalanced() {
            ExpressionParseException e = assertThrows(ExpressionParseException.class,
                    () -> ExpressionForest.parse("cos(a+b"));

            assertTrue(e.hasLocation());
            assertEquals(3, e.getPosition());
        }

        @Test
        @DisplayName("Closing bracket without opening")
        void testStrayClosing() {
            ExpressionParseException e = assertThrows(ExpressionParseException.class,
                    () -> ExpressionForest.parse("a+b)"));
            assertEquals(3, e.getPosition());
        }

        @Test
        @DisplayName("Unsupported operator tokens")
        void testUnsupportedTokens() {
            assertThrows(ExpressionParseException.class, () -> ExpressionForest.parse("a***b"));
            assertThrows(ExpressionParseException.class, () -> ExpressionForest.parse("a//b"));
            assertThrows(ExpressionParseException.class, () -> ExpressionForest.parse("a%b"));
        }

        @Test
        @DisplayName("Missing operands")
        void testMissingOperand() {
            assertThrows(ExpressionParseException.class, () -> ExpressionForest.parse("a*"));
            assertThrows(ExpressionParseException.class, () -> ExpressionForest.parse("/b"));
            assertThrows(ExpressionParseException.class, () -> ExpressionForest.parse("f(a,)"));
        }

        @Test
        @DisplayName("Empty expressions and stray colons")
        void testEmptyAndColon() {
            assertThrows(ExpressionParseException.class, () -> ExpressionForest.parse("   "));
            assertThrows(ExpressionParseException.class, () -> ExpressionForest.parse("a:b"));
        }
    }
}
