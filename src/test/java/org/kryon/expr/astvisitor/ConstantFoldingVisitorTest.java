package org.kryon.expr.astvisitor;

import org.junit.jupiter.api.Test;
import org.kryon.expr.astnode.*;
import org.kryon.expr.runtime.runtimetypes.Value;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.kryon.expr.Trees.*;

public class ConstantFoldingVisitorTest {

    @Test
    public void testFoldsNestedArithmetic() {
        // 1 + 2 * 3
        Node tree = bin(BinaryOperator.ADD, num(1), bin(BinaryOperator.MUL, num(2), num(3)));
        Node folded = ConstantFoldingVisitor.foldConstants(tree);
        assertInstanceOf(IntegerNode.class, folded);
        assertEquals(7, ((IntegerNode) folded).value);
    }

    @Test
    public void testFoldsWithRuntimeSemantics() {
        assertEquals(Value.ofString("ab"), constant(bin(BinaryOperator.ADD, str("a"), str("b"))));
        assertEquals(Value.ofFloat(2.5), constant(bin(BinaryOperator.DIV, num(5), flt(2.0))));
        assertEquals(Value.NULL, constant(bin(BinaryOperator.DIV, num(1), num(0))), "division by zero folds to null");
        assertEquals(Value.NULL, constant(bin(BinaryOperator.SUB, str("a"), num(1))), "type mismatch folds to null");
        assertEquals(Value.TRUE, constant(bin(BinaryOperator.LT, num(1), flt(1.5))));
        assertEquals(Value.ofString("12"), constant(bin(BinaryOperator.CONCAT, num(1), num(2))));
        assertEquals(Value.FALSE, constant(unary(UnaryOperator.NOT, str("x"))));
        assertEquals(Value.ofInt(-3), constant(unary(UnaryOperator.NEG, num(3))));
        assertEquals(Value.ofString("float"), constant(unary(UnaryOperator.TYPEOF, flt(1.0))));
    }

    @Test
    public void testConstantTernarySelectsBranch() {
        Node thenArm = call("string_upper", var("a"));
        Node elseArm = var("b");
        assertSame(thenArm, ConstantFoldingVisitor.foldConstants(ternary(bool(true), thenArm, elseArm)));
        assertSame(elseArm, ConstantFoldingVisitor.foldConstants(ternary(num(0), thenArm, elseArm)));
        assertSame(elseArm, ConstantFoldingVisitor.foldConstants(ternary(str(""), thenArm, elseArm)));
    }

    @Test
    public void testGroupsAreUnwrapped() {
        Node folded = ConstantFoldingVisitor.foldConstants(group(group(var("x"))));
        assertInstanceOf(VariableNode.class, folded);
    }

    @Test
    public void testNonConstantSubtreesAreSharedNotCopied() {
        Node left = var("x");
        Node tree = bin(BinaryOperator.ADD, left, bin(BinaryOperator.MUL, num(2), num(3)));
        Node folded = ConstantFoldingVisitor.foldConstants(tree);

        BinaryOperatorNode rebuilt = assertInstanceOf(BinaryOperatorNode.class, folded);
        assertNotSame(tree, rebuilt);
        assertSame(left, rebuilt.left);
        assertEquals(6, ((IntegerNode) rebuilt.right).value);

        Node untouched = bin(BinaryOperator.ADD, var("x"), var("y"));
        assertSame(untouched, ConstantFoldingVisitor.foldConstants(untouched));
    }

    @Test
    public void testInputTreeIsNotMutated() {
        BinaryOperatorNode inner = (BinaryOperatorNode) bin(BinaryOperator.MUL, num(2), num(3));
        BinaryOperatorNode tree = (BinaryOperatorNode) bin(BinaryOperator.ADD, var("x"), inner);
        String before = tree.toString();

        ConstantFoldingVisitor.foldConstants(tree);

        assertSame(inner, tree.right);
        assertEquals(before, tree.toString());
    }

    @Test
    public void testCallsAreNotFoldedButArgumentsAre() {
        Node tree = call("math_max", bin(BinaryOperator.ADD, num(1), num(1)), var("y"));
        CallNode folded = assertInstanceOf(CallNode.class, ConstantFoldingVisitor.foldConstants(tree));
        assertEquals("math_max", folded.function);
        assertEquals(2, ((IntegerNode) folded.args.get(0)).value);
    }

    @Test
    public void testContainerLiteralsFoldTheirElements() {
        Node tree = array(bin(BinaryOperator.ADD, num(1), num(2)), var("x"));
        ArrayLiteralNode folded = assertInstanceOf(ArrayLiteralNode.class, ConstantFoldingVisitor.foldConstants(tree));
        assertEquals(3, ((IntegerNode) folded.elements.get(0)).value);

        Node obj = object(List.of("k"), List.of(unary(UnaryOperator.NOT, bool(false))));
        ObjectLiteralNode foldedObj = assertInstanceOf(ObjectLiteralNode.class, ConstantFoldingVisitor.foldConstants(obj));
        assertTrue(((BooleanNode) foldedObj.values.get(0)).value);
    }

    @Test
    public void testGetConstantValue() {
        assertEquals(Value.ofInt(4), ConstantFoldingVisitor.getConstantValue(num(4)));
        assertEquals(Value.NULL, ConstantFoldingVisitor.getConstantValue(nul()));
        assertNull(ConstantFoldingVisitor.getConstantValue(var("x")));
        assertNull(ConstantFoldingVisitor.foldConstants(null));
    }

    private static Value constant(Node tree) {
        Node folded = ConstantFoldingVisitor.foldConstants(tree);
        Value value = ConstantFoldingVisitor.getConstantValue(folded);
        assertNotNull(value, "expected a literal but got " + folded);
        return value;
    }
}
