package org.kryon.expr;

import org.kryon.expr.astnode.*;

import java.util.Arrays;
import java.util.List;

/**
 * Short factory methods for building expression trees in tests.
 */
public final class Trees {

    private Trees() {
    }

    public static Node num(long value) {
        return new IntegerNode(value);
    }

    public static Node flt(double value) {
        return new FloatNode(value);
    }

    public static Node str(String value) {
        return new StringNode(value);
    }

    public static Node bool(boolean value) {
        return new BooleanNode(value);
    }

    public static Node nul() {
        return new NullNode();
    }

    public static Node var(String name) {
        return new VariableNode(name);
    }

    public static Node prop(String object, String field) {
        return new PropertyNode(object, field);
    }

    public static Node member(Node object, String property) {
        return new MemberAccessNode(object, property);
    }

    public static Node computed(Node object, Node key) {
        return new ComputedMemberNode(object, key);
    }

    public static Node index(Node array, Node index) {
        return new IndexNode(array, index);
    }

    public static Node bin(BinaryOperator op, Node left, Node right) {
        return new BinaryOperatorNode(op, left, right);
    }

    public static Node unary(UnaryOperator op, Node operand) {
        return new UnaryOperatorNode(op, operand);
    }

    public static Node ternary(Node condition, Node thenExpr, Node elseExpr) {
        return new TernaryOperatorNode(condition, thenExpr, elseExpr);
    }

    public static Node call(String function, Node... args) {
        return new CallNode(function, Arrays.asList(args));
    }

    public static Node method(Node receiver, String method, Node... args) {
        return new MethodCallNode(receiver, method, Arrays.asList(args));
    }

    public static Node group(Node inner) {
        return new GroupNode(inner);
    }

    public static Node array(Node... elements) {
        return new ArrayLiteralNode(Arrays.asList(elements));
    }

    public static Node object(List<String> keys, List<Node> values) {
        return new ObjectLiteralNode(keys, values);
    }
}
