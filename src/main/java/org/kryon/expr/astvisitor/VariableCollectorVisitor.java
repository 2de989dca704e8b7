package org.kryon.expr.astvisitor;

import org.kryon.expr.astnode.*;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the names of the variables an expression reads.
 * <p>
 * A member chain such as {@code user.name} depends on its root variable
 * {@code user} only; the cache invalidates by root name.
 */
public class VariableCollectorVisitor implements Visitor {

    private final Set<String> variables = new LinkedHashSet<>();

    public static Set<String> collect(Node node) {
        VariableCollectorVisitor visitor = new VariableCollectorVisitor();
        visitor.visitChild(node);
        return visitor.variables;
    }

    private void visitChild(Node node) {
        if (node != null) {
            node.accept(this);
        }
    }

    private void visitChildren(List<Node> nodes) {
        for (Node node : nodes) {
            visitChild(node);
        }
    }

    @Override
    public void visit(IntegerNode node) {
    }

    @Override
    public void visit(FloatNode node) {
    }

    @Override
    public void visit(StringNode node) {
    }

    @Override
    public void visit(BooleanNode node) {
    }

    @Override
    public void visit(NullNode node) {
    }

    @Override
    public void visit(VariableNode node) {
        if (node.name != null) {
            variables.add(node.name);
        }
    }

    @Override
    public void visit(PropertyNode node) {
        if (node.object != null) {
            variables.add(node.object);
        }
    }

    @Override
    public void visit(MemberAccessNode node) {
        visitChild(node.object);
    }

    @Override
    public void visit(ComputedMemberNode node) {
        visitChild(node.object);
        visitChild(node.key);
    }

    @Override
    public void visit(IndexNode node) {
        visitChild(node.array);
        visitChild(node.index);
    }

    @Override
    public void visit(BinaryOperatorNode node) {
        visitChild(node.left);
        visitChild(node.right);
    }

    @Override
    public void visit(UnaryOperatorNode node) {
        visitChild(node.operand);
    }

    @Override
    public void visit(TernaryOperatorNode node) {
        visitChild(node.condition);
        visitChild(node.thenExpr);
        visitChild(node.elseExpr);
    }

    @Override
    public void visit(CallNode node) {
        visitChildren(node.args);
    }

    @Override
    public void visit(MethodCallNode node) {
        visitChild(node.receiver);
        visitChildren(node.args);
    }

    @Override
    public void visit(GroupNode node) {
        visitChild(node.inner);
    }

    @Override
    public void visit(ArrayLiteralNode node) {
        visitChildren(node.elements);
    }

    @Override
    public void visit(ObjectLiteralNode node) {
        visitChildren(node.values);
    }
}
