package org.kryon.expr.astvisitor;

import org.kryon.expr.astnode.*;
import org.kryon.expr.runtime.runtimetypes.Value;

import java.util.List;

/*
 *
 * Usage:
 *
 *   PrintVisitor printVisitor = new PrintVisitor();
 *   node.accept(printVisitor);
 *   return printVisitor.getResult();
 */
public class PrintVisitor implements Visitor {

    private final StringBuilder sb = new StringBuilder();
    private int indentLevel = 0;

    private void appendIndent() {
        sb.append("  ".repeat(Math.max(0, indentLevel)));
    }

    public String getResult() {
        return sb.toString();
    }

    private void printChild(Node node) {
        if (node == null) {
            appendIndent();
            sb.append("null\n");
        } else {
            node.accept(this);
        }
    }

    private void printChildren(String label, List<Node> nodes) {
        appendIndent();
        sb.append(label).append(":\n");
        indentLevel++;
        for (Node node : nodes) {
            printChild(node);
        }
        indentLevel--;
    }

    @Override
    public void visit(IntegerNode node) {
        appendIndent();
        sb.append("IntegerNode: ").append(node.value).append("\n");
    }

    @Override
    public void visit(FloatNode node) {
        appendIndent();
        sb.append("FloatNode: ").append(Value.formatDouble(node.value)).append("\n");
    }

    @Override
    public void visit(StringNode node) {
        appendIndent();
        sb.append("StringNode: '").append(node.value).append("'\n");
    }

    @Override
    public void visit(BooleanNode node) {
        appendIndent();
        sb.append("BooleanNode: ").append(node.value).append("\n");
    }

    @Override
    public void visit(NullNode node) {
        appendIndent();
        sb.append("NullNode\n");
    }

    @Override
    public void visit(VariableNode node) {
        appendIndent();
        sb.append("VariableNode: ").append(node.name).append("\n");
    }

    @Override
    public void visit(PropertyNode node) {
        appendIndent();
        sb.append("PropertyNode: ").append(node.object).append(".").append(node.field).append("\n");
    }

    @Override
    public void visit(MemberAccessNode node) {
        appendIndent();
        sb.append("MemberAccessNode: .").append(node.property).append("\n");
        indentLevel++;
        printChild(node.object);
        indentLevel--;
    }

    @Override
    public void visit(ComputedMemberNode node) {
        appendIndent();
        sb.append("ComputedMemberNode:\n");
        indentLevel++;
        printChild(node.object);
        printChild(node.key);
        indentLevel--;
    }

    @Override
    public void visit(IndexNode node) {
        appendIndent();
        sb.append("IndexNode:\n");
        indentLevel++;
        printChild(node.array);
        printChild(node.index);
        indentLevel--;
    }

    @Override
    public void visit(BinaryOperatorNode node) {
        appendIndent();
        sb.append("BinaryOperatorNode: ").append(node.operator.symbol).append("\n");
        indentLevel++;
        printChild(node.left);
        printChild(node.right);
        indentLevel--;
    }

    @Override
    public void visit(UnaryOperatorNode node) {
        appendIndent();
        sb.append("UnaryOperatorNode: ").append(node.operator.symbol.trim()).append("\n");
        indentLevel++;
        printChild(node.operand);
        indentLevel--;
    }

    @Override
    public void visit(TernaryOperatorNode node) {
        appendIndent();
        sb.append("TernaryOperatorNode: ?\n");
        indentLevel++;
        printChild(node.condition);
        printChild(node.thenExpr);
        printChild(node.elseExpr);
        indentLevel--;
    }

    @Override
    public void visit(CallNode node) {
        appendIndent();
        sb.append("CallNode: ").append(node.function).append("\n");
        indentLevel++;
        printChildren("Args", node.args);
        indentLevel--;
    }

    @Override
    public void visit(MethodCallNode node) {
        appendIndent();
        sb.append("MethodCallNode: ").append(node.method).append("\n");
        indentLevel++;
        printChild(node.receiver);
        printChildren("Args", node.args);
        indentLevel--;
    }

    @Override
    public void visit(GroupNode node) {
        appendIndent();
        sb.append("GroupNode:\n");
        indentLevel++;
        printChild(node.inner);
        indentLevel--;
    }

    @Override
    public void visit(ArrayLiteralNode node) {
        appendIndent();
        sb.append("ArrayLiteralNode:\n");
        indentLevel++;
        for (Node element : node.elements) {
            printChild(element);
        }
        indentLevel--;
    }

    @Override
    public void visit(ObjectLiteralNode node) {
        appendIndent();
        sb.append("ObjectLiteralNode:\n");
        indentLevel++;
        for (int i = 0; i < node.keys.size(); i++) {
            appendIndent();
            sb.append("Key: ").append(node.keys.get(i)).append("\n");
            indentLevel++;
            printChild(node.values.get(i));
            indentLevel--;
        }
        indentLevel--;
    }
}
