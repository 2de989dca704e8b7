package org.kryon.expr.astnode;

import org.kryon.expr.astvisitor.Visitor;

public class UnaryOperatorNode extends AbstractNode {
    public final UnaryOperator operator;
    public final Node operand;

    public UnaryOperatorNode(UnaryOperator operator, Node operand) {
        this.operator = operator;
        this.operand = operand;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
