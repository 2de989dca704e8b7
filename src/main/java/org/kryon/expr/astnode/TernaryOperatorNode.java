package org.kryon.expr.astnode;

import org.kryon.expr.astvisitor.Visitor;

/**
 * {@code condition ? thenExpr : elseExpr}. Only the selected arm is evaluated.
 */
public class TernaryOperatorNode extends AbstractNode {
    public final Node condition;
    public final Node thenExpr;
    public final Node elseExpr;

    public TernaryOperatorNode(Node condition, Node thenExpr, Node elseExpr) {
        this.condition = condition;
        this.thenExpr = thenExpr;
        this.elseExpr = elseExpr;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
