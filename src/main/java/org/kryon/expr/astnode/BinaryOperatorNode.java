package org.kryon.expr.astnode;

import org.kryon.expr.astvisitor.Visitor;

/**
 * The BinaryOperatorNode class represents a binary operation such as
 * {@code left + right} or {@code left && right}.
 * <p>
 * Both operands are always evaluated; {@code &&} and {@code ||} do not
 * short-circuit.
 */
public class BinaryOperatorNode extends AbstractNode {
    public final BinaryOperator operator;
    public final Node left;
    public final Node right;

    public BinaryOperatorNode(BinaryOperator operator, Node left, Node right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
