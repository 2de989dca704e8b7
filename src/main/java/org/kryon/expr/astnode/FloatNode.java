package org.kryon.expr.astnode;

import org.kryon.expr.astvisitor.Visitor;

/**
 * A double-precision floating point literal.
 */
public class FloatNode extends AbstractNode {
    public final double value;

    public FloatNode(double value) {
        this.value = value;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
