package org.kryon.expr.astnode;

import org.kryon.expr.astvisitor.Visitor;

/**
 * A 64-bit integer literal.
 */
public class IntegerNode extends AbstractNode {
    public final long value;

    public IntegerNode(long value) {
        this.value = value;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
