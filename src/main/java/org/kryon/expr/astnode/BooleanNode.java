package org.kryon.expr.astnode;

import org.kryon.expr.astvisitor.Visitor;

public class BooleanNode extends AbstractNode {
    public final boolean value;

    public BooleanNode(boolean value) {
        this.value = value;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
