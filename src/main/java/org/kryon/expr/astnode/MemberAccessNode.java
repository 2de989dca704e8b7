package org.kryon.expr.astnode;

import org.kryon.expr.astvisitor.Visitor;

/**
 * Static member access on an arbitrary expression: {@code object.property}.
 */
public class MemberAccessNode extends AbstractNode {
    public final Node object;
    public final String property;

    public MemberAccessNode(Node object, String property) {
        this.object = object;
        this.property = property;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
