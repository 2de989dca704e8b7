package org.kryon.expr.astnode;

import org.kryon.expr.astvisitor.Visitor;

/**
 * Computed member access: {@code object[key]}, where the key is any expression.
 */
public class ComputedMemberNode extends AbstractNode {
    public final Node object;
    public final Node key;

    public ComputedMemberNode(Node object, Node key) {
        this.object = object;
        this.key = key;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
