package org.kryon.expr.astnode;

import org.kryon.expr.astvisitor.Visitor;

/**
 * A parenthesized expression. Only meaningful to the parser's precedence
 * handling; the optimizer unwraps it.
 */
public class GroupNode extends AbstractNode {
    public final Node inner;

    public GroupNode(Node inner) {
        this.inner = inner;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
