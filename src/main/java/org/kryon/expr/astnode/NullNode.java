package org.kryon.expr.astnode;

import org.kryon.expr.astvisitor.Visitor;

/**
 * The {@code null} literal.
 */
public class NullNode extends AbstractNode {

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
