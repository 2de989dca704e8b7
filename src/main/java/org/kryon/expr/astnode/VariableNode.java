package org.kryon.expr.astnode;

import org.kryon.expr.astvisitor.Visitor;

/**
 * A reference to a named variable.
 * <p>
 * The name is resolved at evaluation time only: the host may define
 * variables after the expression has been compiled.
 */
public class VariableNode extends AbstractNode {
    public final String name;

    public VariableNode(String name) {
        this.name = name;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
