package org.kryon.expr.astnode;

import org.kryon.expr.astvisitor.Visitor;

/**
 * The StringNode class represents a string literal.
 */
public class StringNode extends AbstractNode {
    /**
     * The string value represented by this node. Never null; a parser that
     * hands over a missing literal gets the empty string.
     */
    public final String value;

    public StringNode(String value) {
        this.value = value == null ? "" : value;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
