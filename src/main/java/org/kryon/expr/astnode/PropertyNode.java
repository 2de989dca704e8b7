package org.kryon.expr.astnode;

import org.kryon.expr.astvisitor.Visitor;

/**
 * Legacy property access where the object is named directly:
 * {@code object.field}, with {@code object} a variable name.
 * Newer parsers produce {@link MemberAccessNode} instead.
 */
public class PropertyNode extends AbstractNode {
    public final String object;
    public final String field;

    public PropertyNode(String object, String field) {
        this.object = object;
        this.field = field;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
