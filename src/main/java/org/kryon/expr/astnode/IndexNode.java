package org.kryon.expr.astnode;

import org.kryon.expr.astvisitor.Visitor;

/**
 * Array indexing: {@code array[index]}.
 */
public class IndexNode extends AbstractNode {
    public final Node array;
    public final Node index;

    public IndexNode(Node array, Node index) {
        this.array = array;
        this.index = index;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
