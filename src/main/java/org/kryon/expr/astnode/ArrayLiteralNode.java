package org.kryon.expr.astnode;

import org.kryon.expr.astvisitor.Visitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code [e1, e2, ...]}
 */
public class ArrayLiteralNode extends AbstractNode {
    public final List<Node> elements;

    public ArrayLiteralNode(List<Node> elements) {
        this.elements = elements == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(elements));
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
