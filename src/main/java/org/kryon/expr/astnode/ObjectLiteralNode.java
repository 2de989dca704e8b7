package org.kryon.expr.astnode;

import org.kryon.expr.astvisitor.Visitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code { k1: v1, k2: v2, ... }}. Keys and values are parallel lists.
 */
public class ObjectLiteralNode extends AbstractNode {
    public final List<String> keys;
    public final List<Node> values;

    public ObjectLiteralNode(List<String> keys, List<Node> values) {
        if (keys.size() != values.size()) {
            throw new IllegalArgumentException("Object literal has " + keys.size()
                    + " keys but " + values.size() + " values");
        }
        this.keys = Collections.unmodifiableList(new ArrayList<>(keys));
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
