package org.kryon.expr.astnode;

import org.kryon.expr.astvisitor.Visitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A method call on a value: {@code receiver.method(args...)}.
 */
public class MethodCallNode extends AbstractNode {
    public final Node receiver;
    public final String method;
    public final List<Node> args;

    public MethodCallNode(Node receiver, String method, List<Node> args) {
        this.receiver = receiver;
        this.method = method;
        this.args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
