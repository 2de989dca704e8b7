package org.kryon.expr.astnode;

import org.kryon.expr.astvisitor.Visitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A free function call: {@code function(args...)}.
 * <p>
 * Names carrying one of the configured builtin prefixes ({@code string_},
 * {@code math_}, ...) are dispatched to the builtin registry; any other name is
 * a generic call.
 */
public class CallNode extends AbstractNode {
    public final String function;
    public final List<Node> args;

    public CallNode(String function, List<Node> args) {
        this.function = function;
        this.args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
