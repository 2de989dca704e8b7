package org.kryon.expr.astvisitor;

import org.kryon.expr.astnode.*;

/**
 * Visitor over expression tree nodes: one method per node kind.
 */
public interface Visitor {

    void visit(IntegerNode node);

    void visit(FloatNode node);

    void visit(StringNode node);

    void visit(BooleanNode node);

    void visit(NullNode node);

    void visit(VariableNode node);

    void visit(PropertyNode node);

    void visit(MemberAccessNode node);

    void visit(ComputedMemberNode node);

    void visit(IndexNode node);

    void visit(BinaryOperatorNode node);

    void visit(UnaryOperatorNode node);

    void visit(TernaryOperatorNode node);

    void visit(CallNode node);

    void visit(MethodCallNode node);

    void visit(GroupNode node);

    void visit(ArrayLiteralNode node);

    void visit(ObjectLiteralNode node);
}
