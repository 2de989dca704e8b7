package org.kryon.expr.astvisitor;

import org.kryon.expr.astnode.*;
import org.kryon.expr.runtime.operators.CompareOperators;
import org.kryon.expr.runtime.operators.LogicalOperators;
import org.kryon.expr.runtime.operators.MathOperators;
import org.kryon.expr.runtime.operators.StringOperators;
import org.kryon.expr.runtime.runtimetypes.Value;
import org.kryon.expr.runtime.runtimetypes.ValueType;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree visitor that performs constant folding.
 * <p>
 * Operators whose operands are all literals are evaluated at compile time with
 * the same runtime operator functions the interpreter uses, so a folded result
 * is always the value the unfolded bytecode would have produced (including the
 * null results of type mismatches and division by zero).
 * <p>
 * The input tree is never mutated: changed nodes are rebuilt, unchanged
 * subtrees are returned as-is and shared with the input.
 */
public class ConstantFoldingVisitor implements Visitor {

    private Node result;

    /**
     * Performs constant folding on the given tree.
     *
     * @param node The root of the tree to optimize
     * @return The optimized tree (either folded or the original node)
     */
    public static Node foldConstants(Node node) {
        if (node == null) {
            return null;
        }
        ConstantFoldingVisitor visitor = new ConstantFoldingVisitor();
        node.accept(visitor);
        return visitor.result;
    }

    /**
     * Gets the constant value of a literal node.
     *
     * @param node The node to extract a constant value from
     * @return the literal's Value, or null if the node is not a literal
     */
    public static Value getConstantValue(Node node) {
        if (node instanceof IntegerNode intNode) {
            return Value.ofInt(intNode.value);
        } else if (node instanceof FloatNode floatNode) {
            return Value.ofFloat(floatNode.value);
        } else if (node instanceof StringNode strNode) {
            return Value.ofString(strNode.value);
        } else if (node instanceof BooleanNode boolNode) {
            return Value.ofBool(boolNode.value);
        } else if (node instanceof NullNode) {
            return Value.NULL;
        }
        return null;
    }

    /**
     * Converts a scalar Value back into a literal node.
     *
     * @return the literal, or null if the value has no literal form (containers)
     */
    public static Node createConstantNode(Value value) {
        switch (value.type) {
            case ValueType.NULL:
                return new NullNode();
            case ValueType.INT:
                return new IntegerNode(value.getLong());
            case ValueType.FLOAT:
                return new FloatNode(value.getDouble());
            case ValueType.BOOL:
                return new BooleanNode(value.getBoolean());
            case ValueType.STRING:
                return new StringNode(value.toString());
            default:
                return null;
        }
    }

    static boolean isConstantNode(Node node) {
        return node instanceof IntegerNode
                || node instanceof FloatNode
                || node instanceof StringNode
                || node instanceof BooleanNode
                || node instanceof NullNode;
    }

    /**
     * Evaluates a binary operator the way the interpreter does.
     */
    public static Value applyBinary(BinaryOperator operator, Value left, Value right) {
        switch (operator) {
            case ADD:
                return MathOperators.add(left, right);
            case SUB:
                return MathOperators.subtract(left, right);
            case MUL:
                return MathOperators.multiply(left, right);
            case DIV:
                return MathOperators.divide(left, right);
            case MOD:
                return MathOperators.modulus(left, right);
            case CONCAT:
                return StringOperators.concat(left, right);
            case EQ:
                return CompareOperators.equalTo(left, right);
            case NEQ:
                return CompareOperators.notEqualTo(left, right);
            case LT:
                return CompareOperators.lessThan(left, right);
            case LTE:
                return CompareOperators.lessThanOrEqual(left, right);
            case GT:
                return CompareOperators.greaterThan(left, right);
            case GTE:
                return CompareOperators.greaterThanOrEqual(left, right);
            case AND:
                return LogicalOperators.and(left, right);
            case OR:
                return LogicalOperators.or(left, right);
            default:
                throw new IllegalStateException("Unexpected binary operator: " + operator);
        }
    }

    /**
     * Evaluates a unary operator the way the interpreter does.
     */
    public static Value applyUnary(UnaryOperator operator, Value operand) {
        switch (operator) {
            case NEG:
                return MathOperators.negate(operand);
            case NOT:
                return LogicalOperators.not(operand);
            case TYPEOF:
                return LogicalOperators.typeOf(operand);
            default:
                throw new IllegalStateException("Unexpected unary operator: " + operator);
        }
    }

    private List<Node> foldList(List<Node> nodes) {
        List<Node> folded = new ArrayList<>(nodes.size());
        boolean changed = false;
        for (Node element : nodes) {
            Node f = foldConstants(element);
            if (f != element) {
                changed = true;
            }
            folded.add(f);
        }
        return changed ? folded : null;
    }

    private void leaf(Node node) {
        result = node;
    }

    @Override
    public void visit(IntegerNode node) {
        leaf(node);
    }

    @Override
    public void visit(FloatNode node) {
        leaf(node);
    }

    @Override
    public void visit(StringNode node) {
        leaf(node);
    }

    @Override
    public void visit(BooleanNode node) {
        leaf(node);
    }

    @Override
    public void visit(NullNode node) {
        leaf(node);
    }

    @Override
    public void visit(VariableNode node) {
        leaf(node);
    }

    @Override
    public void visit(PropertyNode node) {
        leaf(node);
    }

    @Override
    public void visit(MemberAccessNode node) {
        Node foldedObject = foldConstants(node.object);
        result = foldedObject != node.object ? new MemberAccessNode(foldedObject, node.property) : node;
    }

    @Override
    public void visit(ComputedMemberNode node) {
        Node foldedObject = foldConstants(node.object);
        Node foldedKey = foldConstants(node.key);
        if (foldedObject != node.object || foldedKey != node.key) {
            result = new ComputedMemberNode(foldedObject, foldedKey);
        } else {
            result = node;
        }
    }

    @Override
    public void visit(IndexNode node) {
        Node foldedArray = foldConstants(node.array);
        Node foldedIndex = foldConstants(node.index);
        if (foldedArray != node.array || foldedIndex != node.index) {
            result = new IndexNode(foldedArray, foldedIndex);
        } else {
            result = node;
        }
    }

    @Override
    public void visit(BinaryOperatorNode node) {
        // First, recursively fold the operands
        Node foldedLeft = foldConstants(node.left);
        Node foldedRight = foldConstants(node.right);

        if (isConstantNode(foldedLeft) && isConstantNode(foldedRight)) {
            Value folded = applyBinary(node.operator,
                    getConstantValue(foldedLeft), getConstantValue(foldedRight));
            Node literal = createConstantNode(folded);
            if (literal != null) {
                result = literal;
                return;
            }
        }

        if (foldedLeft != node.left || foldedRight != node.right) {
            result = new BinaryOperatorNode(node.operator, foldedLeft, foldedRight);
        } else {
            result = node;
        }
    }

    @Override
    public void visit(UnaryOperatorNode node) {
        Node foldedOperand = foldConstants(node.operand);

        if (isConstantNode(foldedOperand)) {
            Node literal = createConstantNode(applyUnary(node.operator, getConstantValue(foldedOperand)));
            if (literal != null) {
                result = literal;
                return;
            }
        }

        result = foldedOperand != node.operand ? new UnaryOperatorNode(node.operator, foldedOperand) : node;
    }

    @Override
    public void visit(TernaryOperatorNode node) {
        Node foldedCondition = foldConstants(node.condition);
        Node foldedThen = foldConstants(node.thenExpr);
        Node foldedElse = foldConstants(node.elseExpr);

        // A constant condition selects one arm; the other is dropped entirely
        if (isConstantNode(foldedCondition)) {
            Value condValue = getConstantValue(foldedCondition);
            result = condValue.getBoolean() ? foldedThen : foldedElse;
            return;
        }

        if (foldedCondition != node.condition || foldedThen != node.thenExpr || foldedElse != node.elseExpr) {
            result = new TernaryOperatorNode(foldedCondition, foldedThen, foldedElse);
        } else {
            result = node;
        }
    }

    @Override
    public void visit(CallNode node) {
        // Calls are never folded: builtins may depend on host state
        List<Node> foldedArgs = foldList(node.args);
        result = foldedArgs != null ? new CallNode(node.function, foldedArgs) : node;
    }

    @Override
    public void visit(MethodCallNode node) {
        Node foldedReceiver = foldConstants(node.receiver);
        List<Node> foldedArgs = foldList(node.args);
        if (foldedReceiver != node.receiver || foldedArgs != null) {
            result = new MethodCallNode(foldedReceiver, node.method,
                    foldedArgs != null ? foldedArgs : node.args);
        } else {
            result = node;
        }
    }

    @Override
    public void visit(GroupNode node) {
        result = foldConstants(node.inner);
    }

    @Override
    public void visit(ArrayLiteralNode node) {
        List<Node> foldedElements = foldList(node.elements);
        result = foldedElements != null ? new ArrayLiteralNode(foldedElements) : node;
    }

    @Override
    public void visit(ObjectLiteralNode node) {
        List<Node> foldedValues = foldList(node.values);
        result = foldedValues != null ? new ObjectLiteralNode(node.keys, foldedValues) : node;
    }
}
