package org.kryon.expr.backend.bytecode;

import org.kryon.expr.CompilerOptions;
import org.kryon.expr.astnode.*;
import org.kryon.expr.astvisitor.Visitor;
import org.kryon.expr.core.Configuration;
import org.kryon.expr.json.ExpressionJson;

import java.util.List;

/**
 * BytecodeCompiler traverses the expression tree and generates VM bytecode.
 *
 * Key responsibilities:
 * - Visit tree nodes and emit stack-machine opcodes
 * - Build the string pool and integer pool
 * - Track current and maximum operand stack depth
 * - Back-patch forward jumps with PC-relative offsets
 *
 * Every node leaves exactly one value on the stack. Failures (instruction
 * limit, pool index overflow, a node breaking the one-value rule) set a
 * sticky error: every later emission is a no-op and the resulting unit
 * reports {@link CompiledExpression#hasError()}.
 *
 * Not thread-safe; one instance compiles one expression at a time.
 */
public class BytecodeCompiler implements Visitor {
    private final CompilerOptions options;

    private long[] code = new long[32];
    private int codeSize;
    private StringPool stringPool;
    private IntegerPool intPool;

    private int stackDepth;
    private int maxStackDepth;

    private boolean hasError;
    private String errorMessage;

    public BytecodeCompiler(CompilerOptions options) {
        this.options = options;
    }

    public BytecodeCompiler() {
        this(new CompilerOptions());
    }

    /**
     * Compiles a tree as-is: no folding, no dead-code elimination.
     *
     * @param root the expression; null compiles to a unit yielding null
     * @return the compiled unit, which may carry a compile error
     */
    public CompiledExpression compile(Node root) {
        codeSize = 0;
        stringPool = new StringPool();
        intPool = new IntegerPool();
        stackDepth = 0;
        maxStackDepth = 0;
        hasError = false;
        errorMessage = null;

        compileNode(root);
        emit(Opcodes.HALT);

        long[] finalCode = new long[codeSize];
        System.arraycopy(code, 0, finalCode, 0, codeSize);
        String source = options.debugInfo && root != null ? ExpressionJson.toJson(root) : null;
        CompiledExpression compiled = new CompiledExpression(finalCode, stringPool.toArray(), intPool.toArray(),
                maxStackDepth, source, hasError, errorMessage);

        if (Configuration.debugEnabled) {
            System.err.println(compiled.disassemble());
        }
        return compiled;
    }

    /**
     * Compiles one subexpression and checks that it left exactly one value.
     */
    private void compileNode(Node node) {
        int before = stackDepth;
        if (node == null) {
            emit(Opcodes.PUSH_NULL);
        } else {
            node.accept(this);
        }
        if (!hasError && stackDepth != before + 1) {
            setError(node == null ? "null" : node.getClass().getSimpleName(),
                    "left " + (stackDepth - before) + " values on the stack instead of 1");
        }
    }

    private void compileArgsReversed(List<Node> args) {
        for (int i = args.size() - 1; i >= 0; i--) {
            compileNode(args.get(i));
        }
    }

    // =================================================================
    // EMISSION
    // =================================================================

    private int emit(int opcode) {
        return emit(opcode, 0, 0, 0);
    }

    /**
     * Appends one instruction.
     *
     * @return the instruction's PC, or -1 if nothing was emitted
     */
    private int emit(int opcode, int op1, int op2, int op3) {
        if (hasError) {
            return -1;
        }
        if (codeSize >= options.maxInstructions) {
            setError("emit", "instruction limit of " + options.maxInstructions + " exceeded");
            return -1;
        }
        if (codeSize == code.length) {
            long[] grown = new long[code.length * 2];
            System.arraycopy(code, 0, grown, 0, codeSize);
            code = grown;
        }
        code[codeSize] = Instruction.encode(opcode, op1, op2, op3);
        stackDepth += Opcodes.stackEffect(opcode, op3);
        if (stackDepth > maxStackDepth) {
            maxStackDepth = stackDepth;
        }
        return codeSize++;
    }

    /**
     * Points the jump at {@code jumpPc} to the next instruction to be emitted.
     */
    private void patchJump(int jumpPc) {
        if (jumpPc < 0 || hasError) {
            return;
        }
        code[jumpPc] = Instruction.withOperand3(code[jumpPc], codeSize - jumpPc);
    }

    private int addString(String s) {
        int idx = stringPool.add(s == null ? "" : s);
        if (idx > Instruction.MAX_OPERAND2) {
            setError("string pool", "more than " + (Instruction.MAX_OPERAND2 + 1) + " entries");
        }
        return idx;
    }

    private int addInteger(long value) {
        int idx = intPool.add(value);
        if (idx > Instruction.MAX_OPERAND2) {
            setError("integer pool", "more than " + (Instruction.MAX_OPERAND2 + 1) + " entries");
        }
        return idx;
    }

    private void setError(String where, String message) {
        if (!hasError) {
            hasError = true;
            errorMessage = where + ": " + message;
        }
    }

    // =================================================================
    // LITERALS
    // =================================================================

    @Override
    public void visit(IntegerNode node) {
        long value = node.value;
        if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            emit(Opcodes.PUSH_INT, 0, 0, (int) value);
        } else {
            emit(Opcodes.PUSH_INT, 1, addInteger(value), 0);
        }
    }

    @Override
    public void visit(FloatNode node) {
        // Double.toString is the shortest text that parses back to the same double
        emit(Opcodes.PUSH_FLOAT, 0, addString(Double.toString(node.value)), 0);
    }

    @Override
    public void visit(StringNode node) {
        emit(Opcodes.PUSH_STRING, 0, addString(node.value), 0);
    }

    @Override
    public void visit(BooleanNode node) {
        emit(Opcodes.PUSH_BOOL, node.value ? 1 : 0, 0, 0);
    }

    @Override
    public void visit(NullNode node) {
        emit(Opcodes.PUSH_NULL);
    }

    // =================================================================
    // VARIABLES AND MEMBER ACCESS
    // =================================================================

    @Override
    public void visit(VariableNode node) {
        emit(Opcodes.LOAD_VAR, 0, addString(node.name), 0);
    }

    @Override
    public void visit(PropertyNode node) {
        emit(Opcodes.LOAD_VAR, 0, addString(node.object), 0);
        emit(Opcodes.GET_PROP, 0, addString(node.field), 0);
    }

    @Override
    public void visit(MemberAccessNode node) {
        compileNode(node.object);
        emit(Opcodes.GET_PROP, 0, addString(node.property), 0);
    }

    @Override
    public void visit(ComputedMemberNode node) {
        compileNode(node.object);
        compileNode(node.key);
        emit(Opcodes.GET_PROP_COMPUTED);
    }

    @Override
    public void visit(IndexNode node) {
        compileNode(node.array);
        compileNode(node.index);
        emit(Opcodes.GET_INDEX);
    }

    // =================================================================
    // OPERATORS
    // =================================================================

    @Override
    public void visit(BinaryOperatorNode node) {
        compileNode(node.left);
        compileNode(node.right);
        emit(binaryOpcode(node.operator));
    }

    static int binaryOpcode(BinaryOperator operator) {
        switch (operator) {
            case ADD:
                return Opcodes.ADD;
            case SUB:
                return Opcodes.SUB;
            case MUL:
                return Opcodes.MUL;
            case DIV:
                return Opcodes.DIV;
            case MOD:
                return Opcodes.MOD;
            case CONCAT:
                return Opcodes.CONCAT;
            case EQ:
                return Opcodes.EQ;
            case NEQ:
                return Opcodes.NEQ;
            case LT:
                return Opcodes.LT;
            case LTE:
                return Opcodes.LTE;
            case GT:
                return Opcodes.GT;
            case GTE:
                return Opcodes.GTE;
            case AND:
                return Opcodes.AND;
            case OR:
                return Opcodes.OR;
            default:
                throw new IllegalStateException("Unexpected binary operator: " + operator);
        }
    }

    @Override
    public void visit(UnaryOperatorNode node) {
        compileNode(node.operand);
        switch (node.operator) {
            case NEG:
                emit(Opcodes.NEGATE);
                break;
            case NOT:
                emit(Opcodes.NOT);
                break;
            case TYPEOF:
                emit(Opcodes.TYPEOF);
                break;
            default:
                throw new IllegalStateException("Unexpected unary operator: " + node.operator);
        }
    }

    /*
     *      <condition>
     *      JUMP_IF_FALSE else
     *      <then>
     *      JUMP end
     * else:
     *      <else>
     * end:
     */
    @Override
    public void visit(TernaryOperatorNode node) {
        compileNode(node.condition);
        int jumpToElse = emit(Opcodes.JUMP_IF_FALSE);
        int depthBeforeArm = stackDepth;

        compileNode(node.thenExpr);
        int jumpToEnd = emit(Opcodes.JUMP);
        patchJump(jumpToElse);

        // Only one arm runs: the else arm starts from the same depth as the then arm
        stackDepth = depthBeforeArm;
        compileNode(node.elseExpr);
        patchJump(jumpToEnd);
    }

    // =================================================================
    // CALLS
    // =================================================================

    @Override
    public void visit(CallNode node) {
        compileArgsReversed(node.args);
        int opcode = options.isBuiltinName(node.function) ? Opcodes.CALL_BUILTIN : Opcodes.CALL_FUNCTION;
        emit(opcode, 0, addString(node.function), node.args.size());
    }

    @Override
    public void visit(MethodCallNode node) {
        compileNode(node.receiver);
        compileArgsReversed(node.args);
        emit(Opcodes.CALL_METHOD, 0, addString(node.method), node.args.size());
    }

    @Override
    public void visit(GroupNode node) {
        compileNode(node.inner);
    }

    // =================================================================
    // CONTAINER LITERALS
    // =================================================================

    @Override
    public void visit(ArrayLiteralNode node) {
        for (Node element : node.elements) {
            compileNode(element);
        }
        emit(Opcodes.MAKE_ARRAY, 0, 0, node.elements.size());
    }

    @Override
    public void visit(ObjectLiteralNode node) {
        for (int i = 0; i < node.keys.size(); i++) {
            emit(Opcodes.PUSH_STRING, 0, addString(node.keys.get(i)), 0);
            compileNode(node.values.get(i));
        }
        emit(Opcodes.MAKE_OBJECT, 0, 0, node.keys.size());
    }
}
