package org.kryon.expr.backend.bytecode;

import org.kryon.expr.runtime.BuiltinRegistry;
import org.kryon.expr.runtime.operators.AccessOperators;
import org.kryon.expr.runtime.operators.CompareOperators;
import org.kryon.expr.runtime.operators.LogicalOperators;
import org.kryon.expr.runtime.operators.MathOperators;
import org.kryon.expr.runtime.operators.MethodDispatcher;
import org.kryon.expr.runtime.operators.StringOperators;
import org.kryon.expr.runtime.runtimetypes.Value;
import org.kryon.expr.runtime.runtimetypes.ValueArray;
import org.kryon.expr.runtime.runtimetypes.ValueObject;

/**
 * Stack-machine interpreter for compiled expressions.
 * <p>
 * Evaluation never throws. Malformed input (stack underflow, unknown opcodes,
 * bad jumps) sets the context's error flag; the offending operation yields
 * null and the loop carries on to {@code HALT} or the end of the code.
 */
public class BytecodeInterpreter {

    private BytecodeInterpreter() {
    }

    /**
     * Evaluates a compiled expression.
     *
     * @param code the unit to run
     * @param ctx  a fresh evaluation context
     * @return the value left on top of the stack, or {@link Value#NULL} if the
     *         stack is empty or the unit carries a compile error
     */
    public static Value execute(CompiledExpression code, EvalContext ctx) {
        if (code.hasError()) {
            ctx.setError("Cannot evaluate: " + code.errorMessage);
            return Value.NULL;
        }
        ctx.reserve(code.maxStackDepth);

        long[] bytecode = code.code;
        int pc = 0;  // Program counter

        // Main dispatch loop - dense opcodes compile to a tableswitch
        dispatch:
        while (pc < bytecode.length) {
            long insn = bytecode[pc];
            int opcode = Instruction.opcode(insn);
            int op1 = Instruction.operand1(insn);
            int op2 = Instruction.operand2(insn);
            int op3 = Instruction.operand3(insn);

            switch (opcode) {
                // =================================================================
                // CONSTANTS
                // =================================================================

                case Opcodes.NOP:
                    break;

                case Opcodes.PUSH_INT:
                    if (op1 == 1) {
                        ctx.push(op2 < code.intPool.length ? Value.ofInt(code.intPool[op2]) : Value.NULL);
                    } else {
                        ctx.push(Value.ofInt(op3));
                    }
                    break;

                case Opcodes.PUSH_FLOAT:
                    ctx.push(parseFloat(poolString(code, op2)));
                    break;

                case Opcodes.PUSH_STRING: {
                    String s = poolString(code, op2);
                    ctx.push(s == null ? Value.EMPTY_STRING : Value.ofString(s));
                    break;
                }

                case Opcodes.PUSH_BOOL:
                    ctx.push(Value.ofBool(op1 != 0));
                    break;

                case Opcodes.PUSH_NULL:
                    ctx.push(Value.NULL);
                    break;

                // =================================================================
                // STACK MANIPULATION
                // =================================================================

                case Opcodes.DUP:
                    ctx.push(ctx.peek().copy());
                    break;

                case Opcodes.POP:
                    ctx.pop();
                    break;

                case Opcodes.SWAP: {
                    Value top = ctx.pop();
                    Value below = ctx.pop();
                    ctx.push(top);
                    ctx.push(below);
                    break;
                }

                // =================================================================
                // VARIABLES AND MEMBER ACCESS
                // =================================================================

                case Opcodes.LOAD_VAR: {
                    String name = poolString(code, op2);
                    ctx.push(name == null ? Value.NULL : ctx.lookupVariable(name));
                    break;
                }

                case Opcodes.GET_PROP: {
                    Value obj = ctx.pop();
                    ctx.push(AccessOperators.getProperty(obj, poolString(code, op2)));
                    break;
                }

                case Opcodes.GET_PROP_COMPUTED:
                case Opcodes.GET_INDEX: {
                    Value key = ctx.pop();
                    Value obj = ctx.pop();
                    ctx.push(AccessOperators.getIndexed(obj, key));
                    break;
                }

                // =================================================================
                // CALLS
                // =================================================================

                case Opcodes.CALL_METHOD: {
                    Value[] args = popArgs(ctx, op3);
                    Value receiver = ctx.pop();
                    ctx.push(MethodDispatcher.callMethod(receiver, poolString(code, op2), args));
                    break;
                }

                case Opcodes.CALL_BUILTIN: {
                    Value[] args = popArgs(ctx, op3);
                    ctx.push(callBuiltin(ctx, poolString(code, op2), args));
                    break;
                }

                case Opcodes.CALL_FUNCTION:
                    // No user-defined functions: the call is well-formed but has no target
                    popArgs(ctx, op3);
                    ctx.push(Value.NULL);
                    break;

                // =================================================================
                // BINARY OPERATORS
                // =================================================================

                case Opcodes.ADD:
                case Opcodes.SUB:
                case Opcodes.MUL:
                case Opcodes.DIV:
                case Opcodes.MOD:
                case Opcodes.CONCAT:
                case Opcodes.EQ:
                case Opcodes.NEQ:
                case Opcodes.LT:
                case Opcodes.LTE:
                case Opcodes.GT:
                case Opcodes.GTE:
                case Opcodes.AND:
                case Opcodes.OR: {
                    Value right = ctx.pop();
                    Value left = ctx.pop();
                    ctx.push(binaryOp(opcode, left, right));
                    break;
                }

                // =================================================================
                // UNARY OPERATORS
                // =================================================================

                case Opcodes.NOT:
                    ctx.push(LogicalOperators.not(ctx.pop()));
                    break;

                case Opcodes.NEGATE:
                    ctx.push(MathOperators.negate(ctx.pop()));
                    break;

                case Opcodes.TYPEOF:
                    ctx.push(LogicalOperators.typeOf(ctx.pop()));
                    break;

                // =================================================================
                // CONTROL FLOW
                // =================================================================

                case Opcodes.JUMP:
                    if (!jumpInRange(ctx, pc, op3, bytecode.length)) {
                        break dispatch;
                    }
                    pc += op3;
                    continue;

                case Opcodes.JUMP_IF_FALSE:
                case Opcodes.JUMP_IF_TRUE: {
                    boolean cond = ctx.pop().getBoolean();
                    if (cond == (opcode == Opcodes.JUMP_IF_TRUE)) {
                        if (!jumpInRange(ctx, pc, op3, bytecode.length)) {
                            break dispatch;
                        }
                        pc += op3;
                        continue;
                    }
                    break;
                }

                // =================================================================
                // CONTAINERS
                // =================================================================

                case Opcodes.MAKE_ARRAY: {
                    Value[] elements = new Value[Math.max(op3, 0)];
                    for (int i = elements.length - 1; i >= 0; i--) {
                        elements[i] = ctx.pop();
                    }
                    ctx.push(Value.ofArray(ValueArray.of(elements)));
                    break;
                }

                case Opcodes.MAKE_OBJECT: {
                    int count = Math.max(op3, 0);
                    String[] keys = new String[count];
                    Value[] values = new Value[count];
                    for (int i = count - 1; i >= 0; i--) {
                        values[i] = ctx.pop();
                        keys[i] = ctx.pop().toString();
                    }
                    ValueObject obj = new ValueObject(count);
                    for (int i = 0; i < count; i++) {
                        obj.set(keys[i], values[i]);
                    }
                    ctx.push(Value.ofObject(obj));
                    break;
                }

                case Opcodes.HALT:
                    break dispatch;

                default:
                    ctx.setError("Unknown opcode " + opcode + " at pc " + pc);
                    break;
            }
            pc++;
        }

        return ctx.stackSize() > 0 ? ctx.pop() : Value.NULL;
    }

    static Value binaryOp(int opcode, Value left, Value right) {
        switch (opcode) {
            case Opcodes.ADD:
                return MathOperators.add(left, right);
            case Opcodes.SUB:
                return MathOperators.subtract(left, right);
            case Opcodes.MUL:
                return MathOperators.multiply(left, right);
            case Opcodes.DIV:
                return MathOperators.divide(left, right);
            case Opcodes.MOD:
                return MathOperators.modulus(left, right);
            case Opcodes.CONCAT:
                return StringOperators.concat(left, right);
            case Opcodes.EQ:
                return CompareOperators.equalTo(left, right);
            case Opcodes.NEQ:
                return CompareOperators.notEqualTo(left, right);
            case Opcodes.LT:
                return CompareOperators.lessThan(left, right);
            case Opcodes.LTE:
                return CompareOperators.lessThanOrEqual(left, right);
            case Opcodes.GT:
                return CompareOperators.greaterThan(left, right);
            case Opcodes.GTE:
                return CompareOperators.greaterThanOrEqual(left, right);
            case Opcodes.AND:
                return LogicalOperators.and(left, right);
            case Opcodes.OR:
                return LogicalOperators.or(left, right);
            default:
                throw new IllegalStateException("Not a binary opcode: " + Opcodes.name(opcode));
        }
    }

    /**
     * Pops {@code argc} arguments. The compiler pushes them last-first, so the
     * first pop is the first argument.
     */
    private static Value[] popArgs(EvalContext ctx, int argc) {
        Value[] args = new Value[Math.max(argc, 0)];
        for (int i = 0; i < args.length; i++) {
            args[i] = ctx.pop();
        }
        return args;
    }

    private static Value callBuiltin(EvalContext ctx, String name, Value[] args) {
        BuiltinRegistry builtins = ctx.getBuiltins();
        if (builtins == null || name == null) {
            return Value.NULL;
        }
        try {
            // The host may hand out a container it still holds
            return builtins.call(name, args).copy();
        } catch (RuntimeException e) {
            ctx.setError("Builtin '" + name + "' failed: " + e);
            return Value.NULL;
        }
    }

    /**
     * Jumps only go forward and land inside the code or exactly at its end.
     */
    private static boolean jumpInRange(EvalContext ctx, int pc, int offset, int codeLength) {
        long target = (long) pc + offset;
        if (offset <= 0 || target > codeLength) {
            ctx.setError("Bad jump offset " + offset + " at pc " + pc);
            return false;
        }
        return true;
    }

    private static String poolString(CompiledExpression code, int idx) {
        return idx < code.stringPool.length ? code.stringPool[idx] : null;
    }

    private static Value parseFloat(String text) {
        if (text == null) {
            return Value.NULL;
        }
        try {
            return Value.ofFloat(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            return Value.NULL;
        }
    }
}
