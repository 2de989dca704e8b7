package org.kryon.expr.backend.bytecode;

/**
 * A compiled expression: instruction stream, constant pools and metadata.
 * <p>
 * Immutable once built, so one unit may be evaluated concurrently from
 * several threads, each with its own {@link EvalContext}. Callers must check
 * {@link #hasError()} before evaluating: a unit whose compilation overflowed a
 * limit holds a truncated instruction stream.
 */
public class CompiledExpression {
    public final long[] code;              // Packed instructions, see Instruction
    public final String[] stringPool;      // Names, string literals, float literal text
    public final long[] intPool;           // Integer literals outside int32
    public final int maxStackDepth;        // Deepest operand stack seen by the compiler
    public final String sourceExpr;        // JSON echo of the source tree, or null
    public final boolean compileError;
    public final String errorMessage;

    public CompiledExpression(long[] code, String[] stringPool, long[] intPool, int maxStackDepth,
                              String sourceExpr, boolean compileError, String errorMessage) {
        this.code = code;
        this.stringPool = stringPool;
        this.intPool = intPool;
        this.maxStackDepth = maxStackDepth;
        this.sourceExpr = sourceExpr;
        this.compileError = compileError;
        this.errorMessage = errorMessage;
    }

    public boolean hasError() {
        return compileError;
    }

    /**
     * @return a copy of this unit with a different instruction stream
     */
    CompiledExpression withCode(long[] newCode) {
        return new CompiledExpression(newCode, stringPool, intPool, maxStackDepth,
                sourceExpr, compileError, errorMessage);
    }

    /**
     * Disassembles the unit into a human-readable listing, one line per
     * instruction with its decoded operands.
     *
     * @return the listing
     */
    public String disassemble() {
        StringBuilder sb = new StringBuilder();
        sb.append("=== Bytecode Disassembly ===\n");
        if (sourceExpr != null) {
            sb.append("Source: ").append(sourceExpr).append("\n");
        }
        sb.append("Instructions: ").append(code.length).append("\n");
        sb.append("Max stack depth: ").append(maxStackDepth).append("\n");
        sb.append("String pool: ").append(stringPool.length)
                .append(", integer pool: ").append(intPool.length).append("\n");
        if (compileError) {
            sb.append("Compile error: ").append(errorMessage).append("\n");
        }
        sb.append("\n");

        for (int pc = 0; pc < code.length; pc++) {
            long insn = code[pc];
            int opcode = Instruction.opcode(insn);
            int op1 = Instruction.operand1(insn);
            int op2 = Instruction.operand2(insn);
            int op3 = Instruction.operand3(insn);
            sb.append(String.format("%4d: %-18s", pc, Opcodes.name(opcode)));

            switch (opcode) {
                case Opcodes.PUSH_INT:
                    if (op1 == 1) {
                        sb.append("#").append(op2);
                        if (op2 < intPool.length) {
                            sb.append(" (").append(intPool[op2]).append(")");
                        }
                    } else {
                        sb.append(op3);
                    }
                    break;
                case Opcodes.PUSH_FLOAT:
                    sb.append("#").append(op2).append(" (").append(poolString(op2)).append(")");
                    break;
                case Opcodes.PUSH_STRING:
                    sb.append("#").append(op2).append(" \"").append(poolString(op2)).append("\"");
                    break;
                case Opcodes.PUSH_BOOL:
                    sb.append(op1 != 0 ? "true" : "false");
                    break;
                case Opcodes.LOAD_VAR:
                case Opcodes.GET_PROP:
                    sb.append("#").append(op2).append(" ").append(poolString(op2));
                    break;
                case Opcodes.CALL_METHOD:
                case Opcodes.CALL_BUILTIN:
                case Opcodes.CALL_FUNCTION:
                    sb.append(poolString(op2)).append(" argc=").append(op3);
                    break;
                case Opcodes.JUMP:
                case Opcodes.JUMP_IF_FALSE:
                case Opcodes.JUMP_IF_TRUE:
                    sb.append(op3 >= 0 ? "+" : "").append(op3).append(" -> ").append(pc + op3);
                    break;
                case Opcodes.MAKE_ARRAY:
                case Opcodes.MAKE_OBJECT:
                    sb.append("count=").append(op3);
                    break;
                default:
                    break;
            }
            // Trim the padding of operand-less instructions
            int end = sb.length();
            while (end > 0 && sb.charAt(end - 1) == ' ') {
                end--;
            }
            sb.setLength(end);
            sb.append("\n");
        }
        return sb.toString();
    }

    private String poolString(int idx) {
        return idx < stringPool.length ? stringPool[idx] : "<bad index>";
    }

    @Override
    public String toString() {
        return disassemble();
    }
}
