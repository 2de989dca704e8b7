package org.kryon.expr.backend.bytecode;

/**
 * Packing and unpacking of one instruction word.
 * <pre>
 *   bits 56-63  opcode
 *   bits 48-55  operand1  flag byte
 *   bits 32-47  operand2  unsigned pool index
 *   bits  0-31  operand3  signed immediate / PC-relative offset
 * </pre>
 */
public final class Instruction {

    public static final int MAX_OPERAND1 = 0xFF;
    public static final int MAX_OPERAND2 = 0xFFFF;

    private Instruction() {
    }

    public static long encode(int opcode, int op1, int op2, int op3) {
        return ((long) (opcode & 0xFF) << 56)
                | ((long) (op1 & 0xFF) << 48)
                | ((long) (op2 & 0xFFFF) << 32)
                | (op3 & 0xFFFFFFFFL);
    }

    public static int opcode(long insn) {
        return (int) (insn >>> 56) & 0xFF;
    }

    public static int operand1(long insn) {
        return (int) (insn >>> 48) & 0xFF;
    }

    public static int operand2(long insn) {
        return (int) (insn >>> 32) & 0xFFFF;
    }

    public static int operand3(long insn) {
        return (int) insn;
    }

    /**
     * @return the instruction with operand3 replaced, used to back-patch jumps
     */
    public static long withOperand3(long insn, int op3) {
        return (insn & 0xFFFFFFFF00000000L) | (op3 & 0xFFFFFFFFL);
    }
}
