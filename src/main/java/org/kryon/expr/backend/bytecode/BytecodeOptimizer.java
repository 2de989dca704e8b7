package org.kryon.expr.backend.bytecode;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;

/**
 * Bytecode-level optimizations run after emission.
 */
public class BytecodeOptimizer {

    private BytecodeOptimizer() {
    }

    /**
     * Replaces every instruction that cannot be reached from PC 0 with
     * {@code NOP}.
     * <p>
     * Reachability: {@code JUMP} reaches only its target, conditional jumps
     * reach their target and the next instruction, {@code HALT} reaches
     * nothing, and every other opcode reaches the next instruction. Slots are
     * kept in place, so no jump offset needs re-patching.
     *
     * @param compiled the unit to optimize; not modified
     * @return a new unit, or {@code compiled} itself if nothing was unreachable
     */
    public static CompiledExpression eliminateDeadCode(CompiledExpression compiled) {
        long[] code = compiled.code;
        BitSet reachable = findReachable(code);
        if (reachable.cardinality() == code.length) {
            return compiled;
        }

        long[] optimized = new long[code.length];
        long nop = Instruction.encode(Opcodes.NOP, 0, 0, 0);
        for (int pc = 0; pc < code.length; pc++) {
            optimized[pc] = reachable.get(pc) ? code[pc] : nop;
        }
        return compiled.withCode(optimized);
    }

    static BitSet findReachable(long[] code) {
        BitSet reachable = new BitSet(code.length);
        if (code.length == 0) {
            return reachable;
        }
        Deque<Integer> worklist = new ArrayDeque<>();
        worklist.push(0);
        while (!worklist.isEmpty()) {
            int pc = worklist.pop();
            if (pc < 0 || pc >= code.length || reachable.get(pc)) {
                continue;
            }
            reachable.set(pc);

            long insn = code[pc];
            switch (Instruction.opcode(insn)) {
                case Opcodes.HALT:
                    break;
                case Opcodes.JUMP:
                    worklist.push(pc + Instruction.operand3(insn));
                    break;
                case Opcodes.JUMP_IF_FALSE:
                case Opcodes.JUMP_IF_TRUE:
                    worklist.push(pc + Instruction.operand3(insn));
                    worklist.push(pc + 1);
                    break;
                default:
                    worklist.push(pc + 1);
                    break;
            }
        }
        return reachable;
    }
}
