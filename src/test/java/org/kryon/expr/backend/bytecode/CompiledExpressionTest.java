package org.kryon.expr.backend.bytecode;

import org.junit.jupiter.api.Test;
import org.kryon.expr.CompilerOptions;
import org.kryon.expr.astnode.BinaryOperator;

import static org.junit.jupiter.api.Assertions.*;
import static org.kryon.expr.Trees.*;

public class CompiledExpressionTest {

    @Test
    public void testDisassembly() {
        CompilerOptions options = new CompilerOptions();
        options.debugInfo = true;
        CompiledExpression compiled = new BytecodeCompiler(options)
                .compile(ternary(var("ok"), str("yes"), bin(BinaryOperator.ADD, num(1L << 33), flt(0.5))));

        String listing = compiled.disassemble();
        String expected = "=== Bytecode Disassembly ===\n"
                + "Source: {\"op\":\"ternary\",\"condition\":{\"var\":\"ok\"},\"then\":\"yes\",\"else\":"
                + "{\"op\":\"add\",\"left\":8589934592,\"right\":0.5}}\n"
                + "Instructions: 8\n"
                + "Max stack depth: 2\n"
                + "String pool: 3, integer pool: 1\n"
                + "\n"
                + "   0: LOAD_VAR          #0 ok\n"
                + "   1: JUMP_IF_FALSE     +3 -> 4\n"
                + "   2: PUSH_STRING       #1 \"yes\"\n"
                + "   3: JUMP              +4 -> 7\n"
                + "   4: PUSH_INT          #0 (8589934592)\n"
                + "   5: PUSH_FLOAT        #2 (0.5)\n"
                + "   6: ADD\n"
                + "   7: HALT\n";
        assertEquals(expected, listing);
    }

    @Test
    public void testDisassemblyShowsCompileError() {
        CompilerOptions options = new CompilerOptions();
        options.maxInstructions = 1;
        CompiledExpression compiled = new BytecodeCompiler(options).compile(bin(BinaryOperator.ADD, num(1), num(2)));
        String listing = compiled.disassemble();
        assertTrue(listing.contains("Compile error: emit: instruction limit of 1 exceeded"), listing);
        assertTrue(listing.contains("   0: PUSH_INT          1\n"), listing);
    }

    @Test
    public void testOpcodeNames() {
        assertEquals("GET_PROP_COMPUTED", Opcodes.name(Opcodes.GET_PROP_COMPUTED));
        assertEquals("HALT", Opcodes.name(Opcodes.HALT));
        assertEquals("UNKNOWN(200)", Opcodes.name(200));
    }

    @Test
    public void testInstructionPacking() {
        long insn = Instruction.encode(Opcodes.CALL_METHOD, 1, 65535, -123456);
        assertEquals(Opcodes.CALL_METHOD, Instruction.opcode(insn));
        assertEquals(1, Instruction.operand1(insn));
        assertEquals(65535, Instruction.operand2(insn));
        assertEquals(-123456, Instruction.operand3(insn));

        long patched = Instruction.withOperand3(insn, 7);
        assertEquals(65535, Instruction.operand2(patched));
        assertEquals(7, Instruction.operand3(patched));
    }
}
