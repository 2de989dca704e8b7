package org.kryon.expr.backend.bytecode;

import org.junit.jupiter.api.Test;
import org.kryon.expr.CompilerOptions;
import org.kryon.expr.astnode.BinaryOperator;
import org.kryon.expr.astnode.Node;
import org.kryon.expr.astnode.UnaryOperator;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.kryon.expr.Trees.*;

public class BytecodeCompilerTest {

    private static CompiledExpression compile(Node tree) {
        return new BytecodeCompiler().compile(tree);
    }

    private static int[] opcodes(CompiledExpression compiled) {
        int[] ops = new int[compiled.code.length];
        for (int i = 0; i < ops.length; i++) {
            ops[i] = Instruction.opcode(compiled.code[i]);
        }
        return ops;
    }

    @Test
    public void testSmallIntegerIsInline() {
        CompiledExpression compiled = compile(num(-42));
        assertArrayEquals(new int[]{Opcodes.PUSH_INT, Opcodes.HALT}, opcodes(compiled));
        assertEquals(0, Instruction.operand1(compiled.code[0]));
        assertEquals(-42, Instruction.operand3(compiled.code[0]));
        assertEquals(0, compiled.intPool.length);
        assertEquals(1, compiled.maxStackDepth);
        assertFalse(compiled.hasError());
    }

    @Test
    public void testWideIntegerUsesPool() {
        long big = 1L << 40;
        CompiledExpression compiled = compile(bin(BinaryOperator.ADD, num(big), num(big)));
        long insn = compiled.code[0];
        assertEquals(1, Instruction.operand1(insn));
        assertEquals(0, Instruction.operand2(insn), "pool index 0 is a valid entry");
        assertArrayEquals(new long[]{big}, compiled.intPool, "duplicates share one pool entry");
        assertEquals(compiled.code[0], compiled.code[1]);
    }

    @Test
    public void testStringPoolDeduplicates() {
        CompiledExpression compiled = compile(bin(BinaryOperator.EQ, str("a"), bin(BinaryOperator.ADD, str("a"), var("a"))));
        assertArrayEquals(new String[]{"a"}, compiled.stringPool);
    }

    @Test
    public void testFloatStoredAsRoundTripText() {
        CompiledExpression compiled = compile(flt(0.1));
        assertEquals(Opcodes.PUSH_FLOAT, Instruction.opcode(compiled.code[0]));
        assertEquals("0.1", compiled.stringPool[Instruction.operand2(compiled.code[0])]);
    }

    @Test
    public void testTernaryLayoutAndOffsets() {
        CompiledExpression compiled = compile(ternary(var("c"), num(1), num(2)));
        assertArrayEquals(new int[]{
                Opcodes.LOAD_VAR, Opcodes.JUMP_IF_FALSE, Opcodes.PUSH_INT,
                Opcodes.JUMP, Opcodes.PUSH_INT, Opcodes.HALT}, opcodes(compiled));
        assertEquals(3, Instruction.operand3(compiled.code[1]), "JUMP_IF_FALSE lands on the else arm");
        assertEquals(2, Instruction.operand3(compiled.code[3]), "JUMP lands after the else arm");
        assertEquals(1, compiled.maxStackDepth);
    }

    @Test
    public void testCallArgumentsAreReversed() {
        CompiledExpression compiled = compile(call("math_max", num(1), num(2)));
        assertArrayEquals(new int[]{Opcodes.PUSH_INT, Opcodes.PUSH_INT, Opcodes.CALL_BUILTIN, Opcodes.HALT},
                opcodes(compiled));
        assertEquals(2, Instruction.operand3(compiled.code[0]));
        assertEquals(1, Instruction.operand3(compiled.code[1]));
        assertEquals(2, Instruction.operand3(compiled.code[2]), "argc");
        assertEquals("math_max", compiled.stringPool[Instruction.operand2(compiled.code[2])]);
        assertEquals(2, compiled.maxStackDepth);
    }

    @Test
    public void testBuiltinPrefixesDecideDispatch() {
        assertEquals(Opcodes.CALL_FUNCTION, Instruction.opcode(compile(call("format", num(1))).code[1]));

        CompilerOptions options = new CompilerOptions();
        options.builtinPrefixes = List.of("fmt_");
        CompiledExpression compiled = new BytecodeCompiler(options).compile(call("fmt_date"));
        assertEquals(Opcodes.CALL_BUILTIN, Instruction.opcode(compiled.code[0]));
        compiled = new BytecodeCompiler(options).compile(call("math_max"));
        assertEquals(Opcodes.CALL_FUNCTION, Instruction.opcode(compiled.code[0]));
    }

    @Test
    public void testMethodCallReceiverFirst() {
        CompiledExpression compiled = compile(method(var("items"), "push", num(4)));
        assertArrayEquals(new int[]{Opcodes.LOAD_VAR, Opcodes.PUSH_INT, Opcodes.CALL_METHOD, Opcodes.HALT},
                opcodes(compiled));
        assertEquals(1, Instruction.operand3(compiled.code[2]));
    }

    @Test
    public void testMemberAccessForms() {
        assertArrayEquals(new int[]{Opcodes.LOAD_VAR, Opcodes.GET_PROP, Opcodes.HALT},
                opcodes(compile(prop("user", "name"))));
        assertArrayEquals(new int[]{Opcodes.LOAD_VAR, Opcodes.GET_PROP, Opcodes.HALT},
                opcodes(compile(member(var("user"), "name"))));
        assertArrayEquals(new int[]{Opcodes.LOAD_VAR, Opcodes.PUSH_STRING, Opcodes.GET_PROP_COMPUTED, Opcodes.HALT},
                opcodes(compile(computed(var("user"), str("name")))));
        assertArrayEquals(new int[]{Opcodes.LOAD_VAR, Opcodes.PUSH_INT, Opcodes.GET_INDEX, Opcodes.HALT},
                opcodes(compile(index(var("items"), num(0)))));
    }

    @Test
    public void testStackDepthTracking() {
        // (1 + (2 * (3 - 4))) needs four slots
        Node tree = bin(BinaryOperator.ADD, num(1),
                bin(BinaryOperator.MUL, num(2), bin(BinaryOperator.SUB, num(3), num(4))));
        assertEquals(4, compile(tree).maxStackDepth);
        assertEquals(4, compile(object(List.of("a", "b"), List.of(num(1), num(2)))).maxStackDepth);
    }

    @Test
    public void testNullNodesCompileToPushNull() {
        assertArrayEquals(new int[]{Opcodes.PUSH_NULL, Opcodes.HALT}, opcodes(compile(null)));
        assertArrayEquals(new int[]{Opcodes.PUSH_NULL, Opcodes.NOT, Opcodes.HALT},
                opcodes(compile(unary(UnaryOperator.NOT, null))));
    }

    @Test
    public void testInstructionLimitIsSticky() {
        CompilerOptions options = new CompilerOptions();
        options.maxInstructions = 3;
        CompiledExpression compiled = new BytecodeCompiler(options)
                .compile(array(num(1), num(2), num(3), num(4), num(5)));
        assertTrue(compiled.hasError());
        assertTrue(compiled.errorMessage.contains("instruction limit"), compiled.errorMessage);
        assertEquals(3, compiled.code.length, "nothing is emitted after the failure");
    }

    @Test
    public void testStringPoolOverflow() {
        CompilerOptions options = new CompilerOptions();
        options.maxInstructions = 200_000;
        List<Node> elements = new ArrayList<>();
        for (int i = 0; i <= 65536; i++) {
            elements.add(str("s" + i));
        }
        CompiledExpression compiled = new BytecodeCompiler(options).compile(array(elements.toArray(new Node[0])));
        assertTrue(compiled.hasError());
        assertTrue(compiled.errorMessage.startsWith("string pool"), compiled.errorMessage);
    }

    @Test
    public void testDebugInfoStoresSourceEcho() {
        CompilerOptions options = new CompilerOptions();
        options.debugInfo = true;
        CompiledExpression compiled = new BytecodeCompiler(options).compile(var("count"));
        assertEquals("{\"var\":\"count\"}", compiled.sourceExpr);
        assertNull(compile(var("count")).sourceExpr);
    }
}
