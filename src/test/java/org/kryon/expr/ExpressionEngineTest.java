package org.kryon.expr;

import org.junit.jupiter.api.Test;
import org.kryon.expr.astnode.BinaryOperator;
import org.kryon.expr.astnode.Node;
import org.kryon.expr.backend.bytecode.CompiledExpression;
import org.kryon.expr.backend.bytecode.EvalContext;
import org.kryon.expr.backend.bytecode.Instruction;
import org.kryon.expr.backend.bytecode.Opcodes;
import org.kryon.expr.json.ExpressionJson;
import org.kryon.expr.runtime.BuiltinRegistry;
import org.kryon.expr.runtime.VariableAccessor;
import org.kryon.expr.runtime.runtimetypes.Value;
import org.kryon.expr.runtime.runtimetypes.ValueObject;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.kryon.expr.Trees.*;

public class ExpressionEngineTest {

    private static Node onePlusTwoTimesThree() {
        return bin(BinaryOperator.ADD, num(1), bin(BinaryOperator.MUL, num(2), num(3)));
    }

    @Test
    public void testFoldedExpressionIsASingleConstant() {
        ExpressionEngine engine = new ExpressionEngine();
        CompiledExpression compiled = engine.compile(onePlusTwoTimesThree());

        assertFalse(compiled.hasError());
        assertEquals(2, compiled.code.length);
        assertEquals(Opcodes.PUSH_INT, Instruction.opcode(compiled.code[0]));
        assertEquals(7, Instruction.operand3(compiled.code[0]));
        assertEquals(Opcodes.HALT, Instruction.opcode(compiled.code[1]));
        assertEquals(Value.ofInt(7), engine.evaluate(compiled, VariableAccessor.EMPTY));
    }

    @Test
    public void testWithoutFoldingSameResult() {
        CompilerOptions options = new CompilerOptions();
        options.constantFolding = false;
        options.deadCodeElimination = false;
        ExpressionEngine engine = new ExpressionEngine(options, new BuiltinRegistry());

        CompiledExpression compiled = engine.compile(onePlusTwoTimesThree());
        assertTrue(compiled.code.length > 2);
        assertEquals(Value.ofInt(7), engine.evaluate(compiled, VariableAccessor.EMPTY));
    }

    @Test
    public void testOptionsAreCopied() {
        CompilerOptions options = new CompilerOptions();
        ExpressionEngine engine = new ExpressionEngine(options, new BuiltinRegistry());
        options.constantFolding = false;
        assertTrue(engine.getOptions().constantFolding);
    }

    @Test
    public void testPropertyOfHostState() {
        ValueObject user = new ValueObject();
        user.set("name", Value.ofString("Ann"));
        ValueObject state = new ValueObject();
        state.set("user", Value.ofObject(user));

        ExpressionEngine engine = new ExpressionEngine();
        Node tree = ExpressionJson.fromJson("{\"prop\":\"user\",\"field\":\"name\"}");
        assertEquals(Value.ofString("Ann"), engine.evaluate(tree, VariableAccessor.of(state)));
        assertEquals(Value.NULL, engine.evaluate(tree, VariableAccessor.EMPTY));
    }

    @Test
    public void testCompileCachedReusesUnits() {
        ExpressionEngine engine = new ExpressionEngine();
        CompiledExpression first = engine.compileCached(bin(BinaryOperator.ADD, var("count"), num(1)));
        CompiledExpression second = engine.compileCached(bin(BinaryOperator.ADD, var("count"), num(1)));

        assertSame(first, second);
        assertEquals(1, engine.getCache().stats().hits());
        assertEquals(1, engine.getCache().stats().misses());
    }

    @Test
    public void testLocalsShadowHostVariables() {
        ExpressionEngine engine = new ExpressionEngine();
        CompiledExpression compiled = engine.compile(bin(BinaryOperator.MUL, var("item"), num(10)));
        VariableAccessor host = VariableAccessor.of(Map.of("item", Value.ofInt(1)));

        assertEquals(Value.ofInt(10), engine.evaluate(compiled, host));
        assertEquals(Value.ofInt(40), engine.evaluate(compiled, host, Map.of("item", Value.ofInt(4))));
    }

    @Test
    public void testNullLocalNamesAreSkipped() {
        ExpressionEngine engine = new ExpressionEngine();
        CompiledExpression compiled = engine.compile(var("item"));
        Map<String, Value> locals = new HashMap<>();
        locals.put(null, Value.ofInt(1));
        locals.put("item", Value.ofInt(2));

        assertEquals(Value.ofInt(2), engine.evaluate(compiled, VariableAccessor.EMPTY, locals));
    }

    @Test
    public void testBuiltinsComeFromTheRegistry() {
        BuiltinRegistry builtins = new BuiltinRegistry()
                .register("math_max", args -> Value.ofInt(Math.max(args[0].getLong(), args[1].getLong())));
        ExpressionEngine engine = new ExpressionEngine(builtins);

        Value result = engine.evaluate(call("math_max", var("a"), num(3)),
                VariableAccessor.of(Map.of("a", Value.ofInt(9))));
        assertEquals(Value.ofInt(9), result);
    }

    @Test
    public void testSmallStackLimitReportsOverflow() throws IOException {
        CompilerOptions options;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("small-engine.yaml")) {
            options = CompilerOptions.fromYaml(in);
        }
        ExpressionEngine engine = new ExpressionEngine(options, new BuiltinRegistry());
        assertEquals(2, engine.getCache().capacity());

        CompiledExpression compiled = engine.compile(array(num(1), num(2), num(3), num(4), num(5)));
        EvalContext ctx = engine.newContext(VariableAccessor.EMPTY);
        engine.evaluate(compiled, ctx);
        assertTrue(ctx.hasError());
        assertTrue(ctx.getErrorMessage().startsWith("Stack overflow"));
    }
}
