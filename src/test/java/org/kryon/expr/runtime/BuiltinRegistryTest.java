package org.kryon.expr.runtime;

import org.junit.jupiter.api.Test;
import org.kryon.expr.runtime.runtimetypes.Value;

import static org.junit.jupiter.api.Assertions.*;

public class BuiltinRegistryTest {

    @Test
    public void testRegisterAndCall() {
        BuiltinRegistry registry = new BuiltinRegistry()
                .register("math_max", args -> args[0].getLong() >= args[1].getLong() ? args[0] : args[1])
                .register("type_nothing", args -> null);

        assertTrue(registry.contains("math_max"));
        assertEquals(Value.ofInt(7), registry.call("math_max", new Value[]{Value.ofInt(3), Value.ofInt(7)}));
        assertEquals(Value.NULL, registry.call("type_nothing", new Value[0]), "a Java null result becomes null");
        assertEquals(Value.NULL, registry.call("math_min", new Value[0]), "unknown names give null");
    }

    @Test
    public void testUnregister() {
        BuiltinRegistry registry = new BuiltinRegistry().register("string_id", args -> args[0]);
        assertTrue(registry.unregister("string_id"));
        assertFalse(registry.unregister("string_id"));
        assertNull(registry.lookup("string_id"));
        assertTrue(registry.names().isEmpty());
    }

    @Test
    public void testInvalidRegistration() {
        BuiltinRegistry registry = new BuiltinRegistry();
        assertThrows(IllegalArgumentException.class, () -> registry.register("", args -> Value.NULL));
        assertThrows(IllegalArgumentException.class, () -> registry.register(null, args -> Value.NULL));
        assertThrows(IllegalArgumentException.class, () -> registry.register("math_abs", null));
    }

    @Test
    public void testVariableAccessors() {
        VariableAccessor fromMap = VariableAccessor.of(java.util.Map.of("count", Value.ofInt(3)));
        assertEquals(Value.ofInt(3), fromMap.getVariable("count"));
        assertNull(fromMap.getVariable("missing"));

        VariableAccessor fromObject = VariableAccessor.of(
                new org.kryon.expr.runtime.runtimetypes.ValueObject().with("flag", Value.TRUE));
        assertEquals(Value.TRUE, fromObject.getVariable("flag"));
        assertNull(fromObject.getVariable("missing"));
        assertNull(VariableAccessor.EMPTY.getVariable("anything"));
    }
}
