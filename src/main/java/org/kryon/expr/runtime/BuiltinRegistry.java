package org.kryon.expr.runtime;

import org.kryon.expr.runtime.runtimetypes.Value;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Name to native-function table consulted by the {@code CALL_BUILTIN} opcode.
 * <p>
 * The registry is owned by the host and injected per engine or per
 * evaluation; it is read-mostly and does no locking, so registration must
 * not race with evaluation.
 */
public class BuiltinRegistry {

    private final Map<String, BuiltinFunction> functions = new HashMap<>(32);

    /**
     * Registers (or replaces) a builtin.
     *
     * @param name     full builtin name, including its namespace prefix (e.g. {@code math_max})
     * @param function implementation
     * @return this registry, for chaining
     */
    public BuiltinRegistry register(String name, BuiltinFunction function) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Builtin name must not be empty");
        }
        if (function == null) {
            throw new IllegalArgumentException("Builtin '" + name + "' has no implementation");
        }
        functions.put(name, function);
        return this;
    }

    public boolean unregister(String name) {
        return functions.remove(name) != null;
    }

    public BuiltinFunction lookup(String name) {
        return name == null ? null : functions.get(name);
    }

    public boolean contains(String name) {
        return lookup(name) != null;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(functions.keySet());
    }

    /**
     * Calls a builtin by name.
     *
     * @return the function's result, or {@link Value#NULL} when the name is not
     *         registered or the function returned {@code null}
     */
    public Value call(String name, Value[] args) {
        BuiltinFunction function = lookup(name);
        if (function == null) {
            return Value.NULL;
        }
        Value result = function.call(args);
        return result == null ? Value.NULL : result;
    }
}
