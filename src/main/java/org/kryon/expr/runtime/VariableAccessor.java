package org.kryon.expr.runtime;

import org.kryon.expr.runtime.runtimetypes.Value;
import org.kryon.expr.runtime.runtimetypes.ValueObject;

import java.util.Map;

/**
 * Host-side variable resolution, consulted after the evaluation's local scope.
 * <p>
 * The VM only defines the lookup protocol. Where the state lives (global
 * store, per-component instance state) is the host's business; the host
 * binds an accessor to the component instance being rendered.
 */
@FunctionalInterface
public interface VariableAccessor {

    /** Resolves nothing. */
    VariableAccessor EMPTY = name -> null;

    /**
     * Looks up a variable.
     *
     * @param name variable name as written in the expression
     * @return the current value, or {@code null} if the name is not defined.
     *         The VM copies the result before use, so the accessor may hand
     *         out the value it stores.
     */
    Value getVariable(String name);

    /**
     * Accessor backed by a map of names to values.
     */
    static VariableAccessor of(Map<String, Value> variables) {
        return variables::get;
    }

    /**
     * Accessor backed by the keys of an object.
     */
    static VariableAccessor of(ValueObject state) {
        return name -> state.has(name) ? state.get(name) : null;
    }
}
