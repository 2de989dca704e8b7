package org.kryon.expr.backend.bytecode;

import org.kryon.expr.core.Configuration;
import org.kryon.expr.runtime.BuiltinRegistry;
import org.kryon.expr.runtime.VariableAccessor;
import org.kryon.expr.runtime.runtimetypes.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * State of one evaluation: operand stack, local bindings, the host's
 * variable accessor and builtin registry, and a sticky error flag.
 * <p>
 * A context is meant for a single evaluation. Errors never throw: they are
 * recorded here and the interpreter carries on, yielding null for the
 * offending operation.
 */
public class EvalContext {
    private Value[] stack;
    private int sp;
    private final int maxStackSize;

    // Local scope: parallel lists, looked up linearly
    private final List<String> localNames = new ArrayList<>();
    private final List<Value> localValues = new ArrayList<>();

    private final VariableAccessor accessor;
    private final BuiltinRegistry builtins;

    private boolean hasError;
    private String errorMessage;

    /**
     * @param accessor         external variable lookup; may be null
     * @param builtins         builtin table; may be null, in which case every builtin call yields null
     * @param initialStackSize initial operand stack capacity
     * @param maxStackSize     capacity beyond which pushes overflow
     */
    public EvalContext(VariableAccessor accessor, BuiltinRegistry builtins, int initialStackSize, int maxStackSize) {
        if (initialStackSize <= 0 || maxStackSize <= 0) {
            throw new IllegalArgumentException("Stack sizes must be positive");
        }
        this.stack = new Value[Math.min(initialStackSize, maxStackSize)];
        this.maxStackSize = maxStackSize;
        this.accessor = accessor;
        this.builtins = builtins;
    }

    public EvalContext(VariableAccessor accessor, BuiltinRegistry builtins) {
        this(accessor, builtins, Configuration.defaultInitialStackSize, Configuration.defaultMaxStackSize);
    }

    public EvalContext(VariableAccessor accessor) {
        this(accessor, null);
    }

    /**
     * Binds a local variable, shadowing the accessor. Rebinding a name replaces
     * its value.
     *
     * @throws IllegalArgumentException if {@code name} is null
     */
    public EvalContext defineLocal(String name, Value value) {
        if (name == null) {
            throw new IllegalArgumentException("Local variable name must not be null");
        }
        Value v = value == null ? Value.NULL : value;
        for (int i = 0; i < localNames.size(); i++) {
            if (localNames.get(i).equals(name)) {
                localValues.set(i, v);
                return this;
            }
        }
        localNames.add(name);
        localValues.add(v);
        return this;
    }

    /**
     * Resolves a variable: locals first, then the accessor.
     *
     * @return a copy of the value, or {@link Value#NULL} if it is not defined
     */
    public Value lookupVariable(String name) {
        for (int i = 0; i < localNames.size(); i++) {
            if (localNames.get(i).equals(name)) {
                return localValues.get(i).copy();
            }
        }
        if (accessor != null) {
            Value v;
            try {
                v = accessor.getVariable(name);
            } catch (RuntimeException e) {
                setError("Variable '" + name + "' failed: " + e);
                return Value.NULL;
            }
            if (v != null) {
                return v.copy();
            }
        }
        return Value.NULL;
    }

    public BuiltinRegistry getBuiltins() {
        return builtins;
    }

    // =================================================================
    // OPERAND STACK
    // =================================================================

    /**
     * Grows the stack up front, bounded by the maximum size.
     */
    void reserve(int capacity) {
        int target = Math.min(capacity, maxStackSize);
        if (target > stack.length) {
            Value[] grown = new Value[target];
            System.arraycopy(stack, 0, grown, 0, sp);
            stack = grown;
        }
    }

    void push(Value value) {
        if (sp == stack.length) {
            if (stack.length >= maxStackSize) {
                setError("Stack overflow: more than " + maxStackSize + " values");
                return;
            }
            reserve(Math.max(stack.length * 2, 1));
        }
        stack[sp++] = value;
    }

    Value pop() {
        if (sp == 0) {
            setError("Stack underflow");
            return Value.NULL;
        }
        Value v = stack[--sp];
        stack[sp] = null;
        return v;
    }

    Value peek() {
        if (sp == 0) {
            setError("Stack underflow");
            return Value.NULL;
        }
        return stack[sp - 1];
    }

    public int stackSize() {
        return sp;
    }

    // =================================================================
    // ERRORS
    // =================================================================

    /**
     * Records an error. The flag is sticky; the first message is kept.
     */
    public void setError(String message) {
        if (Configuration.traceEnabled) {
            System.err.println("kryon-expr: " + message);
        }
        if (!hasError) {
            hasError = true;
            errorMessage = message;
        }
    }

    public boolean hasError() {
        return hasError;
    }

    public String getErrorMessage() {
        return errorMessage;
    }
}
