package org.kryon.expr.runtime.operators;

import org.kryon.expr.runtime.runtimetypes.Value;

/**
 * Boolean operators on truthiness, plus {@code typeof}.
 * <p>
 * {@code &&} and {@code ||} receive both operands already evaluated and
 * always produce a bool, never one of the operands.
 */
public class LogicalOperators {

    private LogicalOperators() {
    }

    public static Value and(Value arg1, Value arg2) {
        return Value.ofBool(arg1.getBoolean() && arg2.getBoolean());
    }

    public static Value or(Value arg1, Value arg2) {
        return Value.ofBool(arg1.getBoolean() || arg2.getBoolean());
    }

    public static Value not(Value arg) {
        return Value.ofBool(!arg.getBoolean());
    }

    public static Value typeOf(Value arg) {
        return Value.ofString(arg.typeName());
    }
}
