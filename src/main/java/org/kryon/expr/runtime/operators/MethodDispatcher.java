package org.kryon.expr.runtime.operators;

import org.kryon.expr.runtime.runtimetypes.Value;
import org.kryon.expr.runtime.runtimetypes.ValueArray;
import org.kryon.expr.runtime.runtimetypes.ValueType;

/**
 * Method calls dispatched on the receiver's runtime type.
 *
 * <p>Array methods: {@code push(v)}, {@code pop()}, {@code length()},
 * {@code reverse()}. String methods: {@code length()}, {@code toUpperCase()},
 * {@code toLowerCase()}, {@code trim()}, {@code substring(start[, end])}.
 * An unknown method, too few arguments or any other receiver type gives null.
 *
 * <p>The receiver and arguments are owned by the call: array methods mutate
 * the receiver's own array, and {@code push} moves its argument in.
 */
public class MethodDispatcher {

    private MethodDispatcher() {
    }

    /**
     * Invokes {@code receiver.method(args...)}.
     *
     * @param receiver the popped receiver value
     * @param method   method name from the string pool
     * @param args     arguments in source order
     * @return the method result, or {@link Value#NULL}
     */
    public static Value callMethod(Value receiver, String method, Value[] args) {
        if (method == null) {
            return Value.NULL;
        }
        switch (receiver.type) {
            case ValueType.ARRAY:
                return callArrayMethod(receiver, method, args);
            case ValueType.STRING:
                return callStringMethod(receiver, method, args);
            default:
                // null, scalars and objects have no methods
                return Value.NULL;
        }
    }

    private static Value callArrayMethod(Value receiver, String method, Value[] args) {
        ValueArray arr = receiver.getArray();
        if (arr == null) {
            return Value.NULL;
        }
        switch (method) {
            case "push":
                if (args.length < 1) {
                    return Value.NULL;
                }
                arr.push(args[0]);
                return Value.ofInt(arr.size());
            case "pop":
                return arr.pop();
            case "length":
                return Value.ofInt(arr.size());
            case "reverse":
                arr.reverse();
                return receiver;
            default:
                return Value.NULL;
        }
    }

    private static Value callStringMethod(Value receiver, String method, Value[] args) {
        String str = receiver.getString();
        if (str == null) {
            return Value.NULL;
        }
        switch (method) {
            case "length":
                return Value.ofInt(StringOperators.length(str));
            case "toUpperCase":
                return StringOperators.toUpperCase(str);
            case "toLowerCase":
                return StringOperators.toLowerCase(str);
            case "trim":
                return StringOperators.trim(str);
            case "substring":
                if (args.length < 1) {
                    return Value.NULL;
                }
                return StringOperators.substring(str, args[0], args.length >= 2 ? args[1] : null);
            default:
                return Value.NULL;
        }
    }
}
