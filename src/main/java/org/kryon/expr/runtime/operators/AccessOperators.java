package org.kryon.expr.runtime.operators;

import org.kryon.expr.runtime.runtimetypes.Value;
import org.kryon.expr.runtime.runtimetypes.ValueArray;
import org.kryon.expr.runtime.runtimetypes.ValueObject;
import org.kryon.expr.runtime.runtimetypes.ValueType;

/**
 * Property, computed-member and index access, polymorphic on the receiver type.
 * <p>
 * Every miss gives null: a missing key, an out-of-range index, a null receiver
 * or a receiver that has no members at all. Results are copies, so the
 * receiver keeps sole ownership of its contents.
 */
public class AccessOperators {

    public static final String LENGTH = "length";

    private AccessOperators() {
    }

    /**
     * Static property access: {@code receiver.name}.
     */
    public static Value getProperty(Value receiver, String name) {
        if (name == null) {
            return Value.NULL;
        }
        switch (receiver.type) {
            case ValueType.OBJECT: {
                ValueObject obj = receiver.getObject();
                return obj == null ? Value.NULL : obj.get(name);
            }
            case ValueType.ARRAY:
                if (LENGTH.equals(name)) {
                    ValueArray arr = receiver.getArray();
                    return Value.ofInt(arr == null ? 0 : arr.size());
                }
                return Value.NULL;
            case ValueType.STRING:
                if (LENGTH.equals(name)) {
                    return Value.ofInt(StringOperators.length(receiver.getString()));
                }
                return Value.NULL;
            default:
                return Value.NULL;
        }
    }

    /**
     * Computed access: {@code receiver[key]}.
     * <ul>
     *   <li>array with int key: bounds-checked element</li>
     *   <li>string with int key: one-character string</li>
     *   <li>object with string key: key lookup</li>
     *   <li>array or string with the string key {@code "length"}: element/character count</li>
     * </ul>
     */
    public static Value getIndexed(Value receiver, Value key) {
        if (receiver.isNull() || key.isNull()) {
            return Value.NULL;
        }
        if (key.type == ValueType.INT) {
            long index = (long) key.value;
            switch (receiver.type) {
                case ValueType.ARRAY: {
                    ValueArray arr = receiver.getArray();
                    return arr == null ? Value.NULL : arr.get(index);
                }
                case ValueType.STRING:
                    return StringOperators.charAt(receiver.getString(), index);
                default:
                    return Value.NULL;
            }
        }
        if (key.type == ValueType.STRING && key.value != null) {
            return getProperty(receiver, key.getString());
        }
        return Value.NULL;
    }
}
