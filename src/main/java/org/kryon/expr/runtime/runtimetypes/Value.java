package org.kryon.expr.runtime.runtimetypes;

/**
 * The dynamically typed value produced and consumed by the expression VM.
 *
 * <p>A Value is a type tag plus one payload. Scalars (null, int, float, bool,
 * string) are immutable and may be shared freely. Array and object payloads
 * are mutable containers owned exclusively by the Value holding them:
 * <ul>
 *   <li>{@link #copy()} is always deep, so two Values never alias one container</li>
 *   <li>reads out of a container ({@link ValueArray#get}, {@link ValueObject#get})
 *       hand back copies</li>
 *   <li>writes into a container move the Value in, without duplicating it</li>
 * </ul>
 *
 * <p>A string, array or object Value may be "absent" (null payload). Absent
 * payloads are falsy and stringify as empty, mirroring the host bindings that
 * hand the VM values without backing data.
 */
public final class Value {

    public static final Value NULL = new Value(ValueType.NULL, null);
    public static final Value TRUE = new Value(ValueType.BOOL, Boolean.TRUE);
    public static final Value FALSE = new Value(ValueType.BOOL, Boolean.FALSE);
    public static final Value EMPTY_STRING = new Value(ValueType.STRING, "");

    // Fields to store the type and payload of the value
    public final int type;
    public final Object value;

    private Value(int type, Object value) {
        this.type = type;
        this.value = value;
    }

    // Constructors per kind

    public static Value ofInt(long value) {
        return new Value(ValueType.INT, value);
    }

    public static Value ofFloat(double value) {
        return new Value(ValueType.FLOAT, value);
    }

    public static Value ofBool(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * Creates a string value. A null argument yields an absent string.
     */
    public static Value ofString(String value) {
        return new Value(ValueType.STRING, value);
    }

    /**
     * Wraps an array, taking ownership of it. A null argument yields an absent array.
     */
    public static Value ofArray(ValueArray array) {
        return new Value(ValueType.ARRAY, array);
    }

    /**
     * Wraps an object, taking ownership of it. A null argument yields an absent object.
     */
    public static Value ofObject(ValueObject object) {
        return new Value(ValueType.OBJECT, object);
    }

    public static Value emptyArray() {
        return ofArray(new ValueArray());
    }

    public static Value emptyObject() {
        return ofObject(new ValueObject());
    }

    // Getters

    public long getLong() {
        switch (type) {
            case ValueType.INT:
                return (long) value;
            case ValueType.FLOAT:
                return (long) (double) value;
            case ValueType.BOOL:
                return (boolean) value ? 1 : 0;
            default:
                return 0;
        }
    }

    public double getDouble() {
        switch (type) {
            case ValueType.INT:
                return (double) (long) value;
            case ValueType.FLOAT:
                return (double) value;
            case ValueType.BOOL:
                return (boolean) value ? 1.0 : 0.0;
            default:
                return 0.0;
        }
    }

    /**
     * Returns the string payload, or null for non-strings and absent strings.
     */
    public String getString() {
        return type == ValueType.STRING ? (String) value : null;
    }

    /**
     * Returns the array payload, or null for non-arrays and absent arrays.
     */
    public ValueArray getArray() {
        return type == ValueType.ARRAY ? (ValueArray) value : null;
    }

    /**
     * Returns the object payload, or null for non-objects and absent objects.
     */
    public ValueObject getObject() {
        return type == ValueType.OBJECT ? (ValueObject) value : null;
    }

    public boolean isNull() {
        return type == ValueType.NULL;
    }

    public String typeName() {
        return ValueType.name(type);
    }

    /**
     * Deep copy. Scalars are immutable and returned as-is; containers are
     * duplicated recursively.
     */
    public Value copy() {
        switch (type) {
            case ValueType.ARRAY:
                return value == null ? this : ofArray(((ValueArray) value).copy());
            case ValueType.OBJECT:
                return value == null ? this : ofObject(((ValueObject) value).copy());
            default:
                return this;
        }
    }

    /**
     * Truthiness used by conditional jumps and the logical operators.
     */
    public boolean getBoolean() {
        switch (type) {
            case ValueType.NULL:
                return false;
            case ValueType.INT:
                return (long) value != 0;
            case ValueType.FLOAT:
                return (double) value != 0.0;
            case ValueType.BOOL:
                return (boolean) value;
            case ValueType.STRING:
                return value != null && !((String) value).isEmpty();
            case ValueType.ARRAY:
                return value != null && ((ValueArray) value).size() > 0;
            case ValueType.OBJECT:
                return value != null && ((ValueObject) value).size() > 0;
            default:
                return false;
        }
    }

    /**
     * Stringification used by string coercion and diagnostics.
     */
    @Override
    public String toString() {
        switch (type) {
            case ValueType.NULL:
                return "null";
            case ValueType.INT:
                return Long.toString((long) value);
            case ValueType.FLOAT:
                return formatDouble((double) value);
            case ValueType.BOOL:
                return (boolean) value ? "true" : "false";
            case ValueType.STRING:
                return value == null ? "" : (String) value;
            case ValueType.ARRAY:
                return "[array with " + (value == null ? 0 : ((ValueArray) value).size()) + " items]";
            case ValueType.OBJECT:
                return "[object with " + (value == null ? 0 : ((ValueObject) value).size()) + " entries]";
            default:
                return "unknown";
        }
    }

    /**
     * Shortest round-trip decimal text, without a trailing ".0".
     */
    public static String formatDouble(double d) {
        String s = Double.toString(d);
        if (s.endsWith(".0")) {
            return s.substring(0, s.length() - 2);
        }
        return s;
    }

    /**
     * Structural equality: same tag and equal payloads, recursively for
     * containers. An int never equals a float.
     */
    @Override
    public boolean equals(Object o) {
        // No identity shortcut for floats: a NaN Value is unequal even to itself
        if (this == o && type != ValueType.FLOAT) {
            return true;
        }
        if (!(o instanceof Value)) {
            return false;
        }
        Value other = (Value) o;
        if (type != other.type) {
            return false;
        }
        switch (type) {
            case ValueType.NULL:
                return true;
            case ValueType.INT:
                return (long) value == (long) other.value;
            case ValueType.FLOAT:
                // IEEE comparison, so NaN is never equal to itself
                return (double) value == (double) other.value;
            case ValueType.BOOL:
                return (boolean) value == (boolean) other.value;
            default:
                if (value == null || other.value == null) {
                    return value == other.value;
                }
                return value.equals(other.value);
        }
    }

    @Override
    public int hashCode() {
        if (type == ValueType.FLOAT) {
            double d = (double) value;
            // 0.0 and -0.0 compare equal
            return d == 0.0 ? type : 31 * type + Double.hashCode(d);
        }
        return 31 * type + (value == null ? 0 : value.hashCode());
    }
}
