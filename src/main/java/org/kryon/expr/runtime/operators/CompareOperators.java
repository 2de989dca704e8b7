package org.kryon.expr.runtime.operators;

import org.kryon.expr.runtime.runtimetypes.Value;
import org.kryon.expr.runtime.runtimetypes.ValueType;

/**
 * Equality and ordering operators.
 * <p>
 * {@code ==} and {@code !=} use structural equality and always give a bool.
 * Ordering compares two numbers (int/float promoted) or two strings
 * (lexicographically by UTF-16 code unit); any other pairing gives null.
 */
public class CompareOperators {

    private CompareOperators() {
    }

    public static Value equalTo(Value arg1, Value arg2) {
        return Value.ofBool(arg1.equals(arg2));
    }

    public static Value notEqualTo(Value arg1, Value arg2) {
        return Value.ofBool(!arg1.equals(arg2));
    }

    public static Value lessThan(Value arg1, Value arg2) {
        Integer cmp = compare(arg1, arg2);
        return cmp == null ? Value.NULL : Value.ofBool(cmp < 0);
    }

    public static Value lessThanOrEqual(Value arg1, Value arg2) {
        Integer cmp = compare(arg1, arg2);
        return cmp == null ? Value.NULL : Value.ofBool(cmp <= 0);
    }

    public static Value greaterThan(Value arg1, Value arg2) {
        Integer cmp = compare(arg1, arg2);
        return cmp == null ? Value.NULL : Value.ofBool(cmp > 0);
    }

    public static Value greaterThanOrEqual(Value arg1, Value arg2) {
        Integer cmp = compare(arg1, arg2);
        return cmp == null ? Value.NULL : Value.ofBool(cmp >= 0);
    }

    /**
     * Three-way comparison, or null when the operands are not ordered
     * against each other. NaN is unordered against everything.
     */
    private static Integer compare(Value arg1, Value arg2) {
        if (arg1.type == ValueType.INT && arg2.type == ValueType.INT) {
            return Long.compare((long) arg1.value, (long) arg2.value);
        }
        if (ValueType.isNumeric(arg1.type) && ValueType.isNumeric(arg2.type)) {
            double a = arg1.getDouble();
            double b = arg2.getDouble();
            if (Double.isNaN(a) || Double.isNaN(b)) {
                return null;
            }
            return a < b ? -1 : (a > b ? 1 : 0);
        }
        if (arg1.type == ValueType.STRING && arg2.type == ValueType.STRING) {
            return arg1.toString().compareTo(arg2.toString());
        }
        return null;
    }
}
