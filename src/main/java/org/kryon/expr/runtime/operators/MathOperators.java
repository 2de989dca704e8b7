package org.kryon.expr.runtime.operators;

import org.kryon.expr.runtime.runtimetypes.Value;
import org.kryon.expr.runtime.runtimetypes.ValueType;

/**
 * Arithmetic operators over {@link Value}s.
 * <p>
 * Shared by the VM and the constant folder, so folded and evaluated results
 * always agree. Operand type rules:
 * <ul>
 *   <li>int op int gives an int; any float operand promotes both sides to float</li>
 *   <li>{@code +} with a string on either side concatenates the stringified operands</li>
 *   <li>division or modulus by zero gives null</li>
 *   <li>any other combination gives null</li>
 * </ul>
 */
public class MathOperators {

    private MathOperators() {
    }

    private static boolean bothInt(Value a, Value b) {
        return a.type == ValueType.INT && b.type == ValueType.INT;
    }

    private static boolean bothNumeric(Value a, Value b) {
        return ValueType.isNumeric(a.type) && ValueType.isNumeric(b.type);
    }

    /**
     * Adds two values, or concatenates them when either is a string.
     *
     * @param arg1 left operand
     * @param arg2 right operand
     * @return the sum, the concatenation, or null on a type mismatch
     */
    public static Value add(Value arg1, Value arg2) {
        if (arg1.type == ValueType.STRING || arg2.type == ValueType.STRING) {
            return StringOperators.concat(arg1, arg2);
        }
        if (bothInt(arg1, arg2)) {
            return Value.ofInt((long) arg1.value + (long) arg2.value);
        }
        if (bothNumeric(arg1, arg2)) {
            return Value.ofFloat(arg1.getDouble() + arg2.getDouble());
        }
        return Value.NULL;
    }

    public static Value subtract(Value arg1, Value arg2) {
        if (bothInt(arg1, arg2)) {
            return Value.ofInt((long) arg1.value - (long) arg2.value);
        }
        if (bothNumeric(arg1, arg2)) {
            return Value.ofFloat(arg1.getDouble() - arg2.getDouble());
        }
        return Value.NULL;
    }

    public static Value multiply(Value arg1, Value arg2) {
        if (bothInt(arg1, arg2)) {
            return Value.ofInt((long) arg1.value * (long) arg2.value);
        }
        if (bothNumeric(arg1, arg2)) {
            return Value.ofFloat(arg1.getDouble() * arg2.getDouble());
        }
        return Value.NULL;
    }

    /**
     * Integer division truncates toward zero. Dividing by zero (int or float)
     * gives null instead of trapping or producing an infinity.
     */
    public static Value divide(Value arg1, Value arg2) {
        if (bothInt(arg1, arg2)) {
            long divisor = (long) arg2.value;
            if (divisor == 0) {
                return Value.NULL;
            }
            return Value.ofInt((long) arg1.value / divisor);
        }
        if (bothNumeric(arg1, arg2)) {
            double divisor = arg2.getDouble();
            if (divisor == 0.0) {
                return Value.NULL;
            }
            return Value.ofFloat(arg1.getDouble() / divisor);
        }
        return Value.NULL;
    }

    /**
     * Remainder with the sign of the dividend (C {@code %} / {@code fmod}).
     */
    public static Value modulus(Value arg1, Value arg2) {
        if (bothInt(arg1, arg2)) {
            long divisor = (long) arg2.value;
            if (divisor == 0) {
                return Value.NULL;
            }
            return Value.ofInt((long) arg1.value % divisor);
        }
        if (bothNumeric(arg1, arg2)) {
            double divisor = arg2.getDouble();
            if (divisor == 0.0) {
                return Value.NULL;
            }
            return Value.ofFloat(arg1.getDouble() % divisor);
        }
        return Value.NULL;
    }

    public static Value negate(Value arg) {
        switch (arg.type) {
            case ValueType.INT:
                return Value.ofInt(-(long) arg.value);
            case ValueType.FLOAT:
                return Value.ofFloat(-(double) arg.value);
            default:
                return Value.NULL;
        }
    }
}
