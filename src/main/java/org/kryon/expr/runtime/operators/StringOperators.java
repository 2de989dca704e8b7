package org.kryon.expr.runtime.operators;

import com.ibm.icu.lang.UCharacter;
import org.kryon.expr.runtime.runtimetypes.Value;
import org.kryon.expr.runtime.runtimetypes.ValueType;

/**
 * String operations backing {@code +}/concatenation, string indexing and the
 * string methods.
 * <p>
 * Lengths and indexes count Unicode code points, so a character outside the
 * BMP is one position, never half of a surrogate pair.
 */
public class StringOperators {

    private StringOperators() {
    }

    /**
     * Concatenates the stringified forms of both operands.
     */
    public static Value concat(Value arg1, Value arg2) {
        return Value.ofString(arg1.toString().concat(arg2.toString()));
    }

    /**
     * Number of code points in a string.
     */
    public static int length(String str) {
        return str == null ? 0 : str.codePointCount(0, str.length());
    }

    /**
     * The one-character string at code point {@code index}, or null when out of range.
     *
     * @param str   the string being indexed (absent strings have no characters)
     * @param index zero-based code point index
     * @return a string Value, or {@link Value#NULL}
     */
    public static Value charAt(String str, long index) {
        if (str == null || index < 0 || index >= length(str)) {
            return Value.NULL;
        }
        int start = str.offsetByCodePoints(0, (int) index);
        int end = str.offsetByCodePoints(start, 1);
        return Value.ofString(str.substring(start, end));
    }

    /**
     * Converts to uppercase using ICU4J for full Unicode case mapping.
     */
    public static Value toUpperCase(String str) {
        return Value.ofString(UCharacter.toUpperCase(str));
    }

    /**
     * Converts to lowercase using ICU4J for full Unicode case mapping.
     */
    public static Value toLowerCase(String str) {
        return Value.ofString(UCharacter.toLowerCase(str));
    }

    /**
     * Strips leading and trailing spaces, tabs, carriage returns and newlines.
     * Other whitespace is kept.
     */
    public static Value trim(String str) {
        int start = 0;
        int end = str.length();
        while (start < end && isTrimmable(str.charAt(start))) {
            start++;
        }
        while (end > start && isTrimmable(str.charAt(end - 1))) {
            end--;
        }
        return Value.ofString(str.substring(start, end));
    }

    private static boolean isTrimmable(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }

    /**
     * {@code substring(start[, end])} in code points. Non-integer bounds fall
     * back to the defaults (0 and the length); bounds are clamped to the
     * string and an end before start gives an empty string.
     */
    public static Value substring(String str, Value startArg, Value endArg) {
        int len = length(str);
        long start = startArg != null && startArg.type == ValueType.INT ? (long) startArg.value : 0;
        long end = endArg != null && endArg.type == ValueType.INT ? (long) endArg.value : len;

        start = Math.max(0, Math.min(start, len));
        end = Math.max(0, Math.min(end, len));
        if (end < start) {
            end = start;
        }

        int from = str.offsetByCodePoints(0, (int) start);
        int to = str.offsetByCodePoints(from, (int) (end - start));
        return Value.ofString(str.substring(from, to));
    }
}
