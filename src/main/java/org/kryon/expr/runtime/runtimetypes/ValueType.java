package org.kryon.expr.runtime.runtimetypes;

/**
 * Type tags for {@link Value}.
 * <p>
 * Kept as int constants so the operator tables can switch on them directly.
 */
public class ValueType {

    public static final int NULL = 0;
    public static final int INT = 1;
    public static final int FLOAT = 2;
    public static final int BOOL = 3;
    public static final int STRING = 4;
    public static final int ARRAY = 5;
    public static final int OBJECT = 6;

    private ValueType() {
    } // Prevent instantiation

    /**
     * Returns the user-visible name of a type tag, as reported by {@code typeof}.
     */
    public static String name(int type) {
        switch (type) {
            case NULL:
                return "null";
            case INT:
                return "int";
            case FLOAT:
                return "float";
            case BOOL:
                return "bool";
            case STRING:
                return "string";
            case ARRAY:
                return "array";
            case OBJECT:
                return "object";
            default:
                return "unknown";
        }
    }

    public static boolean isNumeric(int type) {
        return type == INT || type == FLOAT;
    }
}
