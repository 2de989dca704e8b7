package org.kryon.expr.astnode;

/**
 * Binary operators understood by the compiler.
 * <p>
 * {@link #symbol} is the source spelling, used by the printer; {@link #jsonName}
 * is the {@code "op"} tag of the serialized tree.
 */
public enum BinaryOperator {
    ADD("+", "add"),
    SUB("-", "sub"),
    MUL("*", "mul"),
    DIV("/", "div"),
    MOD("%", "mod"),
    EQ("==", "eq"),
    NEQ("!=", "neq"),
    LT("<", "lt"),
    LTE("<=", "lte"),
    GT(">", "gt"),
    GTE(">=", "gte"),
    AND("&&", "and"),
    OR("||", "or"),
    CONCAT("++", "concat");

    public final String symbol;
    public final String jsonName;

    BinaryOperator(String symbol, String jsonName) {
        this.symbol = symbol;
        this.jsonName = jsonName;
    }

    /**
     * @return the operator with the given serialized name, or {@code null}
     */
    public static BinaryOperator fromJsonName(String name) {
        for (BinaryOperator op : values()) {
            if (op.jsonName.equals(name)) {
                return op;
            }
        }
        return null;
    }
}
