package org.kryon.expr.astnode;

public enum UnaryOperator {
    NEG("-", "neg"),
    NOT("!", "not"),
    TYPEOF("typeof ", "typeof");

    public final String symbol;
    public final String jsonName;

    UnaryOperator(String symbol, String jsonName) {
        this.symbol = symbol;
        this.jsonName = jsonName;
    }

    public static UnaryOperator fromJsonName(String name) {
        for (UnaryOperator op : values()) {
            if (op.jsonName.equals(name)) {
                return op;
            }
        }
        return null;
    }
}
