package org.kryon.expr.json;

/**
 * Thrown when a JSON document does not describe a valid expression tree.
 */
public class ExpressionJsonException extends RuntimeException {

    public ExpressionJsonException(String message) {
        super(message);
    }

    public ExpressionJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
