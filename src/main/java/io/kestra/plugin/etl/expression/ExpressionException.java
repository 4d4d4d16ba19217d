package io.kestra.plugin.etl.expression;

public class ExpressionException extends Exception {
    public ExpressionException(String message) {
        super(message);
    }

    public ExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
