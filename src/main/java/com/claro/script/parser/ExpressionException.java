package com.claro.script.parser;

/**
 * Failure while tokenizing, parsing or evaluating an expression.
 * Carries the expression text but no line number; statement code adds that.
 */
public class ExpressionException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String expression;

    public ExpressionException(String expression, String message) {
        super(message);
        this.expression = expression;
    }

    public ExpressionException(String expression, String message, Throwable cause) {
        super(message, cause);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
