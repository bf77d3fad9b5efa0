package com.scalebee.core.exception;

/** The primary (CPU) aggregation could not be obtained; the evaluation cycle cannot proceed. */
public class AggregationQueryException extends RuntimeException {

    private final String expression;

    public AggregationQueryException(String expression, String message, Throwable cause) {
        super(message, cause);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
