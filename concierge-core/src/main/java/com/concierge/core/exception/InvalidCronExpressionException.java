package com.concierge.core.exception;

/**
 * Thrown when a schedule carries a cron expression that cannot be parsed.
 */
public class InvalidCronExpressionException extends ConciergeException {

    public static final String ERROR_CODE = "INVALID_CRON_EXPRESSION";

    private final String expression;

    public InvalidCronExpressionException(String expression, String reason) {
        super(ERROR_CODE, String.format(
            "Invalid cron expression '%s': %s",
            expression, reason
        ));
        this.expression = expression;
    }

    public InvalidCronExpressionException(String expression, String reason, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Invalid cron expression '%s': %s",
            expression, reason
        ), cause);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
