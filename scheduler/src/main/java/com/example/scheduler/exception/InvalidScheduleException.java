package com.example.scheduler.exception;

public class InvalidScheduleException extends RuntimeException {
    private final String expression;

    public InvalidScheduleException(String expression, String reason) {
        super("Invalid schedule expression '" + expression + "': " + reason);
        this.expression = expression;
    }

    public InvalidScheduleException(String expression, Throwable cause) {
        super("Invalid schedule expression '" + expression + "': " + cause.getMessage(), cause);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
