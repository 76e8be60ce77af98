package com.costguard.exception;

public class InvalidBudgetConfigException extends RuntimeException {
    public InvalidBudgetConfigException(String message) {
        super(message);
    }
}
