package com.example.callbackscheduler.exception;

import lombok.Getter;

/**
 * Exception for store operations that failed
 */
@Getter
public class TaskStoreException extends RuntimeException {

    private final String operation;

    public TaskStoreException(String operation, Throwable cause) {
        super(String.format("Store operation %s failed: %s", operation, cause.getMessage()), cause);
        this.operation = operation;
    }
}
