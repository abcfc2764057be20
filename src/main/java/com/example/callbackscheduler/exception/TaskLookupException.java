package com.example.callbackscheduler.exception;

/**
 * Exception for read paths that could not reach the store.
 * The message never carries storage details.
 */
public class TaskLookupException extends RuntimeException {

    public static final String MESSAGE = "failed to retrieve status";

    public TaskLookupException(Throwable cause) {
        super(MESSAGE, cause);
    }
}
