package com.example.callbackscheduler.exception;

/**
 * Reasons a task or a task reference is rejected before it reaches the store.
 */
public enum ValidationError {
    INVALID_TIME_SPEC,
    INCOMPLETE_TASK,
    UNSUPPORTED_METHOD,
    INVALID_TAG,
    INVALID_CALLBACK_URL,
    NEGATIVE_FIELD,
    INVALID_IDENTIFIER
}
