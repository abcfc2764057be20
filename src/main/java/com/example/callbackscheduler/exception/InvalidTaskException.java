package com.example.callbackscheduler.exception;

import lombok.Getter;

/**
 * Exception for input that fails task validation or normalization
 */
@Getter
public class InvalidTaskException extends RuntimeException {

    private final ValidationError error;

    public InvalidTaskException(ValidationError error, String message) {
        super(message);
        this.error = error;
    }
}
