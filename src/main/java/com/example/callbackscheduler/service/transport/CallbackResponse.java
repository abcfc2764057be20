package com.example.callbackscheduler.service.transport;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Status and body of a delivered callback.
 * <p>
 * A status of 0 means no HTTP response was obtained; the body then holds the
 * transport error message.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CallbackResponse {

    public static final int NO_STATUS = 0;

    int status;
    String body;
    boolean transportError;

    public static CallbackResponse of(int status, String body) {
        return new CallbackResponse(status, body, false);
    }

    public static CallbackResponse transportError(String message) {
        return new CallbackResponse(NO_STATUS, message, true);
    }

    public boolean isClientError() {
        return status >= 400 && status < 500;
    }

    public boolean isServerError() {
        return status >= 500 && status < 600;
    }
}
