package com.example.callbackscheduler.domain.enums;

import org.springframework.http.HttpMethod;

import java.util.Optional;

/**
 * HTTP methods accepted for callbacks.
 */
public enum CallbackMethod {
    GET,
    POST,
    PUT,
    DELETE;

    public static Optional<CallbackMethod> fromName(String name) {
        for (var method : values()) {
            if (method.name().equals(name)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }

    public HttpMethod toHttpMethod() {
        return HttpMethod.valueOf(name());
    }
}
