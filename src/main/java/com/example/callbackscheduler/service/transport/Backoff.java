package com.example.callbackscheduler.service.transport;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Jittered exponential backoff between callback attempts.
 */
public final class Backoff {

    static final long BASE_MILLIS = 100;
    static final int MAX_EXPONENT = 30;

    private Backoff() {
    }

    /**
     * Wait before the retry following attempt {@code attempt} (0-based):
     * uniform in [base/2, base) with base = 100ms * 2^attempt.
     */
    public static long delayMillis(int attempt) {
        var exponent = Math.min(Math.max(attempt, 0), MAX_EXPONENT);
        var base = BASE_MILLIS << exponent;
        return ThreadLocalRandom.current().nextLong(base / 2, base);
    }
}
