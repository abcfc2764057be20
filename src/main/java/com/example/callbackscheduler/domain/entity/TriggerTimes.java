package com.example.callbackscheduler.domain.entity;

import com.example.callbackscheduler.exception.InvalidTaskException;
import com.example.callbackscheduler.exception.ValidationError;

import java.time.Clock;
import java.util.regex.Pattern;

/**
 * Minute arithmetic and trigger time specifications.
 * <p>
 * A specification is either an absolute Unix timestamp on a minute boundary
 * or a relative offset {@code +<N>m}, {@code +<N>h}, {@code +<N>d} counted
 * from the current minute.
 */
public final class TriggerTimes {

    public static final long MINUTE = 60L;
    public static final long HOUR = 3600L;
    public static final long DAY = 86400L;

    private static final Pattern RELATIVE_SPEC = Pattern.compile("^\\+(\\d+)([mhd])$");

    private TriggerTimes() {
    }

    /**
     * Current Unix time floored to the minute.
     */
    public static long currentMinute(Clock clock) {
        var now = clock.instant().getEpochSecond();
        return now - now % MINUTE;
    }

    /**
     * Resolve a specification into an absolute, minute-aligned, future timestamp.
     *
     * @throws InvalidTaskException with {@link ValidationError#INVALID_TIME_SPEC}
     */
    public static long normalize(String spec, Clock clock) {
        // neither form can be shorter than "+1m"
        if (spec == null || spec.length() < 3) {
            throw invalid("invalid time specification: " + spec);
        }

        var now = currentMinute(clock);

        if (spec.startsWith("+")) {
            var matcher = RELATIVE_SPEC.matcher(spec);
            if (!matcher.matches()) {
                throw invalid("relative time specification does not match " + RELATIVE_SPEC.pattern());
            }
            try {
                var amount = Long.parseLong(matcher.group(1));
                var unit = switch (matcher.group(2)) {
                    case "m" -> MINUTE;
                    case "h" -> HOUR;
                    default -> DAY;
                };
                return Math.addExact(now, Math.multiplyExact(amount, unit));
            } catch (NumberFormatException | ArithmeticException e) {
                throw invalid("relative time specification out of range: " + spec);
            }
        }

        long timestamp;
        try {
            timestamp = Long.parseLong(spec);
        } catch (NumberFormatException e) {
            throw invalid("invalid Unix timestamp: " + spec);
        }
        if (timestamp % MINUTE != 0) {
            throw invalid("timestamp must be on 1-minute resolution");
        }
        if (timestamp <= now) {
            throw invalid("timestamp must be in the future");
        }
        return timestamp;
    }

    private static InvalidTaskException invalid(String message) {
        return new InvalidTaskException(ValidationError.INVALID_TIME_SPEC, message);
    }
}
