package com.example.callbackscheduler.domain.entity;

import com.example.callbackscheduler.exception.InvalidTaskException;
import com.example.callbackscheduler.exception.ValidationError;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.regex.Pattern;

/**
 * Wire form of a task reference: {@code <tag>[+<suffix>]@<trigger_at>}, trigger part optional.
 * <p>
 * Only the API boundary deals in this string; everything behind it uses {@link TaskKey}.
 */
@Getter
@EqualsAndHashCode
public final class TaskIdentifier {

    private static final Pattern ALPHANUMERIC = Pattern.compile("[A-Za-z0-9]*");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private final String tag;
    private final String suffix;
    private final Long triggerAt;

    private TaskIdentifier(String tag, String suffix, Long triggerAt) {
        this.tag = tag;
        this.suffix = suffix;
        this.triggerAt = triggerAt;
    }

    public static TaskIdentifier of(String tag, String suffix, Long triggerAt) {
        if (!CallbackTask.isValidTag(tag)) {
            throw invalid("tag must be alphanumeric: " + tag);
        }
        if (suffix != null && (suffix.isEmpty() || !ALPHANUMERIC.matcher(suffix).matches())) {
            throw invalid("unique suffix must be alphanumeric: " + suffix);
        }
        return new TaskIdentifier(tag, suffix, triggerAt);
    }

    /**
     * Parse a reference. A null or empty input yields {@link #empty()}.
     *
     * @throws InvalidTaskException with {@link ValidationError#INVALID_IDENTIFIER}
     */
    public static TaskIdentifier parse(String value) {
        if (value == null || value.isEmpty()) {
            return empty();
        }

        var parts = value.split(Pattern.quote(CallbackTask.KEY_DELIMITER), -1);
        if (parts.length > 2) {
            throw invalid("too many '" + CallbackTask.KEY_DELIMITER + "' in " + value);
        }

        Long triggerAt = null;
        if (parts.length == 2) {
            if (!DIGITS.matcher(parts[1]).matches()) {
                throw invalid("trigger_at must be a Unix timestamp: " + parts[1]);
            }
            try {
                triggerAt = Long.parseLong(parts[1]);
            } catch (NumberFormatException e) {
                throw invalid("trigger_at out of range: " + parts[1]);
            }
        }

        var name = parts[0].split(Pattern.quote(CallbackTask.TAG_DELIMITER), -1);
        if (name.length > 2) {
            throw invalid("too many '" + CallbackTask.TAG_DELIMITER + "' in " + value);
        }
        return of(name[0], name.length == 2 ? name[1] : null, triggerAt);
    }

    public static TaskIdentifier empty() {
        return new TaskIdentifier("", null, null);
    }

    public static String format(CallbackTask task) {
        return format(task.key());
    }

    public static String format(TaskKey key) {
        return key.getTagUuid() + CallbackTask.KEY_DELIMITER + key.getTriggerAt();
    }

    public boolean hasTag() {
        return !tag.isEmpty();
    }

    public boolean hasSuffix() {
        return suffix != null;
    }

    public boolean hasTriggerAt() {
        return triggerAt != null;
    }

    /**
     * True when this reference names exactly one stored row
     */
    public boolean isExactKey() {
        return hasSuffix() && hasTriggerAt();
    }

    public boolean isEmpty() {
        return !hasTag() && !hasSuffix() && !hasTriggerAt();
    }

    public String getTagUuid() {
        return hasSuffix() ? tag + CallbackTask.TAG_DELIMITER + suffix : tag;
    }

    /**
     * Structured key, only meaningful for exact references
     */
    public TaskKey toKey() {
        if (!isExactKey()) {
            throw invalid("reference does not identify a single task: " + this);
        }
        return new TaskKey(triggerAt, getTagUuid());
    }

    @Override
    public String toString() {
        return hasTriggerAt() ? getTagUuid() + CallbackTask.KEY_DELIMITER + triggerAt : getTagUuid();
    }

    private static InvalidTaskException invalid(String message) {
        return new InvalidTaskException(ValidationError.INVALID_IDENTIFIER, message);
    }
}
