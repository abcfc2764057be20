package com.example.callbackscheduler.domain.entity;

import com.example.callbackscheduler.domain.enums.CallbackMethod;
import com.example.callbackscheduler.domain.enums.TaskState;
import com.example.callbackscheduler.exception.InvalidTaskException;
import com.example.callbackscheduler.exception.ValidationError;
import jakarta.persistence.*;
import lombok.*;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * A unit of deferred work: call {@code callbackEndpoint} once {@code triggerAt} arrives.
 * <p>
 * Stored under the composite key (trigger_at, tag_uuid), with a secondary index
 * on (tag, trigger_at) for listing every occurrence of a tag.
 */
@Entity
@Table(name = "callback_tasks", indexes = {
        @Index(name = "idx_callback_tasks_tag_trigger_at", columnList = "tag, trigger_at"),
        @Index(name = "idx_callback_tasks_state_trigger_at", columnList = "task_state, trigger_at")
})
@IdClass(TaskKey.class)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class CallbackTask {

    public static final String TAG_DELIMITER = "+";
    public static final String KEY_DELIMITER = "@";
    public static final int MAX_RESPONSE_BYTES = 256;

    static final CallbackMethod DEFAULT_METHOD = CallbackMethod.GET;
    static final int DEFAULT_RETRY = 1;
    static final int DEFAULT_EXPECTED_HTTP_STATUS = 200;
    static final int DEFAULT_MAX_DELAY_MINUTES = 10;

    private static final Pattern VALID_TAG = Pattern.compile("[A-Za-z0-9]*");

    /**
     * Unix seconds, always a multiple of 60 once normalized
     */
    @Id
    @Column(name = "trigger_at", nullable = false, updatable = false)
    private Long triggerAt;

    /**
     * tag + "+" + uuid
     */
    @Id
    @Column(name = "tag_uuid", nullable = false, updatable = false, length = 200)
    private String tagUuid;

    @Column(name = "tag", nullable = false, length = 160)
    private String tag;

    @Column(name = "uuid", nullable = false, length = 32)
    private String uuid;

    @Column(name = "callback_endpoint", nullable = false, length = 2048)
    private String callbackEndpoint;

    @Enumerated(EnumType.STRING)
    @Column(name = "callback_method", nullable = false, length = 10)
    private CallbackMethod callbackMethod;

    @Column(name = "payload", columnDefinition = "TEXT")
    private String payload;

    /**
     * Maximum number of callback attempts
     */
    @Column(name = "retry", nullable = false)
    private Integer retry;

    @Column(name = "expected_http_status", nullable = false)
    private Integer expectedHttpStatus;

    /**
     * Minutes past trigger_at after which the callback is abandoned
     */
    @Column(name = "max_delay", nullable = false)
    private Integer maxDelay;

    @Enumerated(EnumType.STRING)
    @Column(name = "task_state", nullable = false, length = 20)
    private TaskState taskState;

    @Column(name = "response_status")
    private Integer responseStatus;

    @Column(name = "response_body", length = 1024)
    private String responseBody;

    /**
     * Unix seconds of the last callback completion
     */
    @Column(name = "executed_at")
    private Long executedAt;

    /**
     * Raw trigger specification as received from the client, absolute or relative.
     * Cleared once {@link #normalizeTriggerAt(Clock)} has resolved it.
     */
    @Transient
    private String triggerSpec;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        if (this.createdAt == null) {
            this.createdAt = now;
        }
        this.updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // === Validation & normalization ===

    /**
     * Fill unset optional fields and reset the state to pending
     */
    public void setDefaults() {
        this.taskState = TaskState.PENDING;
        if (this.callbackMethod == null) {
            this.callbackMethod = DEFAULT_METHOD;
        }
        if (this.retry == null || this.retry == 0) {
            this.retry = DEFAULT_RETRY;
        }
        if (this.expectedHttpStatus == null || this.expectedHttpStatus == 0) {
            this.expectedHttpStatus = DEFAULT_EXPECTED_HTTP_STATUS;
        }
        if (this.maxDelay == null || this.maxDelay == 0) {
            this.maxDelay = DEFAULT_MAX_DELAY_MINUTES;
        }
    }

    /**
     * Check every client-supplied field.
     *
     * @throws InvalidTaskException describing the first problem found
     */
    public void validate() {
        if (tag == null || (isBlank(triggerSpec) && triggerAt == null) || isBlank(callbackEndpoint)) {
            throw new InvalidTaskException(ValidationError.INCOMPLETE_TASK,
                    "tag, trigger_at and callback are required");
        }
        if (callbackMethod == null) {
            throw new InvalidTaskException(ValidationError.UNSUPPORTED_METHOD, "unsupported HTTP method");
        }
        if (!isValidTag(tag)) {
            throw new InvalidTaskException(ValidationError.INVALID_TAG, "invalid tag: does not match " + VALID_TAG.pattern());
        }
        if (!isValidCallbackUrl(callbackEndpoint)) {
            throw new InvalidTaskException(ValidationError.INVALID_CALLBACK_URL, "invalid callback URL: " + callbackEndpoint);
        }
        if (retry != null && retry < 0) {
            throw new InvalidTaskException(ValidationError.NEGATIVE_FIELD, "retry must be a non-negative integer");
        }
        if (maxDelay != null && maxDelay < 0) {
            throw new InvalidTaskException(ValidationError.NEGATIVE_FIELD, "max_delay must be a non-negative integer");
        }
    }

    /**
     * Resolve the trigger specification into an absolute minute.
     * Re-applying it to an already normalized task leaves triggerAt unchanged.
     */
    public void normalizeTriggerAt(Clock clock) {
        var spec = triggerSpec != null ? triggerSpec : (triggerAt != null ? triggerAt.toString() : null);
        this.triggerAt = TriggerTimes.normalize(spec, clock);
        this.triggerSpec = null;
    }

    /**
     * Attach a fresh unique suffix so repeated tags at the same minute stay distinct
     */
    public void normalizeTag() {
        this.uuid = UUID.randomUUID().toString().replace("-", "");
        this.tagUuid = tag + TAG_DELIMITER + uuid;
    }

    public static boolean isValidTag(String tag) {
        return tag != null && VALID_TAG.matcher(tag).matches();
    }

    static boolean isValidCallbackUrl(String endpoint) {
        try {
            var uri = new URI(endpoint);
            var scheme = uri.getScheme();
            return uri.isAbsolute()
                    && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))
                    && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    // === Execution helpers ===

    public TaskKey key() {
        return new TaskKey(triggerAt, tagUuid);
    }

    /**
     * True once the current minute is beyond trigger_at + max_delay minutes
     */
    public boolean isPastMaxDelay(long currentMinute) {
        return currentMinute > triggerAt + maxDelay * TriggerTimes.MINUTE;
    }

    /**
     * Store the callback outcome and move to successful or failed
     */
    public void recordResponse(int status, String body, long executedAtEpochSecond) {
        this.taskState = status == expectedHttpStatus ? TaskState.SUCCESSFUL : TaskState.FAILED;
        this.responseStatus = status;
        this.responseBody = truncate(body);
        this.executedAt = executedAtEpochSecond;
    }

    /**
     * Copy of this task scheduled at another minute, back in pending with no result
     */
    public CallbackTask rescheduledAt(long newTriggerAt) {
        return toBuilder()
                .triggerAt(newTriggerAt)
                .taskState(TaskState.PENDING)
                .responseStatus(null)
                .responseBody(null)
                .executedAt(null)
                .triggerSpec(null)
                .createdAt(null)
                .updatedAt(null)
                .build();
    }

    static String truncate(String body) {
        if (body == null) {
            return null;
        }
        var bytes = body.getBytes(StandardCharsets.UTF_8);
        if (bytes.length <= MAX_RESPONSE_BYTES) {
            return body;
        }
        var end = MAX_RESPONSE_BYTES;
        // back off to the first byte of a character cut at the limit
        while (end > 0 && (bytes[end] & 0xC0) == 0x80) {
            end--;
        }
        return new String(bytes, 0, end, StandardCharsets.UTF_8);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
