package com.example.callbackscheduler.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle of a callback task.
 * <p>
 * pending -> running -> {successful, failed}; pending -> skipped when the
 * max delay window has passed before the task could be dispatched.
 */
@Getter
@RequiredArgsConstructor
public enum TaskState {

    /**
     * Created and waiting for its trigger minute.
     */
    PENDING("pending"),

    /**
     * Claimed by an executor, callback in flight.
     */
    RUNNING("running"),

    /**
     * Callback answered with the expected HTTP status.
     */
    SUCCESSFUL("successful"),

    /**
     * Callback attempts exhausted without the expected HTTP status.
     */
    FAILED("failed"),

    /**
     * Abandoned without calling back because max_delay had passed.
     */
    SKIPPED("skipped");

    @JsonValue
    private final String code;
}
