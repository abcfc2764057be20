package com.example.callbackscheduler.service.executor;

/**
 * What a single execution attempt ended with. Used for logging and metrics only.
 */
public enum ExecutionOutcome {
    /**
     * Abandoned because the task was past its max delay; no callback was sent
     */
    SKIPPED,
    /**
     * Another dispatcher won the claim on the task
     */
    NOT_CLAIMED,
    SUCCESSFUL,
    FAILED;

    public String tag() {
        return name().toLowerCase();
    }
}
