package com.example.callbackscheduler.domain.store;

import com.example.callbackscheduler.domain.entity.CallbackTask;
import com.example.callbackscheduler.domain.enums.TaskState;
import lombok.Builder;
import lombok.Value;

/**
 * Predicate applied by scans and index queries. Unset fields do not filter.
 */
@Value
@Builder
public class TaskFilter {

    /**
     * Inclusive lower bound on trigger_at
     */
    Long minTriggerAt;

    /**
     * Inclusive upper bound on trigger_at
     */
    Long maxTriggerAt;

    TaskState state;

    public static TaskFilter none() {
        return TaskFilter.builder().build();
    }

    public boolean matches(CallbackTask task) {
        return (minTriggerAt == null || task.getTriggerAt() >= minTriggerAt)
                && (maxTriggerAt == null || task.getTriggerAt() <= maxTriggerAt)
                && (state == null || task.getTaskState() == state);
    }
}
