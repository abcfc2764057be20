package com.example.callbackscheduler.domain.store;

import com.example.callbackscheduler.domain.entity.CallbackTask;
import com.example.callbackscheduler.domain.entity.TaskKey;
import com.example.callbackscheduler.domain.enums.TaskState;
import com.example.callbackscheduler.exception.TaskStoreException;

import java.util.Optional;

/**
 * Persistence for callback tasks: a key-value table keyed by (trigger_at, tag_uuid)
 * with a secondary index on (tag, trigger_at).
 * <p>
 * Listings are ordered by (trigger_at, tag_uuid) and resume strictly after the
 * given cursor, so consecutive pages never overlap or skip rows.
 * Every method throws {@link TaskStoreException} when the backing store fails.
 */
public interface TaskStore {

    Optional<CallbackTask> get(TaskKey key);

    /**
     * Insert or replace the row with the task's key
     */
    CallbackTask put(CallbackTask task);

    /**
     * Conditional single-row state change.
     *
     * @return true when the row was in {@code expected} and now is in {@code next}
     */
    boolean transition(TaskKey key, TaskState expected, TaskState next);

    /**
     * Pending tasks whose trigger minute is exactly {@code triggerAt}
     */
    TaskPage findDue(long triggerAt, TaskKey cursor);

    /**
     * Every occurrence of a tag, through the secondary index
     */
    TaskPage queryByTag(String tag, TaskFilter filter, TaskKey cursor);

    /**
     * Full table scan
     */
    TaskPage scan(TaskFilter filter, TaskKey cursor);
}
