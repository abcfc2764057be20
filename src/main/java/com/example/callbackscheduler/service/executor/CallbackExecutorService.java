package com.example.callbackscheduler.service.executor;

import com.example.callbackscheduler.config.MetricsConfig;
import com.example.callbackscheduler.domain.entity.CallbackTask;
import com.example.callbackscheduler.domain.entity.TaskIdentifier;
import com.example.callbackscheduler.domain.entity.TriggerTimes;
import com.example.callbackscheduler.domain.enums.TaskState;
import com.example.callbackscheduler.domain.store.TaskStore;
import com.example.callbackscheduler.exception.TaskStoreException;
import com.example.callbackscheduler.service.transport.CallbackClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;

/**
 * Runs a single task: max delay check, claim, callback, result persistence.
 * <p>
 * Handles:
 * - Abandoning tasks past their max delay window (pending -> skipped)
 * - Claiming the task so concurrent dispatchers cannot both run it (pending -> running)
 * - Delivering the callback with retries
 * - Storing the response and the final state
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CallbackExecutorService {

    private final TaskStore taskStore;
    private final CallbackClient callbackClient;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    /**
     * Execute one task. Never throws; every failure is logged and reflected in
     * the returned outcome.
     */
    public ExecutionOutcome execute(CallbackTask task) {
        var taskId = TaskIdentifier.format(task);
        try {
            var outcome = run(task, taskId);
            metricsConfig.recordExecution(outcome);
            return outcome;
        } catch (RuntimeException e) {
            log.error("Unexpected error executing task {}: {}", taskId, e.getMessage(), e);
            metricsConfig.recordExecution(ExecutionOutcome.FAILED);
            return ExecutionOutcome.FAILED;
        }
    }

    private ExecutionOutcome run(CallbackTask task, String taskId) {
        var currentMinute = TriggerTimes.currentMinute(clock);

        if (task.isPastMaxDelay(currentMinute)) {
            log.warn("Task {} is past its max delay of {} minutes, skipping", taskId, task.getMaxDelay());
            markSkipped(task, taskId);
            return ExecutionOutcome.SKIPPED;
        }

        if (!claim(task, taskId)) {
            log.debug("Task {} already claimed elsewhere", taskId);
            return ExecutionOutcome.NOT_CLAIMED;
        }
        task.setTaskState(TaskState.RUNNING);

        log.info("Executing task {}: {} {}", taskId, task.getCallbackMethod(), task.getCallbackEndpoint());

        var timerSample = metricsConfig.startCallbackTimer();
        var response = callbackClient.sendWithRetry(
                task.getCallbackEndpoint(),
                task.getPayload(),
                Map.of(),
                task.getCallbackMethod(),
                task.getExpectedHttpStatus(),
                task.getRetry());

        task.recordResponse(response.getStatus(), response.getBody(), clock.instant().getEpochSecond());
        var outcome = task.getTaskState() == TaskState.SUCCESSFUL ? ExecutionOutcome.SUCCESSFUL : ExecutionOutcome.FAILED;
        metricsConfig.recordCallback(timerSample, outcome);

        try {
            taskStore.put(task);
        } catch (TaskStoreException e) {
            log.error("Failed to store result of task {} (state {}): {}", taskId, task.getTaskState(), e.getMessage(), e);
        }

        if (outcome == ExecutionOutcome.SUCCESSFUL) {
            log.info("Task {} succeeded with status {}", taskId, response.getStatus());
        } else {
            log.warn("Task {} failed with status {} (expected {})", taskId, response.getStatus(), task.getExpectedHttpStatus());
        }
        return outcome;
    }

    /**
     * Win the pending -> running transition. A store failure here does not stop
     * the callback; only a lost transition does.
     */
    private boolean claim(CallbackTask task, String taskId) {
        try {
            return taskStore.transition(task.key(), TaskState.PENDING, TaskState.RUNNING);
        } catch (TaskStoreException e) {
            log.error("Failed to mark task {} as running, executing anyway: {}", taskId, e.getMessage(), e);
            return true;
        }
    }

    private void markSkipped(CallbackTask task, String taskId) {
        try {
            if (taskStore.transition(task.key(), TaskState.PENDING, TaskState.SKIPPED)) {
                task.setTaskState(TaskState.SKIPPED);
            }
        } catch (TaskStoreException e) {
            log.error("Failed to mark task {} as skipped: {}", taskId, e.getMessage(), e);
        }
    }
}
