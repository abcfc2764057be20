package com.example.callbackscheduler.service.executor;

import com.example.callbackscheduler.config.MetricsConfig;
import com.example.callbackscheduler.domain.entity.CallbackTask;
import com.example.callbackscheduler.domain.entity.TaskIdentifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Hands tasks to the bounded callback worker pool.
 * <p>
 * A rejected dispatch leaves the task pending; the next catchup pass picks it
 * up again while it is still inside its max delay window.
 */
@Slf4j
@Component
public class TaskDispatcher {

    private final TaskExecutor dispatchExecutor;
    private final CallbackExecutorService executorService;
    private final MetricsConfig metricsConfig;

    public TaskDispatcher(@Qualifier("callbackDispatchExecutor") TaskExecutor dispatchExecutor,
                          CallbackExecutorService executorService, MetricsConfig metricsConfig) {
        this.dispatchExecutor = dispatchExecutor;
        this.executorService = executorService;
        this.metricsConfig = metricsConfig;
    }

    /**
     * @return true if the task was queued for execution
     */
    public boolean dispatch(CallbackTask task) {
        try {
            dispatchExecutor.execute(() -> executorService.execute(task));
            return true;
        } catch (TaskRejectedException e) {
            log.warn("Dispatch pool saturated, task {} stays pending: {}", TaskIdentifier.format(task), e.getMessage());
            metricsConfig.recordDispatchRejected();
            return false;
        }
    }
}
