package com.example.callbackscheduler.config;

import com.example.callbackscheduler.domain.enums.TaskState;
import com.example.callbackscheduler.domain.repository.CallbackTaskRepository;
import com.example.callbackscheduler.service.executor.ExecutionOutcome;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the callback scheduler.
 * <p>
 * Exposes Prometheus metrics for:
 * - Task counts by state
 * - Execution outcomes and callback latency
 * - Rejected dispatches and callback retries
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final CallbackTaskRepository taskRepository;

    private final Map<TaskState, AtomicLong> stateCounters = new EnumMap<>(TaskState.class);

    @PostConstruct
    public void initializeMetrics() {
        for (var state : TaskState.values()) {
            var counter = new AtomicLong(0);
            stateCounters.put(state, counter);

            Gauge.builder("callback_scheduler_tasks", counter, AtomicLong::get)
                    .tag("state", state.getCode())
                    .description("Number of tasks by state")
                    .register(meterRegistry);
        }
    }

    /**
     * Periodically refresh the per-state gauges from the database
     */
    @Scheduled(fixedDelayString = "${callback-scheduler.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        try {
            for (var state : TaskState.values()) {
                stateCounters.get(state).set(taskRepository.countByTaskState(state));
            }
        } catch (DataAccessException e) {
            log.warn("Failed to refresh task state gauges: {}", e.getMessage());
        }
    }

    public Timer.Sample startCallbackTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record the time spent delivering a callback, retries included
     */
    public void recordCallback(Timer.Sample sample, ExecutionOutcome outcome) {
        sample.stop(Timer.builder("callback_scheduler_callback_time")
                .tag("outcome", outcome.tag())
                .description("Callback delivery time")
                .register(meterRegistry));
    }

    public void recordExecution(ExecutionOutcome outcome) {
        meterRegistry.counter("callback_scheduler_executions", "outcome", outcome.tag()).increment();
    }

    public void recordDispatchRejected() {
        meterRegistry.counter("callback_scheduler_dispatch_rejected").increment();
    }

    public void recordRetry() {
        meterRegistry.counter("callback_scheduler_retries").increment();
    }
}
