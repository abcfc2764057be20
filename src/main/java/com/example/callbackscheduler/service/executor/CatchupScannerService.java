package com.example.callbackscheduler.service.executor;

import com.example.callbackscheduler.config.CallbackSchedulerProperties;
import com.example.callbackscheduler.config.ShedLockConfig;
import com.example.callbackscheduler.domain.entity.TaskKey;
import com.example.callbackscheduler.domain.entity.TriggerTimes;
import com.example.callbackscheduler.domain.enums.TaskState;
import com.example.callbackscheduler.domain.store.TaskFilter;
import com.example.callbackscheduler.domain.store.TaskStore;
import com.example.callbackscheduler.exception.TaskStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Replays pending tasks whose minute has already passed.
 * <p>
 * Tasks are missed while the service is down, when a tick fails, or when the
 * worker pool rejects a dispatch. A pass runs at startup, periodically, and on
 * demand. Tasks beyond their max delay are marked skipped by the executor.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatchupScannerService {

    private final TaskStore taskStore;
    private final TaskDispatcher taskDispatcher;
    private final CallbackSchedulerProperties properties;
    private final Clock clock;

    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.isCatchupOnStartup()) {
            catchup();
        }
    }

    @Scheduled(fixedDelayString = "${callback-scheduler.catchup-interval-ms:300000}",
            initialDelayString = "${callback-scheduler.catchup-interval-ms:300000}")
    @SchedulerLock(name = ShedLockConfig.CATCHUP_LOCK, lockAtLeastFor = "10s", lockAtMostFor = "10m")
    public void scheduledCatchup() {
        catchup();
    }

    /**
     * Run one catchup pass. Returns immediately if a pass is already running
     * on this instance.
     *
     * @return number of tasks handed to the worker pool
     */
    public int catchup() {
        if (!isRunning.compareAndSet(false, true)) {
            log.debug("Catchup already in progress, skipping");
            return 0;
        }

        var minute = TriggerTimes.currentMinute(clock);
        var filter = TaskFilter.builder()
                .maxTriggerAt(minute)
                .state(TaskState.PENDING)
                .build();
        var dispatched = 0;

        log.info("Starting catchup for pending tasks up to {}", minute);
        try {
            TaskKey cursor = null;
            do {
                var page = taskStore.scan(filter, cursor);
                for (var task : page.getTasks()) {
                    if (task.getTriggerAt() == null || task.getTagUuid() == null) {
                        log.error("Skipping unreadable task row during catchup (trigger_at: {}, tag_uuid: {})",
                                task.getTriggerAt(), task.getTagUuid());
                        continue;
                    }
                    log.debug("Catching up on task {}@{}", task.getTagUuid(), task.getTriggerAt());
                    if (taskDispatcher.dispatch(task)) {
                        dispatched++;
                    }
                }
                cursor = page.getNext();
            } while (cursor != null);

            log.info("Catchup finished, dispatched {} tasks", dispatched);
        } catch (TaskStoreException e) {
            log.error("Catchup aborted after dispatching {} tasks: {}", dispatched, e.getMessage(), e);
        } finally {
            isRunning.set(false);
        }
        return dispatched;
    }
}
