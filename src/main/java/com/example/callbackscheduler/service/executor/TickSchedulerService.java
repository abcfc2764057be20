package com.example.callbackscheduler.service.executor;

import com.example.callbackscheduler.config.ShedLockConfig;
import com.example.callbackscheduler.domain.entity.TaskKey;
import com.example.callbackscheduler.domain.entity.TriggerTimes;
import com.example.callbackscheduler.domain.store.TaskStore;
import com.example.callbackscheduler.exception.TaskStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fires the tasks due in the current minute.
 * <p>
 * ShedLock keeps the tick on one instance at a time. A task that is fetched by
 * two dispatchers anyway is still executed once, because only one of them wins
 * the pending -> running claim.
 * <p>
 * Flow:
 * 1. Compute the current minute
 * 2. Page through the pending tasks stored at exactly that minute
 * 3. Dispatch each task to the worker pool
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TickSchedulerService {

    private final TaskStore taskStore;
    private final TaskDispatcher taskDispatcher;
    private final Clock clock;

    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    @Scheduled(fixedDelayString = "${callback-scheduler.tick-interval-ms:60000}")
    @SchedulerLock(name = ShedLockConfig.TICK_LOCK, lockAtLeastFor = "5s", lockAtMostFor = "55s")
    public void scheduledTick() {
        tick();
    }

    /**
     * Run one tick cycle.
     *
     * @return number of tasks handed to the worker pool
     */
    public int tick() {
        if (!isRunning.compareAndSet(false, true)) {
            log.debug("Previous tick still running, skipping");
            return 0;
        }

        var minute = TriggerTimes.currentMinute(clock);
        var dispatched = 0;
        var found = 0;
        try {
            TaskKey cursor = null;
            do {
                var page = taskStore.findDue(minute, cursor);
                for (var task : page.getTasks()) {
                    found++;
                    if (taskDispatcher.dispatch(task)) {
                        dispatched++;
                    }
                }
                cursor = page.getNext();
            } while (cursor != null);

            if (found > 0) {
                log.info("Tick {}: found {} due tasks, dispatched {}", minute, found, dispatched);
            } else {
                log.debug("Tick {}: no due tasks", minute);
            }
        } catch (TaskStoreException e) {
            log.error("Tick {} aborted after dispatching {} tasks: {}", minute, dispatched, e.getMessage(), e);
        } finally {
            isRunning.set(false);
        }
        return dispatched;
    }
}
