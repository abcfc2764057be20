package com.example.callbackscheduler.service;

import com.example.callbackscheduler.domain.entity.CallbackTask;
import com.example.callbackscheduler.domain.entity.TaskIdentifier;
import com.example.callbackscheduler.domain.entity.TaskKey;
import com.example.callbackscheduler.domain.entity.TriggerTimes;
import com.example.callbackscheduler.domain.enums.CallbackMethod;
import com.example.callbackscheduler.domain.enums.TaskState;
import com.example.callbackscheduler.domain.store.TaskFilter;
import com.example.callbackscheduler.domain.store.TaskPage;
import com.example.callbackscheduler.domain.store.TaskStore;
import com.example.callbackscheduler.dto.CreateTaskRequest;
import com.example.callbackscheduler.dto.TaskResponse;
import com.example.callbackscheduler.dto.TaskStatusPage;
import com.example.callbackscheduler.exception.InvalidTaskException;
import com.example.callbackscheduler.exception.TaskLookupException;
import com.example.callbackscheduler.exception.TaskNotFoundException;
import com.example.callbackscheduler.exception.TaskStoreException;
import com.example.callbackscheduler.exception.ValidationError;
import com.example.callbackscheduler.mapper.TaskMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Client-facing operations on tasks.
 * <p>
 * Provides:
 * - Task creation with validation and normalization
 * - Rescheduling of failed (or all) occurrences to a new minute
 * - Status lookups by exact reference, by tag, or across all tasks, paginated
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskSchedulingService {

    private final TaskStore taskStore;
    private final TaskMapper taskMapper;
    private final Clock clock;

    // === Task Creation ===

    /**
     * Validate, normalize and store a new task.
     *
     * @return the task reference, {@code <tag>+<uuid>@<trigger_at>}
     * @throws InvalidTaskException if the request is not a valid task
     * @throws TaskStoreException   if the task could not be stored
     */
    public String createTask(CreateTaskRequest request) {
        var task = toTask(request);
        task.setDefaults();
        task.validate();
        task.normalizeTriggerAt(clock);
        task.normalizeTag();

        taskStore.put(task);

        var taskId = TaskIdentifier.format(task);
        log.info("Created task {} ({} {})", taskId, task.getCallbackMethod(), task.getCallbackEndpoint());
        return taskId;
    }

    private CallbackTask toTask(CreateTaskRequest request) {
        CallbackMethod method = null;
        var methodName = request.getCallbackMethod();
        if (methodName != null && !methodName.isEmpty()) {
            method = CallbackMethod.fromName(methodName)
                    .orElseThrow(() -> new InvalidTaskException(ValidationError.UNSUPPORTED_METHOD,
                            "unsupported HTTP method: " + methodName));
        }

        return CallbackTask.builder()
                .tag(request.getTag())
                .triggerSpec(request.getTriggerAt())
                .callbackEndpoint(request.getCallback())
                .callbackMethod(method)
                .payload(request.getPayload())
                .retry(request.getRetry())
                .expectedHttpStatus(request.getExpectedHttpStatus())
                .maxDelay(request.getMaxDelay())
                .build();
    }

    // === Rescheduling ===

    /**
     * Copy the referenced tasks to a new trigger minute, back in pending.
     * Only failed occurrences are copied unless {@code includeAll} is set.
     * The original rows are left as they are.
     *
     * @param ref            {@code tag}, {@code tag@trigger_at} or {@code tag+uuid@trigger_at}
     * @param newTriggerSpec new trigger time; the next minute when blank
     * @return the stored copies
     * @throws TaskNotFoundException if an exact reference matches nothing
     * @throws TaskLookupException   if the tasks could not be read
     * @throws TaskStoreException    if a copy could not be stored; earlier copies stay stored
     */
    public List<TaskResponse> rescheduleTasks(String ref, String newTriggerSpec, boolean includeAll) {
        var identifier = TaskIdentifier.parse(ref);
        var newTriggerAt = resolveNewTriggerAt(newTriggerSpec);

        var candidates = lookup(identifier);
        var rescheduled = new ArrayList<CallbackTask>();
        for (var task : candidates) {
            if (!includeAll && task.getTaskState() != TaskState.FAILED) {
                continue;
            }
            rescheduled.add(taskStore.put(task.rescheduledAt(newTriggerAt)));
        }

        log.info("Rescheduled {} of {} tasks matching {} to {}", rescheduled.size(), candidates.size(), identifier, newTriggerAt);
        return taskMapper.toResponseList(rescheduled);
    }

    private long resolveNewTriggerAt(String spec) {
        if (spec == null || spec.isBlank()) {
            return TriggerTimes.currentMinute(clock) + TriggerTimes.MINUTE;
        }
        return TriggerTimes.normalize(spec, clock);
    }

    private List<CallbackTask> lookup(TaskIdentifier identifier) {
        if (identifier.isExactKey()) {
            return List.of(getOrThrow(identifier));
        }
        if (identifier.hasTriggerAt()) {
            var tasks = collectAll(cursor -> queryByTag(identifier, atMinute(identifier.getTriggerAt()), cursor));
            if (tasks.isEmpty()) {
                throw new TaskNotFoundException(identifier.toString());
            }
            return tasks;
        }
        return collectAll(cursor -> queryByTag(identifier, TaskFilter.none(), cursor));
    }

    private List<CallbackTask> collectAll(Function<TaskKey, TaskPage> query) {
        var tasks = new ArrayList<CallbackTask>();
        TaskKey cursor = null;
        do {
            var page = query.apply(cursor);
            tasks.addAll(page.getTasks());
            cursor = page.getNext();
        } while (cursor != null);
        return tasks;
    }

    // === Status ===

    /**
     * Status of one task, of every occurrence of a tag, or of all tasks.
     *
     * @param ref        exact reference, tag reference, or null/empty for all tasks
     * @param startFrom  {@code next} value of the previous page, or null
     * @param futureOnly only list tasks triggering after the current minute
     * @throws TaskNotFoundException if an exact reference matches nothing
     * @throws TaskLookupException   if the store could not be read
     */
    public TaskStatusPage getStatus(String ref, String startFrom, boolean futureOnly) {
        var identifier = TaskIdentifier.parse(ref);
        var cursor = parseCursor(startFrom);

        if (identifier.isExactKey()) {
            return toStatusPage(new TaskPage(List.of(getOrThrow(identifier)), null));
        }

        if (identifier.hasTriggerAt()) {
            var page = queryByTag(identifier, atMinute(identifier.getTriggerAt()), cursor);
            if (page.getTasks().isEmpty() && cursor == null) {
                throw new TaskNotFoundException(identifier.toString());
            }
            return toStatusPage(page);
        }

        var filter = futureOnly
                ? TaskFilter.builder().minTriggerAt(TriggerTimes.currentMinute(clock) + 1).build()
                : TaskFilter.none();

        if (identifier.hasTag() || identifier.hasSuffix()) {
            return toStatusPage(queryByTag(identifier, filter, cursor));
        }

        try {
            return toStatusPage(taskStore.scan(filter, cursor));
        } catch (TaskStoreException e) {
            throw new TaskLookupException(e);
        }
    }

    private TaskKey parseCursor(String startFrom) {
        var cursor = TaskIdentifier.parse(startFrom);
        if (cursor.isEmpty()) {
            return null;
        }
        if (!cursor.isExactKey()) {
            throw new InvalidTaskException(ValidationError.INVALID_IDENTIFIER,
                    "start_from must be a task reference returned as next: " + startFrom);
        }
        return cursor.toKey();
    }

    private TaskStatusPage toStatusPage(TaskPage page) {
        return TaskStatusPage.builder()
                .tasks(taskMapper.toResponseList(page.getTasks()))
                .next(page.getNext() != null ? TaskIdentifier.format(page.getNext()) : null)
                .build();
    }

    // === Store access ===

    private CallbackTask getOrThrow(TaskIdentifier identifier) {
        try {
            return taskStore.get(identifier.toKey())
                    .orElseThrow(() -> new TaskNotFoundException(identifier.toString()));
        } catch (TaskStoreException e) {
            throw new TaskLookupException(e);
        }
    }

    /**
     * Tag index query. A reference carrying a unique suffix keeps only that task's rows.
     */
    private TaskPage queryByTag(TaskIdentifier identifier, TaskFilter filter, TaskKey cursor) {
        TaskPage page;
        try {
            page = taskStore.queryByTag(identifier.getTag(), filter, cursor);
        } catch (TaskStoreException e) {
            throw new TaskLookupException(e);
        }
        if (!identifier.hasSuffix()) {
            return page;
        }
        var tagUuid = identifier.getTagUuid();
        var matching = page.getTasks().stream()
                .filter(task -> tagUuid.equals(task.getTagUuid()))
                .toList();
        return new TaskPage(matching, page.getNext());
    }

    private static TaskFilter atMinute(long triggerAt) {
        return TaskFilter.builder().minTriggerAt(triggerAt).maxTriggerAt(triggerAt).build();
    }
}
