package com.example.callbackscheduler.domain.store;

import com.example.callbackscheduler.config.CallbackSchedulerProperties;
import com.example.callbackscheduler.domain.entity.CallbackTask;
import com.example.callbackscheduler.domain.entity.TaskKey;
import com.example.callbackscheduler.domain.enums.TaskState;
import com.example.callbackscheduler.domain.repository.CallbackTaskRepository;
import com.example.callbackscheduler.exception.TaskStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link TaskStore} backed by PostgreSQL through Spring Data JPA.
 * <p>
 * Pagination is keyset based: each page asks for one row more than the page
 * size, ordered by (trigger_at, tag_uuid), starting strictly after the cursor.
 * The extra row only signals that another page exists, so no count query runs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaTaskStore implements TaskStore {

    private static final Sort KEY_ORDER = Sort.by(Sort.Order.asc("triggerAt"), Sort.Order.asc("tagUuid"));

    private final CallbackTaskRepository repository;
    private final CallbackSchedulerProperties properties;

    @Override
    public Optional<CallbackTask> get(TaskKey key) {
        return call("get", () -> repository.findById(key));
    }

    @Override
    public CallbackTask put(CallbackTask task) {
        return call("put", () -> repository.save(task));
    }

    @Override
    @Transactional
    public boolean transition(TaskKey key, TaskState expected, TaskState next) {
        var updated = call("transition", () -> repository.transitionState(
                key.getTriggerAt(), key.getTagUuid(), expected, next, Instant.now()));
        return updated == 1;
    }

    @Override
    public TaskPage findDue(long triggerAt, TaskKey cursor) {
        var spec = triggerAtEquals(triggerAt).and(stateEquals(TaskState.PENDING));
        return page("findDue", spec, cursor);
    }

    @Override
    public TaskPage queryByTag(String tag, TaskFilter filter, TaskKey cursor) {
        var spec = tagEquals(tag).and(matching(filter));
        return page("queryByTag", spec, cursor);
    }

    @Override
    public TaskPage scan(TaskFilter filter, TaskKey cursor) {
        return page("scan", matching(filter), cursor);
    }

    private TaskPage page(String operation, Specification<CallbackTask> spec, TaskKey cursor) {
        var pageSize = properties.getPageSize();
        var effective = cursor == null ? spec : spec.and(after(cursor));
        List<CallbackTask> rows = call(operation, () -> repository.findBy(effective,
                query -> query.sortBy(KEY_ORDER).limit(pageSize + 1).all()));
        log.debug("{} returned {} rows (cursor: {})", operation, rows.size(), cursor);
        return TaskPage.of(rows, pageSize);
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | TransactionException e) {
            log.error("Store operation {} failed: {}", operation, e.getMessage(), e);
            throw new TaskStoreException(operation, e);
        }
    }

    // === Specifications ===

    static Specification<CallbackTask> matching(TaskFilter filter) {
        Specification<CallbackTask> spec = (root, query, cb) -> cb.conjunction();
        if (filter.getMinTriggerAt() != null) {
            spec = spec.and((root, query, cb) -> cb.greaterThanOrEqualTo(root.<Long>get("triggerAt"), filter.getMinTriggerAt()));
        }
        if (filter.getMaxTriggerAt() != null) {
            spec = spec.and((root, query, cb) -> cb.lessThanOrEqualTo(root.<Long>get("triggerAt"), filter.getMaxTriggerAt()));
        }
        if (filter.getState() != null) {
            spec = spec.and(stateEquals(filter.getState()));
        }
        return spec;
    }

    static Specification<CallbackTask> after(TaskKey cursor) {
        return (root, query, cb) -> cb.or(
                cb.greaterThan(root.<Long>get("triggerAt"), cursor.getTriggerAt()),
                cb.and(
                        cb.equal(root.get("triggerAt"), cursor.getTriggerAt()),
                        cb.greaterThan(root.<String>get("tagUuid"), cursor.getTagUuid())));
    }

    private static Specification<CallbackTask> triggerAtEquals(long triggerAt) {
        return (root, query, cb) -> cb.equal(root.get("triggerAt"), triggerAt);
    }

    private static Specification<CallbackTask> tagEquals(String tag) {
        return (root, query, cb) -> cb.equal(root.get("tag"), tag);
    }

    private static Specification<CallbackTask> stateEquals(TaskState state) {
        return (root, query, cb) -> cb.equal(root.get("taskState"), state);
    }
}
