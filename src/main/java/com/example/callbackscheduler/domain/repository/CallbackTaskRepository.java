package com.example.callbackscheduler.domain.repository;

import com.example.callbackscheduler.domain.entity.CallbackTask;
import com.example.callbackscheduler.domain.entity.TaskKey;
import com.example.callbackscheduler.domain.enums.TaskState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

/**
 * Repository for CallbackTask entity.
 * <p>
 * Listings are built from JPA Specifications by the store; this interface only
 * adds the conditional state update and the counters used for metrics.
 */
@Repository
public interface CallbackTaskRepository extends JpaRepository<CallbackTask, TaskKey>, JpaSpecificationExecutor<CallbackTask> {

    /**
     * Move a task to a new state only if it is still in the expected one.
     *
     * @return number of rows updated (1 if the transition won, 0 otherwise)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE CallbackTask t
            SET t.taskState = :next,
                t.updatedAt = :now
            WHERE t.triggerAt = :triggerAt
              AND t.tagUuid = :tagUuid
              AND t.taskState = :expected
            """)
    int transitionState(
            @Param("triggerAt") Long triggerAt,
            @Param("tagUuid") String tagUuid,
            @Param("expected") TaskState expected,
            @Param("next") TaskState next,
            @Param("now") Instant now);

    long countByTaskState(TaskState taskState);
}
