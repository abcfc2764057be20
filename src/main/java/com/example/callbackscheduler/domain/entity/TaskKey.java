package com.example.callbackscheduler.domain.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Primary key of a stored task: trigger minute (partition) and tag+uuid (sort).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaskKey implements Serializable, Comparable<TaskKey> {

    private Long triggerAt;
    private String tagUuid;

    /**
     * Ordering used by every paginated listing: trigger minute, then tag+uuid.
     */
    @Override
    public int compareTo(TaskKey other) {
        var byTime = Long.compare(triggerAt, other.triggerAt);
        return byTime != 0 ? byTime : tagUuid.compareTo(other.tagUuid);
    }
}
