package com.example.callbackscheduler.domain.store;

import com.example.callbackscheduler.domain.entity.CallbackTask;
import com.example.callbackscheduler.domain.entity.TaskKey;
import lombok.Value;

import java.util.List;

/**
 * One page of a listing. {@code next} is the key of the last row returned when
 * more rows follow, and null on the final page.
 */
@Value
public class TaskPage {

    List<CallbackTask> tasks;
    TaskKey next;

    public boolean hasNext() {
        return next != null;
    }

    public static TaskPage of(List<CallbackTask> rows, int pageSize) {
        if (rows.size() <= pageSize) {
            return new TaskPage(List.copyOf(rows), null);
        }
        var page = List.copyOf(rows.subList(0, pageSize));
        return new TaskPage(page, page.get(pageSize - 1).key());
    }
}
