package com.example.callbackscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of task statuses. {@code next} is the start_from value for the
 * following page, or null on the last page.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskStatusPage {

    private List<TaskResponse> tasks;

    private String next;
}
