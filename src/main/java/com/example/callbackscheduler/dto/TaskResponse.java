package com.example.callbackscheduler.dto;

import com.example.callbackscheduler.domain.enums.CallbackMethod;
import com.example.callbackscheduler.domain.enums.TaskState;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response DTO for task data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskResponse {

    /**
     * Reference usable with the status and reschedule endpoints
     */
    @JsonProperty("task_id")
    private String taskId;

    private String tag;

    private String uuid;

    @JsonProperty("trigger_at")
    private Long triggerAt;

    @JsonProperty("callback")
    private String callbackEndpoint;

    @JsonProperty("callback_method")
    private CallbackMethod callbackMethod;

    private String payload;

    private Integer retry;

    @JsonProperty("expected_http_status")
    private Integer expectedHttpStatus;

    @JsonProperty("max_delay")
    private Integer maxDelay;

    @JsonProperty("task_state")
    private TaskState taskState;

    @JsonProperty("response_status")
    private Integer responseStatus;

    @JsonProperty("response_body")
    private String responseBody;

    @JsonProperty("executed_at")
    private Long executedAt;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;
}
