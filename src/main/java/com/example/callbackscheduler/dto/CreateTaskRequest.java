package com.example.callbackscheduler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for scheduling a callback
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateTaskRequest {

    /**
     * Absolute Unix timestamp (multiple of 60) or relative "+N[m|h|d]"
     */
    @JsonProperty("trigger_at")
    private String triggerAt;

    @Size(max = 160, message = "tag must be at most 160 characters")
    private String tag;

    private String payload;

    @JsonProperty("callback")
    @Size(max = 2048, message = "callback must be at most 2048 characters")
    private String callback;

    /**
     * GET, POST, PUT or DELETE; GET when omitted
     */
    @JsonProperty("callback_method")
    private String callbackMethod;

    private Integer retry;

    @JsonProperty("expected_http_status")
    private Integer expectedHttpStatus;

    /**
     * Minutes after trigger_at during which the callback may still run
     */
    @JsonProperty("max_delay")
    private Integer maxDelay;
}
