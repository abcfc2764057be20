package com.example.callbackscheduler.controller;

import com.example.callbackscheduler.dto.ApiResponse;
import com.example.callbackscheduler.dto.CreateTaskRequest;
import com.example.callbackscheduler.dto.CreateTaskResponse;
import com.example.callbackscheduler.dto.TaskResponse;
import com.example.callbackscheduler.dto.TaskStatusPage;
import com.example.callbackscheduler.service.TaskSchedulingService;
import com.example.callbackscheduler.service.executor.CatchupScannerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API controller for scheduling callbacks.
 * <p>
 * Task references have the form {@code <tag>[+<uuid>][@<trigger_at>]}. Flags
 * such as {@code all} and {@code future_only} are enabled by their presence
 * unless given the value {@code false}.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/tasks")
@Tag(name = "Callback Tasks", description = "APIs for scheduling and inspecting callbacks")
public class TaskController {

    private final TaskSchedulingService schedulingService;
    private final CatchupScannerService catchupScannerService;

    // === Task Creation ===

    @PostMapping
    @Operation(summary = "Schedule a callback", description = "Create a task that calls back at the given minute")
    public ResponseEntity<ApiResponse<CreateTaskResponse>> createTask(@Valid @RequestBody CreateTaskRequest request) {
        log.info("API: Create task request for tag {} at {}", request.getTag(), request.getTriggerAt());

        var taskId = schedulingService.createTask(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(new CreateTaskResponse(taskId), "Task created successfully"));
    }

    // === Rescheduling ===

    @PostMapping("/reschedule/{ref}")
    @Operation(summary = "Reschedule tasks", description = "Copy failed (or all) occurrences of a task to a new minute")
    public ResponseEntity<ApiResponse<List<TaskResponse>>> rescheduleTasks(
            @Parameter(description = "Task reference: tag, tag@trigger_at or tag+uuid@trigger_at") @PathVariable String ref,
            @Parameter(description = "New trigger time, absolute or relative; next minute when omitted")
            @RequestParam(name = "trigger_at", required = false) String triggerAt,
            @Parameter(description = "Reschedule every occurrence, not only failed ones")
            @RequestParam(name = "all", required = false) String all) {
        log.info("API: Reschedule {} to {} (all: {})", ref, triggerAt, isSet(all));

        var tasks = schedulingService.rescheduleTasks(ref, triggerAt, isSet(all));
        return ResponseEntity.ok(ApiResponse.success(tasks, String.format("Rescheduled %d tasks", tasks.size())));
    }

    // === Status ===

    @GetMapping({"/status", "/status/{ref}"})
    @Operation(summary = "Task status", description = "Status of one task, every occurrence of a tag, or all tasks, paginated")
    public ResponseEntity<ApiResponse<TaskStatusPage>> getStatus(
            @Parameter(description = "Task reference; all tasks when omitted") @PathVariable(required = false) String ref,
            @Parameter(description = "The next value of the previous page; percent-encode it, since '+' in a query string decodes to a space (report%2Babc123%401700000100)")
            @RequestParam(name = "start_from", required = false) String startFrom,
            @Parameter(description = "Only list tasks triggering after the current minute")
            @RequestParam(name = "future_only", required = false) String futureOnly) {

        var page = schedulingService.getStatus(ref, startFrom, isSet(futureOnly));
        return ResponseEntity.ok(ApiResponse.success(page));
    }

    // === Recovery ===

    @PostMapping("/catchup")
    @Operation(summary = "Run catchup", description = "Dispatch pending tasks whose minute has passed; callbacks complete asynchronously")
    public ResponseEntity<ApiResponse<Integer>> catchup() {
        log.info("API: Catchup requested");

        var dispatched = catchupScannerService.catchup();
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.success(dispatched, String.format("Dispatched %d tasks", dispatched)));
    }

    private static boolean isSet(String flag) {
        return flag != null && !"false".equalsIgnoreCase(flag);
    }
}
