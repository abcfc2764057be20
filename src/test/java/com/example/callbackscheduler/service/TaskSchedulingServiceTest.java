package com.example.callbackscheduler.service;

import com.example.callbackscheduler.domain.entity.CallbackTask;
import com.example.callbackscheduler.domain.entity.TaskKey;
import com.example.callbackscheduler.domain.enums.CallbackMethod;
import com.example.callbackscheduler.domain.enums.TaskState;
import com.example.callbackscheduler.domain.store.TaskFilter;
import com.example.callbackscheduler.domain.store.TaskPage;
import com.example.callbackscheduler.domain.store.TaskStore;
import com.example.callbackscheduler.dto.CreateTaskRequest;
import com.example.callbackscheduler.exception.InvalidTaskException;
import com.example.callbackscheduler.exception.TaskLookupException;
import com.example.callbackscheduler.exception.TaskNotFoundException;
import com.example.callbackscheduler.exception.TaskStoreException;
import com.example.callbackscheduler.exception.ValidationError;
import com.example.callbackscheduler.mapper.TaskMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static com.example.callbackscheduler.support.TestTasks.CALLBACK_URL;
import static com.example.callbackscheduler.support.TestTasks.NOW_MINUTE;
import static com.example.callbackscheduler.support.TestTasks.fixedClock;
import static com.example.callbackscheduler.support.TestTasks.task;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("TaskSchedulingService Tests")
class TaskSchedulingServiceTest {

    private static final TaskStoreException STORE_DOWN = new TaskStoreException("query", new RuntimeException("connection refused"));

    @Mock
    private TaskStore taskStore;

    @Spy
    private TaskMapper taskMapper = Mappers.getMapper(TaskMapper.class);

    @Captor
    private ArgumentCaptor<CallbackTask> taskCaptor;

    private TaskSchedulingService schedulingService;

    @BeforeEach
    void setUp() {
        schedulingService = new TaskSchedulingService(taskStore, taskMapper, fixedClock());
    }

    private CreateTaskRequest.CreateTaskRequestBuilder validRequest() {
        return CreateTaskRequest.builder()
                .tag("report")
                .triggerAt("+1m")
                .callback(CALLBACK_URL);
    }

    @Nested
    @DisplayName("createTask Tests")
    class CreateTaskTests {

        @Test
        @DisplayName("Should store a normalized task with defaults")
        void shouldCreateTaskWithDefaults() {
            // Given
            when(taskStore.put(any())).thenAnswer(invocation -> invocation.getArgument(0));

            // When
            var taskId = schedulingService.createTask(validRequest().build());

            // Then
            verify(taskStore).put(taskCaptor.capture());
            var stored = taskCaptor.getValue();
            assertThat(stored.getTriggerAt()).isEqualTo(NOW_MINUTE + 60);
            assertThat(stored.getTaskState()).isEqualTo(TaskState.PENDING);
            assertThat(stored.getCallbackMethod()).isEqualTo(CallbackMethod.GET);
            assertThat(stored.getRetry()).isEqualTo(1);
            assertThat(stored.getExpectedHttpStatus()).isEqualTo(200);
            assertThat(stored.getMaxDelay()).isEqualTo(10);
            assertThat(stored.getUuid()).hasSize(32);
            assertThat(stored.getTagUuid()).isEqualTo("report+" + stored.getUuid());
            assertThat(taskId).isEqualTo("report+" + stored.getUuid() + "@" + (NOW_MINUTE + 60));
        }

        @Test
        @DisplayName("Should keep explicitly provided options")
        void shouldKeepProvidedOptions() {
            // Given
            var request = validRequest()
                    .triggerAt(String.valueOf(NOW_MINUTE + 600))
                    .callbackMethod("POST")
                    .payload("a=1")
                    .retry(5)
                    .expectedHttpStatus(204)
                    .maxDelay(3)
                    .build();
            when(taskStore.put(any())).thenAnswer(invocation -> invocation.getArgument(0));

            // When
            schedulingService.createTask(request);

            // Then
            verify(taskStore).put(taskCaptor.capture());
            var stored = taskCaptor.getValue();
            assertThat(stored.getTriggerAt()).isEqualTo(NOW_MINUTE + 600);
            assertThat(stored.getCallbackMethod()).isEqualTo(CallbackMethod.POST);
            assertThat(stored.getPayload()).isEqualTo("a=1");
            assertThat(stored.getRetry()).isEqualTo(5);
            assertThat(stored.getExpectedHttpStatus()).isEqualTo(204);
            assertThat(stored.getMaxDelay()).isEqualTo(3);
        }

        @Test
        @DisplayName("Should give the same tag a distinct reference each time")
        void shouldGenerateDistinctReferences() {
            // Given
            when(taskStore.put(any())).thenAnswer(invocation -> invocation.getArgument(0));

            // When
            var first = schedulingService.createTask(validRequest().build());
            var second = schedulingService.createTask(validRequest().build());

            // Then
            assertThat(first).isNotEqualTo(second);
        }

        @Test
        @DisplayName("Should reject an unsupported method")
        void shouldRejectUnsupportedMethod() {
            var request = validRequest().callbackMethod("PATCH").build();

            assertThatThrownBy(() -> schedulingService.createTask(request))
                    .isInstanceOf(InvalidTaskException.class)
                    .extracting("error").isEqualTo(ValidationError.UNSUPPORTED_METHOD);
            verifyNoInteractions(taskStore);
        }

        @Test
        @DisplayName("Should reject a request without a callback")
        void shouldRejectIncompleteTask() {
            var request = validRequest().callback(null).build();

            assertThatThrownBy(() -> schedulingService.createTask(request))
                    .isInstanceOf(InvalidTaskException.class)
                    .extracting("error").isEqualTo(ValidationError.INCOMPLETE_TASK);
            verifyNoInteractions(taskStore);
        }

        @Test
        @DisplayName("Should reject a tag with separators")
        void shouldRejectInvalidTag() {
            var request = validRequest().tag("daily-report").build();

            assertThatThrownBy(() -> schedulingService.createTask(request))
                    .isInstanceOf(InvalidTaskException.class)
                    .extracting("error").isEqualTo(ValidationError.INVALID_TAG);
        }

        @Test
        @DisplayName("Should reject a timestamp off the minute boundary")
        void shouldRejectUnalignedTimestamp() {
            var request = validRequest().triggerAt(String.valueOf(NOW_MINUTE + 90)).build();

            assertThatThrownBy(() -> schedulingService.createTask(request))
                    .isInstanceOf(InvalidTaskException.class)
                    .extracting("error").isEqualTo(ValidationError.INVALID_TIME_SPEC);
        }

        @Test
        @DisplayName("Should reject a negative retry count")
        void shouldRejectNegativeRetry() {
            var request = validRequest().retry(-1).build();

            assertThatThrownBy(() -> schedulingService.createTask(request))
                    .isInstanceOf(InvalidTaskException.class)
                    .extracting("error").isEqualTo(ValidationError.NEGATIVE_FIELD);
        }

        @Test
        @DisplayName("Should propagate a store failure")
        void shouldPropagateStoreFailure() {
            when(taskStore.put(any())).thenThrow(STORE_DOWN);

            assertThatThrownBy(() -> schedulingService.createTask(validRequest().build()))
                    .isSameAs(STORE_DOWN);
        }
    }

    @Nested
    @DisplayName("rescheduleTasks Tests")
    class RescheduleTasksTests {

        private final CallbackTask failedEarly = task("report", "a1", NOW_MINUTE - 600, TaskState.FAILED);
        private final CallbackTask succeeded = task("report", "b2", NOW_MINUTE - 300, TaskState.SUCCESSFUL);
        private final CallbackTask failedLate = task("report", "c3", NOW_MINUTE - 60, TaskState.FAILED);

        @BeforeEach
        void setUp() {
            lenient().when(taskStore.put(any())).thenAnswer(invocation -> invocation.getArgument(0));
        }

        @Test
        @DisplayName("Should copy only failed occurrences of a tag")
        void shouldRescheduleFailedOnly() {
            // Given
            when(taskStore.queryByTag("report", TaskFilter.none(), null))
                    .thenReturn(new TaskPage(List.of(failedEarly, succeeded, failedLate), null));

            // When
            var result = schedulingService.rescheduleTasks("report", "+5m", false);

            // Then
            assertThat(result).hasSize(2);
            verify(taskStore, times(2)).put(taskCaptor.capture());
            assertThat(taskCaptor.getAllValues())
                    .extracting(CallbackTask::getTagUuid)
                    .containsExactly("report+a1", "report+c3");
            assertThat(taskCaptor.getAllValues())
                    .allSatisfy(copy -> {
                        assertThat(copy.getTriggerAt()).isEqualTo(NOW_MINUTE + 300);
                        assertThat(copy.getTaskState()).isEqualTo(TaskState.PENDING);
                        assertThat(copy.getResponseStatus()).isNull();
                    });
            assertThat(result).extracting("taskId")
                    .containsExactly("report+a1@" + (NOW_MINUTE + 300), "report+c3@" + (NOW_MINUTE + 300));
        }

        @Test
        @DisplayName("Should copy every occurrence when all is requested")
        void shouldRescheduleAll() {
            // Given
            when(taskStore.queryByTag("report", TaskFilter.none(), null))
                    .thenReturn(new TaskPage(List.of(failedEarly, succeeded, failedLate), null));

            // When
            var result = schedulingService.rescheduleTasks("report", "+5m", true);

            // Then
            assertThat(result).hasSize(3);
            verify(taskStore, times(3)).put(any());
        }

        @Test
        @DisplayName("Should leave the original rows untouched")
        void shouldNotModifyOriginals() {
            // Given
            when(taskStore.queryByTag("report", TaskFilter.none(), null))
                    .thenReturn(new TaskPage(List.of(failedEarly), null));

            // When
            schedulingService.rescheduleTasks("report", "+5m", false);

            // Then
            assertThat(failedEarly.getTriggerAt()).isEqualTo(NOW_MINUTE - 600);
            assertThat(failedEarly.getTaskState()).isEqualTo(TaskState.FAILED);
        }

        @Test
        @DisplayName("Should read every page of a tag")
        void shouldCollectAllPages() {
            // Given
            when(taskStore.queryByTag("report", TaskFilter.none(), null))
                    .thenReturn(new TaskPage(List.of(failedEarly), failedEarly.key()));
            when(taskStore.queryByTag("report", TaskFilter.none(), failedEarly.key()))
                    .thenReturn(new TaskPage(List.of(failedLate), null));

            // When
            var result = schedulingService.rescheduleTasks("report", "+5m", false);

            // Then
            assertThat(result).hasSize(2);
        }

        @Test
        @DisplayName("Should default to the next minute")
        void shouldDefaultToNextMinute() {
            // Given
            when(taskStore.get(failedEarly.key())).thenReturn(Optional.of(failedEarly));

            // When
            var result = schedulingService.rescheduleTasks("report+a1@" + (NOW_MINUTE - 600), null, false);

            // Then
            assertThat(result).singleElement()
                    .satisfies(copy -> assertThat(copy.getTriggerAt()).isEqualTo(NOW_MINUTE + 60));
        }

        @Test
        @DisplayName("Should fail when an exact reference matches nothing")
        void shouldFailOnMissingExactReference() {
            when(taskStore.get(any())).thenReturn(Optional.empty());

            assertThatThrownBy(() -> schedulingService.rescheduleTasks("report+zz@" + NOW_MINUTE, null, false))
                    .isInstanceOf(TaskNotFoundException.class);
            verify(taskStore, never()).put(any());
        }

        @Test
        @DisplayName("Should fail when a tag has no task at the given minute")
        void shouldFailOnEmptyMinute() {
            var atMinute = TaskFilter.builder().minTriggerAt(NOW_MINUTE).maxTriggerAt(NOW_MINUTE).build();
            when(taskStore.queryByTag("report", atMinute, null)).thenReturn(new TaskPage(List.of(), null));

            assertThatThrownBy(() -> schedulingService.rescheduleTasks("report@" + NOW_MINUTE, null, false))
                    .isInstanceOf(TaskNotFoundException.class);
        }

        @Test
        @DisplayName("Should report a lookup failure")
        void shouldReportLookupFailure() {
            when(taskStore.queryByTag(any(), any(), isNull())).thenThrow(STORE_DOWN);

            assertThatThrownBy(() -> schedulingService.rescheduleTasks("report", null, false))
                    .isInstanceOf(TaskLookupException.class)
                    .hasMessage(TaskLookupException.MESSAGE);
        }

        @Test
        @DisplayName("Should stop at the first copy that cannot be stored")
        void shouldStopOnPutFailure() {
            // Given
            when(taskStore.queryByTag("report", TaskFilter.none(), null))
                    .thenReturn(new TaskPage(List.of(failedEarly, failedLate), null));
            when(taskStore.put(any())).thenThrow(STORE_DOWN);

            // When / Then
            assertThatThrownBy(() -> schedulingService.rescheduleTasks("report", null, false))
                    .isInstanceOf(TaskStoreException.class);
            verify(taskStore, times(1)).put(any());
        }

        @Test
        @DisplayName("Should reject an invalid new trigger time")
        void shouldRejectInvalidTriggerTime() {
            assertThatThrownBy(() -> schedulingService.rescheduleTasks("report", "tomorrow", false))
                    .isInstanceOf(InvalidTaskException.class)
                    .extracting("error").isEqualTo(ValidationError.INVALID_TIME_SPEC);
            verifyNoInteractions(taskStore);
        }
    }

    @Nested
    @DisplayName("getStatus Tests")
    class GetStatusTests {

        private final CallbackTask first = task("report", "a1", NOW_MINUTE - 60, TaskState.SUCCESSFUL);
        private final CallbackTask second = task("report", "b2", NOW_MINUTE + 60, TaskState.PENDING);

        @Test
        @DisplayName("Should return the single task for an exact reference")
        void shouldReturnExactTask() {
            // Given
            when(taskStore.get(new TaskKey(NOW_MINUTE - 60, "report+a1"))).thenReturn(Optional.of(first));

            // When
            var page = schedulingService.getStatus("report+a1@" + (NOW_MINUTE - 60), null, false);

            // Then
            assertThat(page.getTasks()).singleElement().satisfies(response -> {
                assertThat(response.getTaskId()).isEqualTo("report+a1@" + (NOW_MINUTE - 60));
                assertThat(response.getTaskState()).isEqualTo(TaskState.SUCCESSFUL);
                assertThat(response.getCallbackEndpoint()).isEqualTo(CALLBACK_URL);
            });
            assertThat(page.getNext()).isNull();
        }

        @Test
        @DisplayName("Should fail when an exact reference matches nothing")
        void shouldFailOnMissingTask() {
            when(taskStore.get(any())).thenReturn(Optional.empty());

            assertThatThrownBy(() -> schedulingService.getStatus("report+a1@" + NOW_MINUTE, null, false))
                    .isInstanceOf(TaskNotFoundException.class);
        }

        @Test
        @DisplayName("Should list every occurrence of a tag with a next cursor")
        void shouldListTagWithCursor() {
            // Given
            when(taskStore.queryByTag("report", TaskFilter.none(), null))
                    .thenReturn(new TaskPage(List.of(first, second), second.key()));

            // When
            var page = schedulingService.getStatus("report", null, false);

            // Then
            assertThat(page.getTasks()).hasSize(2);
            assertThat(page.getNext()).isEqualTo("report+b2@" + (NOW_MINUTE + 60));
        }

        @Test
        @DisplayName("Should resume after the start_from reference")
        void shouldResumeFromCursor() {
            // Given
            when(taskStore.queryByTag("report", TaskFilter.none(), second.key()))
                    .thenReturn(new TaskPage(List.of(), null));

            // When
            var page = schedulingService.getStatus("report", "report+b2@" + (NOW_MINUTE + 60), false);

            // Then
            assertThat(page.getTasks()).isEmpty();
            assertThat(page.getNext()).isNull();
        }

        @Test
        @DisplayName("Should only list future tasks when requested")
        void shouldFilterFutureOnly() {
            // Given
            var future = TaskFilter.builder().minTriggerAt(NOW_MINUTE + 1).build();
            when(taskStore.queryByTag("report", future, null)).thenReturn(new TaskPage(List.of(second), null));

            // When
            var page = schedulingService.getStatus("report", null, true);

            // Then
            assertThat(page.getTasks()).extracting("taskId").containsExactly("report+b2@" + (NOW_MINUTE + 60));
        }

        @Test
        @DisplayName("Should list one tag at one minute")
        void shouldListTagAtMinute() {
            // Given
            var atMinute = TaskFilter.builder().minTriggerAt(NOW_MINUTE + 60).maxTriggerAt(NOW_MINUTE + 60).build();
            when(taskStore.queryByTag("report", atMinute, null)).thenReturn(new TaskPage(List.of(second), null));

            // When
            var page = schedulingService.getStatus("report@" + (NOW_MINUTE + 60), null, false);

            // Then
            assertThat(page.getTasks()).hasSize(1);
        }

        @Test
        @DisplayName("Should keep only the referenced task when a suffix is given without a minute")
        void shouldFilterBySuffix() {
            // Given
            when(taskStore.queryByTag("report", TaskFilter.none(), null))
                    .thenReturn(new TaskPage(List.of(first, second), null));

            // When
            var page = schedulingService.getStatus("report+b2", null, false);

            // Then
            assertThat(page.getTasks()).extracting("uuid").containsExactly("b2");
        }

        @Test
        @DisplayName("Should scan all tasks for an empty reference")
        void shouldScanAllTasks() {
            // Given
            var other = task("backup", "c3", NOW_MINUTE, TaskState.PENDING);
            when(taskStore.scan(TaskFilter.none(), null)).thenReturn(new TaskPage(List.of(first, other), null));

            // When
            var page = schedulingService.getStatus(null, null, false);

            // Then
            assertThat(page.getTasks()).extracting("tag").containsExactly("report", "backup");
            verify(taskStore, never()).queryByTag(any(), any(), any());
        }

        @Test
        @DisplayName("Should reject a start_from that is not a task reference")
        void shouldRejectInvalidCursor() {
            assertThatThrownBy(() -> schedulingService.getStatus("report", "report", false))
                    .isInstanceOf(InvalidTaskException.class)
                    .extracting("error").isEqualTo(ValidationError.INVALID_IDENTIFIER);
            verifyNoInteractions(taskStore);
        }

        @Test
        @DisplayName("Should reject a malformed reference")
        void shouldRejectMalformedReference() {
            assertThatThrownBy(() -> schedulingService.getStatus("report@soon", null, false))
                    .isInstanceOf(InvalidTaskException.class)
                    .extracting("error").isEqualTo(ValidationError.INVALID_IDENTIFIER);
        }

        @Test
        @DisplayName("Should hide store details behind a lookup failure")
        void shouldReportLookupFailure() {
            when(taskStore.scan(any(), isNull())).thenThrow(STORE_DOWN);

            assertThatThrownBy(() -> schedulingService.getStatus("", null, false))
                    .isInstanceOf(TaskLookupException.class)
                    .hasMessage("failed to retrieve status")
                    .hasCause(STORE_DOWN);
        }
    }
}
