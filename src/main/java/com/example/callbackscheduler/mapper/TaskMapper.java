package com.example.callbackscheduler.mapper;

import com.example.callbackscheduler.domain.entity.CallbackTask;
import com.example.callbackscheduler.domain.entity.TaskIdentifier;
import com.example.callbackscheduler.dto.TaskResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting between entities and DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE, imports = TaskIdentifier.class)
public interface TaskMapper {

    @Mapping(target = "taskId", expression = "java(TaskIdentifier.format(task))")
    TaskResponse toResponse(CallbackTask task);

    List<TaskResponse> toResponseList(List<CallbackTask> tasks);
}
