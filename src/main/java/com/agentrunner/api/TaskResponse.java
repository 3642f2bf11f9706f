package com.agentrunner.api;

import com.agentrunner.orchestration.model.TaskResult;
import com.agentrunner.orchestration.model.TaskStatus;
import com.agentrunner.orchestration.model.TaskStep;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        String requestId,
        Instant createdAt,
        TaskStatus status,
        String summary,
        List<TaskStep> steps,
        String message
) {

    public static TaskResponse from(TaskResult result) {
        return new TaskResponse(UUID.randomUUID().toString(), Instant.now(),
                result.status(), result.summary(), result.steps(), result.message());
    }
}
