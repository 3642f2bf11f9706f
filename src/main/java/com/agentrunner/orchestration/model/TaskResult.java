package com.agentrunner.orchestration.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResult(
        TaskStatus status,
        String summary,
        List<TaskStep> steps,
        String message
) {

    public static TaskResult completed(String summary, List<TaskStep> steps) {
        return new TaskResult(TaskStatus.COMPLETED, summary, List.copyOf(steps), null);
    }

    public static TaskResult error(String message) {
        return new TaskResult(TaskStatus.ERROR, null, List.of(), message);
    }

    public boolean isCompleted() {
        return status == TaskStatus.COMPLETED;
    }
}
