package com.agentrunner.orchestration.model;

import java.util.Map;

public record ExecutionObservation(
        String automationId,
        String runId,
        boolean success,
        Map<String, Object> resultData
) {
}
