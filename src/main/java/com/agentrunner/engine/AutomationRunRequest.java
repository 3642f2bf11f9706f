package com.agentrunner.engine;

import java.util.Map;
import java.util.UUID;

public record AutomationRunRequest(
        String automationId,
        String endpointUrl,
        UUID triggeredBy,
        String entryPoint,
        ExecutionMode mode,
        Map<String, Object> seedInput
) {
}
