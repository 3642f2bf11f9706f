package com.agentrunner.engine;

import com.agentrunner.entity.RunStatus;

import java.util.Map;

public record RunResult(
        String runId,
        RunStatus status,
        Map<String, Object> resultData
) {
}
