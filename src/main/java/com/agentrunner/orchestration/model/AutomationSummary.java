package com.agentrunner.orchestration.model;

public record AutomationSummary(
        String id,
        String name,
        boolean active
) {
}
