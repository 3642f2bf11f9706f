package com.agentrunner.orchestration.model;

import java.util.List;
import java.util.UUID;

public record AgentCapabilities(
        UUID agentId,
        String agentName,
        List<AutomationSummary> automations
) {
}
