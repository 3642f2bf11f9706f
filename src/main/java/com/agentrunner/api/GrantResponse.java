package com.agentrunner.api;

import com.agentrunner.entity.GrantScope;

import java.util.UUID;

public record GrantResponse(
        String automationId,
        UUID agentId,
        GrantScope scope
) {
}
