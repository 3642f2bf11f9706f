package com.agentrunner.api;

import com.agentrunner.entity.GrantScope;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public record GrantRequest(
        @NotNull UUID agentId,
        @NotNull GrantScope scope
) {
}
