package com.agentrunner.api;

import jakarta.validation.constraints.Size;

/**
 * Fields left {@code null} are not changed. An empty avatar clears it.
 */
public record UpdateAgentRequest(
        @Size(max = 100) String firstName,
        String avatar
) {
}
