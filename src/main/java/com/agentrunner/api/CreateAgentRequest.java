package com.agentrunner.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateAgentRequest(
        @NotBlank @Size(max = 100) String firstName,
        @Size(max = 100) String lastName,
        String avatar
) {
}
