package com.agentrunner.api;

import jakarta.validation.constraints.NotBlank;

public record TaskRequest(
        @NotBlank String prompt
) {
}
