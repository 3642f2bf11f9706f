package com.agentrunner.api;

import com.agentrunner.orchestration.model.EntryPointDefinition;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

public record RegisterAutomationRequest(
        @NotBlank @Size(max = 64) String id,
        @NotBlank String name,
        boolean active,
        String endpointUrl,
        @NotNull List<@Valid EntryPointRequest> entryPoints
) {

    public record EntryPointRequest(
            @NotBlank String name,
            @NotBlank String type,
            boolean disabled
    ) {
        EntryPointDefinition toDefinition() {
            return new EntryPointDefinition(name, type, disabled);
        }
    }

    public List<EntryPointDefinition> entryPointDefinitions() {
        return entryPoints.stream().map(EntryPointRequest::toDefinition).toList();
    }
}
