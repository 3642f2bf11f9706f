package com.agentrunner.api;

import com.agentrunner.entity.Automation;
import com.agentrunner.entity.AutomationEntryPoint;

import java.util.List;

public record AutomationResponse(
        String id,
        String name,
        boolean active,
        String endpointUrl,
        List<EntryPointResponse> entryPoints
) {

    public record EntryPointResponse(String name, String type, boolean disabled) {
        static EntryPointResponse from(AutomationEntryPoint entryPoint) {
            return new EntryPointResponse(entryPoint.getName(), entryPoint.getType(), entryPoint.isDisabled());
        }
    }

    public static AutomationResponse from(Automation automation) {
        return new AutomationResponse(automation.getId(), automation.getName(), automation.isActive(),
                automation.getEndpointUrl(),
                automation.getEntryPoints().stream().map(EntryPointResponse::from).toList());
    }
}
