package com.agentrunner.api;

import com.agentrunner.entity.AgentIdentity;

import java.util.UUID;

public record AgentResponse(
        UUID id,
        String firstName,
        String lastName,
        String email,
        String avatar
) {

    public static AgentResponse from(AgentIdentity agent) {
        return new AgentResponse(agent.getId(), agent.getFirstName(), agent.getLastName(),
                agent.getEmail(), agent.getAvatar());
    }
}
