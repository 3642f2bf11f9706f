package com.agentrunner.orchestration.api;

import com.agentrunner.entity.AgentIdentity;
import com.agentrunner.orchestration.model.ExecutionObservation;

public interface AutomationExecutionService {

    /**
     * Runs an automation on behalf of an agent and waits for its result.
     *
     * @param agent The agent triggering the run; it must hold EXECUTE rights on the automation.
     * @param automationId The automation to run.
     * @param seedPrompt Text offered to entry points that accept a message.
     * @return The outcome of the run.
     * @throws AutomationNotFoundException if the automation is missing or not executable by the agent.
     * @throws UnsupportedAutomationException if no enabled entry point can be seeded.
     * @throws AutomationTimeoutException if the run does not finish within the configured timeout.
     */
    ExecutionObservation run(AgentIdentity agent, String automationId, String seedPrompt);
}
