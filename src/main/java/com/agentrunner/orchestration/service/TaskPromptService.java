package com.agentrunner.orchestration.service;

import static com.agentrunner.orchestration.OrchestrationConstants.*;

import com.agentrunner.config.AgentRunnerProperties;
import com.agentrunner.orchestration.model.AutomationSummary;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders the system instruction for one agent at one delegation depth. The action
 * vocabulary in the prompt and in corrective observations comes from the same place, so
 * the model is never told about an action it cannot use.
 */
@Service
@RequiredArgsConstructor
public class TaskPromptService {

    private final AgentRunnerProperties properties;

    public boolean canDelegate(int depth) {
        return depth < properties.getMaxDelegationDepth();
    }

    public String systemPrompt(String agentName, List<AutomationSummary> automations, List<String> peerNames, int depth) {
        String automationList = automations.isEmpty()
                ? NO_AUTOMATIONS
                : automations.stream()
                        .map(a -> "- %s (id: %s, active: %s)".formatted(a.name(), a.id(), a.active()))
                        .collect(Collectors.joining("\n"));
        String delegationSection = "";
        if (canDelegate(depth) && !peerNames.isEmpty()) {
            String peerList = peerNames.stream()
                    .map(name -> "- " + name)
                    .collect(Collectors.joining("\n"));
            delegationSection = DELEGATION_SECTION_TEMPLATE.formatted(peerList);
        }
        return SYSTEM_PROMPT_TEMPLATE.formatted(agentName, automationList, delegationSection, legalActions(depth));
    }

    public String legalActions(int depth) {
        if (canDelegate(depth)) {
            return "\"%s\", \"%s\", or \"%s\"".formatted(ACTION_RUN_AUTOMATION, ACTION_DELEGATE, ACTION_COMPLETE);
        }
        return "\"%s\" or \"%s\"".formatted(ACTION_RUN_AUTOMATION, ACTION_COMPLETE);
    }

    public String unknownActionObservation(int depth) {
        return UNKNOWN_ACTION_OBSERVATION.formatted(legalActions(depth));
    }
}
