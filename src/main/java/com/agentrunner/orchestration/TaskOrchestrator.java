package com.agentrunner.orchestration;

import static com.agentrunner.orchestration.OrchestrationConstants.*;

import com.agentrunner.config.AgentRunnerProperties;
import com.agentrunner.entity.AgentIdentity;
import com.agentrunner.orchestration.api.AutomationExecutionService;
import com.agentrunner.orchestration.api.CompletionClient;
import com.agentrunner.orchestration.model.AutomationSummary;
import com.agentrunner.orchestration.model.ConversationMessage;
import com.agentrunner.orchestration.model.ExecutionObservation;
import com.agentrunner.orchestration.model.StepKind;
import com.agentrunner.orchestration.model.StepOutcome;
import com.agentrunner.orchestration.model.TaskAction;
import com.agentrunner.orchestration.model.TaskAction.Complete;
import com.agentrunner.orchestration.model.TaskAction.Delegate;
import com.agentrunner.orchestration.model.TaskAction.RunAutomation;
import com.agentrunner.orchestration.model.TaskAction.Unrecognized;
import com.agentrunner.orchestration.model.TaskResult;
import com.agentrunner.orchestration.model.TaskStep;
import com.agentrunner.orchestration.service.ActionParser;
import com.agentrunner.orchestration.service.AgentDirectoryService;
import com.agentrunner.orchestration.service.AutomationCatalogService;
import com.agentrunner.orchestration.service.JsonProcessingService;
import com.agentrunner.orchestration.service.PeerResolutionService;
import com.agentrunner.orchestration.service.TaskMetricsService;
import com.agentrunner.orchestration.service.TaskPromptService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one agent task: asks the model for one action per turn, performs it, feeds the
 * outcome back as an observation, and stops on completion or when the iteration budget is
 * spent. Delegation recurses with {@code depth + 1} and is only offered below the configured
 * maximum depth.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaskOrchestrator {

    private final AgentRunnerProperties properties;
    private final AgentDirectoryService agentDirectoryService;
    private final AutomationCatalogService automationCatalogService;
    private final PeerResolutionService peerResolutionService;
    private final TaskPromptService taskPromptService;
    private final CompletionClient completionClient;
    private final ActionParser actionParser;
    private final AutomationExecutionService automationExecutionService;
    private final JsonProcessingService jsonProcessingService;
    private final TaskMetricsService metricsService;

    public TaskResult executeTask(UUID agentId, String prompt, int depth) {
        Optional<AgentIdentity> maybeAgent = agentDirectoryService.findAgentById(agentId);
        if (maybeAgent.isEmpty()) {
            log.warn("Task rejected: agent {} not found", agentId);
            return finish(agentId, depth, TaskResult.error(AGENT_NOT_FOUND_MESSAGE.formatted(agentId)));
        }
        if (!properties.hasCompletionCredential()) {
            log.warn("Task rejected for agent {}: no credential for provider {}", agentId, properties.getAiProvider());
            return finish(agentId, depth, TaskResult.error(
                    MISSING_CREDENTIAL_MESSAGE.formatted(properties.getAiProvider().name().toLowerCase())));
        }
        AgentIdentity agent = maybeAgent.get();
        boolean canDelegate = taskPromptService.canDelegate(depth);

        List<AutomationSummary> automations = automationCatalogService.listAutomationsVisibleTo(agentId);
        List<String> peerNames = canDelegate
                ? agentDirectoryService.listPeerAgents(agentId).stream().map(AgentIdentity::getFirstName).toList()
                : List.of();
        String systemPrompt = taskPromptService.systemPrompt(agent.displayName(), automations, peerNames, depth);

        List<ConversationMessage> transcript = new ArrayList<>();
        transcript.add(ConversationMessage.system(systemPrompt));
        transcript.add(ConversationMessage.human(prompt));
        List<TaskStep> steps = new ArrayList<>();

        log.info("Starting task for agent {} at depth {} ({} automation(s), {} peer(s))",
                agent.displayName(), depth, automations.size(), peerNames.size());

        for (int iteration = 1; iteration <= properties.getMaxIterations(); iteration++) {
            metricsService.recordModelRequest(agentId, depth, iteration);
            String reply = completionClient.complete(List.copyOf(transcript));
            transcript.add(ConversationMessage.model(reply));

            TaskAction action = actionParser.parse(reply);
            if (action instanceof Unrecognized unrecognized && !unrecognized.structured()) {
                log.info("Agent {} replied without an action; treating the reply as the summary", agent.displayName());
                return finish(agentId, depth, TaskResult.completed(unrecognized.raw(), steps));
            }
            if (action instanceof Complete complete) {
                return finish(agentId, depth, TaskResult.completed(complete.summary(), steps));
            }
            String observation;
            if (action instanceof RunAutomation runAutomation) {
                observation = runAutomation(agent, runAutomation, automations, prompt, steps);
            } else if (action instanceof Delegate delegate && canDelegate) {
                observation = delegate(agent, delegate, depth, peerNames, steps);
            } else {
                log.info("Agent {} sent an unusable action at depth {}", agent.displayName(), depth);
                observation = taskPromptService.unknownActionObservation(depth);
            }
            transcript.add(ConversationMessage.human(OBSERVATION_PREFIX + observation));
        }

        log.warn("Agent {} reached the iteration limit of {}", agent.displayName(), properties.getMaxIterations());
        return finish(agentId, depth, TaskResult.completed(MAX_ITERATIONS_SUMMARY, steps));
    }

    private String runAutomation(AgentIdentity agent, RunAutomation action, List<AutomationSummary> automations,
                                 String prompt, List<TaskStep> steps) {
        String automationName = automationName(automations, action.automationId());
        log.info("Agent {} runs automation {}{}", agent.displayName(), action.automationId(),
                StringUtils.hasText(action.rationale()) ? " (" + action.rationale() + ")" : "");
        StepOutcome outcome;
        String observation;
        try {
            ExecutionObservation result = automationExecutionService.run(agent, action.automationId(), prompt);
            outcome = result.success() ? StepOutcome.SUCCESS : StepOutcome.FAILED;
            String resultJson = jsonProcessingService.truncate(jsonProcessingService.toJson(result.resultData()),
                    properties.getObservationMaxLength());
            observation = AUTOMATION_EXECUTED_OBSERVATION.formatted(automationName, resultJson);
        } catch (RuntimeException ex) {
            log.warn("Automation {} failed for agent {}: {}", action.automationId(), agent.displayName(), ex.getMessage());
            outcome = StepOutcome.ERROR;
            observation = AUTOMATION_FAILED_OBSERVATION.formatted(ex.getMessage());
        }
        steps.add(new TaskStep(StepKind.RUN_AUTOMATION, automationName, outcome));
        metricsService.recordAutomationRun(action.automationId(), outcome);
        return observation;
    }

    // Unlisted ids are reported as given.
    private static String automationName(List<AutomationSummary> automations, String automationId) {
        return automations.stream()
                .filter(a -> a.id().equals(automationId) && StringUtils.hasText(a.name()))
                .map(AutomationSummary::name)
                .findFirst()
                .orElse(automationId);
    }

    private String delegate(AgentIdentity agent, Delegate action, int depth, List<String> peerNames, List<TaskStep> steps) {
        Optional<AgentIdentity> peer = peerResolutionService.findPeer(agent.getId(), action.peerName());
        if (peer.isEmpty()) {
            log.info("Agent {} tried to delegate to unknown peer '{}'", agent.displayName(), action.peerName());
            return PEER_NOT_FOUND_OBSERVATION.formatted(action.peerName(), String.join(", ", peerNames));
        }
        int childDepth = depth + 1;
        log.info("Agent {} delegates to {} at depth {}", agent.displayName(), peer.get().displayName(), childDepth);
        StepOutcome outcome;
        String observation;
        try {
            TaskResult child = executeTask(peer.get().getId(), action.message(), childDepth);
            outcome = child.isCompleted() ? StepOutcome.SUCCESS : StepOutcome.FAILED;
            String answer = child.isCompleted() ? child.summary() : child.message();
            observation = PEER_RESPONDED_OBSERVATION.formatted(action.peerName(),
                    StringUtils.hasText(answer) ? answer : NO_PEER_SUMMARY);
        } catch (RuntimeException ex) {
            log.warn("Delegation from {} to {} failed: {}", agent.displayName(), action.peerName(), ex.getMessage());
            outcome = StepOutcome.ERROR;
            observation = DELEGATION_FAILED_OBSERVATION.formatted(ex.getMessage());
        }
        steps.add(new TaskStep(StepKind.DELEGATE, action.peerName(), outcome));
        metricsService.recordDelegation(action.peerName(), childDepth, outcome);
        return observation;
    }

    private TaskResult finish(UUID agentId, int depth, TaskResult result) {
        metricsService.recordResult(agentId, depth, result);
        if (depth == 0) {
            metricsService.logSummary();
        }
        return result;
    }
}
