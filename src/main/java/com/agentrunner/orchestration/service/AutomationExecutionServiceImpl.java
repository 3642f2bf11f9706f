package com.agentrunner.orchestration.service;

import com.agentrunner.config.AgentRunnerProperties;
import com.agentrunner.engine.AutomationRunRequest;
import com.agentrunner.engine.ExecutionEngine;
import com.agentrunner.engine.RunResult;
import com.agentrunner.entity.AgentIdentity;
import com.agentrunner.entity.Automation;
import com.agentrunner.entity.AutomationEntryPoint;
import com.agentrunner.entity.RunStatus;
import com.agentrunner.orchestration.api.AutomationExecutionService;
import com.agentrunner.orchestration.api.AutomationNotFoundException;
import com.agentrunner.orchestration.api.AutomationRunFailedException;
import com.agentrunner.orchestration.api.AutomationTimeoutException;
import com.agentrunner.orchestration.api.UnsupportedAutomationException;
import com.agentrunner.orchestration.model.EntryPointKind;
import com.agentrunner.orchestration.model.ExecutionObservation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
@RequiredArgsConstructor
@Slf4j
public class AutomationExecutionServiceImpl implements AutomationExecutionService {

    private static final String ERROR_FIELD = "error";

    private final AutomationCatalogService automationCatalogService;
    private final ExecutionEngine executionEngine;
    private final SeedInputFactory seedInputFactory;
    private final AgentRunnerProperties properties;

    @Override
    public ExecutionObservation run(AgentIdentity agent, String automationId, String seedPrompt) {
        Automation automation = automationCatalogService.findExecutable(agent.getId(), automationId)
                .orElseThrow(() -> new AutomationNotFoundException(automationId));
        SelectedEntryPoint selected = selectEntryPoint(automation)
                .orElseThrow(() -> new UnsupportedAutomationException(automationId));

        AutomationRunRequest request = new AutomationRunRequest(
                automation.getId(),
                automation.getEndpointUrl(),
                agent.getId(),
                selected.entryPoint().getName(),
                selected.kind().mode(),
                seedInputFactory.seedInput(selected.kind(), seedPrompt));
        String runId = executionEngine.submit(request);
        log.info("Agent {} started automation {} via '{}' ({}), run {}", agent.getId(), automation.getId(),
                selected.entryPoint().getName(), selected.kind().type(), runId);

        RunResult result = await(runId);
        Map<String, Object> resultData = result.resultData() != null ? result.resultData() : Map.of();
        boolean success = result.status() != RunStatus.ERROR && resultData.get(ERROR_FIELD) == null;
        log.info("Automation {} run {} finished with status {} (success={})", automation.getId(), runId,
                result.status(), success);
        return new ExecutionObservation(automation.getId(), runId, success, resultData);
    }

    private Optional<SelectedEntryPoint> selectEntryPoint(Automation automation) {
        for (AutomationEntryPoint entryPoint : automation.getEntryPoints()) {
            if (entryPoint.isDisabled()) {
                continue;
            }
            Optional<EntryPointKind> kind = EntryPointKind.fromType(entryPoint.getType());
            if (kind.isPresent()) {
                log.debug("Using entry point '{}' of automation {}", entryPoint.getName(), automation.getId());
                return Optional.of(new SelectedEntryPoint(entryPoint, kind.get()));
            }
        }
        return Optional.empty();
    }

    private RunResult await(String runId) {
        long timeoutMillis = properties.getExecutionTimeout().toMillis();
        try {
            return executionEngine.awaitResult(runId).get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            log.warn("Stopped waiting for run {} after {} ms", runId, timeoutMillis);
            AutomationTimeoutException timeout = new AutomationTimeoutException(timeoutMillis, ex);
            executionEngine.abandon(runId, timeout.getMessage());
            throw timeout;
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            throw new AutomationRunFailedException(runId, cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AutomationRunFailedException(runId, ex);
        }
    }

    private record SelectedEntryPoint(AutomationEntryPoint entryPoint, EntryPointKind kind) {
    }
}
