package com.agentrunner.engine;

import com.agentrunner.entity.AutomationRun;
import com.agentrunner.entity.RunStatus;
import com.agentrunner.orchestration.service.JsonProcessingService;
import com.agentrunner.repository.AutomationRunRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Runs an automation by posting its seed input to the automation's endpoint URL. Each run is
 * recorded as an {@link AutomationRun} row; the endpoint's JSON reply becomes the result data.
 */
@Service
@Slf4j
public class HttpExecutionEngine implements ExecutionEngine {

    private static final String ERROR_FIELD = "error";

    private final AutomationRunRepository automationRunRepository;
    private final JsonProcessingService jsonProcessingService;
    private final RestClient restClient;
    private final ExecutorService workerExecutor;
    private final Clock clock;
    private final Map<String, CompletableFuture<RunResult>> activeRuns = new ConcurrentHashMap<>();

    public HttpExecutionEngine(AutomationRunRepository automationRunRepository,
                               JsonProcessingService jsonProcessingService,
                               @Qualifier("automationRestClient") RestClient restClient,
                               @Qualifier("workerExecutor") ExecutorService workerExecutor,
                               Clock clock) {
        this.automationRunRepository = automationRunRepository;
        this.jsonProcessingService = jsonProcessingService;
        this.restClient = restClient;
        this.workerExecutor = workerExecutor;
        this.clock = clock;
    }

    @Override
    public String submit(AutomationRunRequest request) {
        AutomationRun run = automationRunRepository.save(AutomationRun.builder()
                .automationId(request.automationId())
                .triggeredBy(request.triggeredBy())
                .entryPoint(request.entryPoint())
                .mode(request.mode().name())
                .status(RunStatus.RUNNING)
                .seedInput(jsonProcessingService.toJson(request.seedInput()))
                .build());
        String runId = run.getId().toString();
        CompletableFuture<RunResult> future = CompletableFuture.supplyAsync(() -> dispatch(run.getId(), request), workerExecutor);
        activeRuns.put(runId, future);
        future.whenComplete((result, ex) -> activeRuns.remove(runId));
        return runId;
    }

    @Override
    public CompletableFuture<RunResult> awaitResult(String runId) {
        CompletableFuture<RunResult> active = activeRuns.get(runId);
        if (active != null) {
            return active;
        }
        UUID id;
        try {
            id = UUID.fromString(runId);
        } catch (IllegalArgumentException ex) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Unknown run " + runId));
        }
        return automationRunRepository.findById(id)
                .filter(run -> run.getStatus() != RunStatus.RUNNING)
                .map(run -> CompletableFuture.completedFuture(toResult(run)))
                .orElseGet(() -> CompletableFuture.failedFuture(
                        new IllegalStateException("Run " + runId + " is unknown or no longer tracked")));
    }

    @Override
    public void abandon(String runId, String reason) {
        CompletableFuture<RunResult> active = activeRuns.remove(runId);
        if (active != null) {
            active.cancel(false);
        }
        UUID id;
        try {
            id = UUID.fromString(runId);
        } catch (IllegalArgumentException ex) {
            log.warn("Cannot abandon unknown run {}", runId);
            return;
        }
        log.warn("Abandoning run {}: {}", runId, reason);
        record(id, RunStatus.ERROR, errorData(reason));
    }

    private RunResult dispatch(UUID runId, AutomationRunRequest request) {
        RunStatus status;
        Map<String, Object> resultData;
        if (!StringUtils.hasText(request.endpointUrl())) {
            status = RunStatus.ERROR;
            resultData = errorData("Automation " + request.automationId() + " has no endpoint URL");
        } else {
            try {
                String body = restClient.post()
                        .uri(request.endpointUrl())
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(payload(runId, request))
                        .retrieve()
                        .body(String.class);
                status = RunStatus.SUCCESS;
                resultData = jsonProcessingService.readMap("automation " + request.automationId() + " result", body);
            } catch (RestClientResponseException ex) {
                log.warn("Automation {} endpoint answered {} for run {}", request.automationId(),
                        ex.getStatusCode().value(), runId);
                status = RunStatus.ERROR;
                resultData = errorData("HTTP " + ex.getStatusCode().value() + " from automation endpoint");
            } catch (RestClientException ex) {
                log.warn("Automation {} endpoint unreachable for run {}: {}", request.automationId(), runId, ex.getMessage());
                status = RunStatus.ERROR;
                resultData = errorData(ex.getMessage());
            }
        }
        record(runId, status, resultData);
        return new RunResult(runId.toString(), status, resultData);
    }

    private Map<String, Object> payload(UUID runId, AutomationRunRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("runId", runId.toString());
        payload.put("automationId", request.automationId());
        payload.put("entryPoint", request.entryPoint());
        payload.put("mode", request.mode().name());
        payload.put("triggeredBy", request.triggeredBy() != null ? request.triggeredBy().toString() : null);
        payload.put("input", request.seedInput());
        return payload;
    }

    // Only the first outcome is kept; an abandoned run stays abandoned.
    private void record(UUID runId, RunStatus status, Map<String, Object> resultData) {
        automationRunRepository.findById(runId).filter(run -> run.getStatus() == RunStatus.RUNNING).ifPresent(run -> {
            run.setStatus(status);
            run.setResultData(jsonProcessingService.toJson(resultData));
            run.setFinishedAt(OffsetDateTime.now(clock));
            automationRunRepository.save(run);
        });
    }

    private RunResult toResult(AutomationRun run) {
        return new RunResult(run.getId().toString(), run.getStatus(),
                jsonProcessingService.readMap("run " + run.getId() + " result", run.getResultData()));
    }

    private Map<String, Object> errorData(String message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(ERROR_FIELD, message != null ? message : "Unknown error");
        return data;
    }
}
