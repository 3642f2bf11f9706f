package com.agentrunner.orchestration.service;

import com.agentrunner.orchestration.model.StepOutcome;
import com.agentrunner.orchestration.model.TaskResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class TaskMetricsService {

    private final AtomicLong modelRequestCount = new AtomicLong();
    private final AtomicLong automationRunCount = new AtomicLong();
    private final AtomicLong delegationCount = new AtomicLong();
    private final AtomicLong taskCompletedCount = new AtomicLong();
    private final AtomicLong taskErrorCount = new AtomicLong();

    public void recordModelRequest(UUID agentId, int depth, int iteration) {
        long count = modelRequestCount.incrementAndGet();
        log.info("Model request #{} sent (agent={}, depth={}, iteration={}). Total requests={}.",
                count, agentId, depth, iteration, count);
    }

    public void recordAutomationRun(String automationId, StepOutcome outcome) {
        long count = automationRunCount.incrementAndGet();
        log.info("Automation {} dispatched with outcome {}. Total automation runs={}.", automationId, outcome.code(), count);
    }

    public void recordDelegation(String peerName, int childDepth, StepOutcome outcome) {
        long count = delegationCount.incrementAndGet();
        log.info("Delegation to {} at depth {} ended with outcome {}. Total delegations={}.",
                peerName, childDepth, outcome.code(), count);
    }

    public void recordResult(UUID agentId, int depth, TaskResult result) {
        if (result.isCompleted()) {
            long count = taskCompletedCount.incrementAndGet();
            log.info("Task for agent {} (depth={}) completed with {} step(s). Total completed={}.",
                    agentId, depth, result.steps().size(), count);
        } else {
            long count = taskErrorCount.incrementAndGet();
            log.info("Task for agent {} (depth={}) ended with error: {}. Total errors={}.",
                    agentId, depth, result.message(), count);
        }
    }

    public void logSummary() {
        log.info("Task stats: totalModelRequests={}, totalAutomationRuns={}, totalDelegations={}, totalCompleted={}, totalErrors={}.",
                modelRequestCount.get(), automationRunCount.get(), delegationCount.get(),
                taskCompletedCount.get(), taskErrorCount.get());
    }
}
