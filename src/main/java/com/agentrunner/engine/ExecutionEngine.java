package com.agentrunner.engine;

import java.util.concurrent.CompletableFuture;

/**
 * Runs automations on behalf of agents. Implementations must accept concurrent,
 * independent runs.
 */
public interface ExecutionEngine {

    /**
     * Starts a run and returns immediately.
     *
     * @param request The run to start.
     * @return The id of the started run.
     */
    String submit(AutomationRunRequest request);

    /**
     * Returns a future that completes when the run finishes. No timeout is applied here;
     * callers that cannot wait forever must bound the wait themselves.
     *
     * @param runId The id returned by {@link #submit(AutomationRunRequest)}.
     * @return A future of the run's final result.
     */
    CompletableFuture<RunResult> awaitResult(String runId);

    /**
     * Stops tracking a run nobody waits for any more. A run that is still going is finished
     * as {@link com.agentrunner.entity.RunStatus#ERROR} with the reason as its error; a later
     * answer from the automation does not overwrite it.
     *
     * @param runId The id returned by {@link #submit(AutomationRunRequest)}.
     * @param reason Why the run was abandoned.
     */
    void abandon(String runId, String reason);
}
