package com.agentrunner.orchestration.api;

public class AutomationRunFailedException extends AutomationDispatchException {

    public AutomationRunFailedException(String runId, Throwable cause) {
        super("Automation run " + runId + " failed: " + describe(cause), cause);
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
