package com.agentrunner.orchestration.api;

public class AutomationTimeoutException extends AutomationDispatchException {

    public AutomationTimeoutException(long timeoutMillis, Throwable cause) {
        super("Automation execution timed out after " + timeoutMillis + " ms", cause);
    }
}
