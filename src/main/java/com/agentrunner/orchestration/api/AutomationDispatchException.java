package com.agentrunner.orchestration.api;

/**
 * Base type for failures to start or finish an automation run on an agent's behalf.
 * The task loop reports these to the model as observations.
 */
public abstract class AutomationDispatchException extends RuntimeException {

    protected AutomationDispatchException(String message) {
        super(message);
    }

    protected AutomationDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
