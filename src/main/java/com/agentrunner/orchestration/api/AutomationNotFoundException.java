package com.agentrunner.orchestration.api;

public class AutomationNotFoundException extends AutomationDispatchException {

    public AutomationNotFoundException(String automationId) {
        super("Automation " + automationId + " not found or agent lacks permission");
    }
}
