package com.agentrunner.orchestration.api;

import com.agentrunner.orchestration.model.EntryPointKind;

import java.util.Arrays;
import java.util.stream.Collectors;

public class UnsupportedAutomationException extends AutomationDispatchException {

    public UnsupportedAutomationException(String automationId) {
        super("Automation " + automationId + " has no supported entry point. Supported: " + supportedKinds());
    }

    private static String supportedKinds() {
        return Arrays.stream(EntryPointKind.values())
                .map(EntryPointKind::label)
                .collect(Collectors.joining(", "));
    }
}
