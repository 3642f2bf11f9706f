package com.agentrunner.orchestration.model;

import org.springframework.lang.Nullable;

/**
 * One decoded model reply. Every reply maps to exactly one arm; replies that cannot be
 * decoded are {@link Unrecognized}, never an exception.
 */
public sealed interface TaskAction
        permits TaskAction.RunAutomation, TaskAction.Delegate, TaskAction.Complete, TaskAction.Unrecognized {

    record RunAutomation(String automationId, @Nullable String rationale) implements TaskAction {
    }

    record Delegate(String peerName, String message) implements TaskAction {
    }

    record Complete(String summary) implements TaskAction {
    }

    /**
     * @param raw        the reply as received
     * @param structured {@code true} when the reply was a JSON object whose action could not be used,
     *                   {@code false} when it was not a JSON object at all
     */
    record Unrecognized(String raw, boolean structured) implements TaskAction {
    }
}
