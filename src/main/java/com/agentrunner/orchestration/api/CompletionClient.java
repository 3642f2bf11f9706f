package com.agentrunner.orchestration.api;

import com.agentrunner.orchestration.model.ConversationMessage;

import java.util.List;

/**
 * Sends a transcript to the configured chat model and returns the reply text.
 */
public interface CompletionClient {

    /**
     * @param transcript System instruction first, then alternating human and model messages.
     * @return The reply text, never {@code null}.
     * @throws CompletionFailedException if the completion endpoint cannot be reached or rejects the call.
     */
    String complete(List<ConversationMessage> transcript);
}
