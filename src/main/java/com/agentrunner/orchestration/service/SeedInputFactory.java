package com.agentrunner.orchestration.service;

import static com.agentrunner.orchestration.OrchestrationConstants.*;

import com.agentrunner.orchestration.model.EntryPointKind;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the initial input an entry point receives when an agent triggers it.
 */
@Component
@RequiredArgsConstructor
public class SeedInputFactory {

    private final Clock clock;

    public Map<String, Object> seedInput(EntryPointKind kind, @Nullable String seedPrompt) {
        Instant now = clock.instant();
        Map<String, Object> input = new LinkedHashMap<>();
        switch (kind) {
            case MANUAL -> {
                input.put("triggeredByAgent", true);
                input.put("timestamp", now.toString());
                if (StringUtils.hasText(seedPrompt)) {
                    input.put("message", seedPrompt);
                }
            }
            case INBOUND_REQUEST -> {
                input.put("headers", Map.of());
                input.put("query", Map.of());
                input.put("body", Map.of());
            }
            case CONVERSATIONAL -> {
                input.put("sessionId", SEED_SESSION_PREFIX + now.toEpochMilli());
                input.put("action", SEED_CHAT_ACTION);
                input.put("chatInput", SEED_CHAT_INPUT);
            }
            case FORM_SUBMISSION -> {
                input.put("submittedAt", now.toString());
                input.put("formMode", SEED_FORM_MODE);
            }
            case SCHEDULED -> {
                input.put("timestamp", now.toString());
                input.put("triggeredByAgent", true);
            }
        }
        return input;
    }
}
