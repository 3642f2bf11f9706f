package com.agentrunner.orchestration.service;

import static com.agentrunner.orchestration.OrchestrationConstants.*;

import com.agentrunner.orchestration.model.TaskAction;
import com.agentrunner.orchestration.model.TaskAction.Complete;
import com.agentrunner.orchestration.model.TaskAction.Delegate;
import com.agentrunner.orchestration.model.TaskAction.RunAutomation;
import com.agentrunner.orchestration.model.TaskAction.Unrecognized;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decodes a model reply into a {@link TaskAction}. Decoding is attempted on the reply with a
 * single code fence removed, then on the span between its first and last brace. Never throws.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActionParser {

    private static final Pattern LEADING_FENCE = Pattern.compile("^```(?:json)?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\s*```\\s*$");

    private final JsonProcessingService jsonProcessingService;

    public TaskAction parse(@Nullable String text) {
        String raw = text == null ? "" : text;
        JsonNode node = decode(stripFences(raw));
        if (node == null) {
            log.debug("Model reply is not a JSON object. Snippet: {}", jsonProcessingService.snippet(raw, 120));
            return new Unrecognized(raw, false);
        }
        TaskAction action = toAction(node, raw);
        if (action instanceof Unrecognized) {
            log.info("Model reply has no usable action. Snippet: {}", jsonProcessingService.snippet(raw, 240));
        }
        return action;
    }

    String stripFences(String raw) {
        String cleaned = LEADING_FENCE.matcher(raw.trim()).replaceFirst("");
        cleaned = TRAILING_FENCE.matcher(cleaned).replaceFirst("");
        return cleaned.trim();
    }

    private @Nullable JsonNode decode(String cleaned) {
        JsonNode whole = jsonProcessingService.readTree(cleaned);
        if (whole != null && whole.isObject()) {
            return whole;
        }
        int firstBrace = cleaned.indexOf('{');
        int lastBrace = cleaned.lastIndexOf('}');
        if (firstBrace < 0 || lastBrace <= firstBrace) {
            return null;
        }
        JsonNode embedded = jsonProcessingService.readTree(cleaned.substring(firstBrace, lastBrace + 1));
        return embedded != null && embedded.isObject() ? embedded : null;
    }

    private TaskAction toAction(JsonNode node, String raw) {
        String action = text(node, FIELD_ACTION);
        if (!StringUtils.hasText(action)) {
            return new Unrecognized(raw, true);
        }
        return switch (action.trim().toLowerCase(Locale.ROOT)) {
            case ACTION_COMPLETE -> complete(node);
            case ACTION_RUN_AUTOMATION, LEGACY_ACTION_RUN_AUTOMATION -> runAutomation(node, raw);
            case ACTION_DELEGATE, LEGACY_ACTION_DELEGATE -> delegate(node, raw);
            default -> new Unrecognized(raw, true);
        };
    }

    private TaskAction complete(JsonNode node) {
        String summary = text(node, FIELD_SUMMARY);
        return new Complete(summary != null ? summary : DEFAULT_COMPLETE_SUMMARY);
    }

    private TaskAction runAutomation(JsonNode node, String raw) {
        String automationId = firstText(node, FIELD_AUTOMATION_ID, LEGACY_FIELD_AUTOMATION_ID);
        if (!StringUtils.hasText(automationId)) {
            return new Unrecognized(raw, true);
        }
        return new RunAutomation(automationId.trim(), firstText(node, FIELD_RATIONALE, LEGACY_FIELD_RATIONALE));
    }

    private TaskAction delegate(JsonNode node, String raw) {
        String peerName = firstText(node, FIELD_TO_AGENT, FIELD_PEER_NAME);
        String message = text(node, FIELD_MESSAGE);
        if (!StringUtils.hasText(peerName) || !StringUtils.hasText(message)) {
            return new Unrecognized(raw, true);
        }
        return new Delegate(peerName.trim(), message);
    }

    private @Nullable String firstText(JsonNode node, String field, String alias) {
        String value = text(node, field);
        return StringUtils.hasText(value) ? value : text(node, alias);
    }

    private @Nullable String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
