package com.agentrunner.orchestration.model;

import com.agentrunner.engine.ExecutionMode;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Entry point kinds an agent can seed, in no particular priority: the entry point order
 * on the automation decides which one is used.
 */
public enum EntryPointKind {
    MANUAL("manual", "Manual Trigger", ExecutionMode.MANUAL),
    INBOUND_REQUEST("inbound-request", "Inbound Request Trigger", ExecutionMode.WEBHOOK),
    CONVERSATIONAL("conversational", "Chat Trigger", ExecutionMode.CHAT),
    FORM_SUBMISSION("form-submission", "Form Trigger", ExecutionMode.TRIGGER),
    SCHEDULED("scheduled", "Schedule Trigger", ExecutionMode.TRIGGER);

    private final String type;
    private final String label;
    private final ExecutionMode mode;

    EntryPointKind(String type, String label, ExecutionMode mode) {
        this.type = type;
        this.label = label;
        this.mode = mode;
    }

    public String type() {
        return type;
    }

    public String label() {
        return label;
    }

    public ExecutionMode mode() {
        return mode;
    }

    public static Optional<EntryPointKind> fromType(String type) {
        if (type == null) {
            return Optional.empty();
        }
        String normalized = type.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(kind -> kind.type.equals(normalized))
                .findFirst();
    }
}
