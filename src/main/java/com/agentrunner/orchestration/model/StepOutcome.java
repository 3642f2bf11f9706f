package com.agentrunner.orchestration.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StepOutcome {
    SUCCESS("success"),
    FAILED("failed"),
    ERROR("error");

    private final String code;

    StepOutcome(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
