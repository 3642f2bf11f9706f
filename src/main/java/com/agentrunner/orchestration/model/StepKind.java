package com.agentrunner.orchestration.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StepKind {
    RUN_AUTOMATION("run_automation"),
    DELEGATE("delegate");

    private final String code;

    StepKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
