package com.agentrunner.orchestration.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskStatus {
    COMPLETED("completed"),
    ERROR("error");

    private final String code;

    TaskStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
