package com.agentrunner.orchestration.model;

public enum MessageRole {
    SYSTEM,
    HUMAN,
    MODEL
}
