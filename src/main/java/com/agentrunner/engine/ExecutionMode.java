package com.agentrunner.engine;

public enum ExecutionMode {
    MANUAL,
    WEBHOOK,
    CHAT,
    TRIGGER
}
