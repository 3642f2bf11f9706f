package com.agentrunner.entity;

public enum RunStatus {
    RUNNING,
    SUCCESS,
    ERROR
}
