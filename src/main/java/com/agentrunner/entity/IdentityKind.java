package com.agentrunner.entity;

public enum IdentityKind {
    HUMAN,
    AGENT
}
