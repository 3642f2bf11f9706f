package com.agentrunner.entity;

/**
 * Access an identity holds on an automation. {@link #EXECUTE} implies {@link #READ}.
 */
public enum GrantScope {
    READ,
    EXECUTE
}
