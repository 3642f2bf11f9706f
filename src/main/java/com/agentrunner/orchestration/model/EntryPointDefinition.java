package com.agentrunner.orchestration.model;

/**
 * An entry point as declared when registering an automation. {@code type} may name a kind
 * agents cannot seed; such entry points are catalogued but never dispatched.
 */
public record EntryPointDefinition(
        String name,
        String type,
        boolean disabled
) {
}
