package com.agentrunner.orchestration.model;

public record TaskStep(
        StepKind kind,
        String target,
        StepOutcome outcome
) {
}
