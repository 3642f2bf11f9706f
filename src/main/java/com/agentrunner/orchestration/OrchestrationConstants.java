package com.agentrunner.orchestration;

public final class OrchestrationConstants {

    private OrchestrationConstants() {
        // Private constructor to prevent instantiation
    }

    // Actions
    public static final String ACTION_RUN_AUTOMATION = "run_automation";
    public static final String ACTION_DELEGATE = "delegate";
    public static final String ACTION_COMPLETE = "complete";
    public static final String LEGACY_ACTION_RUN_AUTOMATION = "execute_workflow";
    public static final String LEGACY_ACTION_DELEGATE = "send_message";

    // Action fields
    public static final String FIELD_ACTION = "action";
    public static final String FIELD_AUTOMATION_ID = "automationId";
    public static final String LEGACY_FIELD_AUTOMATION_ID = "workflowId";
    public static final String FIELD_RATIONALE = "rationale";
    public static final String LEGACY_FIELD_RATIONALE = "reasoning";
    public static final String FIELD_TO_AGENT = "toAgent";
    public static final String FIELD_PEER_NAME = "peerName";
    public static final String FIELD_MESSAGE = "message";
    public static final String FIELD_SUMMARY = "summary";

    // Summaries
    public static final String DEFAULT_COMPLETE_SUMMARY = "Task completed";
    public static final String MAX_ITERATIONS_SUMMARY = "reached maximum iterations";
    public static final String NO_PEER_SUMMARY = "No summary";

    // Setup failures
    public static final String AGENT_NOT_FOUND_MESSAGE = "Agent %s not found";
    public static final String MISSING_CREDENTIAL_MESSAGE =
            "Completion endpoint credential not configured. Set agentrunner.%s.api-key to enable agent tasks.";

    // Observations
    public static final String OBSERVATION_PREFIX = "Observation: ";
    public static final String AUTOMATION_EXECUTED_OBSERVATION = "Automation \"%s\" executed. Result: %s";
    public static final String AUTOMATION_FAILED_OBSERVATION = "Automation execution failed: %s";
    public static final String PEER_NOT_FOUND_OBSERVATION = "Agent \"%s\" not found. Available agents: %s";
    public static final String PEER_RESPONDED_OBSERVATION = "Agent \"%s\" responded: %s";
    public static final String DELEGATION_FAILED_OBSERVATION = "Agent delegation failed: %s";
    public static final String UNKNOWN_ACTION_OBSERVATION = "Unknown action. Use %s.";

    // Seed input
    public static final String SEED_SESSION_PREFIX = "agent-";
    public static final String SEED_CHAT_ACTION = "sendMessage";
    public static final String SEED_CHAT_INPUT = "Triggered by agent";
    public static final String SEED_FORM_MODE = "agent";

    // Prompts
    public static final String NO_AUTOMATIONS = "(none)";

    public static final String SYSTEM_PROMPT_TEMPLATE = """
            You are %s, an autonomous AI agent in a workflow automation system.

            You have access to these automations:
            %s
            %s
            RULES:
            - Respond with exactly ONE JSON object per message. No markdown, no explanation, no code fences.
            - After each action, you will receive an Observation with the result. Wait for it before deciding your next action.
            - Do NOT batch multiple actions. One action per response, then wait.
            - Valid actions: %s

            To run an automation:
            {"action": "run_automation", "automationId": "<id>", "rationale": "<why>"}

            When the task is complete (after seeing all results):
            {"action": "complete", "summary": "<what was accomplished>"}

            If asked to run something multiple times, run it once, wait for the result, then run it again.""";

    public static final String DELEGATION_SECTION_TEMPLATE = """

            You can also delegate tasks to other agents:
            %s

            To send a message to another agent:
            {"action": "delegate", "toAgent": "<name>", "message": "<what you need them to do>"}
            """;
}
