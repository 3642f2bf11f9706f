package com.agentrunner.config;

import com.agentrunner.config.AgentRunnerProperties.AiProvider;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AgentRunnerPropertiesTest {

    @Test
    void testDefaults() {
        AgentRunnerProperties properties = new AgentRunnerProperties();
        assertEquals(15, properties.getMaxIterations());
        assertEquals(2, properties.getMaxDelegationDepth());
        assertEquals(Duration.ofSeconds(120), properties.getExecutionTimeout());
        assertEquals(2000, properties.getObservationMaxLength());
        assertEquals(0.2, properties.getCompletion().getTemperature());
        assertEquals(1024, properties.getCompletion().getMaxTokens());
        assertEquals(AiProvider.GOOGLE, properties.getAiProvider());
    }

    @Test
    void testCredentialCheckFollowsProvider() {
        AgentRunnerProperties properties = new AgentRunnerProperties();
        assertFalse(properties.hasCompletionCredential());

        properties.getGoogle().setApiKey("none");
        assertFalse(properties.hasCompletionCredential());

        properties.getGoogle().setApiKey("g-key");
        assertTrue(properties.hasCompletionCredential());
        assertEquals("gemini-2.5-flash", properties.activeModel());

        properties.setAiProvider(AiProvider.OPENAI);
        assertFalse(properties.hasCompletionCredential());
        properties.getOpenai().setApiKey("sk-key");
        assertTrue(properties.hasCompletionCredential());
        assertEquals("gpt-4o-mini", properties.activeModel());
    }

    @Test
    void testInvalidBoundsAreIgnored() {
        AgentRunnerProperties properties = new AgentRunnerProperties();
        properties.setMaxIterations(0);
        properties.setMaxDelegationDepth(-1);
        properties.setExecutionTimeout(Duration.ZERO);
        properties.setAiProvider(null);

        assertEquals(15, properties.getMaxIterations());
        assertEquals(2, properties.getMaxDelegationDepth());
        assertEquals(Duration.ofSeconds(120), properties.getExecutionTimeout());
        assertEquals(AiProvider.GOOGLE, properties.getAiProvider());
    }
}
