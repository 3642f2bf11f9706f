package com.agentrunner.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "agentrunner")
public class AgentRunnerProperties {

    private static final String PLACEHOLDER_KEY = "none";

    private int maxIterations = 15;
    private int maxDelegationDepth = 2;
    private Duration executionTimeout = Duration.ofSeconds(120);
    private int observationMaxLength = 2000;
    private AiProvider aiProvider = AiProvider.GOOGLE;
    private CompletionConfig completion = new CompletionConfig();
    private OpenAIConfig openai = new OpenAIConfig();
    private GoogleConfig google = new GoogleConfig();
    private EngineConfig engine = new EngineConfig();

    public enum AiProvider {
        GOOGLE, OPENAI
    }

    public static class CompletionConfig {
        private double temperature = 0.2;
        private int maxTokens = 1024;

        public double getTemperature() { return temperature; }
        public void setTemperature(double temperature) { this.temperature = temperature; }
        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }
    }

    public static class GoogleConfig {
        private String apiKey;
        private String model = "gemini-2.5-flash";

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    public static class OpenAIConfig {
        private String apiKey;
        private String model = "gpt-4o-mini";

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    public static class EngineConfig {
        private int concurrency = 4;

        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }
    }

    /**
     * Whether the active provider has a usable API key. Blank keys and the
     * {@code none} placeholder (used to let the Spring AI starters boot) count as missing.
     */
    public boolean hasCompletionCredential() {
        String apiKey = aiProvider == AiProvider.OPENAI ? openai.getApiKey() : google.getApiKey();
        return StringUtils.hasText(apiKey) && !PLACEHOLDER_KEY.equalsIgnoreCase(apiKey.trim());
    }

    public String activeModel() {
        return aiProvider == AiProvider.OPENAI ? openai.getModel() : google.getModel();
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        if (maxIterations <= 0) {
            return;
        }
        this.maxIterations = maxIterations;
    }

    public int getMaxDelegationDepth() {
        return maxDelegationDepth;
    }

    public void setMaxDelegationDepth(int maxDelegationDepth) {
        if (maxDelegationDepth < 0) {
            return;
        }
        this.maxDelegationDepth = maxDelegationDepth;
    }

    public Duration getExecutionTimeout() {
        return executionTimeout;
    }

    public void setExecutionTimeout(Duration executionTimeout) {
        if (executionTimeout == null || executionTimeout.isNegative() || executionTimeout.isZero()) {
            return;
        }
        this.executionTimeout = executionTimeout;
    }

    public int getObservationMaxLength() {
        return observationMaxLength;
    }

    public void setObservationMaxLength(int observationMaxLength) {
        this.observationMaxLength = observationMaxLength;
    }

    public AiProvider getAiProvider() {
        return aiProvider;
    }

    public void setAiProvider(AiProvider aiProvider) {
        this.aiProvider = aiProvider != null ? aiProvider : AiProvider.GOOGLE;
    }

    public CompletionConfig getCompletion() {
        return completion;
    }

    public void setCompletion(CompletionConfig completion) {
        this.completion = completion != null ? completion : new CompletionConfig();
    }

    public OpenAIConfig getOpenai() {
        return openai;
    }

    public void setOpenai(OpenAIConfig openai) {
        this.openai = openai != null ? openai : new OpenAIConfig();
    }

    public GoogleConfig getGoogle() {
        return google;
    }

    public void setGoogle(GoogleConfig google) {
        this.google = google != null ? google : new GoogleConfig();
    }

    public EngineConfig getEngine() {
        return engine;
    }

    public void setEngine(EngineConfig engine) {
        this.engine = engine != null ? engine : new EngineConfig();
    }
}
