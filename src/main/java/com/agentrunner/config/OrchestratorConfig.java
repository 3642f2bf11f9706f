package com.agentrunner.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.google.genai.GoogleGenAiChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class OrchestratorConfig {

    @Bean
    public ChatClient googleChatClient(ObjectProvider<GoogleGenAiChatModel> googleChatModelProvider) {
        GoogleGenAiChatModel model = googleChatModelProvider.getIfAvailable();
        return model != null ? ChatClient.builder(model).build() : null;
    }

    @Bean
    public ChatClient openAiChatClient(ObjectProvider<OpenAiChatModel> openAiChatModelProvider) {
        OpenAiChatModel model = openAiChatModelProvider.getIfAvailable();
        return model != null ? ChatClient.builder(model).build() : null;
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService workerExecutor(AgentRunnerProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getEngine().getConcurrency()));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
