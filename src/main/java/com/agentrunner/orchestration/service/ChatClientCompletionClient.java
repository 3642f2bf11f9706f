package com.agentrunner.orchestration.service;

import com.agentrunner.config.AgentRunnerProperties;
import com.agentrunner.config.AgentRunnerProperties.AiProvider;
import com.agentrunner.orchestration.api.CompletionClient;
import com.agentrunner.orchestration.api.CompletionFailedException;
import com.agentrunner.orchestration.model.ConversationMessage;
import com.agentrunner.orchestration.model.MessageRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link CompletionClient} backed by the Spring AI chat client of the configured provider.
 * The first system message of the transcript becomes the system instruction; the rest are
 * sent as user and assistant messages in order.
 */
@Service
@Slf4j
public class ChatClientCompletionClient implements CompletionClient {

    private final ChatClient googleChatClient;
    private final ChatClient openAiChatClient;
    private final AgentRunnerProperties properties;

    public ChatClientCompletionClient(@Qualifier("googleChatClient") ObjectProvider<ChatClient> googleChatClientProvider,
                                      @Qualifier("openAiChatClient") ObjectProvider<ChatClient> openAiChatClientProvider,
                                      AgentRunnerProperties properties) {
        this.googleChatClient = googleChatClientProvider.getIfAvailable();
        this.openAiChatClient = openAiChatClientProvider.getIfAvailable();
        this.properties = properties;
    }

    @Override
    public String complete(List<ConversationMessage> transcript) {
        String system = "";
        List<Message> messages = new ArrayList<>();
        for (ConversationMessage message : transcript) {
            if (message.role() == MessageRole.SYSTEM) {
                system = message.content();
            } else if (message.role() == MessageRole.MODEL) {
                messages.add(new AssistantMessage(message.content()));
            } else {
                messages.add(new UserMessage(message.content()));
            }
        }
        ChatOptions options = ChatOptions.builder()
                .model(properties.activeModel())
                .temperature(properties.getCompletion().getTemperature())
                .maxTokens(properties.getCompletion().getMaxTokens())
                .build();
        try {
            String content = chatClient()
                    .prompt()
                    .system(system)
                    .messages(messages)
                    .options(options)
                    .call()
                    .content();
            return content != null ? content : "";
        } catch (CompletionFailedException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.warn("Completion request to {} failed: {}", properties.getAiProvider(), ex.getMessage());
            throw new CompletionFailedException("Completion request failed: " + ex.getMessage(), ex);
        }
    }

    private ChatClient chatClient() {
        ChatClient client = properties.getAiProvider() == AiProvider.OPENAI ? openAiChatClient : googleChatClient;
        if (client == null) {
            throw new CompletionFailedException(properties.getAiProvider() + " chat model is not available. "
                    + "Check that its Spring AI starter is configured.", null);
        }
        return client;
    }
}
