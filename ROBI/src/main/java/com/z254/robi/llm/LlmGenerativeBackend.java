package com.z254.robi.llm;

import com.z254.robi.config.RobiProperties;
import com.z254.robi.domain.model.ConversationMessage;
import com.z254.robi.domain.model.MessageRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link GenerativeBackend} on top of the default {@link LLMProvider}.
 * Compaction summaries in the history are handed to the model as system context.
 */
@Slf4j
@Component
public class LlmGenerativeBackend implements GenerativeBackend {

    private final LLMProviderRegistry providerRegistry;
    private final RobiProperties.LLMProperties.GeminiProperties config;

    public LlmGenerativeBackend(LLMProviderRegistry providerRegistry, RobiProperties robiProperties) {
        this.providerRegistry = providerRegistry;
        this.config = robiProperties.getLlm().getGemini();
    }

    @Override
    public Flux<String> streamResponse(List<ConversationMessage> history, TurnInput turn, String context) {
        return Flux.defer(() -> {
            LLMProvider provider = providerRegistry.getDefaultProvider();
            LLMRequest request = LLMRequest.builder()
                    .model(provider.getDefaultModel())
                    .messages(buildMessages(history, turn, context))
                    .temperature(config.getTemperature())
                    .maxTokens(config.getMaxTokens())
                    .stream(true)
                    .build();
            return provider.stream(request)
                    .filter(LLMChunk::hasContent)
                    .map(LLMChunk::getContentDelta);
        });
    }

    @Override
    public Mono<String> complete(String instruction, String content) {
        return Mono.defer(() -> {
            LLMProvider provider = providerRegistry.getDefaultProvider();
            LLMRequest request = LLMRequest.builder()
                    .model(provider.getDefaultModel())
                    .messages(List.of(
                            LLMRequest.systemMessage(instruction),
                            LLMRequest.userMessage(content)))
                    .temperature(config.getTemperature())
                    .maxTokens(config.getMaxTokens())
                    .build();
            return provider.complete(request)
                    .map(response -> response.getContent() != null ? response.getContent() : "");
        });
    }

    List<LLMRequest.Message> buildMessages(List<ConversationMessage> history, TurnInput turn, String context) {
        List<LLMRequest.Message> messages = new ArrayList<>();
        messages.add(LLMRequest.systemMessage(CompanionPrompts.SYSTEM_PROMPT));
        if (context != null && !context.isBlank()) {
            messages.add(LLMRequest.systemMessage(context));
        }
        for (ConversationMessage message : history) {
            if (message.isCompactionSummary()) {
                messages.add(LLMRequest.systemMessage(CompanionPrompts.SUMMARY_CONTEXT_LABEL
                        + stripSummaryPrefix(message.getContent())));
            } else if (message.getRole() == MessageRole.ASSISTANT) {
                messages.add(LLMRequest.assistantMessage(message.getContent()));
            } else {
                messages.add(LLMRequest.userMessage(message.getContent()));
            }
        }
        messages.add(LLMRequest.userMessage(turn.hasText() ? turn.text() : "", turn.media()));
        return messages;
    }

    private static String stripSummaryPrefix(String content) {
        if (content != null && content.startsWith(ConversationMessage.SUMMARY_PREFIX)) {
            return content.substring(ConversationMessage.SUMMARY_PREFIX.length()).trim();
        }
        return content;
    }
}
