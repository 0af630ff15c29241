package com.z254.robi.conversation;

import com.z254.robi.config.RobiProperties;
import com.z254.robi.domain.model.ConversationMessage;
import com.z254.robi.domain.model.MessageRole;
import com.z254.robi.domain.repository.ConversationHistoryRepository;
import com.z254.robi.llm.CompanionPrompts;
import com.z254.robi.llm.GenerativeBackend;
import com.z254.robi.observability.StructuredLogger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Per-session dialogue log with summary-based compaction.
 */
@Slf4j
@Service
public class ConversationHistoryService {

    private final ConversationHistoryRepository historyRepository;
    private final GenerativeBackend generativeBackend;
    private final StructuredLogger structuredLogger;
    private final RobiProperties.ConversationProperties config;
    private final Counter compactionsCounter;
    private final Counter compactionFailuresCounter;

    public ConversationHistoryService(
            ConversationHistoryRepository historyRepository,
            GenerativeBackend generativeBackend,
            StructuredLogger structuredLogger,
            RobiProperties robiProperties,
            MeterRegistry meterRegistry) {
        this.historyRepository = historyRepository;
        this.generativeBackend = generativeBackend;
        this.structuredLogger = structuredLogger;
        this.config = robiProperties.getConversation();
        this.compactionsCounter = Counter.builder("robi.history.compactions")
                .description("Conversation history compactions applied")
                .register(meterRegistry);
        this.compactionFailuresCounter = Counter.builder("robi.history.compactions.failed")
                .description("Conversation history compactions that failed")
                .register(meterRegistry);
    }

    public Mono<ConversationMessage> append(String sessionId, MessageRole role, String content) {
        return historyRepository.append(sessionId, role, content == null ? "" : content);
    }

    public Flux<ConversationMessage> getHistory(String sessionId) {
        return historyRepository.findBySessionId(sessionId);
    }

    /**
     * Drop the history of a session that has ended. Session ids are never reused.
     */
    public Mono<Void> release(String sessionId) {
        return historyRepository.deleteBySessionId(sessionId)
                .doOnSuccess(done -> log.debug("Released history of session {}", sessionId));
    }

    /**
     * Summarise all but the newest messages once the history reaches the threshold.
     * The summarised prefix is swapped for one summary message in a single repository call;
     * anything appended while the summary was being written is kept. Failures leave the
     * history unmodified.
     *
     * @return {@code true} when the history was compacted
     */
    public Mono<Boolean> compactIfNeeded(String sessionId) {
        return historyRepository.findBySessionId(sessionId)
                .collectList()
                .flatMap(messages -> {
                    if (messages.size() < config.getCompactionThreshold()
                            || messages.size() <= config.getKeepRecent()) {
                        return Mono.just(false);
                    }
                    List<ConversationMessage> prefix = messages.subList(0, messages.size() - config.getKeepRecent());
                    long firstIndex = prefix.get(0).getIndex();
                    long lastIndex = prefix.get(prefix.size() - 1).getIndex();

                    return generativeBackend.complete(CompanionPrompts.HISTORY_SUMMARY_INSTRUCTION, transcript(prefix))
                            .map(String::trim)
                            .filter(summary -> !summary.isEmpty())
                            .switchIfEmpty(Mono.error(new IllegalStateException("Backend returned an empty summary")))
                            .flatMap(summary -> historyRepository.replacePrefix(sessionId, firstIndex, lastIndex,
                                    ConversationMessage.SUMMARY_PREFIX + " " + summary))
                            .doOnNext(applied -> {
                                if (applied) {
                                    compactionsCounter.increment();
                                    structuredLogger.logCompaction("history:" + sessionId, prefix.size(),
                                            config.getKeepRecent(), true);
                                } else {
                                    log.info("History of session {} changed during compaction, skipped", sessionId);
                                }
                            });
                })
                .onErrorResume(e -> {
                    compactionFailuresCounter.increment();
                    log.warn("History compaction for session {} failed: {}", sessionId, e.getMessage());
                    structuredLogger.logCompaction("history:" + sessionId, 0, 0, false);
                    return Mono.just(false);
                });
    }

    static String transcript(List<ConversationMessage> messages) {
        return messages.stream()
                .map(message -> (message.isCompactionSummary() ? "summary" : message.getRole().value())
                        + ": " + message.getContent())
                .collect(Collectors.joining("\n"));
    }
}
