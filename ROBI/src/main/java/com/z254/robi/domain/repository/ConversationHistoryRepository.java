package com.z254.robi.domain.repository;

import com.z254.robi.domain.model.ConversationMessage;
import com.z254.robi.domain.model.MessageRole;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Repository interface for per-session conversation history.
 */
public interface ConversationHistoryRepository {

    /**
     * Append a message, assigning the next index of the session.
     *
     * @param sessionId session the message belongs to
     * @param role      who said it
     * @param content   message text
     * @return the stored message
     */
    Mono<ConversationMessage> append(String sessionId, MessageRole role, String content);

    /**
     * Messages of a session ordered by index.
     */
    Flux<ConversationMessage> findBySessionId(String sessionId);

    Mono<Long> count(String sessionId);

    /**
     * Replace the messages with index {@code firstIndex..lastIndex} by a single compaction
     * summary stored at {@code firstIndex}. Messages outside the range are kept. Applied only
     * if the history still starts at {@code firstIndex} and still holds {@code lastIndex}.
     *
     * @return {@code true} when the replacement was applied
     */
    Mono<Boolean> replacePrefix(String sessionId, long firstIndex, long lastIndex, String summaryContent);

    Mono<Void> deleteBySessionId(String sessionId);
}
