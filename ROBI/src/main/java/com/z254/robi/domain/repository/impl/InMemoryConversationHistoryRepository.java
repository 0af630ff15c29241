package com.z254.robi.domain.repository.impl;

import com.z254.robi.domain.model.ConversationMessage;
import com.z254.robi.domain.model.MessageRole;
import com.z254.robi.domain.repository.ConversationHistoryRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link ConversationHistoryRepository}, the default history store.
 * Each session's list is guarded by its own monitor.
 */
@Repository
@ConditionalOnProperty(name = "robi.storage.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryConversationHistoryRepository implements ConversationHistoryRepository {

    private final Map<String, SessionLog> sessions = new ConcurrentHashMap<>();

    @Override
    public Mono<ConversationMessage> append(String sessionId, MessageRole role, String content) {
        return Mono.fromSupplier(() -> {
            SessionLog log = sessions.computeIfAbsent(sessionId, id -> new SessionLog());
            synchronized (log) {
                ConversationMessage message = ConversationMessage.builder()
                        .sessionId(sessionId)
                        .role(role)
                        .content(content)
                        .index(log.nextIndex++)
                        .timestamp(Instant.now())
                        .build();
                log.messages.add(message);
                return message.toBuilder().build();
            }
        });
    }

    @Override
    public Flux<ConversationMessage> findBySessionId(String sessionId) {
        return Flux.defer(() -> Flux.fromIterable(snapshot(sessionId)));
    }

    @Override
    public Mono<Long> count(String sessionId) {
        return Mono.fromSupplier(() -> (long) snapshot(sessionId).size());
    }

    @Override
    public Mono<Boolean> replacePrefix(String sessionId, long firstIndex, long lastIndex, String summaryContent) {
        return Mono.fromSupplier(() -> {
            SessionLog log = sessions.get(sessionId);
            if (log == null) {
                return false;
            }
            synchronized (log) {
                List<ConversationMessage> messages = log.messages;
                if (messages.isEmpty() || messages.get(0).getIndex() != firstIndex
                        || messages.stream().noneMatch(m -> m.getIndex() == lastIndex)) {
                    return false;
                }
                messages.removeIf(m -> m.getIndex() >= firstIndex && m.getIndex() <= lastIndex);
                messages.add(0, ConversationMessage.builder()
                        .sessionId(sessionId)
                        .role(MessageRole.USER)
                        .content(summaryContent)
                        .index(firstIndex)
                        .compactionSummary(true)
                        .timestamp(Instant.now())
                        .build());
                return true;
            }
        });
    }

    @Override
    public Mono<Void> deleteBySessionId(String sessionId) {
        return Mono.fromRunnable(() -> sessions.remove(sessionId));
    }

    private List<ConversationMessage> snapshot(String sessionId) {
        SessionLog log = sessions.get(sessionId);
        if (log == null) {
            return List.of();
        }
        synchronized (log) {
            List<ConversationMessage> copy = new ArrayList<>(log.messages.size());
            log.messages.forEach(m -> copy.add(m.toBuilder().build()));
            return copy;
        }
    }

    private static final class SessionLog {
        private final List<ConversationMessage> messages = new ArrayList<>();
        private long nextIndex;
    }
}
