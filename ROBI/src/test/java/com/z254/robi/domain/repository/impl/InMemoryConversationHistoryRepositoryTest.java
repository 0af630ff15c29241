package com.z254.robi.domain.repository.impl;

import com.z254.robi.domain.model.ConversationMessage;
import com.z254.robi.domain.model.MessageRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link InMemoryConversationHistoryRepository}.
 */
class InMemoryConversationHistoryRepositoryTest {

    private InMemoryConversationHistoryRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryConversationHistoryRepository();
        for (int i = 0; i < 6; i++) {
            repository.append("s1", MessageRole.USER, "m" + i).block();
        }
    }

    @Test
    @DisplayName("should keep sessions apart")
    void sessionsAreIsolated() {
        repository.append("s2", MessageRole.ASSISTANT, "otra").block();

        StepVerifier.create(repository.count("s1")).expectNext(6L).verifyComplete();
        StepVerifier.create(repository.findBySessionId("s2").map(ConversationMessage::getIndex))
                .expectNext(0L)
                .verifyComplete();
    }

    @Test
    @DisplayName("should swap a prefix for a summary at its first index")
    void replacePrefix() {
        StepVerifier.create(repository.replacePrefix("s1", 0, 3, "[SUMMARY] resumen"))
                .expectNext(true)
                .verifyComplete();

        List<ConversationMessage> history = repository.findBySessionId("s1").collectList().block();
        assertThat(history).extracting(ConversationMessage::getContent)
                .containsExactly("[SUMMARY] resumen", "m4", "m5");
        assertThat(history.get(0).getIndex()).isZero();
        assertThat(history.get(0).isCompactionSummary()).isTrue();
    }

    @Test
    @DisplayName("should refuse a stale prefix")
    void refuseStalePrefix() {
        repository.replacePrefix("s1", 0, 3, "[SUMMARY] primero").block();

        StepVerifier.create(repository.replacePrefix("s1", 0, 2, "[SUMMARY] segundo"))
                .expectNext(false)
                .verifyComplete();
        StepVerifier.create(repository.replacePrefix("unknown", 0, 2, "[SUMMARY] nada"))
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    @DisplayName("should continue numbering after a compaction")
    void indexesKeepGrowing() {
        repository.replacePrefix("s1", 0, 3, "[SUMMARY] resumen").block();

        StepVerifier.create(repository.append("s1", MessageRole.ASSISTANT, "nuevo").map(ConversationMessage::getIndex))
                .expectNext(6L)
                .verifyComplete();
    }

    @Test
    @DisplayName("should forget a deleted session")
    void deleteSession() {
        repository.deleteBySessionId("s1").block();

        StepVerifier.create(repository.findBySessionId("s1")).verifyComplete();
    }
}
