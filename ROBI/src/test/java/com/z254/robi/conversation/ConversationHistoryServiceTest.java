package com.z254.robi.conversation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.robi.config.RobiProperties;
import com.z254.robi.domain.model.ConversationMessage;
import com.z254.robi.domain.model.MessageRole;
import com.z254.robi.domain.repository.impl.InMemoryConversationHistoryRepository;
import com.z254.robi.llm.CompanionPrompts;
import com.z254.robi.llm.GenerativeBackend;
import com.z254.robi.observability.StructuredLogger;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ConversationHistoryService}.
 */
@ExtendWith(MockitoExtension.class)
class ConversationHistoryServiceTest {

    private static final String SESSION = "session-1";

    @Mock
    private GenerativeBackend generativeBackend;

    private InMemoryConversationHistoryRepository repository;
    private MeterRegistry meterRegistry;
    private ConversationHistoryService historyService;

    @BeforeEach
    void setUp() {
        repository = new InMemoryConversationHistoryRepository();
        meterRegistry = new SimpleMeterRegistry();
        RobiProperties robiProperties = new RobiProperties();
        robiProperties.getConversation().setCompactionThreshold(20);
        robiProperties.getConversation().setKeepRecent(5);
        historyService = new ConversationHistoryService(repository, generativeBackend,
                new StructuredLogger(new ObjectMapper()), robiProperties, meterRegistry);
    }

    private void fill(int count) {
        for (int i = 0; i < count; i++) {
            MessageRole role = i % 2 == 0 ? MessageRole.USER : MessageRole.ASSISTANT;
            historyService.append(SESSION, role, "mensaje " + i).block();
        }
    }

    @Test
    @DisplayName("should assign consecutive indexes in append order")
    void appendInOrder() {
        fill(3);

        StepVerifier.create(historyService.getHistory(SESSION).map(ConversationMessage::getIndex))
                .expectNext(0L, 1L, 2L)
                .verifyComplete();
    }

    @Test
    @DisplayName("should replace everything but the newest messages with one summary")
    void compactAtThreshold() {
        fill(20);
        when(generativeBackend.complete(eq(CompanionPrompts.HISTORY_SUMMARY_INSTRUCTION), startsWith("user: mensaje 0")))
                .thenReturn(Mono.just("  Hablamos del tiempo.  "));

        StepVerifier.create(historyService.compactIfNeeded(SESSION))
                .expectNext(true)
                .verifyComplete();

        List<ConversationMessage> history = historyService.getHistory(SESSION).collectList().block();
        assertThat(history).hasSize(6);
        assertThat(history.get(0).isCompactionSummary()).isTrue();
        assertThat(history.get(0).getContent()).isEqualTo(ConversationMessage.SUMMARY_PREFIX + " Hablamos del tiempo.");
        assertThat(history.subList(1, 6)).extracting(ConversationMessage::getContent)
                .containsExactly("mensaje 15", "mensaje 16", "mensaje 17", "mensaje 18", "mensaje 19");
        assertThat(meterRegistry.counter("robi.history.compactions").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should do nothing below the threshold")
    void belowThreshold() {
        fill(19);

        StepVerifier.create(historyService.compactIfNeeded(SESSION))
                .expectNext(false)
                .verifyComplete();

        verify(generativeBackend, never()).complete(anyString(), anyString());
    }

    @Test
    @DisplayName("should keep the history untouched when summarising fails")
    void keepHistoryOnFailure() {
        fill(20);
        when(generativeBackend.complete(anyString(), anyString()))
                .thenReturn(Mono.error(new IllegalStateException("backend down")));

        StepVerifier.create(historyService.compactIfNeeded(SESSION))
                .expectNext(false)
                .verifyComplete();

        StepVerifier.create(historyService.getHistory(SESSION).count())
                .expectNext(20L)
                .verifyComplete();
        assertThat(meterRegistry.counter("robi.history.compactions.failed").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should treat a blank summary as a failure")
    void blankSummary() {
        fill(20);
        when(generativeBackend.complete(anyString(), anyString())).thenReturn(Mono.just("   "));

        StepVerifier.create(historyService.compactIfNeeded(SESSION))
                .expectNext(false)
                .verifyComplete();

        StepVerifier.create(historyService.getHistory(SESSION).count())
                .expectNext(20L)
                .verifyComplete();
    }

    @Test
    @DisplayName("should label earlier summaries in the transcript")
    void transcriptLabelsSummaries() {
        List<ConversationMessage> messages = List.of(
                ConversationMessage.builder().role(MessageRole.USER).content("[SUMMARY] antes").compactionSummary(true).build(),
                ConversationMessage.builder().role(MessageRole.ASSISTANT).content("¡Hola!").build());

        assertThat(ConversationHistoryService.transcript(messages))
                .isEqualTo("summary: [SUMMARY] antes\nassistant: ¡Hola!");
    }
}
