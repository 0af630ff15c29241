package com.z254.robi.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.robi.config.RobiProperties;
import com.z254.robi.domain.model.Memory;
import com.z254.robi.domain.model.MemoryType;
import com.z254.robi.domain.model.Zone;
import com.z254.robi.domain.model.ZoneCategory;
import com.z254.robi.domain.repository.impl.InMemoryMemoryRepository;
import com.z254.robi.domain.repository.impl.InMemoryZoneRepository;
import com.z254.robi.observability.StructuredLogger;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link MemoryService}.
 */
class MemoryServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    private InMemoryMemoryRepository memoryRepository;
    private InMemoryZoneRepository zoneRepository;
    private MeterRegistry meterRegistry;
    private MemoryService memoryService;

    @BeforeEach
    void setUp() {
        memoryRepository = new InMemoryMemoryRepository();
        zoneRepository = new InMemoryZoneRepository();
        meterRegistry = new SimpleMeterRegistry();
        RobiProperties robiProperties = new RobiProperties();
        robiProperties.getMemory().setMinImportance(5);
        robiProperties.getMemory().setContextLimit(2);

        memoryService = new MemoryService(memoryRepository, zoneRepository, new PrivacyFilter(),
                new StructuredLogger(new ObjectMapper()), robiProperties, meterRegistry,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Memory memory(String personId, String content, int importance, Duration age) {
        return Memory.builder()
                .personId(personId)
                .content(content)
                .importance(importance)
                .createdAt(NOW.minus(age))
                .build();
    }

    @Nested
    @DisplayName("Saving")
    class SavingTests {

        @Test
        @DisplayName("should store ordinary content with clamped importance")
        void storeWithClampedImportance() {
            StepVerifier.create(memoryService.save(memory("person_ana", "  Le gusta el té  ", 42, Duration.ZERO)))
                    .assertNext(result -> {
                        assertThat(result.isStored()).isTrue();
                        assertThat(result.memory().getImportance()).isEqualTo(10);
                        assertThat(result.memory().getContent()).isEqualTo("Le gusta el té");
                        assertThat(result.memory().getId()).isNotNull();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should reject private content without storing it")
        void rejectPrivateContent() {
            StepVerifier.create(memoryService.save(memory(null, "El PIN del móvil es 1234", 5, Duration.ZERO)))
                    .assertNext(result -> {
                        assertThat(result.status()).isEqualTo(SaveResult.Status.REJECTED_PRIVATE);
                        assertThat(result.isStored()).isFalse();
                    })
                    .verifyComplete();

            StepVerifier.create(memoryRepository.findByScope(null)).verifyComplete();
            assertThat(meterRegistry.counter("robi.memory.rejected", "reason", "private").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should reject blank content")
        void rejectBlankContent() {
            StepVerifier.create(memoryService.save(memory(null, "   ", 5, Duration.ZERO)))
                    .assertNext(result -> assertThat(result.status()).isEqualTo(SaveResult.Status.REJECTED_EMPTY))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Retrieval")
    class RetrievalTests {

        @Test
        @DisplayName("should order a scope by importance then recency and skip expired rows")
        void orderScope() {
            memoryService.save(memory("person_ana", "viejo importante", 9, Duration.ofDays(10))).block();
            memoryService.save(memory("person_ana", "nuevo normal", 5, Duration.ofHours(1))).block();
            memoryService.save(memory("person_ana", "reciente importante", 9, Duration.ofDays(1))).block();
            memoryService.save(memory("person_ana", "caducado", 10, Duration.ofDays(2)).toBuilder()
                    .expiresAt(NOW.minusSeconds(1)).build()).block();
            memoryService.save(memory("person_luis", "otra persona", 10, Duration.ZERO)).block();

            StepVerifier.create(memoryService.getForScope("person_ana", false).map(Memory::getContent).collectList())
                    .assertNext(contents -> assertThat(contents)
                            .containsExactly("reciente importante", "viejo importante", "nuevo normal"))
                    .verifyComplete();
            StepVerifier.create(memoryService.getForScope("person_ana", true).count())
                    .expectNext(4L)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should return the most recent memories above the threshold")
        void recentImportant() {
            memoryService.save(memory(null, "a", 8, Duration.ofDays(3))).block();
            memoryService.save(memory(null, "b", 3, Duration.ofDays(1))).block();
            memoryService.save(memory(null, "c", 6, Duration.ofDays(2))).block();
            memoryService.save(memory(null, "d", 5, Duration.ofHours(5))).block();

            StepVerifier.create(memoryService.getRecentImportant(null, 5, 2).map(Memory::getContent))
                    .expectNext("d", "c")
                    .verifyComplete();
        }

        @Test
        @DisplayName("should bundle general, person and zone facts")
        void loadContextBundle() {
            Zone kitchen = zoneRepository.getOrCreate("Cocina", ZoneCategory.KITCHEN, "", NOW).block();
            memoryService.save(memory(null, "La casa tiene dos plantas", 6, Duration.ofDays(1))).block();
            memoryService.save(memory("person_ana", "Le gusta el té", 7, Duration.ofDays(1))).block();
            memoryService.save(Memory.builder()
                    .zoneId(kitchen.getId())
                    .type(MemoryType.ZONE_INFO)
                    .content("La nevera está a la izquierda")
                    .importance(6)
                    .createdAt(NOW)
                    .build()).block();

            StepVerifier.create(memoryService.loadContext("person_ana", "cocina"))
                    .assertNext(context -> {
                        assertThat(context.person()).extracting(Memory::getContent).containsExactly("Le gusta el té");
                        assertThat(context.zone()).extracting(Memory::getContent)
                                .containsExactly("La nevera está a la izquierda");
                        assertThat(context.general()).extracting(Memory::getContent).contains("La casa tiene dos plantas");
                        assertThat(context.render()).contains("Le gusta el té").contains("cocina");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should leave person facts out for an anonymous user")
        void anonymousContext() {
            memoryService.save(memory("person_ana", "Le gusta el té", 7, Duration.ofDays(1))).block();

            StepVerifier.create(memoryService.loadContext(null, null))
                    .assertNext(context -> {
                        assertThat(context.person()).isEmpty();
                        assertThat(context.zone()).isEmpty();
                        assertThat(context.render()).isEmpty();
                    })
                    .verifyComplete();
        }
    }
}
