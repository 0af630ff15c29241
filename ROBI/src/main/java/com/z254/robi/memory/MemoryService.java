package com.z254.robi.memory;

import com.z254.robi.config.RobiProperties;
import com.z254.robi.domain.model.Memory;
import com.z254.robi.domain.model.MemoryType;
import com.z254.robi.domain.model.Zone;
import com.z254.robi.domain.repository.MemoryRepository;
import com.z254.robi.domain.repository.ZoneRepository;
import com.z254.robi.observability.StructuredLogger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Privacy-gated storage and ranked retrieval of what the robot remembers.
 */
@Slf4j
@Service
public class MemoryService {

    static final Comparator<Memory> BY_IMPORTANCE_THEN_RECENCY = Comparator
            .comparingInt(Memory::getImportance).reversed()
            .thenComparing(Memory::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    static final Comparator<Memory> BY_RECENCY = Comparator
            .comparing(Memory::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final MemoryRepository memoryRepository;
    private final ZoneRepository zoneRepository;
    private final PrivacyFilter privacyFilter;
    private final StructuredLogger structuredLogger;
    private final RobiProperties.MemoryProperties config;
    private final Clock clock;
    private final Counter privacyRejectedCounter;

    public MemoryService(
            MemoryRepository memoryRepository,
            ZoneRepository zoneRepository,
            PrivacyFilter privacyFilter,
            StructuredLogger structuredLogger,
            RobiProperties robiProperties,
            MeterRegistry meterRegistry,
            Clock clock) {
        this.memoryRepository = memoryRepository;
        this.zoneRepository = zoneRepository;
        this.privacyFilter = privacyFilter;
        this.structuredLogger = structuredLogger;
        this.config = robiProperties.getMemory();
        this.clock = clock;
        this.privacyRejectedCounter = Counter.builder("robi.memory.rejected")
                .tag("reason", "private")
                .description("Memories refused by the privacy gate")
                .register(meterRegistry);
    }

    /**
     * Store a memory unless it is blank or trips the privacy gate. Importance is clamped to 1..10.
     */
    public Mono<SaveResult> save(Memory memory) {
        String content = memory.getContent();
        if (content == null || content.isBlank()) {
            return Mono.just(SaveResult.rejectedEmpty());
        }
        Optional<String> keyword = privacyFilter.matchedKeyword(content);
        if (keyword.isPresent()) {
            privacyRejectedCounter.increment();
            structuredLogger.logMemoryRejected(memory.getPersonId(), "keyword:" + keyword.get());
            return Mono.just(SaveResult.rejectedPrivate());
        }

        Memory toStore = memory.toBuilder()
                .content(content.trim())
                .type(memory.getType() != null ? memory.getType() : MemoryType.GENERAL)
                .importance(clamp(memory.getImportance()))
                .createdAt(memory.getCreatedAt() != null ? memory.getCreatedAt() : Instant.now(clock))
                .build();
        return memoryRepository.save(toStore)
                .map(SaveResult::stored)
                .doOnNext(result -> log.debug("Stored {} memory for scope {}",
                        toStore.getType().value(), scopeName(toStore.getPersonId())));
    }

    /**
     * All memories of a scope ordered by importance, then most recent first.
     *
     * @param personId       owning person, or {@code null} for the general pool
     * @param includeExpired whether expired memories are returned too
     */
    public Flux<Memory> getForScope(String personId, boolean includeExpired) {
        Instant now = Instant.now(clock);
        return memoryRepository.findByScope(personId)
                .filter(memory -> includeExpired || !memory.isExpired(now))
                .sort(BY_IMPORTANCE_THEN_RECENCY);
    }

    /**
     * The most recent unexpired memories of a scope at or above an importance threshold.
     */
    public Flux<Memory> getRecentImportant(String personId, int minImportance, int limit) {
        Instant now = Instant.now(clock);
        return memoryRepository.findByScope(personId)
                .filter(memory -> !memory.isExpired(now) && memory.getImportance() >= minImportance)
                .sort(BY_RECENCY)
                .take(limit);
    }

    /**
     * Unexpired zone facts, most important first. Restricted to one zone when {@code zoneId} is given.
     */
    public Flux<Memory> getZoneFacts(String zoneId, int limit) {
        Instant now = Instant.now(clock);
        return memoryRepository.findByType(MemoryType.ZONE_INFO)
                .filter(memory -> !memory.isExpired(now))
                .filter(memory -> zoneId == null || Objects.equals(zoneId, memory.getZoneId()))
                .sort(BY_IMPORTANCE_THEN_RECENCY)
                .take(limit);
    }

    /**
     * Build the context bundle for a turn: general facts, facts about the person when known,
     * and facts about the current zone when known.
     */
    public Mono<MemoryContext> loadContext(String personId, String zoneName) {
        int min = config.getMinImportance();
        int limit = config.getContextLimit();

        Mono<List<Memory>> general = getRecentImportant(null, min, limit).collectList();
        Mono<List<Memory>> person = personId == null
                ? Mono.just(List.of())
                : getRecentImportant(personId, min, limit).collectList();
        Mono<List<Memory>> zone = zoneName == null
                ? Mono.just(List.of())
                : zoneRepository.findByName(zoneName)
                        .map(Zone::getId)
                        .flatMap(zoneId -> getZoneFacts(zoneId, config.getZoneFactsLimit()).collectList())
                        .defaultIfEmpty(List.of());

        return Mono.zip(general, person, zone)
                .map(t -> new MemoryContext(t.getT1(), t.getT2(), t.getT3(), personId, zoneName));
    }

    static int clamp(int importance) {
        return Math.max(Memory.MIN_IMPORTANCE, Math.min(Memory.MAX_IMPORTANCE, importance));
    }

    static String scopeName(String personId) {
        return personId == null ? "general" : personId;
    }
}
