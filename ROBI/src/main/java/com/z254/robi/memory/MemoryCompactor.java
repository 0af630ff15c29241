package com.z254.robi.memory;

import com.z254.robi.config.RobiProperties;
import com.z254.robi.domain.model.Memory;
import com.z254.robi.domain.model.MemoryType;
import com.z254.robi.domain.repository.MemoryRepository;
import com.z254.robi.llm.CompanionPrompts;
import com.z254.robi.llm.GenerativeBackend;
import com.z254.robi.observability.StructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Periodic clean-up of the memory store. Per scope (the general pool and each person) it drops
 * expired rows and, when a scope is still over its budget, merges the least important surplus
 * into one summary memory written by the generative backend. Each scope is replaced in a single
 * repository operation; a failed scope is left as it was.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "robi.memory.compaction.enabled", havingValue = "true", matchIfMissing = true)
public class MemoryCompactor {

    private static final String GENERAL_SCOPE = "";

    private static final Comparator<Memory> LEAST_VALUABLE_FIRST = Comparator
            .comparingInt(Memory::getImportance)
            .thenComparing(Memory::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final MemoryRepository memoryRepository;
    private final GenerativeBackend generativeBackend;
    private final PrivacyFilter privacyFilter;
    private final StructuredLogger structuredLogger;
    private final RobiProperties.MemoryProperties.CompactionProperties config;
    private final Clock clock;

    public MemoryCompactor(
            MemoryRepository memoryRepository,
            GenerativeBackend generativeBackend,
            PrivacyFilter privacyFilter,
            StructuredLogger structuredLogger,
            RobiProperties robiProperties,
            Clock clock) {
        this.memoryRepository = memoryRepository;
        this.generativeBackend = generativeBackend;
        this.privacyFilter = privacyFilter;
        this.structuredLogger = structuredLogger;
        this.config = robiProperties.getMemory().getCompaction();
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${robi.memory.compaction.interval:PT6H}",
            initialDelayString = "${robi.memory.compaction.interval:PT6H}")
    public void scheduledCompaction() {
        compactAll()
                .doOnNext(removed -> log.info("Memory compaction removed {} rows", removed))
                .onErrorResume(e -> {
                    log.error("Memory compaction failed", e);
                    return Mono.empty();
                })
                .subscribe();
    }

    /**
     * Compact every scope, one after the other.
     *
     * @return total number of rows removed
     */
    public Mono<Integer> compactAll() {
        return Flux.concat(Flux.just(GENERAL_SCOPE), memoryRepository.findPersonScopes())
                .concatMap(scope -> compactScope(GENERAL_SCOPE.equals(scope) ? null : scope))
                .reduce(0, Integer::sum);
    }

    /**
     * Compact one scope.
     *
     * @param personId owning person, or {@code null} for the general pool
     * @return number of rows removed, zero when nothing changed or the compaction failed
     */
    public Mono<Integer> compactScope(String personId) {
        Instant now = Instant.now(clock);
        String scope = MemoryService.scopeName(personId);
        return memoryRepository.findByScope(personId)
                .collectList()
                .flatMap(all -> {
                    List<String> expiredIds = all.stream()
                            .filter(memory -> memory.isExpired(now))
                            .map(Memory::getId)
                            .collect(Collectors.toList());
                    List<Memory> live = all.stream()
                            .filter(memory -> !memory.isExpired(now))
                            .sorted(LEAST_VALUABLE_FIRST)
                            .toList();

                    if (live.size() <= config.getMaxPerScope()) {
                        if (expiredIds.isEmpty()) {
                            return Mono.just(0);
                        }
                        return memoryRepository.replace(expiredIds, List.of());
                    }

                    List<Memory> merged = live.subList(0, live.size() - config.getMaxPerScope() + 1);
                    return summarise(personId, merged, now)
                            .flatMap(summary -> {
                                List<String> removed = new ArrayList<>(expiredIds);
                                merged.forEach(memory -> removed.add(memory.getId()));
                                return memoryRepository.replace(removed, List.of(summary));
                            });
                })
                .doOnNext(removed -> structuredLogger.logCompaction("memory:" + scope, removed,
                        config.getMaxPerScope(), true))
                .onErrorResume(e -> {
                    log.warn("Memory compaction of scope {} failed: {}", scope, e.getMessage());
                    structuredLogger.logCompaction("memory:" + scope, 0, 0, false);
                    return Mono.just(0);
                });
    }

    private Mono<Memory> summarise(String personId, List<Memory> merged, Instant now) {
        String content = merged.stream()
                .map(memory -> "- " + memory.getContent())
                .collect(Collectors.joining("\n"));
        int importance = merged.stream().mapToInt(Memory::getImportance).max().orElse(5);

        return generativeBackend.complete(CompanionPrompts.MEMORY_SUMMARY_INSTRUCTION, content)
                .map(String::trim)
                .flatMap(summary -> {
                    if (summary.isEmpty()) {
                        return Mono.error(new IllegalStateException("Backend returned an empty memory summary"));
                    }
                    if (privacyFilter.isPrivate(summary)) {
                        return Mono.error(new IllegalStateException("Memory summary failed the privacy gate"));
                    }
                    return Mono.just(Memory.builder()
                            .personId(personId)
                            .type(personId == null ? MemoryType.GENERAL : MemoryType.PERSON_FACT)
                            .content(summary)
                            .importance(importance)
                            .createdAt(now)
                            .build());
                });
    }
}
