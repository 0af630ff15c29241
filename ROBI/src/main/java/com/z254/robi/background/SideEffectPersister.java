package com.z254.robi.background;

import com.z254.robi.conversation.ConversationHistoryService;
import com.z254.robi.domain.model.Memory;
import com.z254.robi.domain.model.MemoryType;
import com.z254.robi.domain.model.MessageRole;
import com.z254.robi.domain.model.Zone;
import com.z254.robi.domain.model.ZoneCategory;
import com.z254.robi.memory.MemoryService;
import com.z254.robi.memory.SaveResult;
import com.z254.robi.people.PersonService;
import com.z254.robi.tag.DecodedResponse;
import com.z254.robi.tag.MemoryDirective;
import com.z254.robi.tag.ZoneDirective;
import com.z254.robi.zone.ZoneGraphService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Schedules the persistence that follows a turn or a device notification. Every unit of work
 * is its own background task, so one failure never blocks the others.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SideEffectPersister {

    private final BackgroundTaskExecutor executor;
    private final ConversationHistoryService historyService;
    private final PersonService personService;
    private final MemoryService memoryService;
    private final ZoneGraphService zoneGraphService;

    /**
     * Last history write of each open session; each write starts after the previous one ends.
     */
    private final Map<String, Mono<Void>> historyWrites = new ConcurrentHashMap<>();

    /**
     * Schedule history, person, memory and zone updates for a completed turn.
     */
    public void persistTurn(TurnOutcome outcome) {
        DecodedResponse response = outcome.response();
        String sessionId = outcome.sessionId();

        Mono<Void> write = historyWrites.compute(sessionId, (id, previous) -> afterQuietly(previous)
                .then(Mono.defer(() -> recordHistory(outcome)))
                .cache());
        executor.submit("history", sessionId, () -> write
                .doFinally(signal -> historyWrites.remove(sessionId, write)));

        response.getDirectives().personName().ifPresent(name ->
                executor.submit("person", sessionId, () -> recordPerson(outcome, name)));

        for (MemoryDirective directive : response.getDirectives().memories()) {
            executor.submit("memory", sessionId, () -> recordMemory(outcome, directive));
        }

        for (ZoneDirective directive : response.getDirectives().zones()) {
            executor.submit("zone_learn", sessionId, () -> zoneGraphService
                    .getOrCreate(directive.name(), directive.category(), directive.description()));
        }
    }

    /**
     * The robot entered a zone. Records it as current and, when it came from a different
     * zone, learns the path between them.
     */
    public void zoneEntered(String sessionId, String previousZone, String zoneName, ZoneCategory category) {
        executor.submit("zone_enter", sessionId, () -> zoneGraphService
                .getOrCreate(zoneName, category, "")
                .then(zoneGraphService.setCurrentZone(zoneName)));
        if (previousZone != null && !previousZone.equalsIgnoreCase(zoneName)) {
            executor.submit("zone_path", sessionId, () -> zoneGraphService
                    .addPathIfAbsent(previousZone, zoneName, "learned while moving", null));
        }
    }

    public void zoneLeft(String sessionId, String zoneName) {
        executor.submit("zone_leave", sessionId, () -> zoneGraphService.getCurrentZone()
                .filter(current -> current.getName().equalsIgnoreCase(zoneName))
                .flatMap(current -> zoneGraphService.clearCurrentZone().thenReturn(current)));
    }

    public void zoneDiscovered(String sessionId, String zoneName, ZoneCategory category) {
        executor.submit("zone_discover", sessionId, () -> zoneGraphService.getOrCreate(zoneName, category, ""));
    }

    public void personSeen(String sessionId, String personId) {
        executor.submit("person_seen", sessionId, () -> personService.getOrCreate(personId, null));
    }

    /**
     * The session is over. Its history is released once the pending history writes finish.
     */
    public void sessionClosed(String sessionId) {
        if (sessionId == null) {
            return;
        }
        Mono<Void> pending = historyWrites.remove(sessionId);
        executor.submit("history_release", sessionId, () -> afterQuietly(pending)
                .then(historyService.release(sessionId)));
    }

    private static Mono<Void> afterQuietly(Mono<Void> previous) {
        return previous == null ? Mono.empty() : previous.onErrorResume(e -> Mono.empty());
    }

    private Mono<Void> recordHistory(TurnOutcome outcome) {
        String userEntry = outcome.input().historyEntry(outcome.response().getMediaSummary());
        String assistantEntry = outcome.response().getVisibleText().strip();
        return historyService.append(outcome.sessionId(), MessageRole.USER, userEntry)
                .then(historyService.append(outcome.sessionId(), MessageRole.ASSISTANT, assistantEntry))
                .then(historyService.compactIfNeeded(outcome.sessionId()))
                .then();
    }

    private Mono<Void> recordPerson(TurnOutcome outcome, String name) {
        String personId = outcome.personId() != null ? outcome.personId() : PersonService.slugFor(name);
        Mono<Void> person = personService.getOrCreate(personId, name)
                .then(personService.rename(personId, name))
                .doOnNext(renamed -> log.info("Person {} is now known as {}", personId, name))
                .then();
        if (outcome.faceEmbedding() == null || outcome.faceEmbedding().isEmpty()) {
            return person;
        }
        return person.then(personService.addEmbedding(personId, outcome.faceEmbedding(), null)).then();
    }

    private Mono<SaveResult> recordMemory(TurnOutcome outcome, MemoryDirective directive) {
        MemoryType type = directive.type();
        String personId = type.isPersonScoped() ? outcome.personId() : null;
        Mono<String> zoneId = type == MemoryType.ZONE_INFO && outcome.zoneName() != null
                ? zoneGraphService.getOrCreate(outcome.zoneName(), ZoneCategory.UNKNOWN, "").map(Zone::getId)
                : Mono.empty();

        return zoneId.map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(zone -> memoryService.save(Memory.builder()
                        .personId(personId)
                        .zoneId(zone.orElse(null))
                        .type(type)
                        .content(directive.content())
                        .importance(type.getDefaultImportance())
                        .build()))
                .doOnNext(result -> {
                    if (!result.isStored()) {
                        log.info("Memory directive not stored: {}", result.status());
                    }
                });
    }
}
