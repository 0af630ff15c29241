package com.z254.robi.domain.repository.impl;

import com.z254.robi.domain.model.FaceEmbedding;
import com.z254.robi.domain.model.Person;
import com.z254.robi.domain.repository.PersonRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory {@link PersonRepository} implementation for local development.
 */
@Repository
public class InMemoryPersonRepository implements PersonRepository {

    private final Map<String, Person> people = new ConcurrentHashMap<>();
    private final Map<String, List<FaceEmbedding>> embeddings = new ConcurrentHashMap<>();

    @Override
    public Mono<Person> findById(String personId) {
        return Mono.fromSupplier(() -> personId == null ? null : people.get(personId))
                .map(person -> person.toBuilder().build());
    }

    @Override
    public Flux<Person> findAll() {
        return Flux.fromIterable(people.values())
                .map(person -> person.toBuilder().build());
    }

    @Override
    public Mono<Person> touch(String personId, String defaultName, Instant now) {
        return Mono.fromSupplier(() -> people.compute(personId, (id, existing) -> {
            if (existing == null) {
                return Person.builder()
                        .personId(id)
                        .name(defaultName)
                        .firstSeen(now)
                        .lastSeen(now)
                        .interactionCount(1)
                        .build();
            }
            return existing.toBuilder()
                    .lastSeen(now)
                    .interactionCount(existing.getInteractionCount() + 1)
                    .build();
        })).map(person -> person.toBuilder().build());
    }

    @Override
    public Mono<Person> rename(String personId, String name) {
        return Mono.fromSupplier(() -> people.computeIfPresent(personId,
                        (id, existing) -> existing.toBuilder().name(name).build()))
                .map(person -> person.toBuilder().build());
    }

    @Override
    public Mono<FaceEmbedding> saveEmbedding(FaceEmbedding embedding) {
        return Mono.fromSupplier(() -> {
            if (embedding.getPersonId() == null || !people.containsKey(embedding.getPersonId())) {
                throw new IllegalArgumentException("Unknown person: " + embedding.getPersonId());
            }
            if (embedding.getId() == null) {
                embedding.setId(UUID.randomUUID().toString());
            }
            embeddings.computeIfAbsent(embedding.getPersonId(), id -> new CopyOnWriteArrayList<>())
                    .add(embedding);
            return embedding;
        });
    }

    @Override
    public Flux<FaceEmbedding> findEmbeddings(String personId) {
        return Flux.fromIterable(embeddings.getOrDefault(personId, List.of()));
    }
}
