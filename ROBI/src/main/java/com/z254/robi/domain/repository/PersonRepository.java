package com.z254.robi.domain.repository;

import com.z254.robi.domain.model.FaceEmbedding;
import com.z254.robi.domain.model.Person;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Repository interface for people and their face embeddings.
 */
public interface PersonRepository {

    Mono<Person> findById(String personId);

    Flux<Person> findAll();

    /**
     * Create the person if missing, otherwise bump the interaction counter and last-seen time.
     * Atomic per person.
     *
     * @param personId    slug of the person
     * @param defaultName name used only when the person is created
     * @param now         timestamp to record
     * @return the stored person after the update
     */
    Mono<Person> touch(String personId, String defaultName, Instant now);

    /**
     * Change the display name. Emits empty when the person does not exist.
     */
    Mono<Person> rename(String personId, String name);

    /**
     * Store an embedding. Fails with {@link IllegalArgumentException} when the person is unknown.
     */
    Mono<FaceEmbedding> saveEmbedding(FaceEmbedding embedding);

    Flux<FaceEmbedding> findEmbeddings(String personId);
}
