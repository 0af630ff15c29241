package com.z254.robi.people;

import com.z254.robi.domain.model.FaceEmbedding;
import com.z254.robi.domain.model.Person;
import com.z254.robi.domain.repository.PersonRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.text.Normalizer;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * People the robot knows and their face samples.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PersonService {

    public static final String SLUG_PREFIX = "person_";

    private final PersonRepository personRepository;
    private final Clock clock;

    /**
     * Slug for a spoken name: accents removed, lower case, non-alphanumerics collapsed to
     * underscores. {@code "María José"} becomes {@code person_maria_jose}.
     */
    public static String slugFor(String name) {
        String ascii = Normalizer.normalize(name == null ? "" : name.trim(), Normalizer.Form.NFD)
                .replaceAll("\\p{M}+", "")
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
        return SLUG_PREFIX + (ascii.isEmpty() ? "unknown" : ascii);
    }

    /**
     * Create the person, or record another interaction with them.
     */
    public Mono<Person> getOrCreate(String personId, String name) {
        if (personId == null || personId.isBlank()) {
            return Mono.error(new IllegalArgumentException("personId must not be blank"));
        }
        String displayName = name != null && !name.isBlank() ? name.trim() : personId;
        return personRepository.touch(personId, displayName, Instant.now(clock))
                .doOnNext(person -> log.debug("Touched person {} ({} interactions)",
                        person.getPersonId(), person.getInteractionCount()));
    }

    public Mono<Person> rename(String personId, String name) {
        return personRepository.rename(personId, name.trim())
                .switchIfEmpty(Mono.error(new IllegalArgumentException("Unknown person: " + personId)));
    }

    /**
     * Attach a face sample. Fails with {@link IllegalArgumentException} for an unknown person.
     */
    public Mono<FaceEmbedding> addEmbedding(String personId, List<Float> vector, String sourceLighting) {
        if (vector == null || vector.isEmpty()) {
            return Mono.error(new IllegalArgumentException("Embedding vector must not be empty"));
        }
        return personRepository.saveEmbedding(FaceEmbedding.builder()
                .personId(personId)
                .vector(List.copyOf(vector))
                .capturedAt(Instant.now(clock))
                .sourceLighting(sourceLighting)
                .build());
    }

    public Flux<FaceEmbedding> getEmbeddings(String personId) {
        return personRepository.findEmbeddings(personId);
    }

    public Mono<Person> findById(String personId) {
        return personRepository.findById(personId);
    }
}
