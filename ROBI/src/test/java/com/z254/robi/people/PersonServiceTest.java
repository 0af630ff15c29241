package com.z254.robi.people;

import com.z254.robi.domain.repository.impl.InMemoryPersonRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link PersonService}.
 */
class PersonServiceTest {

    private PersonService personService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T09:00:00Z"), ZoneOffset.UTC);
        personService = new PersonService(new InMemoryPersonRepository(), clock);
    }

    @Nested
    @DisplayName("Slugs")
    class SlugTests {

        @Test
        @DisplayName("should strip accents and collapse separators")
        void stripAccents() {
            assertThat(PersonService.slugFor("María José")).isEqualTo("person_maria_jose");
            assertThat(PersonService.slugFor("  Íñigo  O'Neill ")).isEqualTo("person_inigo_o_neill");
        }

        @Test
        @DisplayName("should fall back for names with no usable characters")
        void fallbackForEmptySlug() {
            assertThat(PersonService.slugFor("¡¿?!")).isEqualTo("person_unknown");
        }
    }

    @Nested
    @DisplayName("People")
    class PeopleTests {

        @Test
        @DisplayName("should count every interaction")
        void countInteractions() {
            personService.getOrCreate("person_ana", "Ana").block();

            StepVerifier.create(personService.getOrCreate("person_ana", null))
                    .assertNext(person -> {
                        assertThat(person.getInteractionCount()).isEqualTo(2);
                        assertThat(person.getName()).isEqualTo("Ana");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should rename a known person")
        void renameKnownPerson() {
            personService.getOrCreate("person_7", null).block();

            StepVerifier.create(personService.rename("person_7", " Luis "))
                    .assertNext(person -> assertThat(person.getName()).isEqualTo("Luis"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should refuse to rename an unknown person")
        void refuseUnknownRename() {
            StepVerifier.create(personService.rename("person_ghost", "Nadie"))
                    .expectError(IllegalArgumentException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("Face Embeddings")
    class EmbeddingTests {

        @Test
        @DisplayName("should attach embeddings to an existing person")
        void attachEmbedding() {
            personService.getOrCreate("person_ana", "Ana").block();

            personService.addEmbedding("person_ana", List.of(0.1f, 0.2f, 0.3f), "daylight").block();

            StepVerifier.create(personService.getEmbeddings("person_ana"))
                    .assertNext(embedding -> {
                        assertThat(embedding.getVector()).containsExactly(0.1f, 0.2f, 0.3f);
                        assertThat(embedding.getSourceLighting()).isEqualTo("daylight");
                        assertThat(embedding.getId()).isNotNull();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should refuse embeddings for an unknown person")
        void refuseUnknownPerson() {
            StepVerifier.create(personService.addEmbedding("person_ghost", List.of(0.5f), null))
                    .expectError(IllegalArgumentException.class)
                    .verify();
        }
    }
}
