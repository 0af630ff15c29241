package com.z254.robi.tag;

import com.z254.robi.motion.MotionStep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link StreamingTagDecoder}.
 */
class StreamingTagDecoderTest {

    @Nested
    @DisplayName("Header")
    class HeaderTests {

        @Test
        @DisplayName("should resolve an emotion tag split across chunks")
        void resolveEmotionSplitAcrossChunks() {
            StreamingTagDecoder decoder = new StreamingTagDecoder();

            StepVerifier.create(decoder.decode(Flux.just("[emot", "ion:sad] Lo ", "siento.")))
                    .expectNext(DecodedFragment.ofEmotion(Emotion.SAD))
                    .expectNext(DecodedFragment.ofText("Lo "))
                    .expectNext(DecodedFragment.ofText("siento."))
                    .verifyComplete();

            assertThat(decoder.result().getVisibleText()).isEqualTo("Lo siento.");
            assertThat(decoder.result().getEmotion()).isEqualTo(Emotion.SAD);
        }

        @Test
        @DisplayName("should parse emotion, emojis and actions in one header")
        void parseFullHeader() {
            DecodedResponse response = StreamingTagDecoder.decodeComplete(
                    "[emotion:happy][emojis:1f44b, 2764][actions:wave:600|rotate_left:400] ¡Hola!");

            assertThat(response.getEmotion()).isEqualTo(Emotion.HAPPY);
            assertThat(response.getEmojis()).containsExactly("1F44B", "2764");
            assertThat(response.getActions()).extracting(MotionStep::getAction)
                    .containsExactly("wave", "rotate_left");
            assertThat(response.getActions()).extracting(MotionStep::getDurationMs)
                    .containsExactly(600, 400);
            assertThat(response.getVisibleText()).isEqualTo("¡Hola!");
        }

        @Test
        @DisplayName("should accept header tags in any order and case")
        void acceptHeaderTagsInAnyOrder() {
            DecodedResponse response = StreamingTagDecoder.decodeComplete(
                    "[EMOJIS:1F60A] [Emotion:Excited] ¡Genial!");

            assertThat(response.getEmotion()).isEqualTo(Emotion.EXCITED);
            assertThat(response.getEmojis()).containsExactly("1F60A");
            assertThat(response.getVisibleText()).isEqualTo("¡Genial!");
        }

        @Test
        @DisplayName("should default to neutral for unknown or missing emotion")
        void defaultToNeutral() {
            assertThat(StreamingTagDecoder.decodeComplete("[emotion:grumpy] Hmm").getEmotion())
                    .isEqualTo(Emotion.NEUTRAL);
            assertThat(StreamingTagDecoder.decodeComplete("Sin etiquetas").getEmotion())
                    .isEqualTo(Emotion.NEUTRAL);
        }

        @Test
        @DisplayName("should emit text immediately when the reply has no tags")
        void emitUntaggedTextImmediately() {
            StreamingTagDecoder decoder = new StreamingTagDecoder();

            List<DecodedFragment> first = decoder.feed("Hola");

            assertThat(first).containsExactly(
                    DecodedFragment.ofEmotion(Emotion.NEUTRAL),
                    DecodedFragment.ofText("Hola"));
        }

        @Test
        @DisplayName("should hold text while a header tag may still be arriving")
        void holdWhileHeaderIncomplete() {
            StreamingTagDecoder decoder = new StreamingTagDecoder();

            assertThat(decoder.feed("[emotion:hap")).isEmpty();
            assertThat(decoder.isHeaderResolved()).isFalse();
        }

        @Test
        @DisplayName("should emit exactly one neutral emotion for an empty stream")
        void emitEmotionForEmptyStream() {
            StepVerifier.create(new StreamingTagDecoder().decode(Flux.empty()))
                    .expectNext(DecodedFragment.ofEmotion(Emotion.NEUTRAL))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should give up on the header once the buffer cap is reached")
        void resolveAtBufferCap() {
            StreamingTagDecoder decoder = new StreamingTagDecoder(10);

            assertThat(decoder.feed("[emotion:")).isEmpty();
            List<DecodedFragment> fragments = decoder.feed("happyyyyy");

            assertThat(decoder.isHeaderResolved()).isTrue();
            assertThat(fragments.get(0)).isEqualTo(DecodedFragment.ofEmotion(Emotion.NEUTRAL));
            assertThat(fragments).noneMatch(f -> !f.isEmotion() && f.text().contains("[emotion:"));
        }

        @Test
        @DisplayName("should treat brackets that are not control tags as text")
        void treatPlainBracketsAsText() {
            DecodedResponse response = StreamingTagDecoder.decodeComplete("[nota] hola [1] adiós");

            assertThat(response.getVisibleText()).isEqualTo("[nota] hola [1] adiós");
        }
    }

    @Nested
    @DisplayName("Body")
    class BodyTests {

        @Test
        @DisplayName("should capture media summary and strip it from the text")
        void captureMediaSummary() {
            DecodedResponse response = StreamingTagDecoder.decodeComplete(
                    "[emotion:curious] [media_summary:Una taza roja sobre la mesa]   Veo una taza.");

            assertThat(response.getMediaSummary()).isEqualTo("Una taza roja sobre la mesa");
            assertThat(response.getVisibleText()).isEqualTo("Veo una taza.");
            assertThat(response.getEmotion()).isEqualTo(Emotion.CURIOUS);
        }

        @Test
        @DisplayName("should strip directives from the text but keep them in the result")
        void stripDirectives() {
            DecodedResponse response = StreamingTagDecoder.decodeComplete(
                    "[emotion:happy] Encantado, Ana.[person_name:Ana][memory:person_fact:Le gusta el té]"
                            + "[zone_learn:Cocina:kitchen:Tiene una nevera grande]");

            assertThat(response.getVisibleText()).isEqualTo("Encantado, Ana.");
            assertThat(response.getDirectives().personName()).contains("Ana");
            assertThat(response.getDirectives().memories()).hasSize(1);
            assertThat(response.getDirectives().zones()).hasSize(1);
        }

        @Test
        @DisplayName("should honour emojis and actions that arrive after the header")
        void honourLateEmojisAndActions() {
            DecodedResponse response = StreamingTagDecoder.decodeComplete(
                    "[emotion:happy] Hola [emojis:1F44B] [actions:nod]");

            assertThat(response.getEmojis()).containsExactly("1F44B");
            assertThat(response.getActions()).extracting(MotionStep::getAction).containsExactly("nod");
            assertThat(response.getVisibleText()).isEqualTo("Hola  ");
        }

        @Test
        @DisplayName("should drop the opener of a tag that never closes")
        void dropUnterminatedOpener() {
            DecodedResponse response = StreamingTagDecoder.decodeComplete(
                    "[emotion:happy] Hola [memory:general:algo");

            assertThat(response.getVisibleText()).doesNotContain("[memory:");
            assertThat(response.getVisibleText()).startsWith("Hola ");
        }

        @Test
        @DisplayName("should drop the opener of a tag broken by a nested bracket")
        void dropOpenerBrokenByNestedBracket() {
            DecodedResponse response = StreamingTagDecoder.decodeComplete(
                    "[emotion:sad] a [memory:x [y] z");

            assertThat(response.getVisibleText()).isEqualTo("a x [y] z");
        }
    }

    @Nested
    @DisplayName("Chunking")
    class ChunkingTests {

        private static final String RESPONSE =
                "[emotion:curious][emojis:1F440][actions:look_around:1600] "
                        + "[media_summary:Una taza roja] Veo una taza. [memory:general:Hay una taza roja] "
                        + "¿Es tuya? [person_name:Ana] [notas] fin";

        @Test
        @DisplayName("should decode the same result for every two-chunk split")
        void sameResultForEveryTwoChunkSplit() {
            DecodedResponse expected = StreamingTagDecoder.decodeComplete(RESPONSE);

            for (int split = 1; split < RESPONSE.length(); split++) {
                StreamingTagDecoder decoder = new StreamingTagDecoder();
                List<DecodedFragment> fragments = new ArrayList<>(decoder.feed(RESPONSE.substring(0, split)));
                fragments.addAll(decoder.feed(RESPONSE.substring(split)));
                fragments.addAll(decoder.finish());
                DecodedResponse actual = decoder.result();

                assertThat(actual.getVisibleText()).as("split at %d", split).isEqualTo(expected.getVisibleText());
                assertThat(actual.getEmotion()).as("split at %d", split).isEqualTo(expected.getEmotion());
                assertThat(actual.getEmojis()).as("split at %d", split).isEqualTo(expected.getEmojis());
                assertThat(actual.getMediaSummary()).as("split at %d", split).isEqualTo(expected.getMediaSummary());
                assertThat(fragments.stream().filter(DecodedFragment::isEmotion)).hasSize(1);
            }
        }

        @Test
        @DisplayName("should never forward a control tag opener when fed one character at a time")
        void neverForwardOpenerCharByChar() {
            StreamingTagDecoder decoder = new StreamingTagDecoder();
            StringBuilder forwarded = new StringBuilder();

            for (char c : RESPONSE.toCharArray()) {
                decoder.feed(String.valueOf(c)).stream()
                        .filter(f -> !f.isEmotion())
                        .forEach(f -> forwarded.append(f.text()));
            }
            decoder.finish().stream()
                    .filter(f -> !f.isEmotion())
                    .forEach(f -> forwarded.append(f.text()));

            assertThat(ControlTag.containsOpener(forwarded)).isFalse();
            assertThat(forwarded.toString()).isEqualTo(StreamingTagDecoder.decodeComplete(RESPONSE).getVisibleText());
            assertThat(forwarded.toString()).startsWith("Veo una taza.").endsWith("[notas] fin");
        }

        @Test
        @DisplayName("should not count whitespace around header tags towards the buffer cap")
        void whitespaceDoesNotFillHeaderWindow() {
            String response = " ".repeat(600) + "[emotion:sad]" + "\n".repeat(600) + "[emojis:1F622] Lo siento.";
            DecodedResponse expected = StreamingTagDecoder.decodeComplete(response);
            StreamingTagDecoder decoder = new StreamingTagDecoder();

            for (char c : response.toCharArray()) {
                decoder.feed(String.valueOf(c));
            }
            decoder.finish();

            assertThat(expected.getEmotion()).isEqualTo(Emotion.SAD);
            assertThat(decoder.result().getEmotion()).isEqualTo(Emotion.SAD);
            assertThat(decoder.result().getEmojis()).isEqualTo(expected.getEmojis()).isNotEmpty();
            assertThat(decoder.result().getVisibleText()).isEqualTo(expected.getVisibleText());
        }

        @Test
        @DisplayName("should emit the emotion before any text")
        void emitEmotionFirst() {
            StepVerifier.create(new StreamingTagDecoder().decode(Flux.just("[emotion:", "happy]", " Hola")))
                    .assertNext(fragment -> assertThat(fragment.isEmotion()).isTrue())
                    .assertNext(fragment -> assertThat(fragment.text()).isEqualTo("Hola"))
                    .verifyComplete();
        }
    }

    @Test
    @DisplayName("should reject input after finish")
    void rejectInputAfterFinish() {
        StreamingTagDecoder decoder = new StreamingTagDecoder();
        decoder.finish();

        assertThatThrownBy(() -> decoder.feed("late"))
                .isInstanceOf(IllegalStateException.class);
    }
}
