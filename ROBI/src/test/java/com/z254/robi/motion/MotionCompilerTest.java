package com.z254.robi.motion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.robi.tag.ActionsTagParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link MotionCompiler}.
 */
class MotionCompilerTest {

    private MotionCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new MotionCompiler();
    }

    @Nested
    @DisplayName("Alias Expansion")
    class AliasExpansionTests {

        @Test
        @DisplayName("should expand aliases so durations add up to the declared total")
        void expandAliasesToDeclaredTotal() {
            MoveSequence sequence = compiler.buildMoveSequence("test",
                    ActionsTagParser.parseSteps("wave:600|rotate_left:400"), "happy");

            assertThat(sequence.getTotalDurationMs()).isEqualTo(1000);
            assertThat(sequence.getSteps()).allMatch(step -> MotionPrimitive.isPrimitive(step.getAction()));
            assertThat(sequence.getStepCount()).isEqualTo(sequence.getSteps().size());
            assertThat(sequence.getEmotionDuring()).isEqualTo("happy");
            assertThat(sequence.getType()).isEqualTo(MoveSequence.TYPE);
        }

        @Test
        @DisplayName("should use the gesture default duration when none is declared")
        void useDefaultDuration() {
            List<MotionStep> wave = compiler.expandStep(MotionStep.builder().action("wave").build());

            assertThat(wave).extracting(MotionStep::getAction)
                    .containsExactly("turn_right_deg", "turn_left_deg", "turn_right_deg");
            assertThat(wave.stream().mapToInt(MotionStep::durationOrZero).sum()).isEqualTo(800);
        }

        @Test
        @DisplayName("should give the rounding remainder to the last segment")
        void remainderToLastSegment() {
            List<MotionStep> shake = compiler.expandStep(MotionStep.builder().action("shake_head").durationMs(1001).build());

            assertThat(shake.stream().mapToInt(MotionStep::durationOrZero).sum()).isEqualTo(1001);
        }

        @Test
        @DisplayName("should keep every expanded duration within bounds")
        void boundedDurations() {
            MoveSequence sequence = compiler.buildMoveSequence("test",
                    ActionsTagParser.parseSteps("wave:2000000000|pause:-5000"), "happy");

            assertThat(sequence.getSteps()).allSatisfy(step ->
                    assertThat(step.getDurationMs()).isBetween(0, MotionStep.MAX_DURATION_MS));
            assertThat(sequence.getTotalDurationMs()).isEqualTo(MotionStep.MAX_DURATION_MS);
        }

        @Test
        @DisplayName("should clamp durations of steps built outside the parser")
        void clampUnparsedSteps() {
            List<MotionStep> wave = compiler.expandStep(
                    MotionStep.builder().action("wave").durationMs(Integer.MAX_VALUE).build());
            List<MotionStep> pause = compiler.expandStep(MotionStep.of(MotionPrimitive.PAUSE, -5000));

            assertThat(wave.stream().mapToInt(MotionStep::durationOrZero).sum()).isEqualTo(MotionStep.MAX_DURATION_MS);
            assertThat(wave).allSatisfy(step -> assertThat(step.getDurationMs()).isNotNegative());
            assertThat(pause.get(0).getDurationMs()).isZero();
        }

        @Test
        @DisplayName("should let a rotation alias override its angle")
        void overrideRotationAngle() {
            MotionStep step = ActionsTagParser.parseStep("rotate_right:45:500").orElseThrow();

            List<MotionStep> expanded = compiler.expandStep(step);

            assertThat(expanded).hasSize(1);
            assertThat(expanded.get(0).getAction()).isEqualTo("turn_right_deg");
            assertThat(expanded.get(0).getParams()).containsEntry("degrees", 45);
            assertThat(expanded.get(0).getDurationMs()).isEqualTo(500);
        }

        @Test
        @DisplayName("should pass primitives and unknown steps through untouched")
        void passThroughOthers() {
            MotionStep turn = ActionsTagParser.parseStep("turn_left_deg:90:1000").orElseThrow();
            MotionStep unknown = ActionsTagParser.parseStep("moonwalk:3000").orElseThrow();

            assertThat(compiler.expandAll(List.of(turn, unknown))).containsExactly(turn, unknown);
        }
    }

    @Nested
    @DisplayName("Canned Sequences")
    class CannedSequenceTests {

        @Test
        @DisplayName("should scan a full turn in eight stops")
        void faceScanFullTurn() {
            MoveSequence scan = compiler.faceScanSequence();

            List<MotionStep> turns = scan.getSteps().stream()
                    .filter(step -> step.getAction().equals("turn_right_deg"))
                    .toList();
            assertThat(turns).hasSize(8);
            assertThat(turns.stream().mapToInt(step -> (Integer) step.getParams().get("degrees")).sum())
                    .isEqualTo(360);
            assertThat(scan.getStepCount()).isEqualTo(16);
            assertThat(scan.getTotalDurationMs()).isEqualTo(8 * (700 + 800));
        }

        @Test
        @DisplayName("should build the default exploration pattern from primitives")
        void defaultExploration() {
            MoveSequence exploration = compiler.defaultExplorationSequence();

            assertThat(exploration.getSteps()).allMatch(step -> MotionPrimitive.isPrimitive(step.getAction()));
            assertThat(exploration.getTotalDurationMs()).isEqualTo(2000 + 1000 + 1600 + 1000 + 2000 + 1000);
        }
    }

    @Test
    @DisplayName("should serialize steps with flattened parameters")
    void serializeFlattened() {
        ObjectMapper mapper = new ObjectMapper();

        JsonNode json = mapper.valueToTree(MotionStep.of(MotionPrimitive.TURN_LEFT_DEG, 1000, 90));

        assertThat(json.get("action").asText()).isEqualTo("turn_left_deg");
        assertThat(json.get("degrees").asInt()).isEqualTo(90);
        assertThat(json.get("duration_ms").asInt()).isEqualTo(1000);
        assertThat(json.has("params")).isFalse();
    }
}
