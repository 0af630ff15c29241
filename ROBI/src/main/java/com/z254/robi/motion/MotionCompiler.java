package com.z254.robi.motion;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Compiles action steps decoded from model output into primitive move sequences.
 * <p>
 * Gesture aliases expand into primitives whose durations add up to the alias
 * duration (the declared one, or the gesture default). Primitives and unknown
 * steps pass through untouched apart from their duration. Every duration is
 * bounded to {@code 0..MotionStep.MAX_DURATION_MS}.
 */
@Slf4j
@Component
public class MotionCompiler {

    static final int SCAN_STEPS = 8;
    static final int SCAN_TURN_DEGREES = 45;
    static final int SCAN_TURN_MS = 700;
    static final int SCAN_PAUSE_MS = 800;

    private static final Map<String, Gesture> GESTURES = new LinkedHashMap<>();

    static {
        GESTURES.put("wave", new Gesture(800, false, List.of(
                new Segment(MotionPrimitive.TURN_RIGHT_DEG, 1, 20),
                new Segment(MotionPrimitive.TURN_LEFT_DEG, 2, 40),
                new Segment(MotionPrimitive.TURN_RIGHT_DEG, 1, 20))));
        GESTURES.put("nod", new Gesture(600, false, List.of(
                new Segment(MotionPrimitive.MOVE_FORWARD_CM, 1, 3),
                new Segment(MotionPrimitive.MOVE_BACKWARD_CM, 1, 3))));
        GESTURES.put("shake_head", new Gesture(900, false, List.of(
                new Segment(MotionPrimitive.TURN_LEFT_DEG, 1, 25),
                new Segment(MotionPrimitive.TURN_RIGHT_DEG, 2, 50),
                new Segment(MotionPrimitive.TURN_LEFT_DEG, 1, 25))));
        GESTURES.put("rotate_left", new Gesture(1000, true, List.of(
                new Segment(MotionPrimitive.TURN_LEFT_DEG, 1, 90))));
        GESTURES.put("rotate_right", new Gesture(1000, true, List.of(
                new Segment(MotionPrimitive.TURN_RIGHT_DEG, 1, 90))));
        GESTURES.put("spin", new Gesture(2000, false, List.of(
                new Segment(MotionPrimitive.TURN_RIGHT_DEG, 1, 360))));
        GESTURES.put("celebrate", new Gesture(1500, false, List.of(
                new Segment(MotionPrimitive.LED_COLOR, 1, 255, 215, 0),
                new Segment(MotionPrimitive.TURN_RIGHT_DEG, 2, 180),
                new Segment(MotionPrimitive.TURN_LEFT_DEG, 2, 180))));
        GESTURES.put("look_around", new Gesture(1600, false, List.of(
                new Segment(MotionPrimitive.TURN_LEFT_DEG, 1, 45),
                new Segment(MotionPrimitive.PAUSE, 1),
                new Segment(MotionPrimitive.TURN_RIGHT_DEG, 2, 90),
                new Segment(MotionPrimitive.PAUSE, 1),
                new Segment(MotionPrimitive.TURN_LEFT_DEG, 1, 45))));
    }

    public static boolean isGesture(String action) {
        return action != null && GESTURES.containsKey(action.toLowerCase(Locale.ROOT));
    }

    /**
     * Expand one step. Aliases become primitives, everything else is returned as is.
     */
    public List<MotionStep> expandStep(MotionStep step) {
        String action = step.getAction() == null ? "" : step.getAction().toLowerCase(Locale.ROOT);
        Gesture gesture = GESTURES.get(action);
        if (gesture == null) {
            if (!MotionPrimitive.isPrimitive(action)) {
                log.debug("Passing through unknown motion step: {}", step.getAction());
            }
            Integer declared = step.getDurationMs();
            if (declared == null || declared == MotionStep.clampDuration(declared)) {
                return List.of(step);
            }
            return List.of(MotionStep.builder()
                    .action(step.getAction())
                    .params(step.getParams() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(step.getParams()))
                    .durationMs(MotionStep.clampDuration(declared))
                    .build());
        }

        int duration = MotionStep.clampDuration(
                step.getDurationMs() != null ? step.getDurationMs() : gesture.defaultDurationMs);
        Integer degreesOverride = gesture.degreesOverridable ? firstInteger(step.getParams()) : null;
        return gesture.expand(duration, degreesOverride);
    }

    public List<MotionStep> expandAll(List<MotionStep> steps) {
        List<MotionStep> expanded = new ArrayList<>();
        for (MotionStep step : steps) {
            expanded.addAll(expandStep(step));
        }
        return expanded;
    }

    /**
     * Build a move sequence from raw steps, expanding aliases first.
     * Steps without a duration count as zero towards the total.
     */
    public MoveSequence buildMoveSequence(String description, List<MotionStep> steps, String emotionDuring) {
        List<MotionStep> expanded = expandAll(steps);
        int total = expanded.stream().mapToInt(MotionStep::durationOrZero).sum();
        return MoveSequence.builder()
                .description(description)
                .emotionDuring(emotionDuring)
                .totalDurationMs(total)
                .stepCount(expanded.size())
                .steps(expanded)
                .build();
    }

    /**
     * A full turn in place, stopping every 45 degrees so the camera can look for faces.
     */
    public MoveSequence faceScanSequence() {
        List<MotionStep> steps = new ArrayList<>();
        for (int i = 0; i < SCAN_STEPS; i++) {
            steps.add(MotionStep.of(MotionPrimitive.TURN_RIGHT_DEG, SCAN_TURN_MS, SCAN_TURN_DEGREES));
            steps.add(MotionStep.of(MotionPrimitive.PAUSE, SCAN_PAUSE_MS));
        }
        return buildMoveSequence("Face scan", steps, "curious");
    }

    /**
     * Fallback pattern used when the model suggests nothing for an exploration run.
     */
    public MoveSequence defaultExplorationSequence() {
        List<MotionStep> steps = List.of(
                MotionStep.of(MotionPrimitive.MOVE_FORWARD_CM, 2000, 50),
                MotionStep.of(MotionPrimitive.PAUSE, 1000),
                MotionStep.builder().action("look_around").durationMs(1600).build(),
                MotionStep.of(MotionPrimitive.TURN_RIGHT_DEG, 1000, 90),
                MotionStep.of(MotionPrimitive.MOVE_FORWARD_CM, 2000, 50),
                MotionStep.of(MotionPrimitive.PAUSE, 1000));
        return buildMoveSequence("Default exploration", steps, "curious");
    }

    private static Integer firstInteger(Map<String, Object> params) {
        if (params == null) {
            return null;
        }
        for (Object value : params.values()) {
            if (value instanceof Integer i) {
                return i;
            }
        }
        return null;
    }

    private record Segment(MotionPrimitive primitive, int weight, Object... values) {
    }

    private record Gesture(int defaultDurationMs, boolean degreesOverridable, List<Segment> segments) {

        List<MotionStep> expand(int durationMs, Integer degreesOverride) {
            int totalWeight = segments.stream().mapToInt(Segment::weight).sum();
            List<MotionStep> steps = new ArrayList<>(segments.size());
            int assigned = 0;
            for (int i = 0; i < segments.size(); i++) {
                Segment segment = segments.get(i);
                int share = i == segments.size() - 1
                        ? durationMs - assigned
                        : (int) ((long) durationMs * segment.weight() / totalWeight);
                assigned += share;
                Object[] values = segment.values();
                if (degreesOverride != null && values.length == 1) {
                    values = new Object[]{degreesOverride};
                }
                steps.add(MotionStep.of(segment.primitive(), share, values));
            }
            return steps;
        }
    }
}
