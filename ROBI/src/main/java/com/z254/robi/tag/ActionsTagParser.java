package com.z254.robi.tag;

import com.z254.robi.motion.MotionPrimitive;
import com.z254.robi.motion.MotionStep;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@code [actions:step|step|...]} where a step is {@code name(:param)*(:duration_ms)?}.
 * <p>
 * A trailing integer segment is the duration once at least two segments exist. For a
 * primitive it is only taken as the duration when it comes after all of the primitive's
 * parameters, so {@code turn_left_deg:90} turns 90 degrees and {@code led_color:255:0:0}
 * carries no duration. Durations are clamped to {@code 0..MotionStep.MAX_DURATION_MS}.
 * Steps are returned raw; gesture aliases are expanded by the motion compiler.
 */
public class ActionsTagParser extends AnchoredTagParser<List<MotionStep>> {

    public ActionsTagParser() {
        super(ControlTag.ACTIONS);
    }

    @Override
    protected List<MotionStep> convert(String raw) {
        return parseSteps(raw);
    }

    @Override
    protected List<MotionStep> defaultValue() {
        return List.of();
    }

    public static List<MotionStep> parseSteps(String raw) {
        List<MotionStep> steps = new ArrayList<>();
        if (raw == null) {
            return steps;
        }
        for (String token : raw.split("\\|")) {
            parseStep(token).ifPresent(steps::add);
        }
        return steps;
    }

    public static Optional<MotionStep> parseStep(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String[] parts = token.split(":");
        List<String> segments = new ArrayList<>(parts.length);
        for (String part : parts) {
            segments.add(part.trim());
        }
        String name = segments.get(0).toLowerCase(Locale.ROOT);
        if (name.isEmpty()) {
            return Optional.empty();
        }

        Optional<MotionPrimitive> primitive = MotionPrimitive.fromActionName(name);
        List<String> values = new ArrayList<>(segments.subList(1, segments.size()));
        Integer duration = null;
        if (!values.isEmpty() && toLong(values.get(values.size() - 1)) != null) {
            boolean trailingIsDuration = primitive
                    .map(p -> values.size() > p.getParamNames().size())
                    .orElse(true);
            if (trailingIsDuration) {
                duration = MotionStep.clampDuration(toLong(values.remove(values.size() - 1)));
            }
        }

        Map<String, Object> params = new LinkedHashMap<>();
        List<String> names = primitive.map(MotionPrimitive::getParamNames).orElse(List.of());
        for (int i = 0; i < values.size(); i++) {
            String key = i < names.size() ? names.get(i) : (i == 0 ? "param" : "param" + (i + 1));
            params.put(key, toValue(values.get(i)));
        }
        return Optional.of(MotionStep.builder()
                .action(name)
                .params(params)
                .durationMs(duration)
                .build());
    }

    private static Object toValue(String segment) {
        Integer number = toInteger(segment);
        return number != null ? number : segment;
    }

    private static Integer toInteger(String segment) {
        Long number = toLong(segment);
        return number != null && number == number.intValue() ? number.intValue() : null;
    }

    private static Long toLong(String segment) {
        if (segment == null || segment.isEmpty()) {
            return null;
        }
        try {
            return Long.valueOf(segment);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
