package com.z254.robi.motion;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single motion step, either a primitive or a gesture alias still to be expanded.
 * Named parameters are flattened into the step when serialized
 * ({@code {"action":"turn_left_deg","degrees":90,"duration_ms":1000}}).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MotionStep {

    public static final int MAX_DURATION_MS = 60_000;

    private String action;

    @JsonIgnore
    @Builder.Default
    private Map<String, Object> params = new LinkedHashMap<>();

    /**
     * Duration of the step; {@code null} when the step did not declare one.
     */
    private Integer durationMs;

    @JsonAnyGetter
    public Map<String, Object> namedParams() {
        return params;
    }

    @JsonIgnore
    public int durationOrZero() {
        return durationMs != null ? durationMs : 0;
    }

    /**
     * Bound a declared duration to {@code 0..MAX_DURATION_MS}.
     */
    public static int clampDuration(long durationMs) {
        return (int) Math.max(0, Math.min(MAX_DURATION_MS, durationMs));
    }

    public static MotionStep of(MotionPrimitive primitive, int durationMs, Object... values) {
        Map<String, Object> params = new LinkedHashMap<>();
        for (int i = 0; i < values.length && i < primitive.getParamNames().size(); i++) {
            params.put(primitive.getParamNames().get(i), values[i]);
        }
        return MotionStep.builder()
                .action(primitive.getActionName())
                .params(params)
                .durationMs(durationMs)
                .build();
    }
}
