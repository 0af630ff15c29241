package com.z254.robi.motion;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * An expanded, ready-to-play sequence of primitive steps.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MoveSequence {

    public static final String TYPE = "move_sequence";

    @Builder.Default
    private String type = TYPE;

    private String description;

    /**
     * Emotion the face should hold while the sequence plays.
     */
    private String emotionDuring;

    private int totalDurationMs;

    private int stepCount;

    private List<MotionStep> steps;
}
