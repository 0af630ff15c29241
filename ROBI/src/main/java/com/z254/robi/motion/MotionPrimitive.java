package com.z254.robi.motion;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Primitive commands understood by the robot's motor and LED controller.
 * Anything else reaching the controller is ignored by the firmware.
 */
public enum MotionPrimitive {

    TURN_RIGHT_DEG("turn_right_deg", List.of("degrees")),
    TURN_LEFT_DEG("turn_left_deg", List.of("degrees")),
    MOVE_FORWARD_CM("move_forward_cm", List.of("cm")),
    MOVE_BACKWARD_CM("move_backward_cm", List.of("cm")),
    LED_COLOR("led_color", List.of("r", "g", "b")),
    PAUSE("pause", List.of());

    private final String actionName;
    private final List<String> paramNames;

    MotionPrimitive(String actionName, List<String> paramNames) {
        this.actionName = actionName;
        this.paramNames = paramNames;
    }

    public String getActionName() {
        return actionName;
    }

    /**
     * Names of the positional parameters, in the order they appear in an action step.
     */
    public List<String> getParamNames() {
        return paramNames;
    }

    public static Optional<MotionPrimitive> fromActionName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (MotionPrimitive primitive : values()) {
            if (primitive.actionName.equals(normalized)) {
                return Optional.of(primitive);
            }
        }
        return Optional.empty();
    }

    public static boolean isPrimitive(String name) {
        return fromActionName(name).isPresent();
    }
}
