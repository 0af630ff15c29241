package com.z254.robi.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of room a zone is.
 */
public enum ZoneCategory {
    KITCHEN,
    LIVING,
    BEDROOM,
    BATHROOM,
    UNKNOWN;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient lookup; anything unrecognised is {@link #UNKNOWN}.
     */
    @JsonCreator
    public static ZoneCategory fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
