package com.z254.robi.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MemoryType {
    EXPERIENCE(6),
    ZONE_INFO(6),
    PERSON_FACT(7),
    GENERAL(5);

    private final int defaultImportance;

    MemoryType(int defaultImportance) {
        this.defaultImportance = defaultImportance;
    }

    /**
     * Importance given to facts of this type when the model does not say otherwise.
     */
    public int getDefaultImportance() {
        return defaultImportance;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient lookup; unknown types are stored as {@link #GENERAL}.
     */
    @JsonCreator
    public static MemoryType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return GENERAL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return GENERAL;
        }
    }

    /**
     * Types that belong to the person being talked to when one is known.
     */
    public boolean isPersonScoped() {
        return this == PERSON_FACT || this == EXPERIENCE;
    }
}
