package com.z254.robi.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MessageRole {
    USER,
    ASSISTANT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
