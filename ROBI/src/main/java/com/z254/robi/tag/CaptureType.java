package com.z254.robi.tag;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CaptureType {
    PHOTO,
    VIDEO;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
