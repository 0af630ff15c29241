package com.z254.robi.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Someone the robot has met.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Person {

    /**
     * Stable slug, e.g. {@code person_ana}.
     */
    private String personId;

    /**
     * Display name as the person introduced themselves.
     */
    private String name;

    private Instant firstSeen;

    private Instant lastSeen;

    /**
     * Number of interactions. Never decreases.
     */
    private int interactionCount;

    private String notes;
}
