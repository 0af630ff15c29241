package com.z254.robi.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A named place in the home.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Zone {

    private String id;

    /**
     * Unique name, compared case-insensitively.
     */
    private String name;

    @Builder.Default
    private ZoneCategory category = ZoneCategory.UNKNOWN;

    private String description;

    @Builder.Default
    private boolean accessible = true;

    /**
     * Whether the robot is in this zone right now. At most one zone has this set.
     */
    private boolean current;

    private Instant knownSince;
}
