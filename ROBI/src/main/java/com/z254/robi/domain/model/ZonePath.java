package com.z254.robi.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A directed edge between two zones.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ZonePath {

    private String id;

    private String fromZoneId;

    private String toZoneId;

    /**
     * Free-form hint such as "through the hallway, second door on the left".
     */
    private String directionHint;

    private Integer distanceCm;
}
