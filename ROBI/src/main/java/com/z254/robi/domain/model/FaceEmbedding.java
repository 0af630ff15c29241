package com.z254.robi.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Face biometric sample, always owned by a person.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FaceEmbedding {

    private String id;

    private String personId;

    private List<Float> vector;

    private Instant capturedAt;

    /**
     * Lighting conditions reported by the device, if any.
     */
    private String sourceLighting;
}
