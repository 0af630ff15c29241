package com.z254.robi.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A retained fact.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Memory {

    public static final int MIN_IMPORTANCE = 1;
    public static final int MAX_IMPORTANCE = 10;

    private String id;

    /**
     * Owning person, or {@code null} for the general pool.
     */
    private String personId;

    /**
     * Zone the fact is about, if any.
     */
    private String zoneId;

    @Builder.Default
    private MemoryType type = MemoryType.GENERAL;

    private String content;

    /**
     * 1 (trivia) to 10 (essential).
     */
    @Builder.Default
    private int importance = 5;

    private Instant createdAt;

    /**
     * When the fact stops being relevant; {@code null} means never.
     */
    private Instant expiresAt;

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
