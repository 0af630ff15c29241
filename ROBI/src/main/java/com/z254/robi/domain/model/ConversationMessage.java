package com.z254.robi.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One entry of a session's dialogue.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConversationMessage {

    /**
     * Prefix carried by the content of every compaction summary.
     */
    public static final String SUMMARY_PREFIX = "[SUMMARY]";

    private String sessionId;

    private MessageRole role;

    private String content;

    /**
     * Position in the session. Ordering by index is authoritative.
     */
    private long index;

    /**
     * Whether this message replaces an older, summarised prefix of the history.
     */
    private boolean compactionSummary;

    private Instant timestamp;
}
