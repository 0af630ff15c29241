package com.z254.robi.session;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.UUID;

/**
 * Mutable state of one connection. Only the session's own processing loop touches it,
 * one message at a time.
 */
@Getter
public class SessionContext {

    static final String ANONYMOUS = "unknown";

    @Setter
    private SessionPhase phase = SessionPhase.CONNECTING;
    private String sessionId;
    private String personId;
    private Double confidence;
    private List<Float> pendingEmbedding;
    @Setter
    private String currentZone;
    private String lastRequestId;
    @Getter(AccessLevel.NONE)
    private final ByteArrayOutputStream audioBuffer = new ByteArrayOutputStream();

    void activate(String sessionId) {
        this.sessionId = sessionId;
        this.phase = SessionPhase.ACTIVE;
    }

    /**
     * Request id of the message, else the last one seen in this session, else a fresh one.
     */
    public String resolveRequestId(String requested) {
        if (requested != null && !requested.isBlank()) {
            lastRequestId = requested;
            return requested;
        }
        if (lastRequestId != null) {
            return lastRequestId;
        }
        lastRequestId = UUID.randomUUID().toString();
        return lastRequestId;
    }

    /**
     * Start a new interaction: clears the audio buffer and records who the device thinks
     * it is talking to.
     */
    public void startInteraction(String personId, List<Float> faceEmbedding) {
        audioBuffer.reset();
        identify(personId, null);
        this.pendingEmbedding = faceEmbedding == null || faceEmbedding.isEmpty() ? null : List.copyOf(faceEmbedding);
    }

    public void identify(String personId, Double confidence) {
        if (personId == null || personId.isBlank() || ANONYMOUS.equalsIgnoreCase(personId)) {
            this.personId = null;
            this.confidence = null;
        } else {
            this.personId = personId;
            this.confidence = confidence;
        }
    }

    public void appendAudio(byte[] data) {
        if (data != null) {
            audioBuffer.writeBytes(data);
        }
    }

    /**
     * Take the accumulated audio, leaving the buffer empty.
     */
    public byte[] drainAudio() {
        byte[] data = audioBuffer.toByteArray();
        audioBuffer.reset();
        return data;
    }

    public int bufferedAudioBytes() {
        return audioBuffer.size();
    }

    /**
     * Hand over the pending face sample; it is attached to at most one person.
     */
    public List<Float> takePendingEmbedding() {
        List<Float> embedding = pendingEmbedding;
        pendingEmbedding = null;
        return embedding;
    }

    public boolean isIdentified() {
        return personId != null;
    }
}
