package com.z254.robi.api.websocket;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.z254.robi.motion.MoveSequence;
import com.z254.robi.tag.CaptureType;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A message sent to the device: a {@code type} plus the fields that type carries.
 * Absent optional fields are left out of the JSON instead of being sent as null.
 */
public class ServerMessage {

    public static final int DURATION_PER_EMOJI_MS = 2000;
    public static final String EMOJI_TRANSITION = "bounce";

    private final String type;
    private final Map<String, Object> fields = new LinkedHashMap<>();

    private ServerMessage(String type) {
        this.type = type;
    }

    @JsonProperty("type")
    public String getType() {
        return type;
    }

    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public Object get(String field) {
        return fields.get(field);
    }

    @JsonIgnore
    public String getRequestId() {
        return (String) fields.get("request_id");
    }

    private ServerMessage with(String field, Object value) {
        if (value != null) {
            fields.put(field, value);
        }
        return this;
    }

    public static ServerMessage authOk(String sessionId) {
        return new ServerMessage("auth_ok").with("session_id", sessionId);
    }

    public static ServerMessage emotion(String requestId, String emotion, String personIdentified, Double confidence) {
        return new ServerMessage("emotion")
                .with("request_id", requestId)
                .with("emotion", emotion)
                .with("person_identified", personIdentified)
                .with("confidence", confidence);
    }

    public static ServerMessage textChunk(String requestId, String text) {
        return new ServerMessage("text_chunk")
                .with("request_id", requestId)
                .with("text", text);
    }

    public static ServerMessage captureRequest(String requestId, CaptureType captureType) {
        return new ServerMessage("capture_request")
                .with("request_id", requestId)
                .with("capture_type", captureType);
    }

    public static ServerMessage responseMeta(String requestId, String responseText, List<String> emojis,
                                             List<MoveSequence> actions, String personName) {
        return new ServerMessage("response_meta")
                .with("request_id", requestId)
                .with("response_text", responseText)
                .with("expression", new Expression(emojis, DURATION_PER_EMOJI_MS, EMOJI_TRANSITION))
                .with("actions", actions)
                .with("person_name", personName);
    }

    public static ServerMessage streamEnd(String requestId, long processingTimeMs) {
        return new ServerMessage("stream_end")
                .with("request_id", requestId)
                .with("processing_time_ms", processingTimeMs);
    }

    public static ServerMessage error(String requestId, ErrorCode code, String message) {
        return new ServerMessage("error")
                .with("request_id", requestId)
                .with("error_code", code.name())
                .with("message", message)
                .with("recoverable", code.isRecoverable());
    }

    public static ServerMessage pong(Instant timestamp) {
        return new ServerMessage("pong").with("timestamp", timestamp.toString());
    }

    public static ServerMessage explorationActions(String requestId, List<MoveSequence> actions,
                                                   String speech, int durationMinutes) {
        return new ServerMessage("exploration_actions")
                .with("request_id", requestId)
                .with("actions", actions)
                .with("exploration_speech", speech)
                .with("duration_minutes", durationMinutes);
    }

    public static ServerMessage faceScanActions(String requestId, List<MoveSequence> actions) {
        return new ServerMessage("face_scan_actions")
                .with("request_id", requestId)
                .with("actions", actions);
    }

    @Override
    public String toString() {
        return "ServerMessage{type=" + type + ", fields=" + fields + "}";
    }

    /**
     * How the face display cycles through the response emojis.
     */
    public record Expression(List<String> emojis,
                             @JsonProperty("duration_per_emoji") int durationPerEmoji,
                             String transition) {
    }
}
