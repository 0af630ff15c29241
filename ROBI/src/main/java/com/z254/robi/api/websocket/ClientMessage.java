package com.z254.robi.api.websocket;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Any JSON message a device sends. Which fields are meaningful depends on {@link #type}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ClientMessage {

    public static final String AUTH = "auth";
    public static final String INTERACTION_START = "interaction_start";
    public static final String TEXT = "text";
    public static final String AUDIO_END = "audio_end";
    public static final String IMAGE = "image";
    public static final String VIDEO = "video";
    public static final String MULTIMODAL = "multimodal";
    public static final String EXPLORE_MODE = "explore_mode";
    public static final String FACE_SCAN_MODE = "face_scan_mode";
    public static final String ZONE_UPDATE = "zone_update";
    public static final String PERSON_DETECTED = "person_detected";
    public static final String PING = "ping";

    private String type;
    private String requestId;

    // auth
    private String apiKey;
    private String deviceId;

    // interaction_start, person_detected
    private String personId;
    private List<Float> faceEmbedding;
    private Boolean known;
    private Double confidence;

    // text
    private String content;

    // audio_end, image, video
    private String mime;
    private String data;
    private String text;

    // multimodal
    private String audio;
    private String image;
    private String video;
    private String audioMime;
    private String imageMime;
    private String videoMime;

    // explore_mode
    private Integer durationMinutes;

    // zone_update
    private String zoneName;
    private String category;
    private String action;
}
