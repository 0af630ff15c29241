package com.z254.robi.llm;

/**
 * Raw media bytes attached to a turn.
 */
public record MediaPart(Kind kind, byte[] data, String mimeType) {

    public enum Kind {
        AUDIO,
        IMAGE,
        VIDEO
    }

    public static MediaPart audio(byte[] data, String mimeType) {
        return new MediaPart(Kind.AUDIO, data, mimeType != null ? mimeType : "audio/wav");
    }

    public static MediaPart image(byte[] data, String mimeType) {
        return new MediaPart(Kind.IMAGE, data, mimeType != null ? mimeType : "image/jpeg");
    }

    public static MediaPart video(byte[] data, String mimeType) {
        return new MediaPart(Kind.VIDEO, data, mimeType != null ? mimeType : "video/mp4");
    }
}
