package com.z254.robi.tag;

/**
 * A piece of decoder output, in emission order. The first fragment of every
 * response is the emotion; text fragments follow.
 */
public record DecodedFragment(Kind kind, Emotion emotion, String text) {

    public enum Kind {
        EMOTION,
        TEXT
    }

    public static DecodedFragment ofEmotion(Emotion emotion) {
        return new DecodedFragment(Kind.EMOTION, emotion, null);
    }

    public static DecodedFragment ofText(String text) {
        return new DecodedFragment(Kind.TEXT, null, text);
    }

    public boolean isEmotion() {
        return kind == Kind.EMOTION;
    }
}
