package com.z254.robi.tag;

import java.util.List;
import java.util.Locale;

/**
 * Emotion states the robot face can show, with their default OpenMoji codes.
 */
public enum Emotion {

    HAPPY("happy", List.of("1F600", "1F603", "1F604", "1F60A")),
    EXCITED("excited", List.of("1F929", "2728", "1F389", "1F973")),
    SAD("sad", List.of("1F622", "1F61E", "1F614")),
    EMPATHY("empathy", List.of("1FAE6", "1F917", "1F49B")),
    CONFUSED("confused", List.of("1F615", "1F914", "2753")),
    SURPRISED("surprised", List.of("1F632", "1F62E", "2757")),
    LOVE("love", List.of("2764", "1F60D", "1F970", "1F495")),
    COOL("cool", List.of("1F60E", "1F44D", "1F918")),
    GREETING("greeting", List.of("1F44B", "1F60A", "1F917")),
    NEUTRAL("neutral", List.of("1F610", "1F642")),
    CURIOUS("curious", List.of("1F914", "1F9D0", "1F440")),
    WORRIED("worried", List.of("1F62C", "1F61F", "1F625")),
    PLAYFUL("playful", List.of("1F61C", "1F609", "1F92A"));

    private final String tag;
    private final List<String> emojis;

    Emotion(String tag, List<String> emojis) {
        this.tag = tag;
        this.emojis = emojis;
    }

    public String getTag() {
        return tag;
    }

    public List<String> getEmojis() {
        return emojis;
    }

    /**
     * Resolve a tag case-insensitively. Unknown or blank tags map to {@link #NEUTRAL}.
     */
    public static Emotion fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return NEUTRAL;
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (Emotion emotion : values()) {
            if (emotion.tag.equals(normalized)) {
                return emotion;
            }
        }
        return NEUTRAL;
    }
}
