package com.z254.robi.tag;

import com.z254.robi.motion.MotionStep;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything decoded from one complete model response.
 */
@Value
@Builder
public class DecodedResponse {

    Emotion emotion;

    /**
     * Contextual emoji codes from {@code [emojis:]}; empty when the model sent none.
     */
    List<String> emojis;

    /**
     * Raw action steps, aliases not yet expanded.
     */
    List<MotionStep> actions;

    String mediaSummary;

    /**
     * Concatenation of every text fragment forwarded to the client.
     */
    String visibleText;

    String rawText;

    Directives directives;

    /**
     * Contextual emojis followed by the first two emotion emojis, or the emotion
     * defaults when there are no contextual ones.
     */
    public List<String> expressionEmojis() {
        if (emojis == null || emojis.isEmpty()) {
            return emotion.getEmojis();
        }
        List<String> combined = new ArrayList<>(emojis);
        combined.addAll(emotion.getEmojis().subList(0, Math.min(2, emotion.getEmojis().size())));
        return combined;
    }
}
