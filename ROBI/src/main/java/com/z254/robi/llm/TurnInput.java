package com.z254.robi.llm;

import java.util.List;
import java.util.Locale;

/**
 * What the user sent for one turn: optional text plus any media.
 */
public record TurnInput(String text, List<MediaPart> media) {

    public static final String AUDIO_PLACEHOLDER = "[audio]";
    public static final String VISUAL_PLACEHOLDER = "[image/video]";

    public TurnInput {
        media = media == null ? List.of() : List.copyOf(media);
    }

    public static TurnInput text(String text) {
        return new TurnInput(text, List.of());
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }

    public boolean hasMedia() {
        return !media.isEmpty();
    }

    /**
     * Short label for logs and metrics: text, audio, image, video or multimodal.
     */
    public String kind() {
        if (media.isEmpty()) {
            return "text";
        }
        if (media.size() == 1 && !hasText()) {
            return media.get(0).kind().name().toLowerCase(Locale.ROOT);
        }
        return "multimodal";
    }

    /**
     * The "user said" entry recorded in history for this turn. Media turns prefer the model's
     * own summary of the media, then the accompanying text, then a placeholder.
     */
    public String historyEntry(String mediaSummary) {
        if (!hasMedia()) {
            return text == null ? "" : text;
        }
        if (mediaSummary != null && !mediaSummary.isBlank()) {
            return mediaSummary;
        }
        if (hasText()) {
            return text;
        }
        boolean audioOnly = media.stream().allMatch(part -> part.kind() == MediaPart.Kind.AUDIO);
        return audioOnly ? AUDIO_PLACEHOLDER : VISUAL_PLACEHOLDER;
    }
}
