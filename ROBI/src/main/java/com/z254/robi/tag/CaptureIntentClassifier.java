package com.z254.robi.tag;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Decides from the final response text whether the device should capture a photo or a video.
 * Keywords are matched as whole words in Spanish and English; video wins over photo.
 */
public final class CaptureIntentClassifier {

    static final List<String> VIDEO_KEYWORDS = List.of(
            "video", "vídeo", "videos", "vídeos", "graba", "grabar", "grábame", "grabación", "grabando",
            "filma", "filmar", "record", "recording", "film",
            "qué está pasando", "que está pasando", "qué pasa ahí", "qué pasa allí",
            "what's happening", "what is happening");

    static final List<String> PHOTO_KEYWORDS = List.of(
            "foto", "fotos", "fotografía", "fotografiar", "retrato", "selfie",
            "photo", "photos", "picture", "pic", "snapshot",
            "muéstrame tu cara", "show me your face");

    private static final Pattern VIDEO = compile(VIDEO_KEYWORDS);
    private static final Pattern PHOTO = compile(PHOTO_KEYWORDS);

    private CaptureIntentClassifier() {
    }

    public static Optional<CaptureType> classify(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (VIDEO.matcher(lower).find()) {
            return Optional.of(CaptureType.VIDEO);
        }
        if (PHOTO.matcher(lower).find()) {
            return Optional.of(CaptureType.PHOTO);
        }
        return Optional.empty();
    }

    private static Pattern compile(List<String> keywords) {
        String alternatives = keywords.stream().map(Pattern::quote).collect(Collectors.joining("|"));
        return Pattern.compile("(?<!\\p{L})(?:" + alternatives + ")(?!\\p{L})", Pattern.UNICODE_CASE);
    }
}
