package com.z254.robi.tag;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CaptureIntentClassifier}.
 */
class CaptureIntentClassifierTest {

    @Test
    @DisplayName("should request a photo for photo keywords")
    void requestPhoto() {
        assertThat(CaptureIntentClassifier.classify("¡Vale, te hago una foto!")).contains(CaptureType.PHOTO);
        assertThat(CaptureIntentClassifier.classify("Let me take a Picture of you")).contains(CaptureType.PHOTO);
    }

    @Test
    @DisplayName("should request a video for video keywords")
    void requestVideo() {
        assertThat(CaptureIntentClassifier.classify("Voy a grabar un vídeo")).contains(CaptureType.VIDEO);
        assertThat(CaptureIntentClassifier.classify("Let me see what's happening")).contains(CaptureType.VIDEO);
    }

    @Test
    @DisplayName("should prefer video when both kinds of keyword appear")
    void preferVideo() {
        assertThat(CaptureIntentClassifier.classify("Una foto no basta, mejor un video"))
                .contains(CaptureType.VIDEO);
    }

    @Test
    @DisplayName("should match whole words only")
    void matchWholeWords() {
        assertThat(CaptureIntentClassifier.classify("Me encanta la fotosíntesis")).isEmpty();
        assertThat(CaptureIntentClassifier.classify("Es un récord mundial")).isEmpty();
        assertThat(CaptureIntentClassifier.classify("Recorded history")).isEmpty();
    }

    @Test
    @DisplayName("should return nothing for blank text")
    void nothingForBlank() {
        assertThat(CaptureIntentClassifier.classify("   ")).isEmpty();
        assertThat(CaptureIntentClassifier.classify(null)).isEmpty();
    }
}
