package com.z254.robi.llm;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Provider-neutral chat completion request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LLMRequest {

    private String model;

    private List<Message> messages;

    @Builder.Default
    private Double temperature = 0.7;

    private Integer maxTokens;

    @Builder.Default
    private boolean stream = false;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Message {
        private String role;  // system, user, assistant
        private String content;
        /**
         * Binary attachments sent alongside {@link #content}; user messages only.
         */
        private List<MediaPart> media;

        public boolean hasMedia() {
            return media != null && !media.isEmpty();
        }
    }

    public static Message systemMessage(String content) {
        return Message.builder()
                .role("system")
                .content(content)
                .build();
    }

    public static Message userMessage(String content) {
        return Message.builder()
                .role("user")
                .content(content)
                .build();
    }

    public static Message userMessage(String content, List<MediaPart> media) {
        return Message.builder()
                .role("user")
                .content(content)
                .media(media)
                .build();
    }

    public static Message assistantMessage(String content) {
        return Message.builder()
                .role("assistant")
                .content(content)
                .build();
    }
}
