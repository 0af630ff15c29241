package com.z254.robi.llm;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A complete, non-streamed completion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LLMResponse {

    private String id;

    private String model;

    private String providerId;

    private String content;

    private FinishReason finishReason;

    private Usage usage;

    private Long latencyMs;

    public enum FinishReason {
        STOP,           // Natural completion
        LENGTH,         // Hit max tokens
        CONTENT_FILTER, // Blocked by content filter
        ERROR           // Error occurred
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Usage {
        private int promptTokens;
        private int completionTokens;
        private int totalTokens;
    }

    public int getTotalTokens() {
        return usage != null ? usage.getTotalTokens() : 0;
    }
}
