package com.z254.robi.llm;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A streamed completion delta.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LLMChunk {

    private String id;

    private String model;

    private String contentDelta;

    private boolean finished;

    private LLMResponse.FinishReason finishReason;

    public boolean hasContent() {
        return contentDelta != null && !contentDelta.isEmpty();
    }

    public static LLMChunk content(String id, String model, String content) {
        return LLMChunk.builder()
                .id(id)
                .model(model)
                .contentDelta(content)
                .finished(false)
                .build();
    }

    public static LLMChunk finished(String id, String model, LLMResponse.FinishReason reason) {
        return LLMChunk.builder()
                .id(id)
                .model(model)
                .finished(true)
                .finishReason(reason)
                .build();
    }
}
