package com.z254.robi.tag;

import com.z254.robi.domain.model.MemoryType;

/**
 * {@code [memory:type:content]} found in model output.
 */
public record MemoryDirective(MemoryType type, String content) {
}
