package com.z254.robi.tag;

import java.util.List;
import java.util.Optional;

/**
 * Side-effect directives extracted from one complete model response.
 */
public record Directives(List<MemoryDirective> memories, Optional<String> personName, List<ZoneDirective> zones) {

    public static Directives empty() {
        return new Directives(List.of(), Optional.empty(), List.of());
    }

    public boolean isEmpty() {
        return memories.isEmpty() && personName.isEmpty() && zones.isEmpty();
    }
}
