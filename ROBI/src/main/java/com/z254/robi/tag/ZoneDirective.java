package com.z254.robi.tag;

import com.z254.robi.domain.model.ZoneCategory;

/**
 * {@code [zone_learn:name:category:description]} found in model output.
 */
public record ZoneDirective(String name, ZoneCategory category, String description) {
}
