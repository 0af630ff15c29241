package com.z254.robi.tag;

import com.z254.robi.domain.model.MemoryType;
import com.z254.robi.domain.model.ZoneCategory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts memory, person-name and zone-learn directives from the full raw response.
 * Each kind is an independent pass, so a malformed tag of one kind never hides another.
 */
public final class DirectiveExtractor {

    private static final Pattern MEMORY = Pattern.compile(
            "\\[memory:\\s*([a-z_]+)\\s*:([^\\[\\]]+)]", Pattern.CASE_INSENSITIVE);
    private static final Pattern PERSON_NAME = Pattern.compile(
            "\\[person_name:([^\\[\\]]+)]", Pattern.CASE_INSENSITIVE);
    private static final Pattern ZONE_LEARN = Pattern.compile(
            "\\[zone_learn:([^\\[\\]:]+)(?::([^\\[\\]:]*))?(?::([^\\[\\]]*))?]", Pattern.CASE_INSENSITIVE);

    private DirectiveExtractor() {
    }

    public static Directives extract(String rawText) {
        if (rawText == null || rawText.isEmpty()) {
            return Directives.empty();
        }
        return new Directives(extractMemories(rawText), extractPersonName(rawText), extractZones(rawText));
    }

    public static List<MemoryDirective> extractMemories(String rawText) {
        List<MemoryDirective> memories = new ArrayList<>();
        Matcher matcher = MEMORY.matcher(rawText);
        while (matcher.find()) {
            String content = matcher.group(2).trim();
            if (!content.isEmpty()) {
                memories.add(new MemoryDirective(MemoryType.fromValue(matcher.group(1)), content));
            }
        }
        return memories;
    }

    /**
     * First non-blank {@code [person_name:]} value.
     */
    public static Optional<String> extractPersonName(String rawText) {
        Matcher matcher = PERSON_NAME.matcher(rawText);
        while (matcher.find()) {
            String name = matcher.group(1).trim();
            if (!name.isEmpty()) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }

    public static List<ZoneDirective> extractZones(String rawText) {
        List<ZoneDirective> zones = new ArrayList<>();
        Matcher matcher = ZONE_LEARN.matcher(rawText);
        while (matcher.find()) {
            String name = matcher.group(1).trim();
            if (name.isEmpty()) {
                continue;
            }
            String description = matcher.group(3) == null ? "" : matcher.group(3).trim();
            zones.add(new ZoneDirective(name, ZoneCategory.fromValue(matcher.group(2)), description));
        }
        return zones;
    }
}
