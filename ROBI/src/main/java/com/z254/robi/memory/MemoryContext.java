package com.z254.robi.memory;

import com.z254.robi.domain.model.Memory;

import java.util.List;

/**
 * Memories handed to the generative backend for one turn.
 *
 * @param general  facts from the general pool
 * @param person   facts about the person being talked to
 * @param zone     facts about the robot's current location
 * @param personId identity the person facts belong to, if any
 * @param zoneName current location, if any
 */
public record MemoryContext(List<Memory> general, List<Memory> person, List<Memory> zone,
                            String personId, String zoneName) {

    public static MemoryContext empty() {
        return new MemoryContext(List.of(), List.of(), List.of(), null, null);
    }

    public boolean isEmpty() {
        return general.isEmpty() && person.isEmpty() && zone.isEmpty();
    }

    /**
     * Render as a text block for the model; blank when there is nothing to say.
     */
    public String render() {
        if (isEmpty() && zoneName == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder("[Context]\n");
        if (zoneName != null) {
            sb.append("You are currently in: ").append(zoneName).append('\n');
        }
        appendSection(sb, "Things you remember", general);
        appendSection(sb, "About " + (personId != null ? personId : "this person"), person);
        appendSection(sb, "About " + (zoneName != null ? zoneName : "the house"), zone);
        return sb.toString().trim();
    }

    private static void appendSection(StringBuilder sb, String title, List<Memory> memories) {
        if (memories.isEmpty()) {
            return;
        }
        sb.append(title).append(":\n");
        for (Memory memory : memories) {
            sb.append("- ").append(memory.getContent()).append('\n');
        }
    }
}
