package com.z254.robi.memory;

import com.z254.robi.domain.model.Memory;

/**
 * Outcome of {@link MemoryService#save}. Rejections are normal results, not errors.
 */
public record SaveResult(Status status, Memory memory) {

    public enum Status {
        STORED,
        REJECTED_PRIVATE,
        REJECTED_EMPTY
    }

    public static SaveResult stored(Memory memory) {
        return new SaveResult(Status.STORED, memory);
    }

    public static SaveResult rejectedPrivate() {
        return new SaveResult(Status.REJECTED_PRIVATE, null);
    }

    public static SaveResult rejectedEmpty() {
        return new SaveResult(Status.REJECTED_EMPTY, null);
    }

    public boolean isStored() {
        return status == Status.STORED;
    }
}
