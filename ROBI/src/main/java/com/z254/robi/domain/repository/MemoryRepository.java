package com.z254.robi.domain.repository;

import com.z254.robi.domain.model.Memory;
import com.z254.robi.domain.model.MemoryType;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.List;

/**
 * Repository interface for memories. Callers are expected to run content through the
 * privacy gate before saving.
 */
public interface MemoryRepository {

    Mono<Memory> save(Memory memory);

    /**
     * All memories of one scope, expired ones included.
     *
     * @param personId owning person, or {@code null} for the general pool
     */
    Flux<Memory> findByScope(String personId);

    Flux<Memory> findByType(MemoryType type);

    /**
     * Ids of every person owning at least one memory.
     */
    Flux<String> findPersonScopes();

    /**
     * Remove the given memories and store the replacements, as one operation.
     *
     * @param removedIds   ids to delete
     * @param replacements memories to store in their place, possibly empty
     * @return number of rows deleted
     */
    Mono<Integer> replace(Collection<String> removedIds, List<Memory> replacements);
}
