package com.z254.robi.domain.repository.impl;

import com.z254.robi.domain.model.Memory;
import com.z254.robi.domain.model.MemoryType;
import com.z254.robi.domain.repository.MemoryRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * In-memory {@link MemoryRepository} implementation for local development.
 */
@Repository
public class InMemoryMemoryRepository implements MemoryRepository {

    private final Map<String, Memory> store = new LinkedHashMap<>();

    @Override
    public Mono<Memory> save(Memory memory) {
        return Mono.fromSupplier(() -> {
            synchronized (this) {
                return copy(put(memory));
            }
        });
    }

    @Override
    public synchronized Flux<Memory> findByScope(String personId) {
        return Flux.fromIterable(store.values().stream()
                .filter(memory -> Objects.equals(memory.getPersonId(), personId))
                .map(InMemoryMemoryRepository::copy)
                .toList());
    }

    @Override
    public synchronized Flux<Memory> findByType(MemoryType type) {
        return Flux.fromIterable(store.values().stream()
                .filter(memory -> memory.getType() == type)
                .map(InMemoryMemoryRepository::copy)
                .toList());
    }

    @Override
    public synchronized Flux<String> findPersonScopes() {
        return Flux.fromIterable(store.values().stream()
                .map(Memory::getPersonId)
                .filter(Objects::nonNull)
                .distinct()
                .toList());
    }

    @Override
    public Mono<Integer> replace(Collection<String> removedIds, List<Memory> replacements) {
        return Mono.fromSupplier(() -> {
            synchronized (this) {
                int removed = 0;
                for (String id : removedIds) {
                    if (store.remove(id) != null) {
                        removed++;
                    }
                }
                replacements.forEach(this::put);
                return removed;
            }
        });
    }

    private Memory put(Memory memory) {
        if (memory.getId() == null) {
            memory.setId(UUID.randomUUID().toString());
        }
        if (memory.getCreatedAt() == null) {
            memory.setCreatedAt(Instant.now());
        }
        store.put(memory.getId(), memory);
        return memory;
    }

    private static Memory copy(Memory memory) {
        return memory.toBuilder().build();
    }
}
