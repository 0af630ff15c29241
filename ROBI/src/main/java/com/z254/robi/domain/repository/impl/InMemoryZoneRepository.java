package com.z254.robi.domain.repository.impl;

import com.z254.robi.domain.model.Zone;
import com.z254.robi.domain.model.ZoneCategory;
import com.z254.robi.domain.model.ZonePath;
import com.z254.robi.domain.repository.ZoneRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * In-memory {@link ZoneRepository} implementation for local development.
 * All mutations hold the repository monitor, so the current-zone flag is
 * never observed on two zones at once.
 */
@Repository
public class InMemoryZoneRepository implements ZoneRepository {

    private final Map<String, Zone> zonesByKey = new LinkedHashMap<>();
    private final List<ZonePath> paths = new ArrayList<>();

    @Override
    public synchronized Mono<Zone> findByName(String name) {
        return Mono.justOrEmpty(name == null ? null : copy(zonesByKey.get(key(name))));
    }

    @Override
    public synchronized Mono<Zone> findById(String id) {
        return Mono.justOrEmpty(zonesByKey.values().stream()
                .filter(zone -> zone.getId().equals(id))
                .findFirst()
                .map(InMemoryZoneRepository::copy));
    }

    @Override
    public synchronized Flux<Zone> findAll() {
        return Flux.fromIterable(zonesByKey.values().stream().map(InMemoryZoneRepository::copy).toList());
    }

    @Override
    public Mono<Zone> getOrCreate(String name, ZoneCategory category, String description, Instant now) {
        return Mono.fromSupplier(() -> {
            synchronized (this) {
                ZoneCategory safeCategory = category == null ? ZoneCategory.UNKNOWN : category;
                String safeDescription = description == null ? "" : description;
                Zone zone = zonesByKey.get(key(name));
                if (zone == null) {
                    zone = Zone.builder()
                            .id(UUID.randomUUID().toString())
                            .name(name.trim())
                            .category(safeCategory)
                            .description(safeDescription)
                            .knownSince(now)
                            .build();
                    zonesByKey.put(key(name), zone);
                } else {
                    if ((zone.getDescription() == null || zone.getDescription().isBlank())
                            && !safeDescription.isBlank()) {
                        zone.setDescription(safeDescription);
                    }
                    if (zone.getCategory() == ZoneCategory.UNKNOWN) {
                        zone.setCategory(safeCategory);
                    }
                }
                return copy(zone);
            }
        });
    }

    @Override
    public Mono<Zone> setCurrent(String zoneId) {
        return Mono.fromSupplier(() -> {
            synchronized (this) {
                Zone target = zonesByKey.values().stream()
                        .filter(zone -> zone.getId().equals(zoneId))
                        .findFirst()
                        .orElse(null);
                if (target == null) {
                    return null;
                }
                zonesByKey.values().forEach(zone -> zone.setCurrent(false));
                target.setCurrent(true);
                return copy(target);
            }
        });
    }

    @Override
    public Mono<Void> clearCurrent() {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                zonesByKey.values().forEach(zone -> zone.setCurrent(false));
            }
        });
    }

    @Override
    public synchronized Mono<Zone> findCurrent() {
        return Mono.justOrEmpty(zonesByKey.values().stream()
                .filter(Zone::isCurrent)
                .findFirst()
                .map(InMemoryZoneRepository::copy));
    }

    @Override
    public Mono<ZonePath> savePath(ZonePath path) {
        return Mono.fromSupplier(() -> {
            synchronized (this) {
                if (path.getId() == null) {
                    path.setId(UUID.randomUUID().toString());
                }
                paths.add(path);
                return path;
            }
        });
    }

    @Override
    public Mono<ZonePath> savePathIfAbsent(ZonePath path) {
        return Mono.fromSupplier(() -> {
            synchronized (this) {
                boolean exists = paths.stream().anyMatch(existing ->
                        Objects.equals(existing.getFromZoneId(), path.getFromZoneId())
                                && Objects.equals(existing.getToZoneId(), path.getToZoneId()));
                if (exists) {
                    return null;
                }
                if (path.getId() == null) {
                    path.setId(UUID.randomUUID().toString());
                }
                paths.add(path);
                return path;
            }
        });
    }

    @Override
    public synchronized Flux<ZonePath> findPathsFrom(String zoneId) {
        return Flux.fromIterable(paths.stream()
                .filter(path -> Objects.equals(path.getFromZoneId(), zoneId))
                .toList());
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    private static Zone copy(Zone zone) {
        return zone == null ? null : zone.toBuilder().build();
    }
}
