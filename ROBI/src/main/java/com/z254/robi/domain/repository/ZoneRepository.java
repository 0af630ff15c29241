package com.z254.robi.domain.repository;

import com.z254.robi.domain.model.Zone;
import com.z254.robi.domain.model.ZoneCategory;
import com.z254.robi.domain.model.ZonePath;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Repository interface for zones and the directed paths between them.
 */
public interface ZoneRepository {

    /**
     * Find a zone by name, ignoring case.
     *
     * @param name zone name
     * @return the zone or empty
     */
    Mono<Zone> findByName(String name);

    Mono<Zone> findById(String id);

    /**
     * All zones in the order they were first stored.
     */
    Flux<Zone> findAll();

    /**
     * Return the zone with this name, creating it when missing. An existing zone gets its
     * description filled when empty and its category set when still unknown. Atomic per name.
     *
     * @param name        zone name
     * @param category    category to use on creation or to replace {@code UNKNOWN}
     * @param description description to use on creation or to fill an empty one
     * @param now         creation timestamp
     * @return the stored zone
     */
    Mono<Zone> getOrCreate(String name, ZoneCategory category, String description, Instant now);

    /**
     * Clear the current flag on every zone and set it on this one, as one operation.
     *
     * @param zoneId id of the zone the robot is now in
     * @return the updated zone, or empty when the id is unknown (flags left untouched)
     */
    Mono<Zone> setCurrent(String zoneId);

    Mono<Void> clearCurrent();

    Mono<Zone> findCurrent();

    Mono<ZonePath> savePath(ZonePath path);

    /**
     * Store a path unless one already exists between the same endpoints in the same direction.
     *
     * @return the new path, or empty when it already existed
     */
    Mono<ZonePath> savePathIfAbsent(ZonePath path);

    /**
     * Outgoing paths of a zone in insertion order.
     */
    Flux<ZonePath> findPathsFrom(String zoneId);
}
