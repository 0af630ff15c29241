package com.z254.robi.zone;

import com.z254.robi.domain.model.Zone;
import com.z254.robi.domain.model.ZoneCategory;
import com.z254.robi.domain.model.ZonePath;
import com.z254.robi.domain.repository.ZoneRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The robot's map of the home: named zones joined by directed paths.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ZoneGraphService {

    private final ZoneRepository zoneRepository;
    private final Clock clock;

    /**
     * Return the zone with this name, creating it when unknown. Idempotent by name (ignoring
     * case); an existing zone only gets an empty description or an unknown category filled in.
     */
    public Mono<Zone> getOrCreate(String name, ZoneCategory category, String description) {
        if (name == null || name.isBlank()) {
            return Mono.error(new IllegalArgumentException("Zone name must not be blank"));
        }
        return zoneRepository.getOrCreate(name.trim(), category, description, Instant.now(clock));
    }

    /**
     * Add a directed path, creating missing endpoint zones with an unknown category.
     */
    public Mono<ZonePath> addPath(String fromName, String toName, String directionHint, Integer distanceCm) {
        return endpoints(fromName, toName)
                .flatMap(ends -> zoneRepository.savePath(path(ends, directionHint, distanceCm)));
    }

    /**
     * Like {@link #addPath} but leaves the graph alone when the edge already exists.
     *
     * @return the new path, or empty when it was already known
     */
    public Mono<ZonePath> addPathIfAbsent(String fromName, String toName, String directionHint, Integer distanceCm) {
        return endpoints(fromName, toName)
                .flatMap(ends -> zoneRepository.savePathIfAbsent(path(ends, directionHint, distanceCm)))
                .doOnNext(path -> log.info("Learned path {} -> {}", fromName, toName));
    }

    /**
     * Mark the named zone as the one the robot is in, creating it when unknown.
     */
    public Mono<Zone> setCurrentZone(String name) {
        return getOrCreate(name, ZoneCategory.UNKNOWN, "")
                .flatMap(zone -> zoneRepository.setCurrent(zone.getId()));
    }

    public Mono<Void> clearCurrentZone() {
        return zoneRepository.clearCurrent();
    }

    public Mono<Zone> getCurrentZone() {
        return zoneRepository.findCurrent();
    }

    public Flux<Zone> listZones() {
        return zoneRepository.findAll();
    }

    /**
     * Shortest path by hop count, following outgoing edges in insertion order.
     *
     * @return the edges to walk, from start to goal; empty when either zone is unknown,
     * the goal is unreachable, or both names denote the same zone
     */
    public Mono<List<ZonePath>> findPath(String fromName, String toName) {
        if (fromName == null || toName == null) {
            return Mono.just(List.of());
        }
        return Mono.zip(zoneRepository.findByName(fromName), zoneRepository.findByName(toName))
                .flatMap(ends -> {
                    Zone start = ends.getT1();
                    Zone goal = ends.getT2();
                    if (start.getId().equals(goal.getId())) {
                        return Mono.just(List.<ZonePath>of());
                    }
                    return loadAdjacency().map(adjacency -> bfs(start.getId(), goal.getId(), adjacency));
                })
                .defaultIfEmpty(List.of());
    }

    private List<ZonePath> bfs(String startId, String goalId, Map<String, List<ZonePath>> adjacency) {
        // zone id -> edge it was first reached through
        Map<String, ZonePath> reachedBy = new HashMap<>();
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(startId);
        visited.add(startId);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(goalId)) {
                List<ZonePath> route = new ArrayList<>();
                for (ZonePath edge = reachedBy.get(goalId); edge != null; edge = reachedBy.get(edge.getFromZoneId())) {
                    route.add(edge);
                }
                Collections.reverse(route);
                return route;
            }
            for (ZonePath edge : adjacency.getOrDefault(current, List.of())) {
                if (visited.add(edge.getToZoneId())) {
                    reachedBy.put(edge.getToZoneId(), edge);
                    queue.add(edge.getToZoneId());
                }
            }
        }
        return List.of();
    }

    private Mono<Map<String, List<ZonePath>>> loadAdjacency() {
        return zoneRepository.findAll()
                .concatMap(zone -> zoneRepository.findPathsFrom(zone.getId()))
                .<Map<String, List<ZonePath>>>collect(HashMap::new, (adjacency, path) -> adjacency
                        .computeIfAbsent(path.getFromZoneId(), id -> new ArrayList<>())
                        .add(path));
    }

    private Mono<Tuple2<Zone, Zone>> endpoints(String fromName, String toName) {
        return getOrCreate(fromName, ZoneCategory.UNKNOWN, "")
                .zipWith(getOrCreate(toName, ZoneCategory.UNKNOWN, ""));
    }

    private static ZonePath path(Tuple2<Zone, Zone> ends, String directionHint, Integer distanceCm) {
        return ZonePath.builder()
                .fromZoneId(ends.getT1().getId())
                .toZoneId(ends.getT2().getId())
                .directionHint(directionHint)
                .distanceCm(distanceCm)
                .build();
    }
}
