package org.optiroute.routing.store;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

/**
 * Thread-safe store backed by a concurrent map.
 */
@Slf4j
public final class InMemorySavedRouteStore implements SavedRouteStore {
    private static final Comparator<SavedRoute> LISTING_ORDER =
            Comparator.comparing(SavedRoute::getCreatedAt).thenComparing(SavedRoute::getId);

    private final ConcurrentMap<String, SavedRoute> routes = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySavedRouteStore() {
        this(Clock.systemUTC());
    }

    public InMemorySavedRouteStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public SavedRoute save(String name, String description, String payload, String ownerId) {
        requireText(name, "name");
        requireText(payload, "payload");
        SavedRoute route = SavedRoute.builder()
                .id(UUID.randomUUID().toString())
                .name(name)
                .description(description == null ? "" : description)
                .payload(payload)
                .ownerId(ownerId)
                .usageCount(0L)
                .createdAt(clock.instant())
                .build();
        routes.put(route.getId(), route);
        log.debug("saved route {} as '{}'", route.getId(), name);
        return route;
    }

    @Override
    public List<SavedRoute> find(String search, String ownerId) {
        String needle = search == null ? "" : search.trim().toLowerCase(Locale.ROOT);
        List<SavedRoute> matches = new ArrayList<>();
        for (SavedRoute route : routes.values()) {
            if (ownerId != null && !ownerId.equals(route.getOwnerId())) {
                continue;
            }
            if (needle.isEmpty()
                    || route.getName().toLowerCase(Locale.ROOT).contains(needle)
                    || route.getDescription().toLowerCase(Locale.ROOT).contains(needle)) {
                matches.add(route);
            }
        }
        matches.sort(LISTING_ORDER);
        return List.copyOf(matches);
    }

    @Override
    public Optional<SavedRoute> findById(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(routes.get(id));
    }

    @Override
    public boolean delete(String id) {
        return id != null && routes.remove(id) != null;
    }

    @Override
    public SavedRoute reassign(String id, String newOwnerId) {
        requireText(newOwnerId, "newOwnerId");
        return update(id, route -> route.toBuilder().ownerId(newOwnerId).build());
    }

    @Override
    public SavedRoute recordUsage(String id, Instant usedAt) {
        Instant stamp = usedAt == null ? clock.instant() : usedAt;
        return update(id, route -> route.toBuilder()
                .usageCount(route.getUsageCount() + 1L)
                .lastUsedAt(stamp)
                .build());
    }

    /**
     * Number of stored routes.
     */
    public int size() {
        return routes.size();
    }

    private SavedRoute update(String id, UnaryOperator<SavedRoute> change) {
        if (id == null) {
            throw notFound(null);
        }
        SavedRoute updated = routes.computeIfPresent(id, (key, route) -> change.apply(route));
        if (updated == null) {
            throw notFound(id);
        }
        return updated;
    }

    private static SavedRouteStoreException notFound(String id) {
        return new SavedRouteStoreException(SavedRouteStoreException.REASON_NOT_FOUND, "no saved route with id " + id);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new SavedRouteStoreException(
                    SavedRouteStoreException.REASON_INVALID_INPUT,
                    field + " must be non-blank"
            );
        }
    }
}
