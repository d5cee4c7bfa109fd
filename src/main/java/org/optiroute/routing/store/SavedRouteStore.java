package org.optiroute.routing.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence collaborator for saved routes.
 *
 * <p>Implementations must make each call atomic; callers share one store across threads.
 * Failures surface as {@link SavedRouteStoreException}.</p>
 */
public interface SavedRouteStore {

    /**
     * Persists a new route and returns it with its generated id.
     */
    SavedRoute save(String name, String description, String payload, String ownerId);

    /**
     * Lists routes whose name or description contains {@code search} (case-insensitive).
     *
     * @param search substring filter, or {@code null}/blank for all routes.
     * @param ownerId owner filter, or {@code null} for every owner.
     */
    List<SavedRoute> find(String search, String ownerId);

    Optional<SavedRoute> findById(String id);

    /**
     * Removes a route.
     *
     * @return true when a route was removed.
     */
    boolean delete(String id);

    /**
     * Moves a route to another owner.
     *
     * @throws SavedRouteStoreException with {@code STORE_NOT_FOUND} for an unknown id.
     */
    SavedRoute reassign(String id, String newOwnerId);

    /**
     * Increments the usage count and stamps the last-used instant.
     *
     * @throws SavedRouteStoreException with {@code STORE_NOT_FOUND} for an unknown id.
     */
    SavedRoute recordUsage(String id, Instant usedAt);
}
