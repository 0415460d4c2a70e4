package com.ivamare.messagebus.repository;

import java.util.List;
import java.util.Optional;

/**
 * Collection-like access to persisted domain objects.
 *
 * <p>Persistence mechanics are left to implementations; the message bus only
 * cares about which objects pass through {@code add}, {@code get}, {@code list}
 * and {@code remove} (see {@link TrackingRepository}).
 *
 * @param <T> The domain object type
 * @param <K> The key type
 */
public interface Repository<T, K> {

    /**
     * Add an object to the repository.
     *
     * @param obj The object to add
     */
    void add(T obj);

    /**
     * Get an object by key.
     *
     * @param key The object's key
     * @return Optional containing the object if found
     */
    Optional<T> get(K key);

    /**
     * List every object in the repository.
     *
     * @return The objects, never null
     */
    List<T> list();

    /**
     * Remove an object from the repository.
     *
     * @param obj The object to remove
     */
    void remove(T obj);

    void commit();

    void rollback();
}
