package com.ivamare.messagebus.tracking;

import java.util.Set;

/**
 * Capability of an object that hands out child objects and remembers every one
 * it has seen.
 *
 * <p>Implementations call the hooks after the corresponding operation returned
 * successfully, never when it failed. Recording is best-effort: an object that
 * cannot be hashed is skipped with a warning and the observed operation still
 * succeeds.
 *
 * @param <T> The child object type
 */
public interface Tracked<T> {

    /**
     * Records an object that was added.
     */
    void onAdd(T obj);

    /**
     * Records an object that was fetched; null results are ignored.
     */
    void onFetch(T obj);

    /**
     * Records every object of a listing; a null listing is ignored.
     */
    void onList(Iterable<? extends T> objs);

    /**
     * Records an object that was removed.
     */
    void onRemove(T obj);

    /**
     * @return A read-only view of every object seen so far
     */
    Set<T> seen();
}
