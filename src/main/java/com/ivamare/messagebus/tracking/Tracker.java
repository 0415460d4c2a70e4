package com.ivamare.messagebus.tracking;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Default {@link Tracked} implementation holding the "seen" set.
 *
 * <p>The set is created on first use and uses the objects' own
 * {@code equals}/{@code hashCode}. It is never reset; a fresh tracker gives a
 * fresh set. Not thread-safe.
 *
 * @param <T> The tracked object type
 */
public class Tracker<T> implements Tracked<T> {

    private static final Logger log = LoggerFactory.getLogger(Tracker.class);

    private Set<T> seen;

    @Override
    public void onAdd(T obj) {
        track(obj);
    }

    @Override
    public void onFetch(T obj) {
        if (obj != null) {
            track(obj);
        }
    }

    @Override
    public void onList(Iterable<? extends T> objs) {
        if (objs == null) {
            return;
        }
        for (T obj : objs) {
            track(obj);
        }
    }

    @Override
    public void onRemove(T obj) {
        track(obj);
    }

    @Override
    public Set<T> seen() {
        return seen == null ? Set.of() : Collections.unmodifiableSet(seen);
    }

    private void track(T obj) {
        if (seen == null) {
            seen = new LinkedHashSet<>();
        }
        try {
            if (seen.add(obj)) {
                log.debug("Tracking {}", obj);
            }
        } catch (RuntimeException e) {
            log.warn("Tracker does not support unhashable objects, skipping {}: {}",
                obj == null ? null : obj.getClass().getName(), e.toString());
        }
    }
}
