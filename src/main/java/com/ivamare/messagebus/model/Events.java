package com.ivamare.messagebus.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Harvests events from {@link Eventful} objects.
 */
public final class Events {

    private static final Logger log = LoggerFactory.getLogger(Events.class);

    private Events() {
    }

    /**
     * Drains the events of every given object.
     *
     * @param objects Objects that may record events
     * @return The drained events, in no particular order
     * @see #harvestAll(Iterable, Set)
     */
    public static List<Event> harvestAll(Iterable<?> objects) {
        return harvestAll(objects, newHarvestedSet());
    }

    /**
     * Drains the events of every given object. An object whose events cannot
     * be read or checked is logged and skipped; the other objects keep their
     * events.
     *
     * @param objects Objects that may record events
     * @param harvested Events already taken from sources that cannot be cleared
     * @return The drained events, in no particular order
     */
    public static List<Event> harvestAll(Iterable<?> objects, Set<Event> harvested) {
        List<Event> results = new ArrayList<>();
        for (Object obj : objects) {
            try {
                results.addAll(harvest(obj, harvested));
            } catch (RuntimeException e) {
                log.warn("Skipping events of {}: {}", obj, e.toString());
            }
        }
        return results;
    }

    /**
     * Drains the events of one object.
     *
     * @see #harvest(Object, Set)
     */
    public static List<Event> harvest(Object obj) {
        return harvest(obj, newHarvestedSet());
    }

    /**
     * Drains the events of one object. Objects that are not {@link Eventful}
     * have no events. A plain collection of events is checked, copied into a
     * {@link MessageQueue} and cleared.
     *
     * <p>Nothing is cleared unless every element is an event. A source that
     * cannot be cleared, such as an unmodifiable list, is left as it is; its
     * events are remembered in {@code harvested} and returned only once.
     *
     * @param obj Object that may record events
     * @param harvested Events already taken from sources that cannot be cleared
     * @return The drained events, earliest first
     * @throws com.ivamare.messagebus.exception.InvalidMessageTypeException if a
     *         recorded element is not an event
     */
    public static List<Event> harvest(Object obj, Set<Event> harvested) {
        if (!(obj instanceof Eventful eventful)) {
            return List.of();
        }
        Iterable<? extends Event> events = eventful.events();
        if (events == null) {
            return List.of();
        }
        if (events instanceof MessageQueue<?> queue) {
            MessageQueue<Event> checked = new MessageQueue<>(Event.class, queue.snapshot());
            queue.clear();
            return checked.drain();
        }
        List<Event> copied = new MessageQueue<>(Event.class, events).drain();
        if (events instanceof Collection<?> collection) {
            try {
                collection.clear();
                return copied;
            } catch (UnsupportedOperationException e) {
                log.warn("Events of {} cannot be cleared, keeping track of {} harvested event(s)",
                    obj, copied.size());
            }
        }
        List<Event> fresh = new ArrayList<>();
        for (Event event : copied) {
            if (harvested.add(event)) {
                fresh.add(event);
            }
        }
        return fresh;
    }

    /**
     * @return An empty identity set for {@link #harvest(Object, Set)}
     */
    public static Set<Event> newHarvestedSet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }
}
