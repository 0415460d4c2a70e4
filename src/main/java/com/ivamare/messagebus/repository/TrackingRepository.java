package com.ivamare.messagebus.repository;

import com.ivamare.messagebus.model.Event;
import com.ivamare.messagebus.model.Events;
import com.ivamare.messagebus.model.MessageQueue;
import com.ivamare.messagebus.tracking.Tracked;
import com.ivamare.messagebus.tracking.Tracker;
import com.ivamare.messagebus.uow.EventCollector;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Decorates a repository so that every object it adds, gets, lists or removes
 * is remembered, and so that the events those objects record can be collected.
 *
 * <p>Tracking happens only after the delegate returned normally. Register the
 * tracking repository with an {@link com.ivamare.messagebus.uow.EventfulUnitOfWork}
 * to have the bus pick up the events.
 *
 * @param <T> The domain object type
 * @param <K> The key type
 */
public class TrackingRepository<T, K> implements Repository<T, K>, Tracked<T>, EventCollector {

    private final Repository<T, K> delegate;
    private final Tracked<T> tracker;
    private final MessageQueue<Event> events = MessageQueue.ofEvents();
    private final Set<Event> harvested = Events.newHarvestedSet();

    public TrackingRepository(Repository<T, K> delegate) {
        this(delegate, new Tracker<>());
    }

    public TrackingRepository(Repository<T, K> delegate, Tracked<T> tracker) {
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
        this.tracker = Objects.requireNonNull(tracker, "tracker is required");
    }

    @Override
    public void add(T obj) {
        delegate.add(obj);
        onAdd(obj);
    }

    @Override
    public Optional<T> get(K key) {
        Optional<T> result = delegate.get(key);
        result.ifPresent(this::onFetch);
        return result;
    }

    @Override
    public List<T> list() {
        List<T> results = delegate.list();
        onList(results);
        return results;
    }

    @Override
    public void remove(T obj) {
        delegate.remove(obj);
        onRemove(obj);
    }

    @Override
    public void commit() {
        delegate.commit();
    }

    @Override
    public void rollback() {
        delegate.rollback();
    }

    @Override
    public void onAdd(T obj) {
        tracker.onAdd(obj);
    }

    @Override
    public void onFetch(T obj) {
        tracker.onFetch(obj);
    }

    @Override
    public void onList(Iterable<? extends T> objs) {
        tracker.onList(objs);
    }

    @Override
    public void onRemove(T obj) {
        tracker.onRemove(obj);
    }

    @Override
    public Set<T> seen() {
        return tracker.seen();
    }

    /**
     * Events buffered directly on this repository.
     */
    public MessageQueue<Event> events() {
        return events;
    }

    /**
     * Moves the events of every seen object into this repository's buffer, then
     * yields the whole buffer earliest first, popping as it goes. A seen object
     * whose events cannot be harvested is skipped with a warning.
     */
    @Override
    public Iterator<Event> collectEvents() {
        events.extend(Events.harvestAll(tracker.seen(), harvested));
        return events.iterator();
    }

    public Repository<T, K> getDelegate() {
        return delegate;
    }
}
