package com.ivamare.messagebus.uow;

import com.ivamare.messagebus.model.Event;
import com.ivamare.messagebus.model.MessageQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Unit of work with its own event buffer.
 *
 * <p>Entering clears the buffer. Collection first drains every registered
 * {@link EventCollector} (typically tracking repositories) into the buffer, so
 * locally recorded events and harvested ones come out as one stream ordered by
 * creation instant.
 *
 * <pre>
 * var orders = new TrackingRepository&lt;&gt;(new InMemoryRepository&lt;Order, UUID&gt;(Order::id));
 * var uow = new EventfulUnitOfWork(List.of(orders));
 * var bus = new DefaultMessageBus(uow, registry, failureHandler);
 * </pre>
 */
public class EventfulUnitOfWork extends AbstractUnitOfWork implements EventCollector {

    private static final Logger log = LoggerFactory.getLogger(EventfulUnitOfWork.class);

    private final MessageQueue<Event> events = MessageQueue.ofEvents();
    private final List<EventCollector> collectors = new ArrayList<>();

    public EventfulUnitOfWork() {
    }

    public EventfulUnitOfWork(List<? extends EventCollector> collectors) {
        collectors.forEach(this::register);
    }

    /**
     * Register a source whose events are merged into this unit of work's stream.
     *
     * @param collector The source, usually a tracking repository
     */
    public void register(EventCollector collector) {
        collectors.add(Objects.requireNonNull(collector, "collector is required"));
    }

    public List<EventCollector> getCollectors() {
        return List.copyOf(collectors);
    }

    @Override
    public EventfulUnitOfWork enter() {
        events.clear();
        super.enter();
        return this;
    }

    /**
     * Buffer an event on the unit of work itself.
     */
    public void record(Event event) {
        events.append(event);
    }

    public MessageQueue<Event> events() {
        return events;
    }

    @Override
    public Iterator<Event> collectEvents() {
        List<Event> harvested = new ArrayList<>();
        for (EventCollector collector : collectors) {
            try {
                collector.collectEvents().forEachRemaining(harvested::add);
            } catch (RuntimeException e) {
                log.warn("Failed to collect events from {}: {}", collector, e.toString());
            }
        }
        events.extend(harvested);
        return events.iterator();
    }
}
