package com.ivamare.messagebus.model;

/**
 * Convenience base for domain objects that raise events.
 *
 * <p>Example:
 * <pre>
 * public class Order extends Aggregate {
 *     public void confirm() {
 *         this.status = CONFIRMED;
 *         record(new OrderConfirmed(id));
 *     }
 * }
 * </pre>
 */
public abstract class Aggregate implements Eventful {

    private final MessageQueue<Event> events = MessageQueue.ofEvents();

    protected void record(Event event) {
        events.append(event);
    }

    @Override
    public MessageQueue<Event> events() {
        return events;
    }
}
