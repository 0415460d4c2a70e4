package com.ivamare.messagebus.model;

/**
 * An object that records events for the bus to harvest.
 *
 * <p>The returned sequence is either a {@link MessageQueue} or a plain mutable
 * collection of events; harvesting drains it. Objects that do not implement
 * this interface simply have no events.
 */
public interface Eventful {

    /**
     * @return The events recorded by this object since they were last harvested
     */
    Iterable<? extends Event> events();
}
