package com.ivamare.messagebus.uow;

import com.ivamare.messagebus.model.Event;

import java.util.Iterator;

/**
 * Source of events the message bus drains after every handler invocation.
 *
 * <p>Each call starts a new, finite collection. The returned iterator removes
 * every event it yields from the collector, earliest first.
 */
@FunctionalInterface
public interface EventCollector {

    Iterator<Event> collectEvents();
}
