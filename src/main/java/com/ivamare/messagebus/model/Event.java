package com.ivamare.messagebus.model;

import java.time.Instant;

/**
 * A fact that already happened, named with a past-tense verb phrase
 * (e.g. {@code OrderCreated}).
 *
 * <p>An event type may have any number of handlers, including none. A failing
 * handler is logged and never stops the remaining handlers or the caller.
 */
public abstract class Event extends Message {

    protected Event() {
        super();
    }

    protected Event(Instant createdAt) {
        super(createdAt);
    }
}
