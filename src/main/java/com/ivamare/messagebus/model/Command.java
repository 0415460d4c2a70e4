package com.ivamare.messagebus.model;

import java.time.Instant;

/**
 * An imperative instruction for the system to perform an action.
 *
 * <p>Commands are named with an imperative verb phrase (e.g. {@code CreateOrder}).
 * Each command type is routed to exactly one handler, and a handler failure
 * propagates to whoever asked the bus to handle the command.
 */
public abstract class Command extends Message {

    protected Command() {
        super();
    }

    protected Command(Instant createdAt) {
        super(createdAt);
    }
}
