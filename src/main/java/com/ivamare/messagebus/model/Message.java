package com.ivamare.messagebus.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Base type of everything that travels through the message bus.
 *
 * <p>A message is stamped with its creation instant when it is constructed and
 * the stamp never changes afterwards. Messages order by that instant only;
 * {@link MessageQueue} breaks ties by insertion order.
 *
 * <p>Do not extend this class directly: extend {@link Command} or {@link Event}.
 */
public abstract class Message implements Comparable<Message> {

    private final Instant createdAt;

    /**
     * Creates a message stamped with the current instant.
     */
    protected Message() {
        this(Instant.now());
    }

    /**
     * Creates a message with an explicit creation instant.
     *
     * @param createdAt When the message was created
     */
    protected Message(Instant createdAt) {
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt is required");
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Compares creation instants. Consistent with equals only for messages
     * created at distinct instants, equality stays identity based.
     */
    @Override
    public int compareTo(Message other) {
        return createdAt.compareTo(other.createdAt);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }
}
