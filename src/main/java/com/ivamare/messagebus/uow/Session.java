package com.ivamare.messagebus.uow;

/**
 * Storage session driven by a {@link SessionedUnitOfWork}.
 *
 * <p>Every operation defaults to doing nothing, so a session only implements
 * what its store supports.
 */
public interface Session {

    default void commit() {
    }

    default void rollback() {
    }

    default void close() {
    }
}
