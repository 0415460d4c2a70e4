package com.ivamare.messagebus.uow;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Unit of work that opens a {@link Session} on enter and closes it on exit.
 *
 * <p>Commit and rollback are delegated to the current session; outside a scope
 * they do nothing.
 *
 * @param <S> The session type
 */
public class SessionedUnitOfWork<S extends Session> extends AbstractUnitOfWork {

    private final Supplier<? extends S> sessionFactory;
    private S session;

    public SessionedUnitOfWork(Supplier<? extends S> sessionFactory) {
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory is required");
    }

    /**
     * @return The session of the current scope, or null outside a scope
     */
    public S getSession() {
        return session;
    }

    @Override
    public SessionedUnitOfWork<S> enter() {
        session = sessionFactory.get();
        super.enter();
        return this;
    }

    @Override
    public void exit(Throwable error) {
        try {
            super.exit(error);
        } finally {
            close();
        }
    }

    public void close() {
        if (session != null) {
            session.close();
        }
    }

    @Override
    public void commit() {
        super.commit();
        if (session != null) {
            session.commit();
        }
    }

    @Override
    public void rollback() {
        super.rollback();
        if (session != null) {
            session.rollback();
        }
    }
}
