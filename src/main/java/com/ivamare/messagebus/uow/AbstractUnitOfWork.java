package com.ivamare.messagebus.uow;

/**
 * Base unit of work whose commit and rollback do nothing.
 */
public abstract class AbstractUnitOfWork implements UnitOfWork {

    private boolean autoCommit;

    @Override
    public UnitOfWork enter() {
        return this;
    }

    @Override
    public void exit(Throwable error) {
        if (autoCommit && error == null) {
            commit();
        }
    }

    @Override
    public void commit() {
    }

    @Override
    public void rollback() {
    }

    @Override
    public boolean isAutoCommit() {
        return autoCommit;
    }

    @Override
    public void setAutoCommit(boolean autoCommit) {
        this.autoCommit = autoCommit;
    }
}
