package com.ivamare.messagebus.uow;

/**
 * Scoped boundary around one logical operation.
 *
 * <p>{@link #enter()} begins the scope and {@link #exit(Throwable)} ends it.
 * On a clean exit with auto-commit enabled, {@link #commit()} runs; rollback is
 * never automatic. Prefer {@link #execute(UnitOfWorkCallback)}, which pairs the
 * two calls.
 *
 * <p>Implementations that also implement {@link EventCollector} take part in
 * the message bus event collection.
 */
public interface UnitOfWork {

    /**
     * Begin the scope.
     *
     * @return this unit of work
     */
    UnitOfWork enter();

    /**
     * End the scope.
     *
     * @param error The error that ended the scope, or null on a clean exit
     */
    void exit(Throwable error);

    void commit();

    void rollback();

    boolean isAutoCommit();

    void setAutoCommit(boolean autoCommit);

    /**
     * Run work inside this unit of work. Exceptions thrown by the callback end
     * the scope as failed and propagate.
     *
     * @param callback The work
     * @return The callback result
     */
    default <R> R execute(UnitOfWorkCallback<R> callback) {
        enter();
        R result;
        try {
            result = callback.doInUnitOfWork(this);
        } catch (RuntimeException | Error e) {
            exit(e);
            throw e;
        }
        exit(null);
        return result;
    }
}
