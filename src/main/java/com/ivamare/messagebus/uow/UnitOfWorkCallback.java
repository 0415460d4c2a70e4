package com.ivamare.messagebus.uow;

/**
 * Work executed inside {@link UnitOfWork#execute}.
 *
 * @param <R> The result type
 */
@FunctionalInterface
public interface UnitOfWorkCallback<R> {

    R doInUnitOfWork(UnitOfWork unitOfWork);
}
