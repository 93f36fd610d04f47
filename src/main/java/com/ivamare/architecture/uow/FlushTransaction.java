package com.ivamare.architecture.uow;

/**
 * Runs a unit of work flush inside an outer transaction, if there is one.
 */
@FunctionalInterface
public interface FlushTransaction {

    /** Runs the flush directly. */
    FlushTransaction NONE = Runnable::run;

    void execute(Runnable flush);
}
