package com.ivamare.architecture.uow;

/**
 * Receives invalidation events from committed units of work.
 */
@FunctionalInterface
public interface CommitListener {

    void onCommit(InvalidationEvent event);
}
