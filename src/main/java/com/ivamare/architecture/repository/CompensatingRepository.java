package com.ivamare.architecture.repository;

import com.ivamare.architecture.entity.Entity;

/**
 * A repository whose writes can be undone.
 *
 * <p>When a flush fails part way, the unit of work undoes the writes it has
 * already applied, newest first, provided every repository involved is
 * compensating.
 *
 * @param <E> Entity type
 * @param <K> Identity type
 */
public interface CompensatingRepository<E extends Entity<K>, K> extends Repository<E, K> {

    /**
     * Undo a previous {@link #add}.
     *
     * @param entity The entity that was added
     */
    default void undoAdd(E entity) {
        delete(entity);
    }

    /**
     * Undo a previous {@link #update}.
     *
     * @param previous The persisted state captured before the update
     */
    default void undoUpdate(E previous) {
        update(previous);
    }

    /**
     * Undo a previous {@link #delete}.
     *
     * @param entity The entity that was deleted
     */
    default void undoDelete(E entity) {
        add(entity);
    }
}
