package com.ivamare.architecture.repository;

import com.ivamare.architecture.entity.Entity;

import java.util.Optional;

/**
 * Persistence collaborator for one entity type.
 *
 * <p>Implementations live outside the framework. A unit of work calls them
 * only while flushing, in the order deletes, updates, inserts.
 *
 * @param <E> Entity type
 * @param <K> Identity type
 */
public interface Repository<E extends Entity<K>, K> {

    /**
     * @return the entity class this repository stores
     */
    Class<E> entityType();

    /**
     * Insert a new entity.
     *
     * @param entity The entity to insert
     */
    void add(E entity);

    /**
     * Persist the current state of an existing entity.
     *
     * @param entity The entity to update
     */
    void update(E entity);

    /**
     * Remove an entity.
     *
     * @param entity The entity to delete
     */
    void delete(E entity);

    /**
     * Load an entity by identity.
     *
     * @param id The identity
     * @return Optional containing a freshly materialized entity if found
     */
    Optional<E> getById(K id);
}
