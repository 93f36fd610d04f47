package com.ivamare.architecture.repository.impl;

import com.ivamare.architecture.entity.Entity;
import com.ivamare.architecture.exception.ArchitectureException;
import com.ivamare.architecture.repository.CompensatingRepository;
import com.ivamare.architecture.repository.EntitySerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Compensating repository that keeps JSON snapshots in memory.
 *
 * <p>Every read materializes a new instance, so callers never share state
 * with the store. Useful for tests and for prototyping before a real
 * persistence adapter exists.
 *
 * @param <E> Entity type
 * @param <K> Identity type
 */
public class InMemoryRepository<E extends Entity<K>, K> implements CompensatingRepository<E, K> {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRepository.class);

    private final Class<E> entityType;
    private final EntitySerializer serializer;
    private final ConcurrentMap<K, String> snapshots = new ConcurrentHashMap<>();

    public InMemoryRepository(Class<E> entityType, EntitySerializer serializer) {
        this.entityType = entityType;
        this.serializer = serializer;
    }

    @Override
    public Class<E> entityType() {
        return entityType;
    }

    @Override
    public void add(E entity) {
        String previous = snapshots.putIfAbsent(entity.getId(), serializer.serialize(entity));
        if (previous != null) {
            throw new ArchitectureException(entityType.getSimpleName() + " " + entity.getId() + " already exists");
        }
        log.debug("Added {} {}", entityType.getSimpleName(), entity.getId());
    }

    @Override
    public void update(E entity) {
        String replaced = snapshots.replace(entity.getId(), serializer.serialize(entity));
        if (replaced == null) {
            throw new ArchitectureException(entityType.getSimpleName() + " " + entity.getId() + " does not exist");
        }
        log.debug("Updated {} {}", entityType.getSimpleName(), entity.getId());
    }

    @Override
    public void delete(E entity) {
        if (snapshots.remove(entity.getId()) == null) {
            throw new ArchitectureException(entityType.getSimpleName() + " " + entity.getId() + " does not exist");
        }
        log.debug("Deleted {} {}", entityType.getSimpleName(), entity.getId());
    }

    @Override
    public Optional<E> getById(K id) {
        String json = snapshots.get(id);
        return json == null ? Optional.empty() : Optional.of(serializer.deserialize(json, entityType));
    }

    /**
     * @return identities currently stored
     */
    public Set<K> ids() {
        return Set.copyOf(snapshots.keySet());
    }

    public int size() {
        return snapshots.size();
    }
}
