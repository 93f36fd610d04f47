package com.ivamare.architecture.uow;

import com.ivamare.architecture.entity.Entity;
import com.ivamare.architecture.entity.EntityKey;
import com.ivamare.architecture.exception.IdentityConflictException;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Per-scope registry guaranteeing one in-memory instance per entity identity.
 *
 * <p>Not thread-safe: an identity map belongs to exactly one unit of work,
 * which belongs to one execution context.
 */
public class IdentityMap {

    private final Map<EntityKey, Entity<?>> entries = new HashMap<>();

    /**
     * Return the tracked instance for a key, or load and track it.
     *
     * @param key The identity
     * @param loader Materializes the entity, may return null when it does not exist
     * @param <E> entity type
     * @return the single tracked instance, or empty when the loader found nothing
     */
    @SuppressWarnings("unchecked")
    public <E extends Entity<?>> Optional<E> getOrTrack(EntityKey key, Supplier<? extends E> loader) {
        Entity<?> existing = entries.get(key);
        if (existing != null) {
            return Optional.of((E) existing);
        }
        E loaded = loader.get();
        if (loaded == null) {
            return Optional.empty();
        }
        entries.put(key, loaded);
        return Optional.of(loaded);
    }

    /**
     * Track an instance under its own key.
     *
     * @param entity The entity
     * @throws IdentityConflictException if another instance is tracked for the same identity
     */
    public void track(Entity<?> entity) {
        EntityKey key = EntityKey.of(entity);
        Entity<?> existing = entries.putIfAbsent(key, entity);
        if (existing != null && existing != entity) {
            throw new IdentityConflictException(key);
        }
    }

    public Optional<Entity<?>> find(EntityKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean contains(EntityKey key) {
        return entries.containsKey(key);
    }

    public void remove(EntityKey key) {
        entries.remove(key);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public void clear() {
        entries.clear();
    }
}
