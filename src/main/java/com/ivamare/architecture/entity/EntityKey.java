package com.ivamare.architecture.entity;

/**
 * Identity-map key: entity type plus identity.
 *
 * @param type The entity class
 * @param id The identity value
 */
public record EntityKey(Class<?> type, Object id) {

    public EntityKey {
        if (type == null) {
            throw new IllegalArgumentException("type is required");
        }
        if (id == null) {
            throw new IllegalArgumentException("id is required");
        }
    }

    /**
     * Key for an entity instance, using its runtime class.
     *
     * @param entity the entity
     * @return its key
     */
    public static EntityKey of(Entity<?> entity) {
        return new EntityKey(entity.getClass(), entity.getId());
    }

    @Override
    public String toString() {
        return type.getSimpleName() + "#" + id;
    }
}
