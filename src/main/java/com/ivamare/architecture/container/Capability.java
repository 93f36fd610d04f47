package com.ivamare.architecture.container;

import com.ivamare.architecture.entity.Entity;
import com.ivamare.architecture.repository.Repository;

/**
 * A named contract that the container resolves to an implementation.
 *
 * <p>Capabilities are compared by name and type, so two bindings of the same
 * interface can coexist under different names.
 *
 * @param name Unique capability name within a container
 * @param type Contract type the resolved instance satisfies
 * @param <T> Contract type
 */
public record Capability<T>(String name, Class<?> type) {

    private static final String REPOSITORY_PREFIX = "repository:";

    public Capability {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("type is required");
        }
    }

    /**
     * Capability named after the contract type.
     *
     * @param type contract type
     * @param <T> contract type
     * @return capability keyed by the type's name
     */
    public static <T> Capability<T> of(Class<T> type) {
        return new Capability<>(type.getName(), type);
    }

    /**
     * Capability with an explicit name, for several bindings of one contract.
     *
     * @param name capability name
     * @param type contract type
     * @param <T> contract type
     * @return named capability
     */
    public static <T> Capability<T> named(String name, Class<T> type) {
        return new Capability<>(name, type);
    }

    /**
     * The conventional capability for "a Repository for E".
     *
     * @param entityType entity class the repository stores
     * @param <E> entity type
     * @param <K> identity type
     * @return repository capability for the entity type
     */
    public static <E extends Entity<K>, K> Capability<Repository<E, K>> repository(Class<E> entityType) {
        return new Capability<>(REPOSITORY_PREFIX + entityType.getName(), Repository.class);
    }

    /**
     * Untyped variant used when only the runtime class of an entity is known.
     *
     * @param entityType entity class
     * @return repository capability
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static Capability<Repository<Entity<Object>, Object>> repositoryFor(Class<?> entityType) {
        return new Capability(REPOSITORY_PREFIX + entityType.getName(), Repository.class);
    }

    @Override
    public String toString() {
        return name;
    }
}
