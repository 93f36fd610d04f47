package com.ivamare.architecture.entity;

import java.util.Objects;

/**
 * Convenience base for entities.
 *
 * <p>Equality is by concrete class and identity, never by attributes.
 *
 * @param <K> Identity type
 */
public abstract class AbstractEntity<K> implements Entity<K> {

    private K id;
    private long version;

    protected AbstractEntity() {
        // for deserialization
    }

    protected AbstractEntity(K id) {
        if (id == null) {
            throw new IllegalArgumentException("id is required");
        }
        this.id = id;
    }

    @Override
    public K getId() {
        return id;
    }

    @Override
    public long getVersion() {
        return version;
    }

    /**
     * Bump the revision counter. Call from every mutating domain method.
     */
    protected void markModified() {
        version++;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Objects.equals(id, ((AbstractEntity<?>) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), id);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[id=" + id + ", version=" + version + "]";
    }
}
