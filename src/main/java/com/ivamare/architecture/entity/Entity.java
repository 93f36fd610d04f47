package com.ivamare.architecture.entity;

/**
 * A domain object with a stable identity across its lifecycle.
 *
 * @param <K> Value-typed identity key
 */
public interface Entity<K> {

    /**
     * @return the identity key, stable for the entity's lifetime
     */
    K getId();

    /**
     * @return revision counter, incremented on each modification
     */
    long getVersion();
}
