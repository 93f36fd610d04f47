package com.ivamare.architecture.cache;

import java.time.Instant;
import java.util.Set;

/**
 * A cached result and the entity types it was computed from.
 *
 * @param value Handler result (may be null)
 * @param tags Entity types whose mutation invalidates this entry
 * @param createdAt When the result was stored
 */
public record CacheEntry(Object value, Set<Class<?>> tags, Instant createdAt) {

    public CacheEntry {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
