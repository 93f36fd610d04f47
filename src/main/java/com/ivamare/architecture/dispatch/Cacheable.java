package com.ivamare.architecture.dispatch;

import java.util.Set;

/**
 * Marks a request whose result depends only on its payload and the entities it reads.
 *
 * <p>Cacheable requests are memoized by fingerprint. Cached results are
 * tagged with the entity types the handler loaded plus {@link #cacheTags()},
 * and are purged when a commit mutates any of those types.
 */
public interface Cacheable {

    /**
     * Extra entity types this request depends on without loading them through the unit of work.
     *
     * @return additional invalidation tags
     */
    default Set<Class<?>> cacheTags() {
        return Set.of();
    }
}
