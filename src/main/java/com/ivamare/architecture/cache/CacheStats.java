package com.ivamare.architecture.cache;

/**
 * Point-in-time counters for a query cache.
 *
 * @param hits Lookups answered from the cache
 * @param misses Lookups that fell through to the handler
 * @param invalidations Entries purged by commits or explicit invalidation
 * @param size Estimated number of live entries
 */
public record CacheStats(long hits, long misses, long invalidations, long size) {
}
