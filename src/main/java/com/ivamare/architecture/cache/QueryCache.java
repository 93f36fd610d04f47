package com.ivamare.architecture.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import com.ivamare.architecture.uow.CommitListener;
import com.ivamare.architecture.uow.InvalidationEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Shared store of cacheable request results, tagged by entity type.
 *
 * <p>Writes on a fingerprint are first-writer-wins: a losing writer's value is
 * discarded and the stored one returned. Every invalidation advances a
 * sequence number; a result computed before an invalidation of one of its
 * tags is never kept, even if the write races with the purge.
 */
public class QueryCache implements CommitListener {

    private static final Logger log = LoggerFactory.getLogger(QueryCache.class);

    private final Cache<Fingerprint, CacheEntry> store;
    private final Map<Class<?>, Set<Fingerprint>> tagIndex = new ConcurrentHashMap<>();
    private final Map<Class<?>, Long> lastInvalidated = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private volatile long clearedAt;

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder invalidations = new LongAdder();

    public QueryCache(long maximumSize, Duration expireAfterWrite) {
        this(maximumSize, expireAfterWrite, Ticker.systemTicker());
    }

    public QueryCache(long maximumSize, Duration expireAfterWrite, Ticker ticker) {
        this.store = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfterWrite(expireAfterWrite)
            .ticker(ticker)
            .executor(Runnable::run)
            .removalListener((Fingerprint key, CacheEntry entry, RemovalCause cause) -> unindex(key, entry))
            .build();
    }

    /**
     * Look up a live entry.
     *
     * @param fingerprint The request fingerprint
     * @return the entry if present and within its validity window
     */
    public Optional<CacheEntry> get(Fingerprint fingerprint) {
        CacheEntry entry = store.getIfPresent(fingerprint);
        if (entry == null) {
            misses.increment();
            return Optional.empty();
        }
        hits.increment();
        log.debug("Cache hit for {}", fingerprint);
        return Optional.of(entry);
    }

    /**
     * @return the invalidation sequence to pass to {@link #put} for a computation starting now
     */
    public long currentSequence() {
        return sequence.get();
    }

    /**
     * Store a computed result unless another writer got there first.
     *
     * @param fingerprint The request fingerprint
     * @param value The computed result
     * @param tags Entity types the result depends on
     * @param observedSequence {@link #currentSequence()} taken before computing
     * @return the value now associated with the fingerprint (the winner's), or {@code value} if it was discarded as stale
     */
    public Object put(Fingerprint fingerprint, Object value, Set<Class<?>> tags, long observedSequence) {
        if (isStale(tags, observedSequence)) {
            log.debug("Discarded stale result for {}", fingerprint);
            return value;
        }

        CacheEntry entry = new CacheEntry(value, tags, Instant.now());
        CacheEntry existing = store.asMap().putIfAbsent(fingerprint, entry);
        if (existing != null) {
            return existing.value();
        }

        for (Class<?> tag : entry.tags()) {
            tagIndex.computeIfAbsent(tag, t -> ConcurrentHashMap.newKeySet()).add(fingerprint);
        }
        // An invalidation may have run between the first check and indexing
        if (isStale(entry.tags(), observedSequence)) {
            store.asMap().remove(fingerprint, entry);
            log.debug("Discarded stale result for {}", fingerprint);
        }
        return value;
    }

    /**
     * Purge every entry tagged with an entity type.
     *
     * @param entityType The mutated type
     */
    public void invalidate(Class<?> entityType) {
        lastInvalidated.put(entityType, sequence.incrementAndGet());
        Set<Fingerprint> fingerprints = tagIndex.remove(entityType);
        if (fingerprints == null || fingerprints.isEmpty()) {
            return;
        }
        store.invalidateAll(fingerprints);
        invalidations.add(fingerprints.size());
        log.debug("Invalidated {} entries tagged {}", fingerprints.size(), entityType.getSimpleName());
    }

    public void invalidateAll() {
        clearedAt = sequence.incrementAndGet();
        long size = store.estimatedSize();
        store.invalidateAll();
        tagIndex.clear();
        invalidations.add(size);
    }

    @Override
    public void onCommit(InvalidationEvent event) {
        event.entityTypes().forEach(this::invalidate);
    }

    public long size() {
        store.cleanUp();
        return store.estimatedSize();
    }

    public CacheStats stats() {
        return new CacheStats(hits.sum(), misses.sum(), invalidations.sum(), size());
    }

    private boolean isStale(Set<Class<?>> tags, long observedSequence) {
        if (clearedAt > observedSequence) {
            return true;
        }
        for (Class<?> tag : tags) {
            Long invalidatedAt = lastInvalidated.get(tag);
            if (invalidatedAt != null && invalidatedAt > observedSequence) {
                return true;
            }
        }
        return false;
    }

    private void unindex(Fingerprint fingerprint, CacheEntry entry) {
        if (fingerprint == null || entry == null) {
            return;
        }
        CacheEntry current = store.asMap().get(fingerprint);
        if (current != null && current != entry) {
            return;
        }
        for (Class<?> tag : entry.tags()) {
            Set<Fingerprint> fingerprints = tagIndex.get(tag);
            if (fingerprints != null) {
                fingerprints.remove(fingerprint);
            }
        }
    }
}
