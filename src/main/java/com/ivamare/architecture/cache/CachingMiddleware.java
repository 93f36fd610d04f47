package com.ivamare.architecture.cache;

import com.ivamare.architecture.dispatch.Cacheable;
import com.ivamare.architecture.dispatch.DispatchContext;
import com.ivamare.architecture.dispatch.Middleware;
import com.ivamare.architecture.dispatch.Request;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Memoizes {@link Cacheable} requests by fingerprint.
 *
 * <p>Register innermost, just before the handler. Results of read-only
 * dispatches are stored immediately; results of commands are stored only once
 * their unit of work has committed. Non-cacheable requests pass straight through.
 */
public class CachingMiddleware implements Middleware {

    private final QueryCache cache;
    private final FingerprintCalculator fingerprintCalculator;

    public CachingMiddleware(QueryCache cache, FingerprintCalculator fingerprintCalculator) {
        this.cache = cache;
        this.fingerprintCalculator = fingerprintCalculator;
    }

    @Override
    public Object invoke(Request<?> request, DispatchContext context, Next next) throws Exception {
        if (!(request instanceof Cacheable cacheable)) {
            return next.proceed();
        }

        Fingerprint fingerprint = fingerprintCalculator.fingerprint(request);
        Optional<CacheEntry> hit = cache.get(fingerprint);
        if (hit.isPresent()) {
            return hit.get().value();
        }

        long observedSequence = cache.currentSequence();
        Object result = next.proceed();

        Set<Class<?>> tags = new LinkedHashSet<>(context.typesRead());
        tags.addAll(cacheable.cacheTags());

        if (context.isReadOnly()) {
            return cache.put(fingerprint, result, tags, observedSequence);
        }
        context.unitOfWork().afterCommit(() -> cache.put(fingerprint, result, tags, observedSequence));
        return result;
    }
}
