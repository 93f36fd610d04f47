package com.ivamare.architecture.health;

import com.ivamare.architecture.cache.CacheStats;
import com.ivamare.architecture.cache.QueryCache;
import com.ivamare.architecture.container.Container;
import com.ivamare.architecture.dispatch.HandlerRegistry;
import com.ivamare.architecture.uow.UnitOfWorkManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Health indicator for the dispatcher and its collaborators.
 *
 * <p>Reports:
 * <ul>
 *   <li>Container started and number of registrations</li>
 *   <li>Registered handler count</li>
 *   <li>Open units of work</li>
 *   <li>Query cache statistics, when the cache is enabled</li>
 * </ul>
 */
public class DispatcherHealthIndicator implements HealthIndicator {

    private final Container container;
    private final HandlerRegistry handlerRegistry;
    private final UnitOfWorkManager unitOfWorkManager;
    private final QueryCache queryCache;

    public DispatcherHealthIndicator(
            Container container,
            HandlerRegistry handlerRegistry,
            UnitOfWorkManager unitOfWorkManager,
            QueryCache queryCache) {
        this.container = container;
        this.handlerRegistry = handlerRegistry;
        this.unitOfWorkManager = unitOfWorkManager;
        this.queryCache = queryCache;
    }

    @Override
    public Health health() {
        try {
            if (!container.isStarted()) {
                return Health.down()
                    .withDetail("error", "Container not started")
                    .build();
            }

            Health.Builder builder = Health.up()
                .withDetail("registrations", container.registrations().size())
                .withDetail("handlers", handlerRegistry.registeredHandlers().size())
                .withDetail("activeScopes", unitOfWorkManager.activeScopes());

            addCacheStats(builder);

            return builder.build();

        } catch (Exception e) {
            return Health.down(e).build();
        }
    }

    private void addCacheStats(Health.Builder builder) {
        if (queryCache == null) {
            builder.withDetail("cache", "disabled");
            return;
        }
        CacheStats stats = queryCache.stats();
        builder.withDetail("cache.size", stats.size());
        builder.withDetail("cache.hits", stats.hits());
        builder.withDetail("cache.misses", stats.misses());
        builder.withDetail("cache.invalidations", stats.invalidations());
    }
}
