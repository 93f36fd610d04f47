package com.ivamare.architecture.health;

import com.ivamare.architecture.ArchitectureAutoConfiguration;
import com.ivamare.architecture.cache.QueryCache;
import com.ivamare.architecture.container.Container;
import com.ivamare.architecture.dispatch.HandlerRegistry;
import com.ivamare.architecture.uow.UnitOfWorkManager;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for architecture health indicators.
 */
@AutoConfiguration(after = ArchitectureAutoConfiguration.class)
@ConditionalOnClass(HealthIndicator.class)
@ConditionalOnProperty(prefix = "architecture", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HealthAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(DispatcherHealthIndicator.class)
    @ConditionalOnBean({Container.class, HandlerRegistry.class, UnitOfWorkManager.class})
    public DispatcherHealthIndicator dispatcherHealthIndicator(
            Container container,
            HandlerRegistry handlerRegistry,
            UnitOfWorkManager unitOfWorkManager,
            ObjectProvider<QueryCache> queryCache) {
        return new DispatcherHealthIndicator(container, handlerRegistry, unitOfWorkManager, queryCache.getIfAvailable());
    }
}
