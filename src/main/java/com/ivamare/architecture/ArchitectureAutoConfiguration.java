package com.ivamare.architecture;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.architecture.cache.CachingMiddleware;
import com.ivamare.architecture.cache.FingerprintCalculator;
import com.ivamare.architecture.cache.QueryCache;
import com.ivamare.architecture.container.Capability;
import com.ivamare.architecture.container.Container;
import com.ivamare.architecture.container.ContainerConfigurer;
import com.ivamare.architecture.container.ScopeAccessor;
import com.ivamare.architecture.container.impl.DefaultContainer;
import com.ivamare.architecture.dispatch.HandlerRegistry;
import com.ivamare.architecture.dispatch.Middleware;
import com.ivamare.architecture.dispatch.UseCaseDispatcher;
import com.ivamare.architecture.dispatch.impl.DefaultHandlerRegistry;
import com.ivamare.architecture.dispatch.impl.DefaultUseCaseDispatcher;
import com.ivamare.architecture.dispatch.middleware.LoggingMiddleware;
import com.ivamare.architecture.dispatch.middleware.RequestValidator;
import com.ivamare.architecture.dispatch.middleware.ValidationMiddleware;
import com.ivamare.architecture.repository.EntitySerializer;
import com.ivamare.architecture.uow.CommitListener;
import com.ivamare.architecture.uow.FlushTransaction;
import com.ivamare.architecture.uow.SpringTransactionFlush;
import com.ivamare.architecture.uow.UnitOfWorkManager;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.List;

/**
 * Auto-configuration for the architecture core.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Capability container, populated from {@link ContainerConfigurer} beans</li>
 *   <li>Unit of work manager, flushing inside a Spring transaction when a
 *       transaction manager is present</li>
 *   <li>Handler registry, discovering {@link com.ivamare.architecture.dispatch.RequestHandler} beans</li>
 *   <li>Query cache</li>
 *   <li>Use case dispatcher with logging, validation, custom and caching middleware</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * architecture.enabled=false
 * </pre>
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "architecture", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ArchitectureProperties.class)
public class ArchitectureAutoConfiguration {

    // --- Object Mapper ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper architectureObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean
    public EntitySerializer entitySerializer(ObjectMapper objectMapper) {
        return new EntitySerializer(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public FingerprintCalculator fingerprintCalculator(ObjectMapper objectMapper) {
        return new FingerprintCalculator(objectMapper);
    }

    // --- Container ---

    @Bean
    @ConditionalOnMissingBean
    public Container architectureContainer(
            ObjectMapper objectMapper,
            EntitySerializer entitySerializer,
            ObjectProvider<UnitOfWorkManager> unitOfWorkManager,
            ObjectProvider<ContainerConfigurer> configurers) {
        // The manager depends on the container, so look it up only when a scoped capability is resolved
        ScopeAccessor scopeAccessor = () -> unitOfWorkManager.getObject().currentStore();
        DefaultContainer container = new DefaultContainer(scopeAccessor);
        container.registerInstance(Capability.of(ObjectMapper.class), objectMapper);
        container.registerInstance(Capability.of(EntitySerializer.class), entitySerializer);
        configurers.orderedStream().forEach(configurer -> configurer.configure(container));
        container.start();
        return container;
    }

    // --- Unit of Work ---

    @Bean
    @ConditionalOnMissingBean
    public UnitOfWorkManager unitOfWorkManager(
            Container container,
            ObjectProvider<PlatformTransactionManager> transactionManager,
            ObjectProvider<CommitListener> commitListeners) {
        PlatformTransactionManager txManager = transactionManager.getIfUnique();
        FlushTransaction flushTransaction = txManager != null
            ? new SpringTransactionFlush(txManager)
            : FlushTransaction.NONE;
        UnitOfWorkManager manager = new UnitOfWorkManager(container, flushTransaction);
        commitListeners.orderedStream().forEach(manager::addCommitListener);
        return manager;
    }

    // --- Query Cache ---

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "architecture.cache", name = "enabled", havingValue = "true", matchIfMissing = true)
    public QueryCache queryCache(ArchitectureProperties properties) {
        ArchitectureProperties.CacheProperties cache = properties.getCache();
        return new QueryCache(cache.getMaximumSize(), cache.getExpireAfterWrite());
    }

    // --- Handler Registry ---

    @Bean
    @ConditionalOnMissingBean(HandlerRegistry.class)
    public static DefaultHandlerRegistry handlerRegistry() {
        return new DefaultHandlerRegistry();
    }

    // --- Dispatcher ---

    @Bean
    @ConditionalOnMissingBean
    public UseCaseDispatcher useCaseDispatcher(
            HandlerRegistry handlerRegistry,
            UnitOfWorkManager unitOfWorkManager,
            Container container,
            ArchitectureProperties properties,
            FingerprintCalculator fingerprintCalculator,
            ObjectProvider<QueryCache> queryCache,
            ObjectProvider<RequestValidator<?>> validators,
            ObjectProvider<Middleware> middlewares) {
        DefaultUseCaseDispatcher dispatcher = new DefaultUseCaseDispatcher(handlerRegistry, unitOfWorkManager, container);
        ArchitectureProperties.DispatcherProperties settings = properties.getDispatcher();

        if (settings.isLoggingEnabled()) {
            dispatcher.addMiddleware(new LoggingMiddleware());
        }
        if (settings.isValidationEnabled()) {
            List<RequestValidator<?>> validatorBeans = validators.orderedStream().toList();
            if (!validatorBeans.isEmpty()) {
                dispatcher.addMiddleware(new ValidationMiddleware(validatorBeans));
            }
        }
        middlewares.orderedStream().forEach(dispatcher::addMiddleware);

        QueryCache cache = queryCache.getIfAvailable();
        if (cache != null) {
            dispatcher.addMiddleware(new CachingMiddleware(cache, fingerprintCalculator));
        }
        dispatcher.seal();
        return dispatcher;
    }
}
