package com.ivamare.architecture;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import com.ivamare.architecture.cache.CachingMiddleware;
import com.ivamare.architecture.cache.FingerprintCalculator;
import com.ivamare.architecture.cache.QueryCache;
import com.ivamare.architecture.container.Capability;
import com.ivamare.architecture.container.ContainerConfigurer;
import com.ivamare.architecture.container.impl.DefaultContainer;
import com.ivamare.architecture.dispatch.Middleware;
import com.ivamare.architecture.dispatch.RequestHandler;
import com.ivamare.architecture.dispatch.impl.DefaultHandlerRegistry;
import com.ivamare.architecture.dispatch.impl.DefaultUseCaseDispatcher;
import com.ivamare.architecture.dispatch.middleware.LoggingMiddleware;
import com.ivamare.architecture.dispatch.middleware.RequestValidator;
import com.ivamare.architecture.dispatch.middleware.ValidationMiddleware;
import com.ivamare.architecture.repository.EntitySerializer;
import com.ivamare.architecture.uow.FlushTransaction;
import com.ivamare.architecture.uow.UnitOfWorkManager;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Builder for assembling the architecture core without Spring.
 *
 * <p>Middleware is stacked as logging, validation, custom middleware in the
 * order added, then caching innermost.
 */
public class ArchitectureBuilder {

    private ObjectMapper objectMapper;
    private FlushTransaction flushTransaction = FlushTransaction.NONE;
    private final List<ContainerConfigurer> configurers = new ArrayList<>();
    private final List<RequestHandler<?, ?>> handlers = new ArrayList<>();
    private final List<RequestValidator<?>> validators = new ArrayList<>();
    private final List<Middleware> middlewares = new ArrayList<>();
    private boolean loggingEnabled = true;
    private boolean cacheEnabled = true;
    private long cacheMaximumSize = 10_000;
    private Duration cacheExpireAfterWrite = Duration.ofMinutes(10);
    private Ticker cacheTicker = Ticker.systemTicker();

    /**
     * Set the ObjectMapper used for fingerprints and entity snapshots.
     *
     * @param objectMapper The object mapper
     * @return this builder
     */
    public ArchitectureBuilder objectMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        return this;
    }

    /**
     * Add container registrations, applied in order before the container starts.
     *
     * @param configurer The configurer
     * @return this builder
     */
    public ArchitectureBuilder configure(ContainerConfigurer configurer) {
        this.configurers.add(configurer);
        return this;
    }

    /**
     * Register a request handler.
     *
     * @param handler The handler
     * @return this builder
     */
    public ArchitectureBuilder handler(RequestHandler<?, ?> handler) {
        this.handlers.add(handler);
        return this;
    }

    /**
     * Add a request validator.
     *
     * @param validator The validator
     * @return this builder
     */
    public ArchitectureBuilder validator(RequestValidator<?> validator) {
        this.validators.add(validator);
        return this;
    }

    /**
     * Add custom middleware between validation and caching.
     *
     * @param middleware The middleware
     * @return this builder
     */
    public ArchitectureBuilder middleware(Middleware middleware) {
        this.middlewares.add(middleware);
        return this;
    }

    /**
     * Enable/disable dispatch logging (default: enabled).
     *
     * @param enabled Whether to log dispatches
     * @return this builder
     */
    public ArchitectureBuilder logging(boolean enabled) {
        this.loggingEnabled = enabled;
        return this;
    }

    /**
     * Configure the query cache (default: 10000 entries, 10 minutes).
     *
     * @param maximumSize Maximum entries
     * @param expireAfterWrite Validity window
     * @return this builder
     */
    public ArchitectureBuilder cache(long maximumSize, Duration expireAfterWrite) {
        this.cacheEnabled = true;
        this.cacheMaximumSize = maximumSize;
        this.cacheExpireAfterWrite = expireAfterWrite;
        return this;
    }

    /**
     * Set the time source for cache expiry.
     *
     * @param ticker The ticker
     * @return this builder
     */
    public ArchitectureBuilder cacheTicker(Ticker ticker) {
        this.cacheTicker = ticker;
        return this;
    }

    /**
     * Disable the query cache.
     *
     * @return this builder
     */
    public ArchitectureBuilder withoutCache() {
        this.cacheEnabled = false;
        return this;
    }

    /**
     * Run flushes inside an outer transaction.
     *
     * @param flushTransaction The transaction wrapper
     * @return this builder
     */
    public ArchitectureBuilder flushTransaction(FlushTransaction flushTransaction) {
        this.flushTransaction = flushTransaction;
        return this;
    }

    /**
     * Build and start all components.
     *
     * @return the assembled architecture
     */
    public Architecture build() {
        ObjectMapper mapper = objectMapper;
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.findAndRegisterModules();
        }

        DefaultContainer container = new DefaultContainer();
        UnitOfWorkManager unitOfWorkManager = new UnitOfWorkManager(container, flushTransaction);
        container.useScopeAccessor(unitOfWorkManager);
        container.registerInstance(Capability.of(ObjectMapper.class), mapper);
        container.registerInstance(Capability.of(EntitySerializer.class), new EntitySerializer(mapper));
        configurers.forEach(configurer -> configurer.configure(container));
        container.start();

        DefaultHandlerRegistry handlerRegistry = new DefaultHandlerRegistry();
        handlers.forEach(handlerRegistry::register);

        DefaultUseCaseDispatcher dispatcher = new DefaultUseCaseDispatcher(handlerRegistry, unitOfWorkManager, container);
        if (loggingEnabled) {
            dispatcher.addMiddleware(new LoggingMiddleware());
        }
        if (!validators.isEmpty()) {
            dispatcher.addMiddleware(new ValidationMiddleware(validators));
        }
        middlewares.forEach(dispatcher::addMiddleware);

        QueryCache queryCache = null;
        if (cacheEnabled) {
            queryCache = new QueryCache(cacheMaximumSize, cacheExpireAfterWrite, cacheTicker);
            unitOfWorkManager.addCommitListener(queryCache);
            dispatcher.addMiddleware(new CachingMiddleware(queryCache, new FingerprintCalculator(mapper)));
        }
        dispatcher.seal();

        return new Architecture(container, unitOfWorkManager, handlerRegistry, dispatcher, queryCache);
    }
}
