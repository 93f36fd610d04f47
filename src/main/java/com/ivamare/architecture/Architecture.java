package com.ivamare.architecture;

import com.ivamare.architecture.cache.QueryCache;
import com.ivamare.architecture.container.Container;
import com.ivamare.architecture.dispatch.HandlerRegistry;
import com.ivamare.architecture.dispatch.UseCaseDispatcher;
import com.ivamare.architecture.uow.UnitOfWorkManager;

/**
 * The assembled components, as produced by {@link ArchitectureBuilder}.
 *
 * @param container Started dependency container
 * @param unitOfWorkManager Scope manager
 * @param handlerRegistry Handler registry
 * @param dispatcher Sealed dispatcher
 * @param queryCache Query cache, or null when caching is disabled
 */
public record Architecture(
    Container container,
    UnitOfWorkManager unitOfWorkManager,
    HandlerRegistry handlerRegistry,
    UseCaseDispatcher dispatcher,
    QueryCache queryCache
) {
}
