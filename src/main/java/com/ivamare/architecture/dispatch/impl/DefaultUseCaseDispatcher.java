package com.ivamare.architecture.dispatch.impl;

import com.ivamare.architecture.container.Resolver;
import com.ivamare.architecture.dispatch.DispatchContext;
import com.ivamare.architecture.dispatch.HandlerRegistry;
import com.ivamare.architecture.dispatch.Middleware;
import com.ivamare.architecture.dispatch.Query;
import com.ivamare.architecture.dispatch.Request;
import com.ivamare.architecture.dispatch.RequestHandler;
import com.ivamare.architecture.dispatch.UseCaseDispatcher;
import com.ivamare.architecture.exception.DispatchCancelledException;
import com.ivamare.architecture.exception.DispatchException;
import com.ivamare.architecture.uow.UnitOfWork;
import com.ivamare.architecture.uow.UnitOfWorkManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;

/**
 * Default implementation of UseCaseDispatcher.
 */
public class DefaultUseCaseDispatcher implements UseCaseDispatcher {

    private static final Logger log = LoggerFactory.getLogger(DefaultUseCaseDispatcher.class);

    private final HandlerRegistry handlerRegistry;
    private final UnitOfWorkManager unitOfWorkManager;
    private final Resolver resolver;
    private final List<Middleware> middlewares = new CopyOnWriteArrayList<>();

    private volatile boolean sealed;

    /**
     * Creates a new DefaultUseCaseDispatcher.
     *
     * @param handlerRegistry The handler registry
     * @param unitOfWorkManager Source of per-dispatch scopes
     * @param resolver Container passed to handlers through the context
     */
    public DefaultUseCaseDispatcher(
            HandlerRegistry handlerRegistry,
            UnitOfWorkManager unitOfWorkManager,
            Resolver resolver) {
        this.handlerRegistry = handlerRegistry;
        this.unitOfWorkManager = unitOfWorkManager;
        this.resolver = resolver;
    }

    @Override
    public void addMiddleware(Middleware middleware) {
        if (sealed) {
            throw new IllegalStateException("Dispatcher is sealed, cannot add middleware");
        }
        middlewares.add(middleware);
        log.debug("Added middleware {} at position {}", middleware.getClass().getSimpleName(), middlewares.size());
    }

    @Override
    public List<Middleware> middlewares() {
        return List.copyOf(middlewares);
    }

    @Override
    public void seal() {
        if (!sealed) {
            sealed = true;
            log.info("Dispatcher sealed with {} middleware and {} handlers",
                middlewares.size(), handlerRegistry.registeredHandlers().size());
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public <R> R dispatch(Request<R> request) {
        if (request == null) {
            throw new IllegalArgumentException("request is required");
        }
        Class<?> requestType = request.getClass();
        RequestHandler<Request<R>, R> handler = (RequestHandler<Request<R>, R>) handlerRegistry.getOrThrow(requestType);

        UnitOfWork unitOfWork = request instanceof Query<?>
            ? unitOfWorkManager.beginReadOnly()
            : unitOfWorkManager.begin();
        DispatchContext context = new DispatchContext(request, unitOfWork, resolver, Instant.now());

        try {
            Object result = chain(request, context, handler).proceed();
            if (Thread.currentThread().isInterrupted()) {
                throw new DispatchCancelledException(requestType, null);
            }
            unitOfWork.commit();
            return (R) result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchCancelledException(requestType, e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new DispatchException(requestType, e);
        } finally {
            if (unitOfWork.isActive()) {
                unitOfWork.rollback();
                log.debug("Rolled back {} for {}", unitOfWork.getId(), requestType.getSimpleName());
            }
        }
    }

    @Override
    public <R> CompletableFuture<R> dispatchAsync(Request<R> request, Executor executor) {
        CompletableFuture<R> future = new CompletableFuture<>();
        FutureTask<R> task = new FutureTask<>(() -> dispatch(request)) {
            @Override
            protected void done() {
                if (isCancelled()) {
                    future.cancel(false);
                    return;
                }
                try {
                    future.complete(get());
                } catch (ExecutionException e) {
                    future.completeExceptionally(e.getCause());
                } catch (CancellationException e) {
                    future.cancel(false);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    future.completeExceptionally(e);
                }
            }
        };
        future.whenComplete((result, error) -> {
            if (future.isCancelled()) {
                task.cancel(true);
            }
        });
        executor.execute(task);
        return future;
    }

    private <R> Middleware.Next chain(Request<R> request, DispatchContext context, RequestHandler<Request<R>, R> handler) {
        Middleware.Next next = () -> handler.handle(request, context);
        for (int i = middlewares.size() - 1; i >= 0; i--) {
            Middleware middleware = middlewares.get(i);
            Middleware.Next inner = next;
            next = () -> middleware.invoke(request, context, inner);
        }
        return next;
    }
}
