package com.ivamare.architecture.dispatch;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Routes requests to their handlers through the middleware chain, each inside its own unit of work.
 */
public interface UseCaseDispatcher {

    /**
     * Dispatch a request on the calling thread.
     *
     * <p>A fresh unit of work is begun (read-only for {@link Query}), the
     * middleware chain and handler run, and the scope is committed if the
     * handler returns normally or rolled back otherwise.
     *
     * @param request The request
     * @param <R> result type
     * @return the handler's result
     * @throws com.ivamare.architecture.exception.HandlerNotFoundException if no handler is registered
     * @throws com.ivamare.architecture.exception.NestedScopeException if called inside another dispatch
     * @throws com.ivamare.architecture.exception.PartialCommitException if the commit fails
     */
    <R> R dispatch(Request<R> request);

    /**
     * Dispatch on an executor. Cancelling the returned future interrupts the
     * dispatch, which rolls its unit of work back.
     *
     * @param request The request
     * @param executor Executor to run on
     * @param <R> result type
     * @return future completed with the result or the failure
     */
    <R> CompletableFuture<R> dispatchAsync(Request<R> request, Executor executor);

    /**
     * Append middleware. Must be called before {@link #seal()}.
     *
     * @param middleware The middleware, wrapping everything registered after it
     */
    void addMiddleware(Middleware middleware);

    /**
     * @return middleware in registration order, outermost first
     */
    List<Middleware> middlewares();

    /**
     * Freeze the middleware chain. Idempotent.
     */
    void seal();
}
