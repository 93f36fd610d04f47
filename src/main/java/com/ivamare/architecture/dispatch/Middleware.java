package com.ivamare.architecture.dispatch;

/**
 * Cross-cutting wrapper around request handling.
 *
 * <p>Middleware is folded around the handler in registration order, the first
 * registered being outermost. Each one decides whether to call
 * {@link Next#proceed()}; it may translate errors but must not discard them.
 */
@FunctionalInterface
public interface Middleware {

    /**
     * @param request The request being dispatched
     * @param context Dispatch context
     * @param next Continuation into the next middleware or the handler
     * @return the result to hand back outwards
     * @throws Exception from this middleware or anything inside it
     */
    Object invoke(Request<?> request, DispatchContext context, Next next) throws Exception;

    /**
     * Explicit continuation into the rest of the chain.
     */
    @FunctionalInterface
    interface Next {
        Object proceed() throws Exception;
    }
}
