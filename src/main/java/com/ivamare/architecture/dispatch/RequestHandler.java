package com.ivamare.architecture.dispatch;

/**
 * Handles one request type.
 *
 * <p>Handlers can throw any exception. Runtime exceptions reach the caller
 * unchanged, checked ones are wrapped in
 * {@link com.ivamare.architecture.exception.DispatchException}. Either way
 * the unit of work is rolled back.
 *
 * @param <Q> Request type
 * @param <R> Result type
 */
public interface RequestHandler<Q extends Request<R>, R> {

    /**
     * @return the request class this handler is registered for
     */
    Class<Q> requestType();

    /**
     * Execute the use case.
     *
     * @param request The request
     * @param context Dispatch context with the unit of work and resolver
     * @return the result (may be null)
     * @throws Exception on failure
     */
    R handle(Q request, DispatchContext context) throws Exception;

    /**
     * Build a handler from a lambda.
     *
     * @param requestType request class
     * @param body handler body
     * @param <Q> request type
     * @param <R> result type
     * @return handler
     */
    static <Q extends Request<R>, R> RequestHandler<Q, R> of(Class<Q> requestType, Body<Q, R> body) {
        return new RequestHandler<>() {
            @Override
            public Class<Q> requestType() {
                return requestType;
            }

            @Override
            public R handle(Q request, DispatchContext context) throws Exception {
                return body.handle(request, context);
            }
        };
    }

    /**
     * Lambda shape for {@link #of}.
     */
    @FunctionalInterface
    interface Body<Q, R> {
        R handle(Q request, DispatchContext context) throws Exception;
    }
}
