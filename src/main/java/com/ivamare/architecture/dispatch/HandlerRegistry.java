package com.ivamare.architecture.dispatch;

import java.util.List;
import java.util.Optional;

/**
 * Registry of request handlers, one per request type.
 */
public interface HandlerRegistry {

    /**
     * Register a handler under its request type.
     *
     * @param handler The handler
     * @throws com.ivamare.architecture.exception.DuplicateHandlerException if the type already has one
     */
    void register(RequestHandler<?, ?> handler);

    /**
     * Get the handler for a request type.
     *
     * @param requestType The request class
     * @return Optional containing the handler if found
     */
    Optional<RequestHandler<?, ?>> get(Class<?> requestType);

    /**
     * Get the handler for a request type, throwing if not found.
     *
     * @param requestType The request class
     * @return The handler
     * @throws com.ivamare.architecture.exception.HandlerNotFoundException if not found
     */
    RequestHandler<?, ?> getOrThrow(Class<?> requestType);

    /**
     * Check if a handler is registered.
     *
     * @param requestType The request class
     * @return true if handler is registered
     */
    boolean hasHandler(Class<?> requestType);

    /**
     * @return all request types with a handler
     */
    List<Class<?>> registeredHandlers();

    /**
     * Remove all handlers. Useful for testing.
     */
    void clear();
}
