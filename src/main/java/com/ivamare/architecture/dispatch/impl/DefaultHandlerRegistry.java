package com.ivamare.architecture.dispatch.impl;

import com.ivamare.architecture.dispatch.HandlerRegistry;
import com.ivamare.architecture.dispatch.RequestHandler;
import com.ivamare.architecture.exception.DuplicateHandlerException;
import com.ivamare.architecture.exception.HandlerNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.BeanPostProcessor;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default implementation of HandlerRegistry.
 *
 * <p>Implements BeanPostProcessor so that {@link RequestHandler} beans are
 * registered as the application context creates them.
 */
public class DefaultHandlerRegistry implements HandlerRegistry, BeanPostProcessor {

    private static final Logger log = LoggerFactory.getLogger(DefaultHandlerRegistry.class);

    private final Map<Class<?>, RequestHandler<?, ?>> handlers = new ConcurrentHashMap<>();

    @Override
    public void register(RequestHandler<?, ?> handler) {
        Class<?> requestType = handler.requestType();
        if (requestType == null) {
            throw new IllegalArgumentException("Handler " + handler.getClass().getName() + " declares no request type");
        }
        if (handlers.putIfAbsent(requestType, handler) != null) {
            throw new DuplicateHandlerException(requestType);
        }
        log.debug("Registered handler for {}", requestType.getName());
    }

    @Override
    public Optional<RequestHandler<?, ?>> get(Class<?> requestType) {
        return Optional.ofNullable(handlers.get(requestType));
    }

    @Override
    public RequestHandler<?, ?> getOrThrow(Class<?> requestType) {
        return get(requestType)
            .orElseThrow(() -> new HandlerNotFoundException(requestType));
    }

    @Override
    public boolean hasHandler(Class<?> requestType) {
        return handlers.containsKey(requestType);
    }

    @Override
    public List<Class<?>> registeredHandlers() {
        return List.copyOf(handlers.keySet());
    }

    @Override
    public void clear() {
        handlers.clear();
    }

    /**
     * BeanPostProcessor callback - registers RequestHandler beans.
     */
    @Override
    public Object postProcessAfterInitialization(Object bean, String beanName) {
        if (bean instanceof RequestHandler<?, ?> handler) {
            register(handler);
            log.info("Discovered handler bean {} for {}", beanName, handler.requestType().getSimpleName());
        }
        return bean;
    }
}
