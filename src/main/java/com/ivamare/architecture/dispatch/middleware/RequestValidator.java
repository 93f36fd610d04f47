package com.ivamare.architecture.dispatch.middleware;

import java.util.List;
import java.util.function.Function;

/**
 * Checks a request before its handler runs.
 *
 * @param <Q> Request type this validator applies to (subtypes included)
 */
public interface RequestValidator<Q> {

    Class<Q> requestType();

    /**
     * @param request The request
     * @return violation messages, empty when valid
     */
    List<String> validate(Q request);

    static <Q> RequestValidator<Q> of(Class<Q> requestType, Function<Q, List<String>> rule) {
        return new RequestValidator<>() {
            @Override
            public Class<Q> requestType() {
                return requestType;
            }

            @Override
            public List<String> validate(Q request) {
                return rule.apply(request);
            }
        };
    }
}
