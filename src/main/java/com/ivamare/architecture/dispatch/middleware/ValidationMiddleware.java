package com.ivamare.architecture.dispatch.middleware;

import com.ivamare.architecture.dispatch.DispatchContext;
import com.ivamare.architecture.dispatch.Middleware;
import com.ivamare.architecture.dispatch.Request;
import com.ivamare.architecture.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs every applicable {@link RequestValidator} and short-circuits with
 * {@link ValidationException} before the handler is invoked.
 *
 * <p>Register it outermost so invalid requests never touch the unit of work.
 */
public class ValidationMiddleware implements Middleware {

    private static final Logger log = LoggerFactory.getLogger(ValidationMiddleware.class);

    private final List<RequestValidator<?>> validators = new CopyOnWriteArrayList<>();

    public ValidationMiddleware() {
    }

    public ValidationMiddleware(List<? extends RequestValidator<?>> validators) {
        this.validators.addAll(validators);
    }

    public ValidationMiddleware addValidator(RequestValidator<?> validator) {
        validators.add(validator);
        return this;
    }

    @Override
    public Object invoke(Request<?> request, DispatchContext context, Next next) throws Exception {
        List<String> violations = new ArrayList<>();
        for (RequestValidator<?> validator : validators) {
            if (validator.requestType().isInstance(request)) {
                violations.addAll(apply(validator, request));
            }
        }
        if (!violations.isEmpty()) {
            log.debug("Rejected {} with {} violations", request.getClass().getSimpleName(), violations.size());
            throw new ValidationException(request.getClass(), violations);
        }
        return next.proceed();
    }

    private static <Q> List<String> apply(RequestValidator<Q> validator, Object request) {
        List<String> result = validator.validate(validator.requestType().cast(request));
        return result == null ? List.of() : result;
    }
}
