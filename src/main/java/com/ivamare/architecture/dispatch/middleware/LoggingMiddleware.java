package com.ivamare.architecture.dispatch.middleware;

import com.ivamare.architecture.dispatch.DispatchContext;
import com.ivamare.architecture.dispatch.Middleware;
import com.ivamare.architecture.dispatch.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Logs each dispatch with its elapsed time. Failures are logged and rethrown.
 */
public class LoggingMiddleware implements Middleware {

    private static final Logger log = LoggerFactory.getLogger(LoggingMiddleware.class);

    @Override
    public Object invoke(Request<?> request, DispatchContext context, Next next) throws Exception {
        String name = request.getClass().getSimpleName();
        log.debug("Dispatching {} (scope={})", name, context.unitOfWork().getId());
        try {
            Object result = next.proceed();
            log.debug("Handled {} in {}ms", name, elapsedMillis(context));
            return result;
        } catch (Exception e) {
            log.warn("Handling {} failed after {}ms: {}", name, elapsedMillis(context), e.getMessage());
            throw e;
        }
    }

    private static long elapsedMillis(DispatchContext context) {
        return Duration.between(context.startedAt(), Instant.now()).toMillis();
    }
}
