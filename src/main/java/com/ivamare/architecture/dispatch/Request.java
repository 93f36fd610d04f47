package com.ivamare.architecture.dispatch;

/**
 * An immutable description of a use-case invocation.
 *
 * <p>Implementations should be value objects (records work well). A request
 * has no identity beyond the invocation itself.
 *
 * @param <R> Result type produced by the handler
 */
public interface Request<R> {
}
