package com.ivamare.architecture.dispatch;

/**
 * A request that may mutate domain state. Dispatched inside a read-write unit of work.
 *
 * @param <R> Result type
 */
public interface Command<R> extends Request<R> {
}
