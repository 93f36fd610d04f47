package com.ivamare.architecture.dispatch;

/**
 * A read-only request. Dispatched inside a read-only unit of work, so it can
 * load entities but never register changes.
 *
 * @param <R> Result type
 */
public interface Query<R> extends Request<R> {
}
