package com.ivamare.architecture.container;

/**
 * How long a resolved instance is reused.
 */
public enum Lifetime {
    /** A new instance on every resolution. */
    TRANSIENT,
    /** One instance per container, created on first resolution. */
    SINGLETON,
    /** One instance per unit of work, dropped when the unit of work ends. */
    SCOPED
}
