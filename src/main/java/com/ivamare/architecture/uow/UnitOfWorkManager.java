package com.ivamare.architecture.uow;

import com.ivamare.architecture.container.Resolver;
import com.ivamare.architecture.container.ScopeAccessor;
import com.ivamare.architecture.container.ScopedInstanceStore;
import com.ivamare.architecture.exception.NestedScopeException;
import com.ivamare.architecture.exception.ScopeNotActiveException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Binds at most one unit of work to each execution context.
 *
 * <p>Concurrent threads each get their own scope and identity map; nothing
 * tracked in one scope is visible from another.
 */
public class UnitOfWorkManager implements ScopeAccessor {

    private static final Logger log = LoggerFactory.getLogger(UnitOfWorkManager.class);

    private final Resolver resolver;
    private final FlushTransaction flushTransaction;
    private final List<CommitListener> listeners = new CopyOnWriteArrayList<>();
    private final ThreadLocal<UnitOfWork> current = new ThreadLocal<>();
    private final AtomicInteger activeScopes = new AtomicInteger();

    public UnitOfWorkManager(Resolver resolver) {
        this(resolver, FlushTransaction.NONE);
    }

    public UnitOfWorkManager(Resolver resolver, FlushTransaction flushTransaction) {
        this.resolver = resolver;
        this.flushTransaction = flushTransaction == null ? FlushTransaction.NONE : flushTransaction;
    }

    /**
     * Add a listener notified after each successful commit. Applies to scopes begun afterwards.
     *
     * @param listener The listener
     */
    public void addCommitListener(CommitListener listener) {
        listeners.add(listener);
    }

    /**
     * Begin a read-write unit of work on the calling thread.
     *
     * @return the new scope
     * @throws NestedScopeException if a scope is already active on this thread
     */
    public UnitOfWork begin() {
        return begin(ScopeMode.READ_WRITE);
    }

    /**
     * Begin a read-only unit of work on the calling thread.
     *
     * @return the new scope
     * @throws NestedScopeException if a scope is already active on this thread
     */
    public UnitOfWork beginReadOnly() {
        return begin(ScopeMode.READ_ONLY);
    }

    private UnitOfWork begin(ScopeMode mode) {
        UnitOfWork existing = current.get();
        if (existing != null && existing.isActive()) {
            throw new NestedScopeException(existing.getId());
        }

        UnitOfWork[] holder = new UnitOfWork[1];
        UnitOfWork unitOfWork = new UnitOfWork(mode, resolver, listeners, flushTransaction,
            () -> release(holder[0]));
        holder[0] = unitOfWork;

        current.set(unitOfWork);
        activeScopes.incrementAndGet();
        log.debug("Began {} unit of work {}", mode, unitOfWork.getId());
        return unitOfWork;
    }

    private void release(UnitOfWork unitOfWork) {
        activeScopes.decrementAndGet();
        // Only the owning thread can clear its binding; stale ended scopes are ignored by begin()
        if (current.get() == unitOfWork) {
            current.remove();
        }
    }

    /**
     * @return the active scope on this thread, if any
     */
    public Optional<UnitOfWork> current() {
        UnitOfWork unitOfWork = current.get();
        return unitOfWork != null && unitOfWork.isActive() ? Optional.of(unitOfWork) : Optional.empty();
    }

    /**
     * @return the active scope on this thread
     * @throws ScopeNotActiveException if none is active
     */
    public UnitOfWork require() {
        return current().orElseThrow(() -> new ScopeNotActiveException("No active unit of work on this thread"));
    }

    /**
     * @return number of scopes currently open across all threads
     */
    public int activeScopes() {
        return activeScopes.get();
    }

    @Override
    public Optional<ScopedInstanceStore> currentStore() {
        return current().map(ScopedInstanceStore.class::cast);
    }
}
