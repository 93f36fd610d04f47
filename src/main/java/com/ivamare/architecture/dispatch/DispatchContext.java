package com.ivamare.architecture.dispatch;

import com.ivamare.architecture.container.Capability;
import com.ivamare.architecture.container.Resolver;
import com.ivamare.architecture.entity.Entity;
import com.ivamare.architecture.uow.UnitOfWork;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Context provided to middleware and handlers during one dispatch.
 *
 * @param request The request being dispatched
 * @param unitOfWork Scope of this dispatch (read-only for queries)
 * @param resolver Container view for resolving collaborators
 * @param startedAt When dispatch began
 */
public record DispatchContext(
    Request<?> request,
    UnitOfWork unitOfWork,
    Resolver resolver,
    Instant startedAt
) {
    public DispatchContext {
        if (request == null) {
            throw new IllegalArgumentException("request is required");
        }
        if (unitOfWork == null) {
            throw new IllegalArgumentException("unitOfWork is required");
        }
        if (resolver == null) {
            throw new IllegalArgumentException("resolver is required");
        }
        if (startedAt == null) {
            startedAt = Instant.now();
        }
    }

    public <T> T resolve(Capability<T> capability) {
        return resolver.resolve(capability);
    }

    public <T> T resolve(Class<T> type) {
        return resolver.resolve(type);
    }

    public <E extends Entity<K>, K> Optional<E> load(Class<E> type, K id) {
        return unitOfWork.load(type, id);
    }

    public void registerNew(Entity<?> entity) {
        unitOfWork.registerNew(entity);
    }

    public void registerDirty(Entity<?> entity) {
        unitOfWork.registerDirty(entity);
    }

    public void registerDeleted(Entity<?> entity) {
        unitOfWork.registerDeleted(entity);
    }

    /**
     * @return entity types read so far in this dispatch
     */
    public Set<Class<?>> typesRead() {
        return unitOfWork.typesRead();
    }

    public boolean isReadOnly() {
        return unitOfWork.isReadOnly();
    }
}
