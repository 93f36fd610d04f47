package com.ivamare.architecture.uow;

import com.ivamare.architecture.container.Capability;
import com.ivamare.architecture.container.Resolver;
import com.ivamare.architecture.container.ScopedInstanceStore;
import com.ivamare.architecture.entity.Entity;
import com.ivamare.architecture.entity.EntityKey;
import com.ivamare.architecture.exception.PartialCommitException;
import com.ivamare.architecture.exception.PartialCommitException.Stage;
import com.ivamare.architecture.exception.ReadOnlyScopeException;
import com.ivamare.architecture.exception.ScopeClosedException;
import com.ivamare.architecture.repository.CompensatingRepository;
import com.ivamare.architecture.repository.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Transactional scope that batches domain mutations.
 *
 * <p>Changes are logged by {@link #registerNew}, {@link #registerDirty} and
 * {@link #registerDeleted}, then flushed by {@link #commit()} in the order
 * deletes, updates, inserts. Within a stage, registration order is kept.
 *
 * <p>A unit of work is confined to the execution context that began it and is
 * not thread-safe. Obtain one from {@link UnitOfWorkManager}.
 */
public class UnitOfWork implements ScopedInstanceStore {

    private static final Logger log = LoggerFactory.getLogger(UnitOfWork.class);

    private final UUID id = UUID.randomUUID();
    private final ScopeMode mode;
    private final Resolver resolver;
    private final List<CommitListener> listeners;
    private final FlushTransaction flushTransaction;
    private final Runnable onEnd;

    private final IdentityMap identityMap = new IdentityMap();
    private final Map<EntityKey, Entity<?>> newEntities = new LinkedHashMap<>();
    private final Map<EntityKey, Entity<?>> dirtyEntities = new LinkedHashMap<>();
    private final Map<EntityKey, Entity<?>> deletedEntities = new LinkedHashMap<>();
    private final Set<Class<?>> typesRead = new LinkedHashSet<>();
    private final Map<Capability<?>, Object> scopedInstances = new HashMap<>();
    private final List<Runnable> afterCommit = new ArrayList<>();

    private ScopeStatus status = ScopeStatus.ACTIVE;

    UnitOfWork(ScopeMode mode, Resolver resolver, List<CommitListener> listeners,
               FlushTransaction flushTransaction, Runnable onEnd) {
        this.mode = mode;
        this.resolver = resolver;
        this.listeners = List.copyOf(listeners);
        this.flushTransaction = flushTransaction;
        this.onEnd = onEnd;
    }

    public UUID getId() {
        return id;
    }

    public ScopeMode getMode() {
        return mode;
    }

    public ScopeStatus getStatus() {
        return status;
    }

    public boolean isActive() {
        return status == ScopeStatus.ACTIVE;
    }

    public boolean isReadOnly() {
        return mode == ScopeMode.READ_ONLY;
    }

    public IdentityMap identityMap() {
        return identityMap;
    }

    /**
     * @return entity types loaded through this scope, in first-read order
     */
    public Set<Class<?>> typesRead() {
        return Set.copyOf(typesRead);
    }

    /**
     * @return true if any change is waiting to be flushed
     */
    public boolean hasPendingChanges() {
        return !newEntities.isEmpty() || !dirtyEntities.isEmpty() || !deletedEntities.isEmpty();
    }

    // --- Loading ---

    /**
     * Load an entity through the identity map, using the repository bound for its type.
     *
     * @param type Entity class
     * @param id Identity
     * @param <E> entity type
     * @param <K> identity type
     * @return the tracked instance, or empty if it does not exist or is registered for deletion
     * @throws IllegalStateException if the repository returns an instance of a different class than {@code type}
     */
    public <E extends Entity<K>, K> Optional<E> load(Class<E> type, K id) {
        requireActive();
        EntityKey key = new EntityKey(type, id);
        typesRead.add(type);
        if (deletedEntities.containsKey(key)) {
            return Optional.empty();
        }
        Repository<E, K> repository = resolver.resolve(Capability.repository(type));
        return identityMap.getOrTrack(key, () -> repository.getById(id).map(loaded -> {
            // Entities are keyed by runtime class everywhere else
            if (loaded.getClass() != type) {
                throw new IllegalStateException("Repository for " + type.getName() + " returned "
                    + loaded.getClass().getName() + " for " + key);
            }
            return loaded;
        }).orElse(null));
    }

    // --- Change registration ---

    /**
     * Log an insert and start tracking the entity.
     *
     * @param entity The new entity
     */
    public void registerNew(Entity<?> entity) {
        requireWritable("register new entity");
        EntityKey key = EntityKey.of(entity);
        if (deletedEntities.containsKey(key) || dirtyEntities.containsKey(key)) {
            throw new IllegalStateException(key + " is already persisted in this unit of work");
        }
        identityMap.track(entity);
        newEntities.putIfAbsent(key, entity);
        log.debug("Registered new {} in {}", key, id);
    }

    /**
     * Log an update. Has no effect for entities registered as new in this scope.
     *
     * @param entity The modified entity
     */
    public void registerDirty(Entity<?> entity) {
        requireWritable("register dirty entity");
        EntityKey key = EntityKey.of(entity);
        if (deletedEntities.containsKey(key)) {
            throw new IllegalStateException(key + " is registered for deletion");
        }
        identityMap.track(entity);
        if (newEntities.containsKey(key)) {
            return;
        }
        dirtyEntities.putIfAbsent(key, entity);
        log.debug("Registered dirty {} in {}", key, id);
    }

    /**
     * Log a delete. Deleting an entity registered as new in this scope cancels the insert.
     *
     * @param entity The entity to remove
     */
    public void registerDeleted(Entity<?> entity) {
        requireWritable("register deleted entity");
        EntityKey key = EntityKey.of(entity);
        identityMap.track(entity);
        identityMap.remove(key);
        if (newEntities.remove(key) != null) {
            log.debug("Cancelled insert of {} in {}", key, id);
            return;
        }
        dirtyEntities.remove(key);
        deletedEntities.putIfAbsent(key, entity);
        log.debug("Registered deleted {} in {}", key, id);
    }

    // --- Completion ---

    /**
     * Flush pending changes and end the scope.
     *
     * @throws PartialCommitException if a repository fails during flush
     * @throws ScopeClosedException if the scope has already ended
     */
    public void commit() {
        requireActive();
        if (mode == ScopeMode.READ_ONLY || !hasPendingChanges()) {
            List<Runnable> actions = List.copyOf(afterCommit);
            end(ScopeStatus.COMMITTED);
            log.debug("Committed {} with no changes", id);
            rethrow(runAfterCommit(actions, null));
            return;
        }

        Set<Class<?>> mutatedTypes = mutatedTypes();
        int changes;
        try {
            List<FlushStep> steps = planFlush();
            changes = steps.size();
            flushTransaction.execute(() -> flush(steps));
        } catch (RuntimeException e) {
            if (isActive()) {
                end(ScopeStatus.ROLLED_BACK);
            }
            throw e;
        }

        List<Runnable> actions = List.copyOf(afterCommit);
        end(ScopeStatus.COMMITTED);
        log.debug("Committed {} with {} changes", id, changes);
        RuntimeException failure = publish(new InvalidationEvent(id, mutatedTypes));
        rethrow(runAfterCommit(actions, failure));
    }

    /**
     * Discard pending changes and end the scope without repository side effects.
     * Does nothing if the scope has already ended.
     */
    public void rollback() {
        if (status.isEnded()) {
            return;
        }
        end(ScopeStatus.ROLLED_BACK);
        log.debug("Rolled back {}", id);
    }

    /**
     * Run an action once this scope has committed successfully. Dropped on rollback.
     *
     * @param action The action
     */
    public void afterCommit(Runnable action) {
        requireActive();
        afterCommit.add(action);
    }

    // --- Scoped instances ---

    @Override
    @SuppressWarnings("unchecked")
    public <T> T scopedInstance(Capability<T> capability, Supplier<T> factory) {
        requireActive();
        Object existing = scopedInstances.get(capability);
        if (existing == null) {
            existing = factory.get();
            scopedInstances.put(capability, existing);
        }
        return (T) existing;
    }

    // --- Internals ---

    private List<FlushStep> planFlush() {
        // Resolve every repository up front so binding errors surface before any write
        List<FlushStep> steps = new ArrayList<>();
        deletedEntities.forEach((key, entity) -> steps.add(new FlushStep(Stage.DELETE, key, entity, repositoryOf(key))));
        dirtyEntities.forEach((key, entity) -> steps.add(new FlushStep(Stage.UPDATE, key, entity, repositoryOf(key))));
        newEntities.forEach((key, entity) -> steps.add(new FlushStep(Stage.INSERT, key, entity, repositoryOf(key))));
        return steps;
    }

    private void flush(List<FlushStep> steps) {
        List<AppliedStep> applied = new ArrayList<>();
        for (FlushStep step : steps) {
            try {
                applied.add(apply(step));
            } catch (RuntimeException e) {
                log.warn("Flush of {} failed at {} stage for {}: {}", id, step.stage(), step.key(), e.getMessage());
                List<RuntimeException> undoFailures = new ArrayList<>();
                boolean compensated = compensate(applied, undoFailures);
                end(ScopeStatus.ROLLED_BACK);
                PartialCommitException failure = new PartialCommitException(step.stage(), step.key(), compensated, e);
                undoFailures.forEach(failure::addSuppressed);
                throw failure;
            }
        }
    }

    private AppliedStep apply(FlushStep step) {
        Entity<Object> entity = step.entity();
        Repository<Entity<Object>, Object> repository = step.repository();
        Entity<Object> previous = null;
        switch (step.stage()) {
            case DELETE -> repository.delete(entity);
            case UPDATE -> {
                if (repository instanceof CompensatingRepository) {
                    previous = repository.getById(entity.getId()).orElse(null);
                }
                repository.update(entity);
            }
            case INSERT -> repository.add(entity);
        }
        return new AppliedStep(step, previous);
    }

    private boolean compensate(List<AppliedStep> applied, List<RuntimeException> undoFailures) {
        boolean complete = true;
        for (int i = applied.size() - 1; i >= 0; i--) {
            AppliedStep done = applied.get(i);
            FlushStep step = done.step();
            if (!(step.repository() instanceof CompensatingRepository<Entity<Object>, Object> repository)) {
                complete = false;
                continue;
            }
            try {
                switch (step.stage()) {
                    case DELETE -> repository.undoDelete(step.entity());
                    case UPDATE -> {
                        if (done.previous() == null) {
                            complete = false;
                        } else {
                            repository.undoUpdate(done.previous());
                        }
                    }
                    case INSERT -> repository.undoAdd(step.entity());
                }
            } catch (RuntimeException e) {
                complete = false;
                undoFailures.add(e);
            }
        }
        return complete;
    }

    private Set<Class<?>> mutatedTypes() {
        Set<Class<?>> types = new LinkedHashSet<>();
        deletedEntities.keySet().forEach(key -> types.add(key.type()));
        dirtyEntities.keySet().forEach(key -> types.add(key.type()));
        newEntities.keySet().forEach(key -> types.add(key.type()));
        return types;
    }

    // Listeners and after-commit actions all run once the flush has succeeded.
    // The first failure is reported, later ones are suppressed into it.

    private RuntimeException publish(InvalidationEvent event) {
        RuntimeException failure = null;
        for (CommitListener listener : listeners) {
            try {
                listener.onCommit(event);
            } catch (RuntimeException e) {
                log.warn("Commit listener failed for {}: {}", id, e.getMessage());
                failure = collect(failure, e);
            }
        }
        return failure;
    }

    private RuntimeException runAfterCommit(List<Runnable> actions, RuntimeException failure) {
        for (Runnable action : actions) {
            try {
                action.run();
            } catch (RuntimeException e) {
                log.warn("After-commit action failed for {}: {}", id, e.getMessage());
                failure = collect(failure, e);
            }
        }
        return failure;
    }

    private static RuntimeException collect(RuntimeException first, RuntimeException next) {
        if (first == null) {
            return next;
        }
        first.addSuppressed(next);
        return first;
    }

    private static void rethrow(RuntimeException failure) {
        if (failure != null) {
            throw failure;
        }
    }

    private Repository<Entity<Object>, Object> repositoryOf(EntityKey key) {
        return resolver.resolve(Capability.repositoryFor(key.type()));
    }

    private void end(ScopeStatus finalStatus) {
        status = finalStatus;
        newEntities.clear();
        dirtyEntities.clear();
        deletedEntities.clear();
        identityMap.clear();
        scopedInstances.clear();
        afterCommit.clear();
        onEnd.run();
    }

    private void requireActive() {
        if (status.isEnded()) {
            throw new ScopeClosedException(id, status.name());
        }
    }

    private void requireWritable(String operation) {
        requireActive();
        if (mode == ScopeMode.READ_ONLY) {
            throw new ReadOnlyScopeException(operation);
        }
    }

    private record FlushStep(Stage stage, EntityKey key, Entity<?> rawEntity, Repository<Entity<Object>, Object> repository) {

        @SuppressWarnings("unchecked")
        Entity<Object> entity() {
            return (Entity<Object>) rawEntity;
        }
    }

    private record AppliedStep(FlushStep step, Entity<Object> previous) {
    }
}
