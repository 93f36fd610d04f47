package com.ivamare.architecture.container.impl;

import com.ivamare.architecture.container.Capability;
import com.ivamare.architecture.container.Container;
import com.ivamare.architecture.container.Lifetime;
import com.ivamare.architecture.container.Provider;
import com.ivamare.architecture.container.Registration;
import com.ivamare.architecture.container.ScopeAccessor;
import com.ivamare.architecture.container.ScopedInstanceStore;
import com.ivamare.architecture.exception.ArchitectureException;
import com.ivamare.architecture.exception.ContainerFrozenException;
import com.ivamare.architecture.exception.CyclicDependencyException;
import com.ivamare.architecture.exception.DuplicateRegistrationException;
import com.ivamare.architecture.exception.ProviderException;
import com.ivamare.architecture.exception.ScopeNotActiveException;
import com.ivamare.architecture.exception.UnregisteredCapabilityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default implementation of Container.
 *
 * <p>Singletons are built once per container. One thread builds a singleton
 * while others wanting it wait, later reads are lock-free. A thread about to
 * wait first checks whether the builder is itself waiting on something this
 * thread is building, and reports that as a cycle instead of blocking. Scoped
 * instances live in the store supplied by the {@link ScopeAccessor}.
 */
public class DefaultContainer implements Container {

    private static final Logger log = LoggerFactory.getLogger(DefaultContainer.class);

    private final Map<Capability<?>, Registration<?>> registrations = new ConcurrentHashMap<>();
    private final Map<Capability<?>, Registration<?>> ordered = new LinkedHashMap<>();
    private final Map<Capability<?>, SingletonSlot> singletons = new ConcurrentHashMap<>();
    private final Object singletonLock = new Object();
    private final Map<Thread, Capability<?>> awaiting = new HashMap<>();
    private final ThreadLocal<Deque<Capability<?>>> resolutionStack = ThreadLocal.withInitial(ArrayDeque::new);

    private volatile ScopeAccessor scopeAccessor = ScopeAccessor.NONE;
    private volatile boolean started;

    public DefaultContainer() {
    }

    public DefaultContainer(ScopeAccessor scopeAccessor) {
        this.scopeAccessor = scopeAccessor;
    }

    /**
     * Set where scoped instances are kept. Only allowed before start.
     *
     * @param scopeAccessor locator for the current scope
     */
    public void useScopeAccessor(ScopeAccessor scopeAccessor) {
        if (started) {
            throw new ContainerFrozenException("scope accessor");
        }
        this.scopeAccessor = scopeAccessor == null ? ScopeAccessor.NONE : scopeAccessor;
    }

    @Override
    public synchronized <T> void register(Capability<T> capability, Provider<T> provider, Lifetime lifetime) {
        if (started) {
            throw new ContainerFrozenException(capability.toString());
        }
        if (registrations.containsKey(capability)) {
            throw new DuplicateRegistrationException(capability.toString());
        }
        Registration<T> registration = new Registration<>(capability, provider, lifetime);
        registrations.put(capability, registration);
        ordered.put(capability, registration);
        if (registration.lifetime() == Lifetime.SINGLETON) {
            singletons.put(capability, new SingletonSlot());
        }
        log.debug("Registered {} ({})", capability, registration.lifetime());
    }

    @Override
    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        log.info("Container started with {} registrations", registrations.size());
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    @Override
    public synchronized List<Registration<?>> registrations() {
        return List.copyOf(ordered.values());
    }

    @Override
    public boolean isRegistered(Capability<?> capability) {
        return registrations.containsKey(capability);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T resolve(Capability<T> capability) {
        Registration<T> registration = (Registration<T>) registrations.get(capability);
        if (registration == null) {
            throw new UnregisteredCapabilityException(capability.toString());
        }

        return switch (registration.lifetime()) {
            case TRANSIENT -> construct(registration);
            case SINGLETON -> resolveSingleton(registration);
            case SCOPED -> resolveScoped(registration);
        };
    }

    private <T> T resolveSingleton(Registration<T> registration) {
        Capability<T> capability = registration.capability();
        SingletonSlot slot = singletons.get(capability);
        Object instance = slot.instance;
        if (instance != null) {
            return cast(instance);
        }

        Thread current = Thread.currentThread();
        synchronized (singletonLock) {
            while (slot.instance == null && slot.builder != null && slot.builder != current) {
                List<String> cycle = crossThreadCycle(capability, current);
                if (cycle != null) {
                    throw new CyclicDependencyException(cycle);
                }
                awaiting.put(current, capability);
                try {
                    singletonLock.wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ProviderException(capability.toString(), e);
                } finally {
                    awaiting.remove(current);
                }
            }
            if (slot.instance != null) {
                return cast(slot.instance);
            }
            if (slot.builder == current) {
                throw new CyclicDependencyException(cyclePath(resolutionStack.get(), capability));
            }
            slot.builder = current;
        }

        try {
            T built = construct(registration);
            slot.instance = built;
            log.debug("Constructed singleton {}", capability);
            return built;
        } finally {
            synchronized (singletonLock) {
                slot.builder = null;
                singletonLock.notifyAll();
            }
        }
    }

    /**
     * Follow the chain of threads building and awaiting singletons. Returns the
     * path if the chain leads back to a singleton the current thread is building.
     * Caller holds {@code singletonLock}.
     */
    private List<String> crossThreadCycle(Capability<?> wanted, Thread current) {
        List<String> path = new ArrayList<>();
        path.add(wanted.toString());
        Set<Thread> visited = new HashSet<>();
        Thread builder = singletons.get(wanted).builder;
        while (builder != null && visited.add(builder)) {
            Capability<?> awaited = awaiting.get(builder);
            if (awaited == null) {
                return null;
            }
            path.add(awaited.toString());
            Thread next = singletons.get(awaited).builder;
            if (next == current) {
                path.add(0, awaited.toString());
                return path;
            }
            builder = next;
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private static <T> T cast(Object instance) {
        return (T) instance;
    }

    private <T> T resolveScoped(Registration<T> registration) {
        ScopedInstanceStore store = scopeAccessor.currentStore()
            .orElseThrow(() -> new ScopeNotActiveException(
                "Scoped capability " + registration.capability() + " requires an active unit of work"));
        return store.scopedInstance(registration.capability(), () -> construct(registration));
    }

    private <T> T construct(Registration<T> registration) {
        Capability<T> capability = registration.capability();
        Deque<Capability<?>> stack = resolutionStack.get();
        if (stack.contains(capability)) {
            throw new CyclicDependencyException(cyclePath(stack, capability));
        }

        stack.push(capability);
        try {
            T instance = registration.provider().provide(this);
            if (instance == null) {
                throw new ProviderException(capability.toString(), "provider returned null");
            }
            return instance;
        } catch (ArchitectureException e) {
            throw e;
        } catch (Exception e) {
            throw new ProviderException(capability.toString(), e);
        } finally {
            stack.pop();
            if (stack.isEmpty()) {
                resolutionStack.remove();
            }
        }
    }

    private List<String> cyclePath(Deque<Capability<?>> stack, Capability<?> repeated) {
        // The deque is a stack, so iterate from the bottom to get resolution order
        List<String> path = new ArrayList<>();
        boolean inCycle = false;
        Iterator<Capability<?>> it = stack.descendingIterator();
        while (it.hasNext()) {
            Capability<?> current = it.next();
            if (current.equals(repeated)) {
                inCycle = true;
            }
            if (inCycle) {
                path.add(current.toString());
            }
        }
        path.add(repeated.toString());
        return path;
    }

    private static final class SingletonSlot {
        private volatile Object instance;
        // guarded by singletonLock
        private Thread builder;
    }
}
