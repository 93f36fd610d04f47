package com.ivamare.architecture.cache;

import com.ivamare.architecture.Architecture;
import com.ivamare.architecture.ArchitectureBuilder;
import com.ivamare.architecture.container.Capability;
import com.ivamare.architecture.container.Lifetime;
import com.ivamare.architecture.dispatch.RequestHandler;
import com.ivamare.architecture.dispatch.UseCaseDispatcher;
import com.ivamare.architecture.fixtures.Customer;
import com.ivamare.architecture.fixtures.Order;
import com.ivamare.architecture.fixtures.OrderRequests.ChangeTotal;
import com.ivamare.architecture.fixtures.OrderRequests.CountCustomerOrders;
import com.ivamare.architecture.fixtures.OrderRequests.GetOrderTotal;
import com.ivamare.architecture.fixtures.OrderRequests.Ping;
import com.ivamare.architecture.fixtures.OrderRequests.PlaceOrder;
import com.ivamare.architecture.fixtures.OrderRequests.RegisterCustomer;
import com.ivamare.architecture.repository.EntitySerializer;
import com.ivamare.architecture.repository.impl.InMemoryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CachingMiddleware")
class CachingMiddlewareTest {

    private final Map<Class<?>, AtomicInteger> invocations = new ConcurrentHashMap<>();
    private final AtomicLong nanos = new AtomicLong();

    private Architecture architecture;
    private UseCaseDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        architecture = new ArchitectureBuilder()
            .configure(container -> {
                container.register(Capability.repository(Order.class),
                    r -> new InMemoryRepository<>(Order.class, r.resolve(EntitySerializer.class)), Lifetime.SINGLETON);
                container.register(Capability.repository(Customer.class),
                    r -> new InMemoryRepository<>(Customer.class, r.resolve(EntitySerializer.class)), Lifetime.SINGLETON);
            })
            .handler(RequestHandler.of(PlaceOrder.class, (request, context) -> {
                count(PlaceOrder.class);
                context.registerNew(new Order(request.id(), request.customer(), request.total()));
                return request.id();
            }))
            .handler(RequestHandler.of(ChangeTotal.class, (request, context) -> {
                count(ChangeTotal.class);
                Order order = context.load(Order.class, request.id()).orElseThrow();
                order.changeTotal(request.total());
                context.registerDirty(order);
                if (request.total() < 0) {
                    throw new IllegalArgumentException("negative total");
                }
                return order.getTotal();
            }))
            .handler(RequestHandler.of(RegisterCustomer.class, (request, context) -> {
                count(RegisterCustomer.class);
                context.registerNew(new Customer(request.id(), request.name()));
                if (request.name().isBlank()) {
                    throw new IllegalArgumentException("name is required");
                }
                return request.id();
            }))
            .handler(RequestHandler.of(GetOrderTotal.class, (request, context) -> {
                count(GetOrderTotal.class);
                return context.load(Order.class, request.id()).map(Order::getTotal).orElse(-1L);
            }))
            .handler(RequestHandler.of(CountCustomerOrders.class, (request, context) -> {
                count(CountCustomerOrders.class);
                return invocations.get(PlaceOrder.class).get();
            }))
            .handler(RequestHandler.of(Ping.class, (request, context) -> {
                count(Ping.class);
                return request.message();
            }))
            .cache(100, Duration.ofMinutes(5))
            .cacheTicker(nanos::get)
            .build();
        dispatcher = architecture.dispatcher();

        dispatcher.dispatch(new PlaceOrder("o-1", "alice", 10));
    }

    private void count(Class<?> requestType) {
        invocations.computeIfAbsent(requestType, t -> new AtomicInteger()).incrementAndGet();
    }

    private int invocationsOf(Class<?> requestType) {
        AtomicInteger counter = invocations.get(requestType);
        return counter == null ? 0 : counter.get();
    }

    @Nested
    @DisplayName("memoization")
    class MemoizationTests {

        @Test
        @DisplayName("should run the handler once for identical cacheable requests")
        void shouldMemoizeIdenticalRequests() {
            assertThat(dispatcher.dispatch(new GetOrderTotal("o-1"))).isEqualTo(10L);
            assertThat(dispatcher.dispatch(new GetOrderTotal("o-1"))).isEqualTo(10L);

            assertThat(invocationsOf(GetOrderTotal.class)).isEqualTo(1);
            assertThat(architecture.queryCache().stats().hits()).isEqualTo(1);
        }

        @Test
        @DisplayName("should keep different payloads apart")
        void shouldSeparatePayloads() {
            dispatcher.dispatch(new GetOrderTotal("o-1"));
            assertThat(dispatcher.dispatch(new GetOrderTotal("o-404"))).isEqualTo(-1L);

            assertThat(invocationsOf(GetOrderTotal.class)).isEqualTo(2);
        }

        @Test
        @DisplayName("should not memoize requests that are not cacheable")
        void shouldPassThroughNonCacheable() {
            dispatcher.dispatch(new Ping("hi"));
            dispatcher.dispatch(new Ping("hi"));

            assertThat(invocationsOf(Ping.class)).isEqualTo(2);
        }

        @Test
        @DisplayName("should recompute after the validity window")
        void shouldRecomputeAfterExpiry() {
            dispatcher.dispatch(new GetOrderTotal("o-1"));
            nanos.addAndGet(TimeUnit.MINUTES.toNanos(6));

            dispatcher.dispatch(new GetOrderTotal("o-1"));

            assertThat(invocationsOf(GetOrderTotal.class)).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("cacheable commands")
    class CacheableCommandTests {

        @Test
        @DisplayName("should store the result once the command has committed")
        void shouldStoreAfterCommit() {
            assertThat(dispatcher.dispatch(new RegisterCustomer("c-1", "Alice"))).isEqualTo("c-1");
            assertThat(architecture.queryCache().size()).isEqualTo(1);

            assertThat(dispatcher.dispatch(new RegisterCustomer("c-1", "Alice"))).isEqualTo("c-1");

            assertThat(invocationsOf(RegisterCustomer.class)).isEqualTo(1);
            assertThat(architecture.queryCache().stats().hits()).isEqualTo(1);
        }

        @Test
        @DisplayName("should not store the result when the command rolls back")
        void shouldNotStoreOnRollback() {
            assertThatThrownBy(() -> dispatcher.dispatch(new RegisterCustomer("c-1", " ")))
                .isInstanceOf(IllegalArgumentException.class);
            assertThat(architecture.queryCache().size()).isZero();

            assertThatThrownBy(() -> dispatcher.dispatch(new RegisterCustomer("c-1", " ")))
                .isInstanceOf(IllegalArgumentException.class);

            assertThat(invocationsOf(RegisterCustomer.class)).isEqualTo(2);
            assertThat(architecture.queryCache().stats().hits()).isZero();
        }
    }

    @Nested
    @DisplayName("invalidation")
    class InvalidationTests {

        @Test
        @DisplayName("should recompute after a commit mutates a type the result read")
        void shouldInvalidateOnCommit() {
            dispatcher.dispatch(new GetOrderTotal("o-1"));

            dispatcher.dispatch(new ChangeTotal("o-1", 25));

            assertThat(dispatcher.dispatch(new GetOrderTotal("o-1"))).isEqualTo(25L);
            assertThat(invocationsOf(GetOrderTotal.class)).isEqualTo(2);
        }

        @Test
        @DisplayName("should keep results that do not depend on the mutated type")
        void shouldKeepUnrelatedResults() {
            dispatcher.dispatch(new GetOrderTotal("o-1"));

            architecture.queryCache().invalidate(Customer.class);

            dispatcher.dispatch(new GetOrderTotal("o-1"));
            assertThat(invocationsOf(GetOrderTotal.class)).isEqualTo(1);
        }

        @Test
        @DisplayName("should honour declared cache tags")
        void shouldHonourDeclaredTags() {
            assertThat(dispatcher.dispatch(new CountCustomerOrders("alice"))).isEqualTo(1);
            assertThat(dispatcher.dispatch(new CountCustomerOrders("alice"))).isEqualTo(1);

            dispatcher.dispatch(new PlaceOrder("o-2", "alice", 5));

            assertThat(dispatcher.dispatch(new CountCustomerOrders("alice"))).isEqualTo(2);
            assertThat(invocationsOf(CountCustomerOrders.class)).isEqualTo(2);
        }

        @Test
        @DisplayName("should not invalidate when the command fails")
        void shouldNotInvalidateOnFailure() {
            dispatcher.dispatch(new GetOrderTotal("o-1"));

            assertThatThrownBy(() -> dispatcher.dispatch(new ChangeTotal("o-1", -5)))
                .isInstanceOf(IllegalArgumentException.class);

            assertThat(dispatcher.dispatch(new GetOrderTotal("o-1"))).isEqualTo(10L);
            assertThat(invocationsOf(GetOrderTotal.class)).isEqualTo(1);
        }
    }
}
