package com.ivamare.architecture.uow;

import com.ivamare.architecture.entity.EntityKey;
import com.ivamare.architecture.exception.IdentityConflictException;
import com.ivamare.architecture.fixtures.Order;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdentityMapTest {

    private IdentityMap identityMap;

    @BeforeEach
    void setUp() {
        identityMap = new IdentityMap();
    }

    @Test
    void shouldLoadOnceAndReturnSameInstance() {
        AtomicInteger loads = new AtomicInteger();
        EntityKey key = new EntityKey(Order.class, "o-1");

        Optional<Order> first = identityMap.getOrTrack(key, () -> {
            loads.incrementAndGet();
            return new Order("o-1", "alice", 10);
        });
        Optional<Order> second = identityMap.getOrTrack(key, () -> {
            loads.incrementAndGet();
            return new Order("o-1", "alice", 10);
        });

        assertThat(first).isPresent();
        assertThat(second.get()).isSameAs(first.get());
        assertThat(loads).hasValue(1);
    }

    @Test
    void shouldNotTrackMissingEntities() {
        EntityKey key = new EntityKey(Order.class, "missing");

        assertThat(identityMap.<Order>getOrTrack(key, () -> null)).isEmpty();
        assertThat(identityMap.contains(key)).isFalse();
    }

    @Test
    void shouldRejectSecondInstanceForSameIdentity() {
        identityMap.track(new Order("o-1", "alice", 10));

        assertThatThrownBy(() -> identityMap.track(new Order("o-1", "alice", 10)))
            .isInstanceOf(IdentityConflictException.class)
            .hasMessageContaining("Order#o-1");
    }

    @Test
    void shouldAllowTrackingSameInstanceTwice() {
        Order order = new Order("o-1", "alice", 10);

        identityMap.track(order);
        identityMap.track(order);

        assertThat(identityMap.size()).isEqualTo(1);
        assertThat(identityMap.find(EntityKey.of(order))).containsSame(order);
    }

    @Test
    void shouldClear() {
        identityMap.track(new Order("o-1", "alice", 10));
        identityMap.track(new Order("o-2", "bob", 20));

        identityMap.clear();

        assertThat(identityMap.isEmpty()).isTrue();
    }
}
