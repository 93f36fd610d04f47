package com.ivamare.architecture.repository.impl;

import com.ivamare.architecture.exception.ArchitectureException;
import com.ivamare.architecture.fixtures.Order;
import com.ivamare.architecture.fixtures.TestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryRepositoryTest {

    private InMemoryRepository<Order, String> repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryRepository<>(Order.class, TestSupport.serializer());
    }

    @Test
    void shouldMaterializeFreshInstances() {
        Order order = new Order("o-1", "alice", 10);
        repository.add(order);

        Order first = repository.getById("o-1").orElseThrow();
        Order second = repository.getById("o-1").orElseThrow();

        assertThat(first).isNotSameAs(order).isNotSameAs(second).isEqualTo(order);
        assertThat(first.getCustomer()).isEqualTo("alice");
        assertThat(first.getTotal()).isEqualTo(10);
    }

    @Test
    void shouldNotShareStateWithCallers() {
        Order order = new Order("o-1", "alice", 10);
        repository.add(order);

        order.changeTotal(500);

        assertThat(repository.getById("o-1").orElseThrow().getTotal()).isEqualTo(10);
    }

    @Test
    void shouldKeepVersionAcrossUpdates() {
        Order order = new Order("o-1", "alice", 10);
        repository.add(order);
        order.changeTotal(20);
        order.changeTotal(30);

        repository.update(order);

        Order stored = repository.getById("o-1").orElseThrow();
        assertThat(stored.getTotal()).isEqualTo(30);
        assertThat(stored.getVersion()).isEqualTo(2);
    }

    @Test
    void shouldRejectDuplicateAdd() {
        repository.add(new Order("o-1", "alice", 10));

        assertThatThrownBy(() -> repository.add(new Order("o-1", "bob", 20)))
            .isInstanceOf(ArchitectureException.class)
            .hasMessageContaining("already exists");
    }

    @Test
    void shouldRejectUpdateAndDeleteOfMissingEntity() {
        Order order = new Order("o-1", "alice", 10);

        assertThatThrownBy(() -> repository.update(order)).isInstanceOf(ArchitectureException.class);
        assertThatThrownBy(() -> repository.delete(order)).isInstanceOf(ArchitectureException.class);
    }

    @Test
    void shouldUndoEachWrite() {
        Order order = new Order("o-1", "alice", 10);
        repository.add(order);
        repository.undoAdd(order);
        assertThat(repository.getById("o-1")).isEmpty();

        repository.add(order);
        repository.delete(order);
        repository.undoDelete(order);
        assertThat(repository.ids()).containsExactly("o-1");
    }
}
