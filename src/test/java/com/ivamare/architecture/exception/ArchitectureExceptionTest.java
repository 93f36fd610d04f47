package com.ivamare.architecture.exception;

import com.ivamare.architecture.entity.EntityKey;
import com.ivamare.architecture.fixtures.Order;
import com.ivamare.architecture.fixtures.OrderRequests.PlaceOrder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Architecture exceptions")
class ArchitectureExceptionTest {

    @Test
    @DisplayName("should share a common runtime base")
    void shouldShareCommonBase() {
        assertThat(new UnregisteredCapabilityException("clock")).isInstanceOf(ArchitectureException.class);
        assertThat(new NestedScopeException(UUID.randomUUID())).isInstanceOf(ArchitectureException.class);
        assertThat(new HandlerNotFoundException(PlaceOrder.class)).isInstanceOf(RuntimeException.class);
    }

    @Test
    @DisplayName("should render the cycle path")
    void shouldRenderCyclePath() {
        CyclicDependencyException e = new CyclicDependencyException(List.of("a", "b", "a"));

        assertThat(e).hasMessage("Cyclic dependency detected: a -> b -> a");
        assertThat(e.getPath()).containsExactly("a", "b", "a");
    }

    @Test
    @DisplayName("should describe partial commits")
    void shouldDescribePartialCommit() {
        IllegalStateException cause = new IllegalStateException("constraint violated");
        PartialCommitException e = new PartialCommitException(
            PartialCommitException.Stage.UPDATE, new EntityKey(Order.class, "o-1"), false, cause);

        assertThat(e.getMessage())
            .contains("UPDATE")
            .contains("Order#o-1")
            .contains("NOT compensated")
            .contains("constraint violated");
        assertThat(e).hasCause(cause);
    }

    @Test
    @DisplayName("should join validation violations")
    void shouldJoinViolations() {
        ValidationException e = new ValidationException(PlaceOrder.class, List.of("a", "b"));

        assertThat(e).hasMessage("Validation failed for PlaceOrder: a; b");
        assertThat(e.getViolations()).containsExactly("a", "b");
    }
}
