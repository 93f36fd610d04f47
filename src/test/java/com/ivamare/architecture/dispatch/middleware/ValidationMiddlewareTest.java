package com.ivamare.architecture.dispatch.middleware;

import com.ivamare.architecture.container.Resolver;
import com.ivamare.architecture.dispatch.Command;
import com.ivamare.architecture.dispatch.DispatchContext;
import com.ivamare.architecture.dispatch.Middleware;
import com.ivamare.architecture.dispatch.Request;
import com.ivamare.architecture.exception.ValidationException;
import com.ivamare.architecture.fixtures.OrderRequests.GetOrderTotal;
import com.ivamare.architecture.fixtures.OrderRequests.PlaceOrder;
import com.ivamare.architecture.uow.UnitOfWork;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ValidationMiddleware")
class ValidationMiddlewareTest {

    @Mock
    private UnitOfWork unitOfWork;

    @Mock
    private Resolver resolver;

    @Mock
    private Middleware.Next next;

    private ValidationMiddleware middleware;

    @BeforeEach
    void setUp() {
        middleware = new ValidationMiddleware(List.of(
            RequestValidator.of(PlaceOrder.class, request -> {
                List<String> violations = new ArrayList<>();
                if (request.total() <= 0) {
                    violations.add("total must be positive");
                }
                if (request.customer() == null || request.customer().isBlank()) {
                    violations.add("customer is required");
                }
                return violations;
            })
        ));
    }

    private DispatchContext contextFor(Request<?> request) {
        return new DispatchContext(request, unitOfWork, resolver, Instant.now());
    }

    @Test
    @DisplayName("should proceed when every validator passes")
    void shouldProceedWhenValid() throws Exception {
        PlaceOrder request = new PlaceOrder("o-1", "alice", 10);
        when(next.proceed()).thenReturn("o-1");

        Object result = middleware.invoke(request, contextFor(request), next);

        assertThat(result).isEqualTo("o-1");
    }

    @Test
    @DisplayName("should collect all violations and skip the handler")
    void shouldRejectWithAllViolations() throws Exception {
        PlaceOrder request = new PlaceOrder("o-1", " ", 0);

        assertThatThrownBy(() -> middleware.invoke(request, contextFor(request), next))
            .isInstanceOfSatisfying(ValidationException.class, e -> {
                assertThat(e.getViolations()).containsExactly("total must be positive", "customer is required");
                assertThat(e.getRequestType()).isEqualTo(PlaceOrder.class);
            })
            .hasMessage("Validation failed for PlaceOrder: total must be positive; customer is required");
        verify(next, never()).proceed();
    }

    @Test
    @DisplayName("should ignore validators for other request types")
    void shouldIgnoreUnrelatedValidators() throws Exception {
        GetOrderTotal request = new GetOrderTotal("o-1");
        when(next.proceed()).thenReturn(10L);

        assertThat(middleware.invoke(request, contextFor(request), next)).isEqualTo(10L);
    }

    @Test
    @DisplayName("should apply validators registered for a supertype")
    @SuppressWarnings({"unchecked", "rawtypes"})
    void shouldApplySupertypeValidators() throws Exception {
        Class<Command<?>> commandType = (Class) Command.class;
        middleware.addValidator(RequestValidator.of(commandType, command -> List.of("commands are frozen")));
        PlaceOrder request = new PlaceOrder("o-1", "alice", 10);

        assertThatThrownBy(() -> middleware.invoke(request, contextFor(request), next))
            .isInstanceOfSatisfying(ValidationException.class,
                e -> assertThat(e.getViolations()).containsExactly("commands are frozen"));
        verify(next, never()).proceed();
    }

    @Test
    @DisplayName("should treat a null result as no violations")
    void shouldTreatNullAsValid() throws Exception {
        ValidationMiddleware lenient = new ValidationMiddleware()
            .addValidator(RequestValidator.of(PlaceOrder.class, request -> null));
        PlaceOrder request = new PlaceOrder("o-1", "alice", 10);
        when(next.proceed()).thenReturn("o-1");

        assertThat(lenient.invoke(request, contextFor(request), next)).isEqualTo("o-1");
    }
}
