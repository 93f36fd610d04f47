package com.ivamare.architecture.fixtures;

import com.ivamare.architecture.dispatch.Cacheable;
import com.ivamare.architecture.dispatch.Command;
import com.ivamare.architecture.dispatch.Query;

import java.util.Set;

/**
 * Requests used across dispatcher and cache tests.
 */
public final class OrderRequests {

    private OrderRequests() {
    }

    public record PlaceOrder(String id, String customer, long total) implements Command<String> {
    }

    public record ChangeTotal(String id, long total) implements Command<Long> {
    }

    public record RegisterCustomer(String id, String name) implements Command<String>, Cacheable {
    }

    public record GetOrderTotal(String id) implements Query<Long>, Cacheable {
    }

    public record CountCustomerOrders(String customer) implements Query<Integer>, Cacheable {
        @Override
        public Set<Class<?>> cacheTags() {
            return Set.of(Order.class);
        }
    }

    public record Ping(String message) implements Query<String> {
    }
}
