package com.qasandbox.domain.order;

import java.util.Objects;

/**
 * Order status state machine.
 *
 * <pre>
 *   PENDING -> CONFIRMED -> SHIPPED
 *   PENDING -> CANCELLED
 * </pre>
 *
 * SHIPPED and CANCELLED are terminal. CONFIRMED cannot be skipped.
 */
public final class OrderLifecycle {

    public OrderStatus initial() {
        return OrderStatus.PENDING;
    }

    public boolean canTransition(OrderStatus from, OrderStatus to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        return switch (from) {
            case PENDING -> to == OrderStatus.CONFIRMED || to == OrderStatus.CANCELLED;
            case CONFIRMED -> to == OrderStatus.SHIPPED;
            case SHIPPED, CANCELLED -> false;
        };
    }

    /**
     * @return the new status
     * @throws InvalidTransitionException when the edge is not part of the chain
     */
    public OrderStatus transition(OrderStatus from, OrderStatus to) {
        if (!canTransition(from, to)) {
            throw new InvalidTransitionException(from, to);
        }
        return to;
    }

    public OrderStatus cancel(OrderStatus from) {
        return transition(from, OrderStatus.CANCELLED);
    }
}
