package com.qasandbox.domain.order;

import com.qasandbox.domain.DomainException;

public final class InvalidTransitionException extends DomainException {

    private final OrderStatus from;
    private final OrderStatus to;

    public InvalidTransitionException(OrderStatus from, OrderStatus to) {
        super(message(from, to));
        this.from = from;
        this.to = to;
    }

    public OrderStatus from() {
        return from;
    }

    public OrderStatus to() {
        return to;
    }

    private static String message(OrderStatus from, OrderStatus to) {
        if (to == OrderStatus.CANCELLED) {
            return "Only pending orders can be cancelled (current status: " + from.value() + ")";
        }
        return "Cannot change order status from " + from.value() + " to " + to.value();
    }
}
