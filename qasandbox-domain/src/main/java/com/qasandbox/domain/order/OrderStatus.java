package com.qasandbox.domain.order;

import java.util.Locale;

public enum OrderStatus {
    PENDING,
    CONFIRMED,
    SHIPPED,
    CANCELLED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return switch (this) {
            case SHIPPED, CANCELLED -> true;
            case PENDING, CONFIRMED -> false;
        };
    }

    /**
     * @throws IllegalArgumentException for unknown status values
     */
    public static OrderStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Order status is blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (OrderStatus s : values()) {
            if (s.name().equals(normalized)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown order status: " + value);
    }
}
