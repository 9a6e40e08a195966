package com.qasandbox.domain.order;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Objects;

/**
 * One product line of an order, priced at creation time.
 */
public record OrderLine(long productId, int quantity, BigDecimal unitPrice) {

    public OrderLine {
        Objects.requireNonNull(unitPrice, "unitPrice");
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive, got " + quantity);
        }
        if (unitPrice.signum() <= 0) {
            throw new IllegalArgumentException("Unit price must be positive, got " + unitPrice);
        }
    }

    public BigDecimal subtotal() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }

    /** Sum of all subtotals, scaled to cents. */
    public static BigDecimal total(Collection<OrderLine> lines) {
        BigDecimal sum = BigDecimal.ZERO;
        for (OrderLine line : lines) {
            sum = sum.add(line.subtotal());
        }
        return sum.setScale(2, RoundingMode.HALF_UP);
    }
}
