package com.qasandbox.api.order;

import com.qasandbox.infrastructure.order.OrderRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Issues order numbers of the form {@code ORD-XXXXXXXX} (8 uppercase hex chars).
 *
 * The existence check skips numbers already stored, but it is not atomic with the insert:
 * two concurrent requests can still draw the same fresh number. The unique constraint
 * {@code uk_orders_number} then rejects the second insert, the transaction rolls back
 * (stock included) and the client gets {@code 409 conflict}; resubmitting the order is safe.
 */
@Component
public class OrderNumberGenerator {

  static final int MAX_ATTEMPTS = 5;

  private final OrderRepository orders;
  private final Supplier<UUID> randomness;

  @Autowired
  public OrderNumberGenerator(OrderRepository orders) {
    this(orders, UUID::randomUUID);
  }

  OrderNumberGenerator(OrderRepository orders, Supplier<UUID> randomness) {
    this.orders = orders;
    this.randomness = randomness;
  }

  /**
   * @throws IllegalStateException when every attempt hit a stored number
   */
  public String next() {
    for (int i = 0; i < MAX_ATTEMPTS; i++) {
      String candidate = format(randomness.get());
      if (!orders.existsByOrderNumber(candidate)) {
        return candidate;
      }
    }
    throw new IllegalStateException("Could not allocate a unique order number");
  }

  static String format(UUID uuid) {
    return "ORD-" + uuid.toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
  }
}
