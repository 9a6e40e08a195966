package com.qasandbox.api.order;

import com.qasandbox.infrastructure.order.OrderEntity;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record OrderView(
    Long id,
    String orderNumber,
    Long userId,
    String status,
    BigDecimal totalAmount,
    String shippingAddress,
    String notes,
    List<Item> items,
    Instant createdAt,
    Instant updatedAt
) {

  public record Item(Long productId, int quantity, BigDecimal unitPrice) {}

  public static OrderView from(OrderEntity o) {
    return new OrderView(
        o.getId(),
        o.getOrderNumber(),
        o.getUserId(),
        o.getStatus(),
        o.getTotalAmount(),
        o.getShippingAddress(),
        o.getNotes(),
        o.getItems().stream().map(i -> new Item(i.getProductId(), i.getQuantity(), i.getUnitPrice())).toList(),
        o.getCreatedAt(),
        o.getUpdatedAt()
    );
  }
}
