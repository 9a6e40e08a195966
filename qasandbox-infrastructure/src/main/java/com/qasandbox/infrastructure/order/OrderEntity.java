package com.qasandbox.infrastructure.order;

import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(
    name = "orders",
    uniqueConstraints = @UniqueConstraint(name = "uk_orders_number", columnNames = "order_number"),
    indexes = {
        @Index(name = "ix_orders_user", columnList = "user_id"),
        @Index(name = "ix_orders_status", columnList = "status")
    }
)
public class OrderEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false)
  private Long id;

  @Column(name = "order_number", nullable = false, length = 50, updatable = false)
  private String orderNumber;

  @Column(name = "user_id", nullable = false, updatable = false)
  private Long userId;

  // pending | confirmed | shipped | cancelled
  @Column(name = "status", nullable = false, length = 20)
  private String status;

  @Column(name = "total_amount", nullable = false, precision = 14, scale = 2, updatable = false)
  private BigDecimal totalAmount;

  @Column(name = "shipping_address", columnDefinition = "text")
  private String shippingAddress;

  @Column(name = "notes", columnDefinition = "text")
  private String notes;

  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(
      name = "order_items",
      joinColumns = @JoinColumn(name = "order_id"),
      foreignKey = @ForeignKey(name = "fk_order_items_order")
  )
  @OrderColumn(name = "line_no")
  private List<OrderItemEmbeddable> items = new ArrayList<>();

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected OrderEntity() {}

  public OrderEntity(String orderNumber, Long userId, String status, BigDecimal totalAmount,
                     String shippingAddress, String notes, List<OrderItemEmbeddable> items, Instant createdAt) {
    this.orderNumber = orderNumber;
    this.userId = userId;
    this.status = status;
    this.totalAmount = totalAmount;
    this.shippingAddress = shippingAddress;
    this.notes = notes;
    this.items = new ArrayList<>(items);
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  public Long getId() { return id; }
  public String getOrderNumber() { return orderNumber; }
  public Long getUserId() { return userId; }
  public String getStatus() { return status; }
  public BigDecimal getTotalAmount() { return totalAmount; }
  public String getShippingAddress() { return shippingAddress; }
  public String getNotes() { return notes; }
  public List<OrderItemEmbeddable> getItems() { return List.copyOf(items); }
  public Instant getCreatedAt() { return createdAt; }
  public Instant getUpdatedAt() { return updatedAt; }

  public void setStatus(String status) { this.status = status; }
  public void setShippingAddress(String shippingAddress) { this.shippingAddress = shippingAddress; }
  public void setNotes(String notes) { this.notes = notes; }
  public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
