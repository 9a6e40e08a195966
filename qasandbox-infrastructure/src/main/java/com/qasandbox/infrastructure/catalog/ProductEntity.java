package com.qasandbox.infrastructure.catalog;

import jakarta.persistence.*;
import org.hibernate.annotations.Check;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(
    name = "products",
    uniqueConstraints = @UniqueConstraint(name = "uk_products_sku", columnNames = "sku"),
    indexes = {
        @Index(name = "ix_products_name", columnList = "name"),
        @Index(name = "ix_products_category", columnList = "category_id")
    }
)
@Check(constraints = "price > 0 AND stock >= 0")
public class ProductEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false)
  private Long id;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "description", columnDefinition = "text")
  private String description;

  @Column(name = "price", nullable = false, precision = 12, scale = 2)
  private BigDecimal price;

  @Column(name = "stock", nullable = false)
  private int stock;

  @Column(name = "sku", nullable = false, length = 50)
  private String sku;

  @Column(name = "active", nullable = false)
  private boolean active;

  // Plain reference; deleting a category sets it to null (see CategoryService).
  @Column(name = "category_id")
  private Long categoryId;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ProductEntity() {}

  public ProductEntity(String name, String description, BigDecimal price, int stock, String sku,
                       Long categoryId, Instant createdAt) {
    this.name = name;
    this.description = description;
    this.price = price;
    this.stock = stock;
    this.sku = sku;
    this.active = true;
    this.categoryId = categoryId;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  public Long getId() { return id; }
  public String getName() { return name; }
  public String getDescription() { return description; }
  public BigDecimal getPrice() { return price; }
  public int getStock() { return stock; }
  public String getSku() { return sku; }
  public boolean isActive() { return active; }
  public Long getCategoryId() { return categoryId; }
  public Instant getCreatedAt() { return createdAt; }
  public Instant getUpdatedAt() { return updatedAt; }

  public void setName(String name) { this.name = name; }
  public void setDescription(String description) { this.description = description; }
  public void setPrice(BigDecimal price) { this.price = price; }
  public void setStock(int stock) { this.stock = stock; }
  public void setSku(String sku) { this.sku = sku; }
  public void setActive(boolean active) { this.active = active; }
  public void setCategoryId(Long categoryId) { this.categoryId = categoryId; }
  public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
