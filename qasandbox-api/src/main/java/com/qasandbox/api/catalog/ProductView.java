package com.qasandbox.api.catalog;

import com.qasandbox.infrastructure.catalog.ProductEntity;

import java.math.BigDecimal;
import java.time.Instant;

public record ProductView(
    Long id,
    String name,
    String description,
    BigDecimal price,
    int stock,
    String sku,
    Long categoryId,
    boolean isActive,
    Instant createdAt,
    Instant updatedAt,
    CategoryView category
) {

  public static ProductView from(ProductEntity p, CategoryView category) {
    return new ProductView(
        p.getId(),
        p.getName(),
        p.getDescription(),
        p.getPrice(),
        p.getStock(),
        p.getSku(),
        p.getCategoryId(),
        p.isActive(),
        p.getCreatedAt(),
        p.getUpdatedAt(),
        category
    );
  }
}
