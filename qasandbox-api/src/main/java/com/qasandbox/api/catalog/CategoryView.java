package com.qasandbox.api.catalog;

import com.qasandbox.infrastructure.catalog.CategoryEntity;

import java.time.Instant;

public record CategoryView(Long id, String name, String description, boolean isActive, Instant createdAt) {

  public static CategoryView from(CategoryEntity c) {
    return new CategoryView(c.getId(), c.getName(), c.getDescription(), c.isActive(), c.getCreatedAt());
  }
}
