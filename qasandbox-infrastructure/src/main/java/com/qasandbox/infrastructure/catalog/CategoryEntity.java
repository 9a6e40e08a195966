package com.qasandbox.infrastructure.catalog;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "categories", uniqueConstraints = @UniqueConstraint(name = "uk_categories_name", columnNames = "name"))
public class CategoryEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false)
  private Long id;

  @Column(name = "name", nullable = false, length = 100)
  private String name;

  @Column(name = "description", columnDefinition = "text")
  private String description;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected CategoryEntity() {}

  public CategoryEntity(String name, String description, Instant createdAt) {
    this.name = name;
    this.description = description;
    this.active = true;
    this.createdAt = createdAt;
  }

  public Long getId() { return id; }
  public String getName() { return name; }
  public String getDescription() { return description; }
  public boolean isActive() { return active; }
  public Instant getCreatedAt() { return createdAt; }

  public void setName(String name) { this.name = name; }
  public void setDescription(String description) { this.description = description; }
  public void setActive(boolean active) { this.active = active; }
}
