package com.qasandbox.infrastructure.user;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(
    name = "users",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_users_email", columnNames = "email"),
        @UniqueConstraint(name = "uk_users_username", columnNames = "username")
    },
    indexes = @Index(name = "ix_users_role", columnList = "role")
)
public class UserEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false)
  private Long id;

  @Column(name = "email", nullable = false, length = 255)
  private String email;

  @Column(name = "username", nullable = false, length = 100)
  private String username;

  @Column(name = "password_hash", nullable = false, length = 100)
  private String passwordHash;

  @Column(name = "full_name", length = 255)
  private String fullName;

  // admin | tester | viewer
  @Column(name = "role", nullable = false, length = 20)
  private String role;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected UserEntity() {}

  public UserEntity(String email, String username, String passwordHash, String fullName, String role, Instant createdAt) {
    this.email = email;
    this.username = username;
    this.passwordHash = passwordHash;
    this.fullName = fullName;
    this.role = role;
    this.active = true;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  public Long getId() { return id; }
  public String getEmail() { return email; }
  public String getUsername() { return username; }
  public String getPasswordHash() { return passwordHash; }
  public String getFullName() { return fullName; }
  public String getRole() { return role; }
  public boolean isActive() { return active; }
  public Instant getCreatedAt() { return createdAt; }
  public Instant getUpdatedAt() { return updatedAt; }

  public void setEmail(String email) { this.email = email; }
  public void setUsername(String username) { this.username = username; }
  public void setPasswordHash(String passwordHash) { this.passwordHash = passwordHash; }
  public void setFullName(String fullName) { this.fullName = fullName; }
  public void setRole(String role) { this.role = role; }
  public void setActive(boolean active) { this.active = active; }
  public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
