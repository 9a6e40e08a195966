package com.qasandbox.api.user;

import com.qasandbox.infrastructure.user.UserEntity;

import java.time.Instant;

public record UserView(
    Long id,
    String email,
    String username,
    String fullName,
    String role,
    boolean isActive,
    Instant createdAt,
    Instant updatedAt
) {

  public static UserView from(UserEntity u) {
    return new UserView(
        u.getId(),
        u.getEmail(),
        u.getUsername(),
        u.getFullName(),
        u.getRole(),
        u.isActive(),
        u.getCreatedAt(),
        u.getUpdatedAt()
    );
  }
}
