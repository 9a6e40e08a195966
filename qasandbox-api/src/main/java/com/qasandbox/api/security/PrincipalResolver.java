package com.qasandbox.api.security;

import com.qasandbox.domain.access.Principal;
import com.qasandbox.domain.access.Role;
import com.qasandbox.infrastructure.user.UserEntity;
import com.qasandbox.infrastructure.user.UserRepository;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

/**
 * Turns a validated JWT into a {@link Principal}.
 *
 * The user is reloaded on every request: the role comes from the database, not from the token,
 * so role changes and deactivation take effect immediately.
 */
@Component
public class PrincipalResolver {

  private final UserRepository users;

  public PrincipalResolver(UserRepository users) {
    this.users = users;
  }

  public Principal resolve(Jwt jwt) {
    return toPrincipal(resolveUser(jwt));
  }

  public UserEntity resolveUser(Jwt jwt) {
    if (jwt == null) {
      throw new AuthenticationFailedException("Not authenticated");
    }
    long userId;
    try {
      userId = Long.parseLong(jwt.getSubject());
    } catch (NumberFormatException e) {
      throw new AuthenticationFailedException("Could not validate credentials");
    }
    UserEntity user = users.findById(userId)
        .orElseThrow(() -> new AuthenticationFailedException("Could not validate credentials"));
    if (!user.isActive()) {
      throw new AccountDisabledException("User account is deactivated");
    }
    return user;
  }

  public static Principal toPrincipal(UserEntity user) {
    return Principal.of(user.getId(), Role.fromValue(user.getRole()));
  }
}
