package com.qasandbox.api.auth;

import com.qasandbox.api.security.AccountDisabledException;
import com.qasandbox.api.security.AuthenticationFailedException;
import com.qasandbox.domain.access.Role;
import com.qasandbox.infrastructure.user.UserEntity;
import com.qasandbox.infrastructure.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

@Service
public class AuthService {

  private static final Logger log = LoggerFactory.getLogger(AuthService.class);

  private final UserRepository users;
  private final PasswordEncoder passwordEncoder;
  private final JwtEncoder jwtEncoder;

  private final String issuer;
  private final long accessTokenMinutes;

  public AuthService(
      UserRepository users,
      PasswordEncoder passwordEncoder,
      JwtEncoder jwtEncoder,
      @Value("${qasandbox.auth.issuer}") String issuer,
      @Value("${qasandbox.auth.accessTokenMinutes:1440}") long accessTokenMinutes
  ) {
    this.users = users;
    this.passwordEncoder = passwordEncoder;
    this.jwtEncoder = jwtEncoder;
    this.issuer = issuer;
    this.accessTokenMinutes = accessTokenMinutes;
  }

  @Transactional(readOnly = true)
  public AccessToken login(String username, String password) {
    var user = users.findByUsername(username == null ? "" : username.trim())
        .orElseThrow(() -> new AuthenticationFailedException("Invalid username or password"));

    if (!passwordEncoder.matches(password, user.getPasswordHash())) {
      throw new AuthenticationFailedException("Invalid username or password");
    }
    if (!user.isActive()) {
      throw new AccountDisabledException("User account is deactivated");
    }
    log.info("User logged in: userId={}, role={}", user.getId(), user.getRole());
    return issueToken(user);
  }

  /**
   * Creates a user. The role defaults to tester when absent.
   *
   * @throws IllegalArgumentException on duplicate email or username, or an unknown role
   */
  @Transactional
  public UserEntity register(String email, String username, String password, String fullName, String role) {
    String normalizedEmail = normalizeEmail(email);
    String normalizedUsername = username.trim();
    Role resolvedRole = (role == null || role.isBlank()) ? Role.TESTER : Role.fromValue(role);

    if (users.existsByEmailIgnoreCase(normalizedEmail)) {
      throw new IllegalArgumentException("Email already registered");
    }
    if (users.existsByUsername(normalizedUsername)) {
      throw new IllegalArgumentException("Username already taken");
    }

    var entity = users.save(new UserEntity(
        normalizedEmail,
        normalizedUsername,
        passwordEncoder.encode(password),
        fullName,
        resolvedRole.value(),
        Instant.now()
    ));
    log.info("User registered: userId={}, role={}", entity.getId(), entity.getRole());
    return entity;
  }

  private AccessToken issueToken(UserEntity user) {
    Instant now = Instant.now();
    Instant exp = now.plus(accessTokenMinutes, ChronoUnit.MINUTES);

    var claims = JwtClaimsSet.builder()
        .issuer(issuer)
        .issuedAt(now)
        .expiresAt(exp)
        .subject(user.getId().toString())
        .claim("role", user.getRole())
        .build();

    // HS256 pinned on the header, otherwise NimbusJwtEncoder may fail to select the key.
    String token = jwtEncoder.encode(
        JwtEncoderParameters.from(JwsHeader.with(MacAlgorithm.HS256).build(), claims)
    ).getTokenValue();
    return new AccessToken(token, ChronoUnit.SECONDS.between(now, exp));
  }

  static String normalizeEmail(String email) {
    if (email == null) return "";
    return email.trim().toLowerCase(Locale.ROOT);
  }

  public record AccessToken(String accessToken, long expiresInSeconds) {}
}
