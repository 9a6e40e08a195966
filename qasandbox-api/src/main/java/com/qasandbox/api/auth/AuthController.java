package com.qasandbox.api.auth;

import com.qasandbox.api.security.PrincipalResolver;
import com.qasandbox.api.user.UserView;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {

  private final AuthService auth;
  private final PrincipalResolver principals;

  public AuthController(AuthService auth, PrincipalResolver principals) {
    this.auth = auth;
    this.principals = principals;
  }

  public record LoginRequest(
      @NotBlank String username,
      @NotBlank String password
  ) {}

  public record RegisterRequest(
      @Email @NotBlank String email,
      @NotBlank @Size(min = 3, max = 100) String username,
      @NotBlank @Size(min = 6, max = 72) String password,
      String fullName,
      String role
  ) {}

  public record TokenResponse(String accessToken, String tokenType, long expiresInSeconds) {}

  @PostMapping(value = "/login", produces = MediaType.APPLICATION_JSON_VALUE)
  public TokenResponse login(@Valid @RequestBody LoginRequest req) {
    var t = auth.login(req.username(), req.password());
    return new TokenResponse(t.accessToken(), "bearer", t.expiresInSeconds());
  }

  @PostMapping(value = "/register", produces = MediaType.APPLICATION_JSON_VALUE)
  @ResponseStatus(HttpStatus.CREATED)
  public UserView register(@Valid @RequestBody RegisterRequest req) {
    return UserView.from(auth.register(req.email(), req.username(), req.password(), req.fullName(), req.role()));
  }

  @GetMapping("/me")
  public UserView me(@AuthenticationPrincipal Jwt jwt) {
    return UserView.from(principals.resolveUser(jwt));
  }
}
