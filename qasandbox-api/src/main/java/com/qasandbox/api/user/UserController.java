package com.qasandbox.api.user;

import com.qasandbox.api.security.PrincipalResolver;
import com.qasandbox.domain.access.Role;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/users")
public class UserController {

  private final UserService users;
  private final PrincipalResolver principals;

  public UserController(UserService users, PrincipalResolver principals) {
    this.users = users;
    this.principals = principals;
  }

  public record UpdateUserRequest(
      @Email String email,
      @Size(min = 3, max = 100) String username,
      String fullName,
      String role,
      Boolean isActive
  ) {}

  @GetMapping
  public List<UserView> list(
      @AuthenticationPrincipal Jwt jwt,
      @RequestParam(required = false) String role,
      @RequestParam(required = false) Boolean isActive,
      @RequestParam(defaultValue = "0") int skip,
      @RequestParam(defaultValue = "20") int limit
  ) {
    Role roleFilter = role == null ? null : Role.fromValue(role);
    return users.list(principals.resolve(jwt), roleFilter, isActive, skip, limit).stream()
        .map(UserView::from)
        .toList();
  }

  @GetMapping("/{id}")
  public UserView get(@AuthenticationPrincipal Jwt jwt, @PathVariable long id) {
    return UserView.from(users.get(principals.resolve(jwt), id));
  }

  @PutMapping("/{id}")
  public UserView update(@AuthenticationPrincipal Jwt jwt, @PathVariable long id,
                         @Valid @RequestBody UpdateUserRequest req) {
    var update = new UserService.UserUpdate(req.email(), req.username(), req.fullName(), req.role(), req.isActive());
    return UserView.from(users.update(principals.resolve(jwt), id, update));
  }

  @DeleteMapping("/{id}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void delete(@AuthenticationPrincipal Jwt jwt, @PathVariable long id) {
    users.delete(principals.resolve(jwt), id);
  }
}
