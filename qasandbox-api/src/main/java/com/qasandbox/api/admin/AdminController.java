package com.qasandbox.api.admin;

import com.qasandbox.api.security.PrincipalResolver;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin")
public class AdminController {

  private final AdminService admin;
  private final PrincipalResolver principals;

  public AdminController(AdminService admin, PrincipalResolver principals) {
    this.admin = admin;
    this.principals = principals;
  }

  public record ResetResponse(String message, int usersCreated, int categoriesCreated, int productsCreated, int ordersCreated) {}

  @PostMapping("/reset")
  public ResetResponse reset(@AuthenticationPrincipal Jwt jwt) {
    var counts = admin.reset(principals.resolve(jwt));
    return new ResetResponse(
        "Database reset successfully",
        counts.usersCreated(),
        counts.categoriesCreated(),
        counts.productsCreated(),
        counts.ordersCreated()
    );
  }

  @GetMapping("/stats")
  public AdminService.Stats stats(@AuthenticationPrincipal Jwt jwt) {
    return admin.stats(principals.resolve(jwt));
  }
}
