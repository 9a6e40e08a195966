package com.qasandbox.api;

import com.qasandbox.api.seed.DataSeeder;
import com.qasandbox.infrastructure.audit.AuditLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end checks over HTTP against the seeded fixture data.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class ApiAccessIntegrationTest {

  @LocalServerPort int port;
  @Autowired TestRestTemplate rest;
  @Autowired DataSeeder seeder;
  @Autowired AuditLogRepository audits;
  @Autowired JwtEncoder jwtEncoder;

  String adminToken;
  String testerToken;
  String viewerToken;

  @BeforeEach
  void reseed() {
    seeder.clear();
    seeder.seed();
    adminToken = login("admin", "admin123");
    testerToken = login("tester", "tester123");
    viewerToken = login("viewer", "viewer123");
  }

  @Test
  void loginWithWrongPasswordIsUnauthorized() {
    var r = post("/api/v1/auth/login", null, Map.of("username", "admin", "password", "nope"));
    assertThat(r.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
    assertThat(r.getBody()).containsEntry("reason", "unauthorized");
  }

  @Test
  void requestsWithoutTokenAreRejected() {
    var r = rest.getForEntity(url("/api/v1/products"), String.class);
    assertThat(r.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
  }

  @Test
  void meReturnsTheCallerProfile() {
    var me = get("/api/v1/auth/me", viewerToken, Map.class);
    assertThat(me.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(me.getBody()).containsEntry("username", "viewer").containsEntry("role", "viewer");
  }

  @Test
  void tokenFromAnotherIssuerIsRejected() {
    Object adminId = get("/api/v1/auth/me", adminToken, Map.class).getBody().get("id");
    Instant now = Instant.now();
    var claims = JwtClaimsSet.builder()
        .issuer("someone-else")
        .issuedAt(now)
        .expiresAt(now.plus(5, ChronoUnit.MINUTES))
        .subject(adminId.toString())
        .claim("role", "admin")
        .build();
    String forged = jwtEncoder.encode(
        JwtEncoderParameters.from(JwsHeader.with(MacAlgorithm.HS256).build(), claims)
    ).getTokenValue();

    var r = get("/api/v1/auth/me", forged, String.class);
    assertThat(r.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
  }

  @Test
  void viewerReadsCatalogButCannotWriteIt() {
    var list = get("/api/v1/products?limit=100", viewerToken, List.class);
    assertThat(list.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(list.getBody()).hasSize(20);

    var create = post("/api/v1/products", viewerToken, Map.of("name", "Widget", "price", 5, "sku", "SKU-9999"));
    assertThat(create.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    assertThat(create.getBody()).containsEntry("reason", "forbidden");

    var category = post("/api/v1/categories", viewerToken, Map.of("name", "Toys"));
    assertThat(category.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
  }

  @Test
  void testerManagesCatalog() {
    var category = post("/api/v1/categories", testerToken, Map.of("name", "Toys", "description", "Games"));
    assertThat(category.getStatusCode()).isEqualTo(HttpStatus.CREATED);
    long categoryId = ((Number) category.getBody().get("id")).longValue();

    var product = post("/api/v1/products", testerToken,
        Map.of("name", "Puzzle", "price", "19.99", "stock", 4, "sku", "SKU-9001", "categoryId", categoryId));
    assertThat(product.getStatusCode()).isEqualTo(HttpStatus.CREATED);
    assertThat(product.getBody()).containsEntry("sku", "SKU-9001");

    var duplicate = post("/api/v1/products", testerToken,
        Map.of("name", "Puzzle 2", "price", "9.99", "sku", "SKU-9001"));
    assertThat(duplicate.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);

    var invalid = post("/api/v1/products", testerToken, Map.of("name", "Free", "price", 0, "sku", "SKU-9002"));
    assertThat(invalid.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(invalid.getBody()).containsEntry("reason", "validation_error");

    var deleted = exchange(HttpMethod.DELETE, "/api/v1/categories/" + categoryId, testerToken, null, Map.class);
    assertThat(deleted.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
    long productId = ((Number) product.getBody().get("id")).longValue();
    var detached = get("/api/v1/products/" + productId, testerToken, Map.class);
    assertThat(detached.getBody().get("categoryId")).isNull();
  }

  @Test
  void viewerListsOnlyOwnOrdersAndForeignOrdersAreNotFound() {
    long viewerId = ((Number) get("/api/v1/auth/me", viewerToken, Map.class).getBody().get("id")).longValue();

    var own = get("/api/v1/orders?limit=100", viewerToken, List.class);
    assertThat(own.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(own.getBody()).isNotEmpty();
    for (Object o : own.getBody()) {
      assertThat(((Number) ((Map<?, ?>) o).get("userId")).longValue()).isEqualTo(viewerId);
    }

    var all = get("/api/v1/orders?limit=100", adminToken, List.class);
    assertThat(all.getBody()).hasSize(DataSeeder.ORDER_COUNT);
    Map<?, ?> foreign = (Map<?, ?>) all.getBody().stream()
        .filter(o -> ((Number) ((Map<?, ?>) o).get("userId")).longValue() != viewerId)
        .findFirst()
        .orElseThrow();

    var hidden = get("/api/v1/orders/" + foreign.get("id"), viewerToken, Map.class);
    assertThat(hidden.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(hidden.getBody()).containsEntry("reason", "not_found");

    Object viewerOrderId = ((Map<?, ?>) own.getBody().get(0)).get("id");
    var byAdmin = get("/api/v1/orders/" + viewerOrderId, adminToken, Map.class);
    assertThat(byAdmin.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(((Number) byAdmin.getBody().get("userId")).longValue()).isEqualTo(viewerId);
    assertThat(get("/api/v1/orders/" + viewerOrderId, viewerToken, Map.class).getStatusCode()).isEqualTo(HttpStatus.OK);
  }

  @Test
  void orderErrorsMapToConflict() {
    var products = get("/api/v1/products?sortBy=stock&sortOrder=asc&limit=1", testerToken, List.class);
    Map<?, ?> p = (Map<?, ?>) products.getBody().get(0);
    int stock = ((Number) p.get("stock")).intValue();

    var tooMany = post("/api/v1/orders", testerToken,
        Map.of("items", List.of(Map.of("productId", p.get("id"), "quantity", stock + 1))));
    assertThat(tooMany.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(tooMany.getBody()).containsEntry("reason", "insufficient_stock");

    var created = post("/api/v1/orders", testerToken,
        Map.of("items", List.of(Map.of("productId", p.get("id"), "quantity", 1))));
    assertThat(created.getStatusCode()).isEqualTo(HttpStatus.CREATED);
    assertThat(created.getBody()).containsEntry("status", "pending");

    var skip = exchange(HttpMethod.PUT, "/api/v1/orders/" + created.getBody().get("id"), testerToken,
        Map.of("status", "shipped"), Map.class);
    assertThat(skip.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(skip.getBody())
        .containsEntry("reason", "invalid_transition")
        .containsEntry("from", "pending")
        .containsEntry("to", "shipped");
  }

  @Test
  void adminOperationsAreAdminOnly() {
    var stats = get("/api/v1/admin/stats", adminToken, Map.class);
    assertThat(stats.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(stats.getBody())
        .containsEntry("users", 3)
        .containsEntry("categories", 5)
        .containsEntry("products", 20)
        .containsEntry("orders", 10);

    assertThat(get("/api/v1/admin/stats", testerToken, Map.class).getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    assertThat(post("/api/v1/admin/reset", testerToken, Map.of()).getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);

    long before = audits.count();
    var reset = post("/api/v1/admin/reset", adminToken, Map.of());
    assertThat(reset.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(reset.getBody()).containsEntry("ordersCreated", 10);
    assertThat(audits.count()).isEqualTo(before + 1);
    assertThat(audits.findByActionOrderByCreatedAtDesc("DATABASE_RESET")).isNotEmpty();
  }

  @Test
  void deactivatedUserIsLockedOut() {
    long testerId = ((Number) get("/api/v1/auth/me", testerToken, Map.class).getBody().get("id")).longValue();

    var update = exchange(HttpMethod.PUT, "/api/v1/users/" + testerId, adminToken, Map.of("isActive", false), Map.class);
    assertThat(update.getStatusCode()).isEqualTo(HttpStatus.OK);

    var me = get("/api/v1/auth/me", testerToken, Map.class);
    assertThat(me.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    assertThat(me.getBody()).containsEntry("reason", "account_disabled");

    var relogin = post("/api/v1/auth/login", null, Map.of("username", "tester", "password", "tester123"));
    assertThat(relogin.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
  }

  @Test
  void adminCannotDeleteThemselves() {
    long adminId = ((Number) get("/api/v1/auth/me", adminToken, Map.class).getBody().get("id")).longValue();
    var r = exchange(HttpMethod.DELETE, "/api/v1/users/" + adminId, adminToken, null, Map.class);
    assertThat(r.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
  }

  @Test
  void registerDefaultsToTesterAndRejectsDuplicates() {
    var body = Map.of("email", "new@qa-test.com", "username", "newbie", "password", "secret123");
    var created = post("/api/v1/auth/register", null, body);
    assertThat(created.getStatusCode()).isEqualTo(HttpStatus.CREATED);
    assertThat(created.getBody()).containsEntry("role", "tester");

    var again = post("/api/v1/auth/register", null, body);
    assertThat(again.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
  }

  private String login(String username, String password) {
    var r = post("/api/v1/auth/login", null, Map.of("username", username, "password", password));
    assertThat(r.getStatusCode()).isEqualTo(HttpStatus.OK);
    return (String) r.getBody().get("accessToken");
  }

  @SuppressWarnings("rawtypes")
  private ResponseEntity<Map> post(String path, String token, Object body) {
    return exchange(HttpMethod.POST, path, token, body, Map.class);
  }

  private <T> ResponseEntity<T> get(String path, String token, Class<T> type) {
    return exchange(HttpMethod.GET, path, token, null, type);
  }

  private <T> ResponseEntity<T> exchange(HttpMethod method, String path, String token, Object body, Class<T> type) {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    if (token != null) headers.setBearerAuth(token);
    return rest.exchange(url(path), method, new HttpEntity<>(body, headers), type);
  }

  private String url(String path) {
    return "http://localhost:" + port + path;
  }
}
