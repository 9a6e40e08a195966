package com.qasandbox.api.seed;

import com.qasandbox.domain.access.Role;
import com.qasandbox.domain.order.OrderLine;
import com.qasandbox.domain.order.OrderStatus;
import com.qasandbox.infrastructure.catalog.CategoryEntity;
import com.qasandbox.infrastructure.catalog.CategoryRepository;
import com.qasandbox.infrastructure.catalog.ProductEntity;
import com.qasandbox.infrastructure.catalog.ProductRepository;
import com.qasandbox.infrastructure.order.OrderEntity;
import com.qasandbox.infrastructure.order.OrderItemEmbeddable;
import com.qasandbox.infrastructure.order.OrderRepository;
import com.qasandbox.infrastructure.user.UserEntity;
import com.qasandbox.infrastructure.user.UserRepository;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Known fixture data for the sandbox: 3 users with fixed credentials, 5 categories,
 * 20 products and 10 orders. Content is deterministic, so every reset yields the same state.
 */
@Component
public class DataSeeder {

  private final UserRepository users;
  private final CategoryRepository categories;
  private final ProductRepository products;
  private final OrderRepository orders;
  private final PasswordEncoder passwordEncoder;

  public DataSeeder(
      UserRepository users,
      CategoryRepository categories,
      ProductRepository products,
      OrderRepository orders,
      PasswordEncoder passwordEncoder
  ) {
    this.users = users;
    this.categories = categories;
    this.products = products;
    this.orders = orders;
    this.passwordEncoder = passwordEncoder;
  }

  public record SeedCounts(int usersCreated, int categoriesCreated, int productsCreated, int ordersCreated) {}

  private record UserSeed(String email, String username, String fullName, String password, Role role) {}

  private record ProductSeed(String name, String category, String price, int stock) {}

  private static final List<UserSeed> USERS = List.of(
      new UserSeed("admin@qa-test.com", "admin", "Admin User", "admin123", Role.ADMIN),
      new UserSeed("tester@qa-test.com", "tester", "Test User", "tester123", Role.TESTER),
      new UserSeed("viewer@qa-test.com", "viewer", "Viewer User", "viewer123", Role.VIEWER)
  );

  private static final List<String[]> CATEGORIES = List.of(
      new String[] {"Electronics", "Computers, phones, and gadgets"},
      new String[] {"Clothing", "Apparel and accessories"},
      new String[] {"Home & Garden", "Furniture and appliances"},
      new String[] {"Books", "Physical and digital books"},
      new String[] {"Sports", "Sports equipment and gear"}
  );

  private static final List<ProductSeed> PRODUCTS = List.of(
      new ProductSeed("Laptop Pro 15", "Electronics", "1299.99", 15),
      new ProductSeed("Wireless Mouse", "Electronics", "49.99", 100),
      new ProductSeed("USB-C Hub", "Electronics", "79.99", 50),
      new ProductSeed("Mechanical Keyboard", "Electronics", "149.99", 30),
      new ProductSeed("4K Monitor", "Electronics", "399.99", 20),
      new ProductSeed("Cotton T-Shirt", "Clothing", "24.99", 200),
      new ProductSeed("Denim Jeans", "Clothing", "59.99", 150),
      new ProductSeed("Running Shoes", "Clothing", "89.99", 75),
      new ProductSeed("Winter Jacket", "Clothing", "149.99", 40),
      new ProductSeed("Desk Lamp", "Home & Garden", "34.99", 80),
      new ProductSeed("Office Chair", "Home & Garden", "249.99", 25),
      new ProductSeed("Plant Pot Set", "Home & Garden", "29.99", 120),
      new ProductSeed("Coffee Table", "Home & Garden", "199.99", 15),
      new ProductSeed("Python Cookbook", "Books", "44.99", 60),
      new ProductSeed("Design Patterns", "Books", "49.99", 45),
      new ProductSeed("Clean Code", "Books", "39.99", 70),
      new ProductSeed("Yoga Mat", "Sports", "29.99", 90),
      new ProductSeed("Dumbbells Set", "Sports", "79.99", 35),
      new ProductSeed("Tennis Racket", "Sports", "129.99", 20),
      new ProductSeed("Soccer Ball", "Sports", "24.99", 100)
  );

  public static final int ORDER_COUNT = 10;

  /** Removes all business data. The audit log is kept. */
  @Transactional
  public void clear() {
    orders.deleteAll();
    orders.flush();
    products.deleteAllInBatch();
    categories.deleteAllInBatch();
    users.deleteAllInBatch();
  }

  @Transactional
  public SeedCounts seed() {
    Instant now = Instant.now();

    List<UserEntity> seededUsers = new ArrayList<>();
    for (UserSeed u : USERS) {
      seededUsers.add(users.save(new UserEntity(
          u.email(), u.username(), passwordEncoder.encode(u.password()), u.fullName(), u.role().value(), now)));
    }

    Map<String, Long> categoryIds = new HashMap<>();
    for (String[] c : CATEGORIES) {
      categoryIds.put(c[0], categories.save(new CategoryEntity(c[0], c[1], now)).getId());
    }

    List<ProductEntity> seededProducts = new ArrayList<>();
    for (int i = 0; i < PRODUCTS.size(); i++) {
      ProductSeed p = PRODUCTS.get(i);
      seededProducts.add(products.save(new ProductEntity(
          p.name(),
          p.name() + " from the " + p.category() + " range.",
          new BigDecimal(p.price()),
          p.stock(),
          String.format("SKU-%04d", i + 1),
          categoryIds.get(p.category()),
          now
      )));
    }

    OrderStatus[] statuses = OrderStatus.values();
    for (int i = 0; i < ORDER_COUNT; i++) {
      UserEntity owner = seededUsers.get(i % seededUsers.size());
      OrderStatus status = statuses[i % statuses.length];

      // 1..4 consecutive products starting at a fixed offset, one unit each
      List<OrderLine> lines = new ArrayList<>();
      int lineCount = 1 + (i % 4);
      for (int k = 0; k < lineCount; k++) {
        ProductEntity p = seededProducts.get((i * 3 + k) % seededProducts.size());
        lines.add(new OrderLine(p.getId(), 1, p.getPrice()));
        if (status != OrderStatus.CANCELLED) {
          p.setStock(p.getStock() - 1);
        }
      }

      orders.save(new OrderEntity(
          String.format("ORD-%08X", i + 1),
          owner.getId(),
          status.value(),
          OrderLine.total(lines),
          (100 + i) + " Test Street, QA City",
          i % 2 == 0 ? "Seed order " + (i + 1) : null,
          lines.stream().map(l -> new OrderItemEmbeddable(l.productId(), l.quantity(), l.unitPrice())).toList(),
          now.plusMillis(i)
      ));
    }

    return new SeedCounts(seededUsers.size(), CATEGORIES.size(), seededProducts.size(), ORDER_COUNT);
  }
}
