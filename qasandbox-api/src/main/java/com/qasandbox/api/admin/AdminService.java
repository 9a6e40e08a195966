package com.qasandbox.api.admin;

import com.qasandbox.api.seed.DataSeeder;
import com.qasandbox.domain.access.AccessPolicy;
import com.qasandbox.domain.access.Action;
import com.qasandbox.domain.access.Principal;
import com.qasandbox.domain.access.ResourceType;
import com.qasandbox.infrastructure.catalog.CategoryRepository;
import com.qasandbox.infrastructure.catalog.ProductRepository;
import com.qasandbox.infrastructure.order.OrderRepository;
import com.qasandbox.infrastructure.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AdminService {

  private static final Logger log = LoggerFactory.getLogger(AdminService.class);

  private final AccessPolicy accessPolicy;
  private final DataSeeder seeder;
  private final AdminAuditService audit;
  private final UserRepository users;
  private final CategoryRepository categories;
  private final ProductRepository products;
  private final OrderRepository orders;

  public AdminService(
      AccessPolicy accessPolicy,
      DataSeeder seeder,
      AdminAuditService audit,
      UserRepository users,
      CategoryRepository categories,
      ProductRepository products,
      OrderRepository orders
  ) {
    this.accessPolicy = accessPolicy;
    this.seeder = seeder;
    this.audit = audit;
    this.users = users;
    this.categories = categories;
    this.products = products;
    this.orders = orders;
  }

  public record Stats(long users, long categories, long products, long orders) {}

  /**
   * Wipes users, catalog and orders and loads the fixture data again.
   * User ids change, so tokens issued before the reset stop resolving.
   */
  @Transactional
  public DataSeeder.SeedCounts reset(Principal principal) {
    accessPolicy.require(principal, Action.ADMIN, ResourceType.ADMIN_OPS);
    seeder.clear();
    DataSeeder.SeedCounts counts = seeder.seed();
    audit.log(principal, "DATABASE_RESET", "database", null);
    log.warn("Database reset by userId={}: {}", principal.id(), counts);
    return counts;
  }

  @Transactional(readOnly = true)
  public Stats stats(Principal principal) {
    accessPolicy.require(principal, Action.READ, ResourceType.ADMIN_OPS);
    return new Stats(users.count(), categories.count(), products.count(), orders.count());
  }
}
