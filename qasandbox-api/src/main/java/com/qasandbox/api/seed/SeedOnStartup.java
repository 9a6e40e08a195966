package com.qasandbox.api.seed;

import com.qasandbox.infrastructure.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Loads the fixture data once, on a fresh database.
 */
@Component
public class SeedOnStartup implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(SeedOnStartup.class);

  private final SeedProperties props;
  private final UserRepository users;
  private final DataSeeder seeder;

  public SeedOnStartup(SeedProperties props, UserRepository users, DataSeeder seeder) {
    this.props = props;
    this.users = users;
    this.seeder = seeder;
  }

  @Override
  public void run(ApplicationArguments args) {
    if (!props.enabled()) {
      log.info("Seed disabled (qasandbox.seed.enabled=false)");
      return;
    }
    if (users.count() > 0) {
      log.info("Seed skipped: database already has users");
      return;
    }
    var counts = seeder.seed();
    log.info("Seed loaded: {}", counts);
  }
}
