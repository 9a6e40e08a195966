package com.qasandbox.api;

import com.qasandbox.domain.access.AccessPolicy;
import com.qasandbox.domain.access.VisibilityFilter;
import com.qasandbox.domain.order.OrderLifecycle;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * If this fails, the service is not starting in a controlled test environment.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class ApiContextLoadsTest {

  @Autowired AccessPolicy accessPolicy;
  @Autowired VisibilityFilter visibilityFilter;
  @Autowired OrderLifecycle orderLifecycle;

  @Test
  void domainRulesAreWired() {
    assertThat(accessPolicy).isNotNull();
    assertThat(visibilityFilter).isNotNull();
    assertThat(orderLifecycle).isNotNull();
  }
}
