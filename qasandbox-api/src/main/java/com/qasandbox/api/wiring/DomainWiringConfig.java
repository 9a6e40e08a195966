package com.qasandbox.api.wiring;

import com.qasandbox.domain.access.AccessPolicy;
import com.qasandbox.domain.access.VisibilityFilter;
import com.qasandbox.domain.order.OrderLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the framework-free domain rules as beans.
 */
@Configuration
public class DomainWiringConfig {

    @Bean
    public AccessPolicy accessPolicy() {
        return new AccessPolicy();
    }

    @Bean
    public VisibilityFilter visibilityFilter() {
        return new VisibilityFilter();
    }

    @Bean
    public OrderLifecycle orderLifecycle() {
        return new OrderLifecycle();
    }
}
