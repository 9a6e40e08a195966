package com.qasandbox.api.seed;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Seed data config.
 *
 * @param enabled load the fixture data on startup when the users table is empty
 */
@ConfigurationProperties(prefix = "qasandbox.seed")
public record SeedProperties(boolean enabled) {}
