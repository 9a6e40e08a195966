package com.qasandbox.api.docs;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Public identity of the service, shown on the root endpoint and in the OpenAPI document.
 *
 * @param name    display name, e.g. "QA Testing API"
 * @param version API version string
 * @param docsPath where the interactive docs are served
 */
@ConfigurationProperties(prefix = "qasandbox.api")
public record ApiInfoProperties(String name, String version, String docsPath) {}
