package com.qasandbox.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.qasandbox")
@EnableJpaRepositories(basePackages = "com.qasandbox")
@EntityScan(basePackages = "com.qasandbox")
@ConfigurationPropertiesScan(basePackages = "com.qasandbox")
public class QaSandboxApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(QaSandboxApiApplication.class, args);
  }
}
