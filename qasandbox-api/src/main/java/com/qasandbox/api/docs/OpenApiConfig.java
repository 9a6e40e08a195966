package com.qasandbox.api.docs;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  static final String BEARER_SCHEME = "bearerAuth";

  private static final String DESCRIPTION = """
      REST API for manual QA practice: JWT authentication, role-based authorization \
      (admin, tester, viewer), CRUD with filtering and paging, and a data reset.

      Test credentials: admin / admin123, tester / tester123, viewer / viewer123.

      1. Call `POST /api/v1/auth/login` with username and password.
      2. Copy `accessToken` from the response.
      3. Click "Authorize" and paste the token (without the "Bearer " prefix).

      `POST /api/v1/admin/reset` (admin only) restores the initial data set.
      """;

  @Bean
  public OpenAPI apiInfo(ApiInfoProperties props) {
    return new OpenAPI()
        .info(new Info()
            .title(props.name())
            .version(props.version())
            .description(DESCRIPTION))
        .components(new Components()
            .addSecuritySchemes(BEARER_SCHEME, new SecurityScheme()
                .type(SecurityScheme.Type.HTTP)
                .scheme("bearer")
                .bearerFormat("JWT")))
        .addSecurityItem(new SecurityRequirement().addList(BEARER_SCHEME));
  }
}
