package com.qasandbox.api.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.web.SecurityFilterChain;

import java.util.Arrays;

/**
 * Security configuration for the sandbox API.
 *
 * - Stateless (JWT only, no sessions), CORS open to any origin
 * - Authentication only: role rules live in AccessPolicy, not in URL matchers
 * - Explicit public endpoints (login, register, health, API docs)
 */
@Configuration
public class SecurityConfig {

    static final String[] DOCS_PATHS = {
        "/docs", "/docs/**", "/swagger-ui.html", "/swagger-ui/**", "/v3/api-docs", "/v3/api-docs/**"
    };

    private static final String[] PUBLIC_GET_PATHS = {"/", "/health", "/api/v1/health", "/error"};

    private static final String[] PUBLIC_POST_PATHS = {"/api/v1/auth/register", "/api/v1/auth/login"};

    @Bean
    @Order(2)
    SecurityFilterChain publicChain(HttpSecurity http) throws Exception {
        return http
            .securityMatcher(concat(PUBLIC_GET_PATHS, PUBLIC_POST_PATHS, DOCS_PATHS))
            .cors(Customizer.withDefaults())
            .csrf(csrf -> csrf.disable())
            .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                .requestMatchers(HttpMethod.GET, PUBLIC_GET_PATHS).permitAll()
                .requestMatchers(HttpMethod.GET, DOCS_PATHS).permitAll()
                .requestMatchers(HttpMethod.POST, PUBLIC_POST_PATHS).permitAll()
                .requestMatchers("/error").permitAll()
                .anyRequest().denyAll()
            )
            .build();
    }

    /** Everything else under /api/** needs a valid bearer token. */
    @Bean
    @Order(3)
    SecurityFilterChain securedApiChain(HttpSecurity http, JwtDecoder jwtDecoder) throws Exception {
        return http
            .securityMatcher("/api/**")
            .cors(Customizer.withDefaults())
            .csrf(csrf -> csrf.disable())
            .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                .anyRequest().authenticated()
            )
            .oauth2ResourceServer(oauth -> oauth
                .jwt(jwt -> jwt
                    .decoder(jwtDecoder)
                    .jwtAuthenticationConverter(new JwtRoleConverter()))
            )
            .build();
    }

    private static String[] concat(String[]... groups) {
        return Arrays.stream(groups).flatMap(Arrays::stream).distinct().toArray(String[]::new);
    }
}
