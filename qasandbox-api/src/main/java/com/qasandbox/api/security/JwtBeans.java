package com.qasandbox.api.security;

import com.nimbusds.jose.jwk.source.ImmutableSecret;
import com.nimbusds.jose.proc.SecurityContext;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtValidators;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Token plumbing: one HS256 signing key shared by the encoder (login) and the decoder
 * (resource server). Decoded tokens must carry our issuer as well as a valid signature and expiry.
 */
@Configuration
public class JwtBeans {

  static final String DEV_FALLBACK_SECRET = "dev-secret-change-me";

  @Bean
  public PasswordEncoder passwordEncoder() {
    return new BCryptPasswordEncoder();
  }

  @Bean
  public SecretKey jwtSigningKey(@Value("${qasandbox.auth.jwtSecret:}") String secret, Environment env) {
    String configured = secret == null ? "" : secret.trim();
    if (configured.isEmpty()) {
      if (!env.acceptsProfiles(Profiles.of("dev"))) {
        throw new IllegalStateException("qasandbox.auth.jwtSecret is empty. Set QASANDBOX_JWT_SECRET.");
      }
      configured = DEV_FALLBACK_SECRET;
    }
    return new SecretKeySpec(sha256(configured), "HmacSHA256");
  }

  @Bean
  public JwtEncoder jwtEncoder(SecretKey jwtSigningKey) {
    return new NimbusJwtEncoder(new ImmutableSecret<SecurityContext>(jwtSigningKey));
  }

  @Bean
  public JwtDecoder jwtDecoder(SecretKey jwtSigningKey, @Value("${qasandbox.auth.issuer}") String issuer) {
    NimbusJwtDecoder decoder = NimbusJwtDecoder.withSecretKey(jwtSigningKey)
        .macAlgorithm(MacAlgorithm.HS256)
        .build();
    decoder.setJwtValidator(JwtValidators.createDefaultWithIssuer(issuer));
    return decoder;
  }

  // Any secret length works: the key is always the 32-byte digest.
  private static byte[] sha256(String secret) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(secret.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
