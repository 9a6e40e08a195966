package com.qasandbox.api.security;

/** Credentials or token do not identify a known user. Mapped to 401. */
public class AuthenticationFailedException extends RuntimeException {

  public AuthenticationFailedException(String message) {
    super(message);
  }
}
