package com.qasandbox.api.security;

/** The user exists but has been deactivated. Mapped to 403. */
public class AccountDisabledException extends RuntimeException {

  public AccountDisabledException(String message) {
    super(message);
  }
}
