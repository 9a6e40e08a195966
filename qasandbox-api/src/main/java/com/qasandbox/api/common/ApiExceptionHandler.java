package com.qasandbox.api.common;

import com.qasandbox.api.security.AccountDisabledException;
import com.qasandbox.api.security.AuthenticationFailedException;
import com.qasandbox.domain.NotFoundException;
import com.qasandbox.domain.access.PermissionDeniedException;
import com.qasandbox.domain.order.InsufficientStockException;
import com.qasandbox.domain.order.InvalidTransitionException;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
    return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
  }

  @ExceptionHandler({MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class})
  public ResponseEntity<Map<String, Object>> unreadable(Exception ex) {
    return error(HttpStatus.BAD_REQUEST, "bad_request", "invalid_request");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException ex) {
    Map<String, String> fields = new HashMap<>();
    for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
      fields.put(fe.getField(), fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
    }
    Map<String, Object> body = body("validation_error", "invalid_request");
    body.put("fields", fields);
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<Map<String, Object>> validation(ConstraintViolationException ex) {
    return error(HttpStatus.BAD_REQUEST, "validation_error", ex.getMessage());
  }

  @ExceptionHandler(AuthenticationFailedException.class)
  public ResponseEntity<Map<String, Object>> unauthorized(AuthenticationFailedException ex) {
    return error(HttpStatus.UNAUTHORIZED, "unauthorized", ex.getMessage());
  }

  @ExceptionHandler(AccountDisabledException.class)
  public ResponseEntity<Map<String, Object>> disabled(AccountDisabledException ex) {
    return error(HttpStatus.FORBIDDEN, "account_disabled", ex.getMessage());
  }

  @ExceptionHandler(PermissionDeniedException.class)
  public ResponseEntity<Map<String, Object>> forbidden(PermissionDeniedException ex) {
    return error(HttpStatus.FORBIDDEN, "forbidden", ex.getMessage());
  }

  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<Map<String, Object>> notFound(NotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
  }

  @ExceptionHandler(InvalidTransitionException.class)
  public ResponseEntity<Map<String, Object>> invalidTransition(InvalidTransitionException ex) {
    Map<String, Object> body = body("invalid_transition", ex.getMessage());
    body.put("from", ex.from().value());
    body.put("to", ex.to().value());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
  }

  @ExceptionHandler(InsufficientStockException.class)
  public ResponseEntity<Map<String, Object>> insufficientStock(InsufficientStockException ex) {
    Map<String, Object> body = body("insufficient_stock", ex.getMessage());
    body.put("productId", ex.productId());
    body.put("requested", ex.requested());
    body.put("available", ex.available());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
  }

  @ExceptionHandler(DataIntegrityViolationException.class)
  public ResponseEntity<Map<String, Object>> conflict(DataIntegrityViolationException ex) {
    log.warn("Data integrity violation: {}", ex.getMostSpecificCause().getMessage());
    return error(HttpStatus.CONFLICT, "conflict", "Request conflicts with existing data");
  }

  private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String reason, String message) {
    return ResponseEntity.status(status).body(body(reason, message));
  }

  private static Map<String, Object> body(String reason, String message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "error");
    body.put("reason", reason);
    body.put("message", message == null ? "invalid_request" : message);
    body.put("ts", Instant.now().toString());
    return body;
  }
}
