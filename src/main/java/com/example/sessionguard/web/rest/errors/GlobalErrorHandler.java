package com.example.sessionguard.web.rest.errors;

import com.example.sessionguard.exception.RateLimitExceededException;
import com.example.sessionguard.exception.SessionException;
import com.example.sessionguard.exception.UnknownRateLimitPurposeException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

/**
 * Global Error Handler
 *
 * Provides consistent error responses without exposing sensitive information
 */
@Slf4j
@RestControllerAdvice
@RequestMapping(produces = MediaType.APPLICATION_JSON_VALUE)
public class GlobalErrorHandler {

  @ExceptionHandler(RateLimitExceededException.class)
  public ResponseEntity<Map<String, Object>> handleRateLimitExceeded(
      RateLimitExceededException ex, WebRequest request) {
    Map<String, Object> body = createErrorBody(
        HttpStatus.TOO_MANY_REQUESTS,
        "rate_limited",
        ex.getMessage(),
        request
                                              );
    body.put("purpose", ex.getPurpose().pathValue());
    body.put("limit", ex.getLimit());

    return new ResponseEntity<>(body, HttpStatus.TOO_MANY_REQUESTS);
  }

  @ExceptionHandler(SessionException.class)
  public ResponseEntity<Map<String, Object>> handleSessionException(
      SessionException ex, WebRequest request) {
    log.warn("Session error: {}", ex.getMessage());

    Map<String, Object> body = createErrorBody(
        HttpStatus.UNAUTHORIZED,
        "invalid_session",
        "Session is invalid or expired",
        request
                                              );

    return new ResponseEntity<>(body, HttpStatus.UNAUTHORIZED);
  }

  // Redis unreachable or timed out; callers must treat it as a denial
  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<Map<String, Object>> handleDataAccessException(
      DataAccessException ex, WebRequest request) {
    log.error("Session store error", ex);

    Map<String, Object> body = createErrorBody(
        HttpStatus.SERVICE_UNAVAILABLE,
        "store_unavailable",
        "Service temporarily unavailable",
        request
                                              );

    return new ResponseEntity<>(body, HttpStatus.SERVICE_UNAVAILABLE);
  }

  @ExceptionHandler(UnknownRateLimitPurposeException.class)
  public ResponseEntity<Map<String, Object>> handleUnknownPurpose(
      UnknownRateLimitPurposeException ex, WebRequest request) {

    Map<String, Object> body = createErrorBody(
        HttpStatus.NOT_FOUND,
        "unknown_purpose",
        ex.getMessage(),
        request
                                              );

    return new ResponseEntity<>(body, HttpStatus.NOT_FOUND);
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<Map<String, Object>> handleAccessDeniedException(
      AccessDeniedException ex, WebRequest request) {
    log.warn("Access denied: {}", ex.getMessage());

    Map<String, Object> body = createErrorBody(
        HttpStatus.FORBIDDEN,
        "access_denied",
        "Access denied",
        request
                                              );

    return new ResponseEntity<>(body, HttpStatus.FORBIDDEN);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> handleValidationException(
      MethodArgumentNotValidException ex, WebRequest request) {

    String errors = ex.getBindingResult().getFieldErrors().stream()
        .map(FieldError::getDefaultMessage)
        .collect(Collectors.joining(", "));

    Map<String, Object> body = createErrorBody(
        HttpStatus.BAD_REQUEST,
        "validation_error",
        errors,
        request
                                              );

    return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
  }

  @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
  public ResponseEntity<Map<String, Object>> handleBadRequest(
      Exception ex, WebRequest request) {
    log.debug("Rejected request: {}", ex.getMessage());

    Map<String, Object> body = createErrorBody(
        HttpStatus.BAD_REQUEST,
        "invalid_request",
        ex instanceof IllegalArgumentException ? ex.getMessage() : "Malformed request body",
        request
                                              );

    return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<Map<String, Object>> handleMissingParams(
      MissingServletRequestParameterException ex, WebRequest request) {

    Map<String, Object> body = createErrorBody(
        HttpStatus.BAD_REQUEST,
        "missing_parameter",
        String.format("Missing required parameter: %s", ex.getParameterName()),
        request
                                              );

    return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<Map<String, Object>> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {

    Map<String, Object> body = createErrorBody(
        HttpStatus.METHOD_NOT_ALLOWED,
        "method_not_allowed",
        String.format("Method %s not supported", ex.getMethod()),
        request
                                              );

    return new ResponseEntity<>(body, HttpStatus.METHOD_NOT_ALLOWED);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGenericException(
      Exception ex, WebRequest request) {
    log.error("Unexpected error", ex);

    Map<String, Object> body = createErrorBody(
        HttpStatus.INTERNAL_SERVER_ERROR,
        "internal_error",
        "An error occurred processing your request",
        request
                                              );

    return new ResponseEntity<>(body, HttpStatus.INTERNAL_SERVER_ERROR);
  }

  private Map<String, Object> createErrorBody(
      HttpStatus status, String error, String message, WebRequest request) {

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("timestamp", Instant.now());
    body.put("status", status.value());
    body.put("error", error);
    body.put("message", message);
    body.put("path", extractPath(request));

    return body;
  }

  private String extractPath(WebRequest request) {
    String description = request.getDescription(false);
    return description.replace("uri=", "");
  }
}
