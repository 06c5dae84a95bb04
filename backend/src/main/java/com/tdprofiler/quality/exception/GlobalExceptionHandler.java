package com.tdprofiler.quality.exception;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import lombok.extern.slf4j.Slf4j;

/**
 * Translates exceptions raised by the controllers into {@link ErrorResponse} bodies. Client
 * mistakes are logged at warn level; anything unexpected is logged with its stack trace and
 * reported as a 500 without internal details, unless debug output is enabled outside production.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final String PRODUCTION = "production";

  @Value("${app.environment:production}")
  private String environment;

  @Value("${app.debug.enabled:false}")
  private boolean debugEnabled;

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
      IllegalArgumentException ex, WebRequest request) {
    log.warn("Rejected request to {}: {}", pathOf(request), ex.getMessage());
    return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidationExceptions(
      MethodArgumentNotValidException ex, WebRequest request) {
    Map<String, String> errors = new LinkedHashMap<>();
    for (ObjectError error : ex.getBindingResult().getAllErrors()) {
      String field =
          error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
      errors.putIfAbsent(field, error.getDefaultMessage());
    }
    log.warn("Validation failed for {}: {}", pathOf(request), errors);

    return ResponseEntity.badRequest()
        .body(
            base(HttpStatus.BAD_REQUEST, "Invalid request data", request)
                .error("Validation Failed")
                .validationErrors(Map.copyOf(errors))
                .build());
  }

  @ExceptionHandler(MissingServletRequestPartException.class)
  public ResponseEntity<ErrorResponse> handleMissingPart(
      MissingServletRequestPartException ex, WebRequest request) {
    log.warn("Missing multipart part '{}'", ex.getRequestPartName());
    return respond(
        HttpStatus.BAD_REQUEST,
        "Required part '" + ex.getRequestPartName() + "' is missing",
        request);
  }

  @ExceptionHandler(ResourceNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
      ResourceNotFoundException ex, WebRequest request) {
    log.info("{}: {}", ex.getMessage(), pathOf(request));
    return respond(HttpStatus.NOT_FOUND, ex.getMessage(), request);
  }

  @ExceptionHandler(RateLimitExceededException.class)
  public ResponseEntity<ErrorResponse> handleRateLimitExceeded(
      RateLimitExceededException ex, WebRequest request) {
    log.warn("Rate limit hit for '{}', retry after {}s", ex.getAction(), ex.getRetryAfterSeconds());
    return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
        .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
        .body(
            base(HttpStatus.TOO_MANY_REQUESTS, ex.getMessage(), request)
                .error("Rate limit exceeded")
                .action(ex.getAction())
                .retryAfterSeconds(ex.getRetryAfterSeconds())
                .build());
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ErrorResponse> handleMaxUploadSizeExceeded(
      MaxUploadSizeExceededException ex, WebRequest request) {
    log.warn("Upload rejected by multipart limit: {}", ex.getMessage());
    return respond(
        HttpStatus.PAYLOAD_TOO_LARGE, "File size exceeds the maximum allowed size", request);
  }

  @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
  public ResponseEntity<ErrorResponse> handleNotFoundExceptions(Exception ex, WebRequest request) {
    log.debug("No handler for {}", pathOf(request));
    return respond(HttpStatus.NOT_FOUND, "The requested resource was not found", request);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ErrorResponse> handleHttpRequestMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {
    String message = String.format("Request method '%s' is not supported", ex.getMethod());
    log.warn("{} on {}", message, pathOf(request));
    return respond(HttpStatus.METHOD_NOT_ALLOWED, message, request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
      HttpMessageNotReadableException ex, WebRequest request) {
    log.warn("Unreadable body for {}: {}", pathOf(request), ex.getMessage());
    return respond(HttpStatus.BAD_REQUEST, "Malformed JSON request", request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGlobalException(Exception ex, WebRequest request) {
    log.error("Unexpected error while handling {}", pathOf(request), ex);

    ErrorResponse.ErrorResponseBuilder body =
        base(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", request);
    if (debugEnabled && !PRODUCTION.equals(environment)) {
      body.debugMessage(ex.getMessage());
    }
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body.build());
  }

  private ResponseEntity<ErrorResponse> respond(
      HttpStatus status, String message, WebRequest request) {
    return ResponseEntity.status(status).body(base(status, message, request).build());
  }

  private static ErrorResponse.ErrorResponseBuilder base(
      HttpStatus status, String message, WebRequest request) {
    return ErrorResponse.builder()
        .timestamp(LocalDateTime.now())
        .status(status.value())
        .error(status.getReasonPhrase())
        .message(message)
        .path(pathOf(request));
  }

  private static String pathOf(WebRequest request) {
    return request.getDescription(false).replace("uri=", "");
  }
}
