package com.opsdash.coordination.controller;

import com.opsdash.coordination.exception.BusConnectionException;
import com.opsdash.coordination.exception.NotConnectedException;
import com.opsdash.coordination.exception.NotFoundException;
import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
  }

  @ExceptionHandler({BusConnectionException.class, NotConnectedException.class})
  public ResponseEntity<ErrorResponse> handleBusUnavailable(RuntimeException ex) {
    log.warn("Event bus unavailable: {}", ex.getMessage());
    return error(HttpStatus.SERVICE_UNAVAILABLE, "bus_unavailable", ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    String message = ex.getBindingResult().getFieldErrors().stream()
        .map(fieldError -> fieldError.getField() + " " + fieldError.getDefaultMessage())
        .collect(Collectors.joining(", "));
    return error(HttpStatus.BAD_REQUEST, "validation_failed", message);
  }

  @ExceptionHandler({
      IllegalArgumentException.class,
      HttpMessageNotReadableException.class,
      ConstraintViolationException.class
  })
  public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
    return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
  }

  private ResponseEntity<ErrorResponse> error(HttpStatus status, String error, String message) {
    return ResponseEntity.status(status).body(new ErrorResponse(error, message, Instant.now()));
  }

  public record ErrorResponse(String error, String message, Instant timestamp) {}
}
