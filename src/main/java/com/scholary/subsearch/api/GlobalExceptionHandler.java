package com.scholary.subsearch.api;

import com.scholary.subsearch.index.IndexCorruptedException;
import com.scholary.subsearch.index.IndexException;
import com.scholary.subsearch.index.IndexNotFoundException;
import com.scholary.subsearch.index.InvalidQueryException;
import jakarta.servlet.http.HttpServletRequest;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

/** Maps exceptions from the API to {@link ErrorResponse} bodies. */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(IndexNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleIndexNotFound(
      IndexNotFoundException e, HttpServletRequest request) {
    LOGGER.warn("Index not found: {}", e.getMessage());
    return respond(HttpStatus.NOT_FOUND, "INDEX_NOT_FOUND", e.getMessage(), request);
  }

  @ExceptionHandler(IndexCorruptedException.class)
  public ResponseEntity<ErrorResponse> handleIndexCorrupted(
      IndexCorruptedException e, HttpServletRequest request) {
    LOGGER.error("Index corrupted: {}", e.getMessage(), e);
    return respond(HttpStatus.CONFLICT, "INDEX_CORRUPTED", e.getMessage(), request);
  }

  @ExceptionHandler(IndexException.class)
  public ResponseEntity<ErrorResponse> handleIndex(IndexException e, HttpServletRequest request) {
    LOGGER.error("Index failure: {}", e.getMessage(), e);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INDEX_ERROR", e.getMessage(), request);
  }

  @ExceptionHandler(InvalidQueryException.class)
  public ResponseEntity<ErrorResponse> handleInvalidQuery(
      InvalidQueryException e, HttpServletRequest request) {
    LOGGER.warn("Invalid query: {}", e.getMessage());
    return respond(HttpStatus.BAD_REQUEST, "INVALID_QUERY", e.getMessage(), request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(
      MethodArgumentNotValidException e, HttpServletRequest request) {
    String message =
        e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    LOGGER.warn("Validation failed: {}", message);
    return respond(HttpStatus.UNPROCESSABLE_ENTITY, "VALIDATION_FAILED", message, request);
  }

  @ExceptionHandler(HandlerMethodValidationException.class)
  public ResponseEntity<ErrorResponse> handleMethodValidation(
      HandlerMethodValidationException e, HttpServletRequest request) {
    String message =
        e.getAllValidationResults().stream()
            .flatMap(result -> result.getResolvableErrors().stream())
            .map(MessageSourceResolvable::getDefaultMessage)
            .collect(Collectors.joining(", "));
    LOGGER.warn("Validation failed: {}", message);
    return respond(HttpStatus.UNPROCESSABLE_ENTITY, "VALIDATION_FAILED", message, request);
  }

  @ExceptionHandler({
    MissingServletRequestParameterException.class,
    HttpMessageNotReadableException.class,
    IllegalArgumentException.class
  })
  public ResponseEntity<ErrorResponse> handleBadRequest(Exception e, HttpServletRequest request) {
    LOGGER.warn("Bad request: {}", e.getMessage());
    return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage(), request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(Exception e, HttpServletRequest request) {
    LOGGER.error("Unexpected error on {}", request.getRequestURI(), e);
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred", request);
  }

  private static ResponseEntity<ErrorResponse> respond(
      HttpStatus status, String code, String message, HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(ErrorResponse.of(code, message, request.getRequestURI()));
  }
}
