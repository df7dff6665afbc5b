package org.parley.relserver.exception;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import org.parley.relserver.dto.ProblemDetail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Global exception handler for relation server exceptions.
 * Converts exceptions to RFC 7807 problem+json responses.
 */
@ControllerAdvice
public class RelExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(RelExceptionHandler.class);

  private static final MediaType PROBLEM_JSON =
      MediaType.parseMediaType("application/problem+json");

  static final String INVALID_ARGUMENT = "invalid_argument";
  static final String CURSOR_HINT = "Restart pagination by repeating the request without 'from'";

  private final MeterRegistry meterRegistry;

  /**
   * Constructs a RelExceptionHandler.
   *
   * @param meterRegistry the meter registry for error counters
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "MeterRegistry is a Spring-managed bean, not a mutable data structure"
  )
  public RelExceptionHandler(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  /**
   * Handle invalid pagination tokens, adding a hint on how to recover.
   *
   * @param ex the invalid cursor exception
   * @return RFC 7807 problem+json response
   */
  @ExceptionHandler(InvalidCursorException.class)
  @SuppressWarnings("PMD.LooseCoupling") // HttpHeaders provides Spring-specific utility methods
  public ResponseEntity<ProblemDetail> handleInvalidCursor(InvalidCursorException ex) {
    logger.debug("Rejected pagination token: {}", ex.getMessage());
    countError(ex.getCode());

    ProblemDetail problem = new ProblemDetail(ex.getMessage(), ex.getStatus(), ex.getCode());
    problem.putExtra("hint", CURSOR_HINT);
    return respond(problem);
  }

  /**
   * Handle all RelException instances.
   *
   * @param ex the relation server exception
   * @return RFC 7807 problem+json response
   */
  @ExceptionHandler(RelException.class)
  public ResponseEntity<ProblemDetail> handleRelException(RelException ex) {
    logger.debug("Request failed with {}: {}", ex.getCode(), ex.getMessage());
    countError(ex.getCode());

    return respond(new ProblemDetail(ex.getMessage(), ex.getStatus(), ex.getCode()));
  }

  /**
   * Handle IllegalArgumentException (e.g., malformed relation type or bad limit).
   *
   * @param ex the illegal argument exception
   * @return RFC 7807 problem+json response with 400 Bad Request
   */
  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex) {
    countError(INVALID_ARGUMENT);
    return respond(new ProblemDetail(
        ex.getMessage(), HttpStatus.BAD_REQUEST.value(), INVALID_ARGUMENT));
  }

  /**
   * Handle a missing acting-user header.
   *
   * @param ex the missing header exception
   * @return RFC 7807 problem+json response with 400 Bad Request
   */
  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ProblemDetail> handleMissingHeader(MissingRequestHeaderException ex) {
    countError(INVALID_ARGUMENT);
    return respond(new ProblemDetail(
        "Missing required header: " + ex.getHeaderName(),
        HttpStatus.BAD_REQUEST.value(),
        INVALID_ARGUMENT));
  }

  /**
   * Handle request parameters of the wrong type (e.g. a non-numeric limit).
   *
   * @param ex the type mismatch exception
   * @return RFC 7807 problem+json response with 400 Bad Request
   */
  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ProblemDetail> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    countError(INVALID_ARGUMENT);
    return respond(new ProblemDetail(
        "Invalid value for parameter '" + ex.getName() + "'",
        HttpStatus.BAD_REQUEST.value(),
        INVALID_ARGUMENT));
  }

  /**
   * Handle request bodies that fail bean validation.
   *
   * @param ex the validation exception
   * @return RFC 7807 problem+json response with 400 Bad Request
   */
  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ProblemDetail> handleInvalidBody(MethodArgumentNotValidException ex) {
    countError(INVALID_ARGUMENT);
    String message = ex.getBindingResult().getFieldErrors().stream()
        .map(FieldError::getDefaultMessage)
        .findFirst()
        .orElse("Invalid request body");
    return respond(new ProblemDetail(message, HttpStatus.BAD_REQUEST.value(), INVALID_ARGUMENT));
  }

  /**
   * Handle request bodies that are not a JSON object.
   *
   * @param ex the unreadable message exception
   * @return RFC 7807 problem+json response with 400 Bad Request
   */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ProblemDetail> handleUnreadableBody(HttpMessageNotReadableException ex) {
    countError(INVALID_ARGUMENT);
    return respond(new ProblemDetail(
        "Request body must be a JSON object",
        HttpStatus.BAD_REQUEST.value(),
        INVALID_ARGUMENT));
  }

  @SuppressWarnings("PMD.LooseCoupling") // HttpHeaders provides Spring-specific utility methods
  private ResponseEntity<ProblemDetail> respond(ProblemDetail problem) {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(PROBLEM_JSON);
    return new ResponseEntity<>(problem, headers, HttpStatus.valueOf(problem.getStatus()));
  }

  private void countError(String code) {
    meterRegistry.counter("relations.errors", "code", code).increment();
  }
}
