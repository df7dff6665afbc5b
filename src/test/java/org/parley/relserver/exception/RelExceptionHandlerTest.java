package org.parley.relserver.exception;

import static org.assertj.core.api.Assertions.assertThat;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.parley.relserver.dto.ProblemDetail;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Unit tests for RelExceptionHandler.
 */
class RelExceptionHandlerTest {

  private SimpleMeterRegistry meterRegistry;
  private RelExceptionHandler handler;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    handler = new RelExceptionHandler(meterRegistry);
  }

  @Test
  void handleRelException_shouldMapNotFoundToProblemJson() {
    ResponseEntity<ProblemDetail> response =
        handler.handleRelException(new EventNotFoundException("$missing"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getHeaders().getContentType()).isNotNull();
    assertThat(response.getHeaders().getContentType().toString())
        .isEqualTo("application/problem+json");
    assertThat(response.getBody()).isNotNull();
    assertThat(response.getBody().getCode()).isEqualTo(EventNotFoundException.ERROR_CODE);
    assertThat(response.getBody().getStatus()).isEqualTo(404);
    assertThat(response.getBody().getTitle()).contains("$missing");
  }

  @Test
  void handleRelException_shouldMapPermissionDeniedToForbidden() {
    ResponseEntity<ProblemDetail> response = handler.handleRelException(
        new PermissionDeniedException("@eve:test", "!room:test"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    assertThat(response.getBody().getCode()).isEqualTo(PermissionDeniedException.ERROR_CODE);
  }

  @Test
  void handleInvalidCursor_shouldAddRecoveryHint() {
    ResponseEntity<ProblemDetail> response =
        handler.handleInvalidCursor(new InvalidCursorException("Malformed pagination token"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().getCode()).isEqualTo(InvalidCursorException.ERROR_CODE);
    assertThat(response.getBody().getExtras())
        .containsEntry("hint", RelExceptionHandler.CURSOR_HINT);
  }

  @Test
  void handleIllegalArgument_shouldReturnInvalidArgument() {
    ResponseEntity<ProblemDetail> response = handler.handleIllegalArgument(
        new IllegalArgumentException("Limit must be between 1 and 1000"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().getCode()).isEqualTo(RelExceptionHandler.INVALID_ARGUMENT);
    assertThat(response.getBody().getTitle()).isEqualTo("Limit must be between 1 and 1000");
  }

  @Test
  void handlers_shouldCountErrorsByCode() {
    handler.handleRelException(new EventNotFoundException("$a"));
    handler.handleRelException(new EventNotFoundException("$b"));
    handler.handleIllegalArgument(new IllegalArgumentException("bad"));

    assertThat(meterRegistry.counter("relations.errors", "code", "event_not_found").count())
        .isEqualTo(2.0);
    assertThat(meterRegistry.counter("relations.errors", "code", "invalid_argument").count())
        .isEqualTo(1.0);
  }
}
