package org.parley.relserver.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a pagination token is malformed, of an unsupported version,
 * or was issued for a different query.
 * Maps to HTTP 400 Bad Request with error code "invalid_cursor".
 */
public class InvalidCursorException extends RelException {

  private static final long serialVersionUID = 1L;

  public static final String ERROR_CODE = "invalid_cursor";

  /**
   * Constructor with message.
   *
   * @param message what is wrong with the token
   */
  public InvalidCursorException(String message) {
    super(message, ERROR_CODE, HttpStatus.BAD_REQUEST);
  }

  /**
   * Constructor with message and cause.
   *
   * @param message what is wrong with the token
   * @param cause the decoding failure
   */
  public InvalidCursorException(String message, Throwable cause) {
    super(message, ERROR_CODE, HttpStatus.BAD_REQUEST, cause);
  }
}
