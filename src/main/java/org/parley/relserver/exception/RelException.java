package org.parley.relserver.exception;

import org.springframework.http.HttpStatus;

/**
 * Base exception for relation server errors.
 * Carries a stable error code and the HTTP status it maps to.
 */
public class RelException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final String code;
  private final int status;

  /**
   * Constructor with message, code, and status.
   *
   * @param message error message
   * @param code stable error code
   * @param status HTTP status
   */
  public RelException(String message, String code, HttpStatus status) {
    super(message);
    this.code = code;
    this.status = status.value();
  }

  /**
   * Constructor with message, code, status, and cause.
   *
   * @param message error message
   * @param code stable error code
   * @param status HTTP status
   * @param cause the cause
   */
  public RelException(String message, String code, HttpStatus status, Throwable cause) {
    super(message, cause);
    this.code = code;
    this.status = status.value();
  }

  public String getCode() {
    return code;
  }

  public int getStatus() {
    return status;
  }
}
