package org.parley.relserver.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a relation has an invalid shape or an ineligible target,
 * or when a relation type cannot be aggregated.
 * Maps to HTTP 400 Bad Request with error code "invalid_relation".
 */
public class InvalidRelationException extends RelException {

  private static final long serialVersionUID = 1L;

  public static final String ERROR_CODE = "invalid_relation";

  public InvalidRelationException(String message) {
    super(message, ERROR_CODE, HttpStatus.BAD_REQUEST);
  }
}
