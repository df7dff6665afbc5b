package org.parley.relserver.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when the membership collaborator rejects the acting user.
 * Maps to HTTP 403 Forbidden with error code "forbidden".
 */
public class PermissionDeniedException extends RelException {

  private static final long serialVersionUID = 1L;

  public static final String ERROR_CODE = "forbidden";

  /**
   * Constructor with user and room.
   *
   * @param userId the acting user
   * @param roomId the room the user tried to access
   */
  public PermissionDeniedException(String userId, String roomId) {
    super("User " + userId + " is not in room " + roomId, ERROR_CODE, HttpStatus.FORBIDDEN);
  }
}
