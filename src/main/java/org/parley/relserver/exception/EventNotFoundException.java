package org.parley.relserver.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when an event does not exist or is not visible in the requested room.
 * Maps to HTTP 404 Not Found with error code "event_not_found".
 */
public class EventNotFoundException extends RelException {

  private static final long serialVersionUID = 1L;

  public static final String ERROR_CODE = "event_not_found";

  /**
   * Constructor with event id.
   *
   * @param eventId the id of the event that was not found
   */
  public EventNotFoundException(String eventId) {
    super("Event not found: " + eventId, ERROR_CODE, HttpStatus.NOT_FOUND);
  }
}
