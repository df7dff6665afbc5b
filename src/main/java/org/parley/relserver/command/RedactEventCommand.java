package org.parley.relserver.command;

import java.util.Objects;

/**
 * Command to redact an event.
 *
 * @param roomId the room of the event
 * @param eventId the event to redact
 * @param sender the redacting user
 * @param reason optional reason
 */
public record RedactEventCommand(
    String roomId,
    String eventId,
    String sender,
    String reason) implements Command {

  /**
   * Creates a new RedactEventCommand with validation.
   *
   * @throws IllegalArgumentException if any identifier is blank
   */
  public RedactEventCommand {
    Objects.requireNonNull(roomId, "Room ID cannot be null");
    Objects.requireNonNull(eventId, "Event ID cannot be null");
    Objects.requireNonNull(sender, "Sender cannot be null");

    if (eventId.isBlank()) {
      throw new IllegalArgumentException("Event ID cannot be blank");
    }
  }
}
