package org.parley.relserver.command;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.parley.relserver.domain.RelationType;

/**
 * Command to send a new event that relates to an existing event.
 *
 * @param roomId the room to send to
 * @param parentId the event being related to
 * @param relationType the relation type
 * @param eventType the type of the new event
 * @param key the aggregation key (annotations only), or null
 * @param sender the sending user
 * @param content client-supplied content of the new event
 */
public record SendRelationCommand(
    String roomId,
    String parentId,
    RelationType relationType,
    String eventType,
    String key,
    String sender,
    Map<String, Object> content) implements Command {

  /**
   * Creates a new SendRelationCommand with validation.
   *
   * @throws IllegalArgumentException if any identifier is blank
   */
  public SendRelationCommand {
    Objects.requireNonNull(roomId, "Room ID cannot be null");
    Objects.requireNonNull(parentId, "Parent event ID cannot be null");
    Objects.requireNonNull(relationType, "Relation type cannot be null");
    Objects.requireNonNull(eventType, "Event type cannot be null");
    Objects.requireNonNull(sender, "Sender cannot be null");

    if (roomId.isBlank()) {
      throw new IllegalArgumentException("Room ID cannot be blank");
    }
    if (parentId.isBlank()) {
      throw new IllegalArgumentException("Parent event ID cannot be blank");
    }
    if (eventType.isBlank()) {
      throw new IllegalArgumentException("Event type cannot be blank");
    }
    if (sender.isBlank()) {
      throw new IllegalArgumentException("Sender cannot be blank");
    }

    content = content == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(content));
  }
}
