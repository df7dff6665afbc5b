package org.parley.relserver.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A persisted room event as held by the event store.
 * The content is immutable; redaction only flips the {@code redacted} marker.
 *
 * @param eventId the globally unique event id
 * @param roomId the room the event was sent to
 * @param type the event type (e.g. m.room.message)
 * @param stateKey the state key for state events, null otherwise
 * @param sender the user that sent the event
 * @param content the event content
 * @param originServerTs the origin server timestamp
 * @param position the position of the event in the room stream
 * @param redacted whether the event has been redacted
 */
public record RoomEvent(
    String eventId,
    String roomId,
    String type,
    String stateKey,
    String sender,
    Map<String, Object> content,
    Instant originServerTs,
    StreamPosition position,
    boolean redacted) {

  /**
   * Creates a room event with validation; the content is copied.
   *
   * @throws IllegalArgumentException if any identifier is blank
   */
  public RoomEvent {
    Objects.requireNonNull(eventId, "Event ID cannot be null");
    Objects.requireNonNull(roomId, "Room ID cannot be null");
    Objects.requireNonNull(type, "Event type cannot be null");
    Objects.requireNonNull(sender, "Sender cannot be null");
    Objects.requireNonNull(originServerTs, "Origin server timestamp cannot be null");
    Objects.requireNonNull(position, "Position cannot be null");

    if (eventId.isBlank()) {
      throw new IllegalArgumentException("Event ID cannot be blank");
    }
    if (roomId.isBlank()) {
      throw new IllegalArgumentException("Room ID cannot be blank");
    }
    if (type.isBlank()) {
      throw new IllegalArgumentException("Event type cannot be blank");
    }

    content = content == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(content));
  }

  public boolean isState() {
    return stateKey != null;
  }

  public boolean isMembership() {
    return EventTypes.MEMBER.equals(type);
  }

  /**
   * Returns the relation this event declares in its content, if any.
   *
   * @return the relation descriptor
   */
  public Optional<RelationDescriptor> relation() {
    return RelationDescriptor.fromContent(content);
  }

  /**
   * Returns a copy of this event carrying the redaction marker.
   *
   * @return the redacted event
   */
  public RoomEvent asRedacted() {
    return new RoomEvent(eventId, roomId, type, stateKey, sender, content,
        originServerTs, position, true);
  }
}
