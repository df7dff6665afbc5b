package org.parley.relserver.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An event that has not been persisted yet.
 * The event store assigns the stream position, and the event id unless one
 * is supplied (events replicated from another instance keep their id).
 *
 * @param eventId the event id to keep, or null to have one generated
 * @param roomId the target room
 * @param type the event type
 * @param stateKey the state key, null for non-state events
 * @param sender the sending user
 * @param content the event content
 * @param originServerTs the origin server timestamp
 */
public record EventDraft(
    String eventId,
    String roomId,
    String type,
    String stateKey,
    String sender,
    Map<String, Object> content,
    Instant originServerTs) {

  /**
   * Creates an event draft.
   */
  public EventDraft {
    Objects.requireNonNull(roomId, "Room ID cannot be null");
    Objects.requireNonNull(type, "Event type cannot be null");
    Objects.requireNonNull(sender, "Sender cannot be null");
    Objects.requireNonNull(originServerTs, "Origin server timestamp cannot be null");
    content = content == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(content));
  }

  /**
   * Creates a draft for a new message-like event sent now.
   *
   * @param roomId the target room
   * @param type the event type
   * @param sender the sending user
   * @param content the event content
   * @return the draft
   */
  public static EventDraft message(String roomId, String type, String sender,
      Map<String, Object> content) {
    return new EventDraft(null, roomId, type, null, sender, content, Instant.now());
  }

  /**
   * Creates a draft for a new state event sent now.
   *
   * @param roomId the target room
   * @param type the event type
   * @param stateKey the state key
   * @param sender the sending user
   * @param content the event content
   * @return the draft
   */
  public static EventDraft state(String roomId, String type, String stateKey, String sender,
      Map<String, Object> content) {
    Objects.requireNonNull(stateKey, "State key cannot be null");
    return new EventDraft(null, roomId, type, stateKey, sender, content, Instant.now());
  }
}
