package org.parley.relserver.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.f4b6a3.uuid.UuidCreator;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.parley.relserver.domain.RelationEdge;
import org.parley.relserver.domain.RoomEvent;

/**
 * Event recording that a relation event was persisted and indexed.
 * Carries the full source event so another instance can store and index it.
 *
 * @param eventId the log event ID (null to auto-generate)
 * @param roomId the room id
 * @param relationEventId the id of the persisted relation event
 * @param targetEventId the target of the relation
 * @param relationType the relation type wire value
 * @param sourceType the type of the relation event (e.g. m.reaction)
 * @param sender the sender of the relation event
 * @param content the content of the relation event, including the relation descriptor
 * @param originServerTs origin server timestamp of the relation event
 * @param timestamp when this log event was created
 */
public record RelationCreatedEvent(
    @JsonProperty("eventId") String eventId,
    @JsonProperty("roomId") String roomId,
    @JsonProperty("relationEventId") String relationEventId,
    @JsonProperty("targetEventId") String targetEventId,
    @JsonProperty("relationType") String relationType,
    @JsonProperty("sourceType") String sourceType,
    @JsonProperty("sender") String sender,
    @JsonProperty("content") Map<String, Object> content,
    @JsonProperty("originServerTs") Instant originServerTs,
    @JsonProperty("timestamp") Instant timestamp)
    implements RelationEvent {

  /**
   * Creates a new RelationCreatedEvent with validation.
   * If eventId is null, a UUIDv7 will be auto-generated.
   *
   * @throws IllegalArgumentException if any identifier is blank
   */
  public RelationCreatedEvent {
    eventId = (eventId == null) ? UuidCreator.getTimeOrderedEpoch().toString() : eventId;

    Objects.requireNonNull(roomId, "Room ID cannot be null");
    Objects.requireNonNull(relationEventId, "Relation event ID cannot be null");
    Objects.requireNonNull(targetEventId, "Target event ID cannot be null");
    Objects.requireNonNull(relationType, "Relation type cannot be null");
    Objects.requireNonNull(sourceType, "Source type cannot be null");
    Objects.requireNonNull(sender, "Sender cannot be null");
    Objects.requireNonNull(originServerTs, "Origin server timestamp cannot be null");
    Objects.requireNonNull(timestamp, "Timestamp cannot be null");

    if (roomId.isBlank()) {
      throw new IllegalArgumentException("Room ID cannot be blank");
    }
    if (relationEventId.isBlank()) {
      throw new IllegalArgumentException("Relation event ID cannot be blank");
    }
    if (targetEventId.isBlank()) {
      throw new IllegalArgumentException("Target event ID cannot be blank");
    }

    content = content == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(content));
  }

  /**
   * Creates the log event for a freshly persisted relation event.
   *
   * @param event the persisted relation event
   * @param edge the indexed edge
   * @return the log event
   */
  public static RelationCreatedEvent of(RoomEvent event, RelationEdge edge) {
    return new RelationCreatedEvent(
        null,
        event.roomId(),
        event.eventId(),
        edge.targetEventId(),
        edge.relationType().value(),
        event.type(),
        event.sender(),
        event.content(),
        event.originServerTs(),
        Instant.now());
  }

  @JsonIgnore
  @Override
  public AggregateIdentity getAggregateIdentity() {
    return AggregateIdentity.target(roomId, targetEventId);
  }
}
