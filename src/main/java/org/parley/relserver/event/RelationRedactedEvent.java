package org.parley.relserver.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.f4b6a3.uuid.UuidCreator;
import java.time.Instant;
import java.util.Objects;

/**
 * Event recording that an event was redacted.
 * When the redacted event was a relation, {@code targetEventId} is the target
 * of that relation; otherwise it is the redacted event itself.
 *
 * @param eventId the log event ID (null to auto-generate)
 * @param roomId the room id
 * @param redactedEventId the event that was redacted
 * @param targetEventId the aggregate the redaction affects
 * @param redactionEventId the id of the redaction event
 * @param sender the user that redacted
 * @param timestamp when this log event was created
 */
public record RelationRedactedEvent(
    @JsonProperty("eventId") String eventId,
    @JsonProperty("roomId") String roomId,
    @JsonProperty("redactedEventId") String redactedEventId,
    @JsonProperty("targetEventId") String targetEventId,
    @JsonProperty("redactionEventId") String redactionEventId,
    @JsonProperty("sender") String sender,
    @JsonProperty("timestamp") Instant timestamp)
    implements RelationEvent {

  /**
   * Creates a new RelationRedactedEvent with validation.
   * If eventId is null, a UUIDv7 will be auto-generated.
   */
  public RelationRedactedEvent {
    eventId = (eventId == null) ? UuidCreator.getTimeOrderedEpoch().toString() : eventId;

    Objects.requireNonNull(roomId, "Room ID cannot be null");
    Objects.requireNonNull(redactedEventId, "Redacted event ID cannot be null");
    Objects.requireNonNull(targetEventId, "Target event ID cannot be null");
    Objects.requireNonNull(redactionEventId, "Redaction event ID cannot be null");
    Objects.requireNonNull(sender, "Sender cannot be null");
    Objects.requireNonNull(timestamp, "Timestamp cannot be null");

    if (redactedEventId.isBlank()) {
      throw new IllegalArgumentException("Redacted event ID cannot be blank");
    }
  }

  @JsonIgnore
  @Override
  public AggregateIdentity getAggregateIdentity() {
    return AggregateIdentity.target(roomId, targetEventId);
  }
}
