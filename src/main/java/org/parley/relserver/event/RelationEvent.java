package org.parley.relserver.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.time.Instant;

/**
 * Base interface for events published to the relation event log.
 * Events are immutable and describe a change that was already applied locally;
 * other instances replay them to converge their relation index.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "eventType")
@JsonSubTypes({
    @JsonSubTypes.Type(value = RelationCreatedEvent.class, name = "RelationCreated"),
    @JsonSubTypes.Type(value = RelationRedactedEvent.class, name = "RelationRedacted")
})
public sealed interface RelationEvent
    permits RelationCreatedEvent, RelationRedactedEvent {

  /**
   * Returns the globally unique log event ID (UUIDv7).
   * Used by the projector to skip events re-delivered by Kafka.
   *
   * @return the event ID
   */
  String eventId();

  /**
   * Gets the timestamp when this event occurred.
   *
   * @return the event timestamp
   */
  Instant timestamp();

  /**
   * Gets the room this event applies to.
   *
   * @return the room id
   */
  String roomId();

  /**
   * Returns the aggregate identity for partitioning.
   * All events concerning the same target event share a partition key so
   * they are consumed in order.
   *
   * @return the aggregate identity
   */
  AggregateIdentity getAggregateIdentity();
}
