package org.parley.relserver.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * An indexed relation from a source event to a target event.
 * Edges are created once at ingest and never physically deleted; redaction of
 * the source event only sets the soft-delete marker.
 *
 * @param sourceEventId the relation event
 * @param targetEventId the event being related to
 * @param roomId the room both events belong to
 * @param relationType the relation type
 * @param aggregationKey the annotation key, null for other relation types
 * @param eventType the type of the relation event (e.g. m.reaction)
 * @param originServerTs origin server timestamp of the relation event
 * @param sender sender of the relation event
 * @param position stream position of the relation event
 * @param redacted soft-delete marker
 */
public record RelationEdge(
    String sourceEventId,
    String targetEventId,
    String roomId,
    RelationType relationType,
    String aggregationKey,
    String eventType,
    Instant originServerTs,
    String sender,
    StreamPosition position,
    boolean redacted) {

  /**
   * Creates a relation edge with validation.
   *
   * @throws IllegalArgumentException if an annotation key is given for a non-annotation
   */
  public RelationEdge {
    Objects.requireNonNull(sourceEventId, "Source event ID cannot be null");
    Objects.requireNonNull(targetEventId, "Target event ID cannot be null");
    Objects.requireNonNull(roomId, "Room ID cannot be null");
    Objects.requireNonNull(relationType, "Relation type cannot be null");
    Objects.requireNonNull(eventType, "Event type cannot be null");
    Objects.requireNonNull(originServerTs, "Origin server timestamp cannot be null");
    Objects.requireNonNull(sender, "Sender cannot be null");
    Objects.requireNonNull(position, "Position cannot be null");

    if (aggregationKey != null && !relationType.isAnnotation()) {
      throw new IllegalArgumentException(
          "Aggregation key is only allowed on annotations, got " + relationType);
    }
  }

  /**
   * Derives the edge for a persisted event that declares a relation.
   *
   * @param event the persisted relation event
   * @return the edge
   * @throws IllegalArgumentException if the event declares no relation
   */
  public static RelationEdge of(RoomEvent event) {
    RelationDescriptor relation = event.relation()
        .orElseThrow(() -> new IllegalArgumentException(
            "Event " + event.eventId() + " does not declare a relation"));
    return new RelationEdge(
        event.eventId(),
        relation.targetEventId(),
        event.roomId(),
        relation.relationType(),
        relation.relationType().isAnnotation() ? relation.key() : null,
        event.type(),
        event.originServerTs(),
        event.sender(),
        event.position(),
        event.redacted());
  }

  /**
   * Returns a copy of this edge with the soft-delete marker set.
   *
   * @return the redacted edge
   */
  public RelationEdge asRedacted() {
    return new RelationEdge(sourceEventId, targetEventId, roomId, relationType,
        aggregationKey, eventType, originServerTs, sender, position, true);
  }

  /**
   * Checks whether this edge counts towards an aggregation group.
   *
   * @return true for live annotations carrying a key
   */
  public boolean isAggregatable() {
    return !redacted && relationType.isAnnotation() && aggregationKey != null;
  }
}
