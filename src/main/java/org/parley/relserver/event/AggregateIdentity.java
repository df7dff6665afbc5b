package org.parley.relserver.event;

/**
 * Identity of the aggregate an event belongs to, used as the Kafka partition key.
 * The aggregate of a relation event is the target event it points at.
 */
public interface AggregateIdentity {

  /**
   * Returns the aggregate type, for logging and headers.
   *
   * @return the aggregate type
   */
  String getAggregateType();

  /**
   * Returns the partition key for this aggregate instance.
   *
   * @return the partition key
   */
  String getPartitionKey();

  /**
   * Returns the room the aggregate lives in.
   *
   * @return the room id
   */
  String getRoomId();

  /**
   * Create the identity of a relation target.
   *
   * @param roomId the room id
   * @param targetEventId the target event id
   * @return the target aggregate identity
   */
  static AggregateIdentity target(String roomId, String targetEventId) {
    return new TargetAggregate(roomId, targetEventId);
  }

  /**
   * Relation target aggregate: all relations and redactions of one target.
   *
   * @param roomId the room id
   * @param targetEventId the target event id
   */
  record TargetAggregate(String roomId, String targetEventId) implements AggregateIdentity {
    @Override
    public String getAggregateType() {
      return "RelationTarget";
    }

    @Override
    public String getPartitionKey() {
      return targetEventId;
    }

    @Override
    public String getRoomId() {
      return roomId;
    }
  }
}
