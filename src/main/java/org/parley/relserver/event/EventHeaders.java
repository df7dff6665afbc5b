package org.parley.relserver.event;

/**
 * Constants for Kafka event headers.
 */
public final class EventHeaders {
  /**
   * Header key for the globally unique log event ID, used for deduplication.
   */
  public static final String EVENT_ID = "eventId";

  /**
   * Header key for the room id.
   */
  public static final String ROOM_ID = "roomId";

  /**
   * Header key for the log event type (RelationCreated, RelationRedacted).
   */
  public static final String EVENT_TYPE = "eventType";

  /**
   * Header key for the publish timestamp (UTC epoch milliseconds).
   */
  public static final String TIMESTAMP = "timestamp";

  /**
   * Header key for the correlation ID of the request that caused the event.
   */
  public static final String CORRELATION_ID = "correlationId";

  /**
   * Header key for the aggregate type.
   */
  public static final String AGGREGATE_TYPE = "aggregateType";

  /**
   * Header key for the aggregate id (the partition key).
   */
  public static final String AGGREGATE_ID = "aggregateId";

  /**
   * Header key for the relation type of a created relation.
   */
  public static final String REL_TYPE = "relType";

  private EventHeaders() {
    throw new UnsupportedOperationException("Utility class");
  }
}
