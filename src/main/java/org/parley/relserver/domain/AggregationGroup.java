package org.parley.relserver.domain;

import java.util.Comparator;
import java.util.Objects;

/**
 * Count of live annotations sharing an event type and key on one target.
 * Derived state: maintained by the aggregation counters, never persisted as an event.
 *
 * @param targetEventId the annotated event
 * @param eventType the annotation event type
 * @param key the aggregation key
 * @param count number of non-redacted annotations in the group
 * @param creationOrder sequence number taken when the group first appeared
 */
public record AggregationGroup(
    String targetEventId,
    String eventType,
    String key,
    long count,
    long creationOrder) {

  /**
   * Serving order: highest count first, ties broken by the group created first.
   */
  public static final Comparator<AggregationGroup> SERVING_ORDER =
      Comparator.comparingLong(AggregationGroup::count).reversed()
          .thenComparingLong(AggregationGroup::creationOrder);

  /**
   * Creates an aggregation group.
   */
  public AggregationGroup {
    Objects.requireNonNull(targetEventId, "Target event ID cannot be null");
    Objects.requireNonNull(eventType, "Event type cannot be null");
    Objects.requireNonNull(key, "Key cannot be null");
    if (count < 0) {
      throw new IllegalArgumentException("Count cannot be negative");
    }
  }

  public RelationType relationType() {
    return RelationType.ANNOTATION;
  }

  /**
   * Returns a copy with the count moved by delta.
   *
   * @param delta the amount to add (may be negative)
   * @return the updated group
   */
  public AggregationGroup adjustedBy(long delta) {
    return new AggregationGroup(targetEventId, eventType, key, count + delta, creationOrder);
  }

  /**
   * Checks whether this group is served after the given watermark.
   *
   * @param count the watermark count
   * @param creationOrder the watermark creation order
   * @return true if this group sorts strictly after the watermark
   */
  public boolean isAfter(long count, long creationOrder) {
    return this.count < count || (this.count == count && this.creationOrder > creationOrder);
  }
}
