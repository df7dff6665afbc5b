package org.parley.relserver.pagination;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;
import org.parley.relserver.domain.AggregationGroup;

/**
 * Watermark for paging aggregation groups, positioned on the
 * (count, creation order) of the last group returned.
 *
 * @param version token format version
 * @param targetEventId the parent event
 * @param eventType the event type filter, or null
 * @param count count of the last returned group
 * @param creationOrder creation order of the last returned group
 */
public record AggregationPageCursor(
    @JsonProperty("v") int version,
    @JsonProperty("t") String targetEventId,
    @JsonProperty("e") String eventType,
    @JsonProperty("c") long count,
    @JsonProperty("o") long creationOrder) implements PaginationCursor {

  /**
   * Creates an aggregation page cursor.
   */
  public AggregationPageCursor {
    Objects.requireNonNull(targetEventId, "Target event ID cannot be null");
    if (count < 1) {
      throw new IllegalArgumentException("Cursor count must be positive");
    }
  }

  /**
   * Creates a cursor positioned at the given group.
   *
   * @param eventType the event type filter of the query, or null
   * @param group the last returned group
   * @return the cursor
   */
  public static AggregationPageCursor at(String eventType, AggregationGroup group) {
    return new AggregationPageCursor(CURRENT_VERSION, group.targetEventId(), eventType,
        group.count(), group.creationOrder());
  }

  /**
   * Checks that this cursor belongs to the given query.
   *
   * @param target the requested parent
   * @param type the requested event type filter, or null
   * @return true if the cursor was issued for that query
   */
  public boolean belongsTo(String target, String type) {
    return targetEventId.equals(target) && Objects.equals(eventType, type);
  }
}
