package org.parley.relserver.pagination;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;
import org.parley.relserver.domain.RelationFilter;
import org.parley.relserver.domain.RelationType;
import org.parley.relserver.domain.StreamPosition;

/**
 * Watermark for paging raw relations of one target, optionally filtered
 * by relation type and event type.
 *
 * @param version token format version
 * @param targetEventId the parent event
 * @param relationType the relation type filter, or null
 * @param eventType the event type filter, or null
 * @param topological topological position of the last returned edge
 * @param stream stream position of the last returned edge
 */
public record RelationPageCursor(
    @JsonProperty("v") int version,
    @JsonProperty("t") String targetEventId,
    @JsonProperty("r") String relationType,
    @JsonProperty("e") String eventType,
    @JsonProperty("tp") long topological,
    @JsonProperty("sp") long stream) implements PaginationCursor {

  /**
   * Creates a relation page cursor.
   */
  public RelationPageCursor {
    Objects.requireNonNull(targetEventId, "Target event ID cannot be null");
    if (topological < 0 || stream < 0) {
      throw new IllegalArgumentException("Cursor position cannot be negative");
    }
  }

  /**
   * Creates a cursor positioned at the given edge.
   *
   * @param targetEventId the parent event
   * @param filter the filter of the query
   * @param position the position of the last returned edge
   * @return the cursor
   */
  public static RelationPageCursor at(String targetEventId, RelationFilter filter,
      StreamPosition position) {
    return new RelationPageCursor(
        CURRENT_VERSION,
        targetEventId,
        filter.relationType() == null ? null : filter.relationType().value(),
        filter.eventType(),
        position.topological(),
        position.stream());
  }

  public StreamPosition position() {
    return new StreamPosition(topological, stream);
  }

  /**
   * Checks that this cursor belongs to the given query.
   *
   * @param target the requested parent
   * @param filter the requested filter
   * @return true if target and filter are the ones the cursor was issued for
   */
  public boolean belongsTo(String target, RelationFilter filter) {
    RelationType type = filter.relationType();
    return targetEventId.equals(target)
        && Objects.equals(relationType, type == null ? null : type.value())
        && Objects.equals(eventType, filter.eventType());
  }
}
