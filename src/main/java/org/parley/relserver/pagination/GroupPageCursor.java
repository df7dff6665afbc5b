package org.parley.relserver.pagination;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;
import org.parley.relserver.domain.StreamPosition;

/**
 * Watermark for paging the annotations inside a single aggregation group.
 *
 * @param version token format version
 * @param targetEventId the parent event
 * @param eventType the group's event type
 * @param key the group's key
 * @param topological topological position of the last returned edge
 * @param stream stream position of the last returned edge
 */
public record GroupPageCursor(
    @JsonProperty("v") int version,
    @JsonProperty("t") String targetEventId,
    @JsonProperty("e") String eventType,
    @JsonProperty("k") String key,
    @JsonProperty("tp") long topological,
    @JsonProperty("sp") long stream) implements PaginationCursor {

  /**
   * Creates a group page cursor.
   */
  public GroupPageCursor {
    Objects.requireNonNull(targetEventId, "Target event ID cannot be null");
    Objects.requireNonNull(eventType, "Event type cannot be null");
    Objects.requireNonNull(key, "Key cannot be null");
    if (topological < 0 || stream < 0) {
      throw new IllegalArgumentException("Cursor position cannot be negative");
    }
  }

  /**
   * Creates a cursor positioned at the given edge.
   *
   * @param targetEventId the parent event
   * @param eventType the group's event type
   * @param key the group's key
   * @param position the position of the last returned edge
   * @return the cursor
   */
  public static GroupPageCursor at(String targetEventId, String eventType, String key,
      StreamPosition position) {
    return new GroupPageCursor(CURRENT_VERSION, targetEventId, eventType, key,
        position.topological(), position.stream());
  }

  public StreamPosition position() {
    return new StreamPosition(topological, stream);
  }

  /**
   * Checks that this cursor belongs to the given group.
   *
   * @param target the requested parent
   * @param type the requested event type
   * @param groupKey the requested key
   * @return true if the cursor was issued for that group
   */
  public boolean belongsTo(String target, String type, String groupKey) {
    return targetEventId.equals(target) && eventType.equals(type) && key.equals(groupKey);
  }
}
