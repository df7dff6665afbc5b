package org.parley.relserver.pagination;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;
import org.parley.relserver.domain.StreamPosition;

/**
 * Watermark for paging a room's message history backwards.
 *
 * @param version token format version
 * @param roomId the room
 * @param topological topological position of the last returned event
 * @param stream stream position of the last returned event
 */
public record MessagesPageCursor(
    @JsonProperty("v") int version,
    @JsonProperty("rm") String roomId,
    @JsonProperty("tp") long topological,
    @JsonProperty("sp") long stream) implements PaginationCursor {

  /**
   * Creates a messages page cursor.
   */
  public MessagesPageCursor {
    Objects.requireNonNull(roomId, "Room ID cannot be null");
    if (topological < 0 || stream < 0) {
      throw new IllegalArgumentException("Cursor position cannot be negative");
    }
  }

  public static MessagesPageCursor at(String roomId, StreamPosition position) {
    return new MessagesPageCursor(CURRENT_VERSION, roomId,
        position.topological(), position.stream());
  }

  public StreamPosition position() {
    return new StreamPosition(topological, stream);
  }
}
