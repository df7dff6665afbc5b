package org.parley.relserver.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

/**
 * A page of a room's timeline, newest first.
 *
 * @param chunk the events
 * @param end token for the next (older) page, absent when exhausted
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Page of room events, newest first")
public record MessagesResponse(
    @Schema(description = "Room events", requiredMode = Schema.RequiredMode.REQUIRED)
    List<RoomEventView> chunk,
    @Schema(description = "Token for the next page; absent at the start of the room")
    String end) {

  /**
   * Copies the chunk into an unmodifiable list.
   */
  public MessagesResponse {
    chunk = chunk != null ? List.copyOf(chunk) : List.of();
  }
}
