package org.parley.relserver.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

/**
 * A page of relation events, newest first.
 *
 * @param chunk the relation events
 * @param nextBatch token for the next (older) page, absent when exhausted
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Page of events relating to a parent event, newest first")
public record RelationChunkResponse(
    @Schema(description = "Relation events", requiredMode = Schema.RequiredMode.REQUIRED)
    List<RoomEventView> chunk,
    @Schema(description = "Token for the next page; absent when there are no older relations")
    @JsonProperty("next_batch") String nextBatch) {

  /**
   * Copies the chunk into an unmodifiable list.
   */
  public RelationChunkResponse {
    chunk = chunk != null ? List.copyOf(chunk) : List.of();
  }
}
