package org.parley.relserver.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

/**
 * Relation summaries attached to a served event under {@code unsigned."m.relations"}.
 * Sections without relations are omitted.
 *
 * @param annotations first page of annotation groups
 * @param references oldest references
 * @param replacement latest edit by the original sender
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Relation summaries bundled into an event")
public record BundledRelations(
    @JsonProperty("m.annotation") AggregationChunkResponse annotations,
    @JsonProperty("m.reference") ReferenceChunk references,
    @JsonProperty("m.replace") Replacement replacement) {

  @JsonIgnore
  public boolean isEmpty() {
    return annotations == null && references == null && replacement == null;
  }

  /**
   * Bundled references.
   *
   * @param chunk references in chronological order
   */
  public record ReferenceChunk(List<EventReference> chunk) {

    /**
     * Copies the chunk into an unmodifiable list.
     */
    public ReferenceChunk {
      chunk = chunk != null ? List.copyOf(chunk) : List.of();
    }
  }

  /**
   * Reference to a related event.
   *
   * @param eventId the id of the referencing event
   */
  public record EventReference(@JsonProperty("event_id") String eventId) {
  }

  /**
   * Summary of the latest replacement.
   *
   * @param eventId the id of the replacing event
   * @param originServerTs its origin server timestamp (epoch millis)
   * @param sender its sender
   */
  public record Replacement(
      @JsonProperty("event_id") String eventId,
      @JsonProperty("origin_server_ts") long originServerTs,
      @JsonProperty("sender") String sender) {
  }
}
