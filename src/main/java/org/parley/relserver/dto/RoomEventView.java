package org.parley.relserver.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.Map;
import org.parley.relserver.domain.RoomEvent;

/**
 * Client representation of a room event.
 * Redacted events are served with empty content.
 *
 * @param eventId the event id
 * @param roomId the room id
 * @param type the event type
 * @param stateKey the state key, absent for non-state events
 * @param sender the sender
 * @param content the content
 * @param originServerTs the origin server timestamp (epoch millis)
 * @param unsigned non-authenticated metadata, absent when empty
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "A room event")
public record RoomEventView(
    @JsonProperty("event_id") String eventId,
    @JsonProperty("room_id") String roomId,
    @JsonProperty("type") String type,
    @JsonProperty("state_key") String stateKey,
    @JsonProperty("sender") String sender,
    @JsonProperty("content") Map<String, Object> content,
    @JsonProperty("origin_server_ts") long originServerTs,
    @JsonProperty("unsigned") Unsigned unsigned) {

  /**
   * Builds the view of an event without relation summaries.
   *
   * @param event the stored event
   * @return the view
   */
  public static RoomEventView of(RoomEvent event) {
    return of(event, null);
  }

  /**
   * Builds the view of an event, attaching relation summaries if given.
   *
   * @param event the stored event
   * @param relations the bundled relations, or null
   * @return the view
   */
  public static RoomEventView of(RoomEvent event, BundledRelations relations) {
    Unsigned unsigned = null;
    if (event.redacted() || relations != null) {
      unsigned = new Unsigned(relations, event.redacted() ? Boolean.TRUE : null);
    }
    return new RoomEventView(
        event.eventId(),
        event.roomId(),
        event.type(),
        event.stateKey(),
        event.sender(),
        event.redacted() ? Map.of() : event.content(),
        event.originServerTs().toEpochMilli(),
        unsigned);
  }

  /**
   * Non-authenticated metadata.
   *
   * @param relations bundled relation summaries, absent when there are none
   * @param redacted present and true when the event was redacted
   */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Unsigned(
      @JsonProperty("m.relations") BundledRelations relations,
      @JsonProperty("redacted") Boolean redacted) {
  }
}
