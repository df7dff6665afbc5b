package org.parley.relserver.controller;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Map;
import org.parley.relserver.config.RelationsProperties;
import org.parley.relserver.controller.util.PaginationValidator;
import org.parley.relserver.dto.MessagesResponse;
import org.parley.relserver.dto.RedactRequest;
import org.parley.relserver.dto.RoomEventView;
import org.parley.relserver.dto.SendEventResponse;
import org.parley.relserver.service.RoomAccessGuard;
import org.parley.relserver.service.RoomEventService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Room event endpoints: sending, state, fetching with bundled relations,
 * history and redaction.
 */
@RestController
@RequestMapping("/_matrix/client/r0/rooms/{roomId}")
@Tag(name = "Room Events", description = "Room events with bundled relation summaries")
public class RoomEventController {

  private final RoomEventService roomEventService;
  private final RoomAccessGuard accessGuard;
  private final RelationsProperties properties;

  /**
   * Constructs a RoomEventController.
   *
   * @param roomEventService the room event service
   * @param accessGuard the room membership check
   * @param properties relation configuration
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Collaborators are Spring-managed beans and are intentionally shared")
  public RoomEventController(RoomEventService roomEventService, RoomAccessGuard accessGuard,
      RelationsProperties properties) {
    this.roomEventService = roomEventService;
    this.accessGuard = accessGuard;
    this.properties = properties;
  }

  /**
   * Fetches a single event with its relation summaries in {@code unsigned}.
   *
   * @param roomId the room
   * @param eventId the event
   * @param userId the acting user
   * @return the event
   */
  @GetMapping(value = "/event/{eventId}", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Get event", description = "Returns the event with bundled relations")
  @ApiResponse(responseCode = "200", description = "The event")
  @ApiResponse(responseCode = "404", description = "Event not found",
      content = @Content(mediaType = "application/problem+json"))
  public RoomEventView getEvent(
      @PathVariable String roomId,
      @PathVariable String eventId,
      @RequestHeader(RelationController.USER_HEADER) String userId
  ) {
    accessGuard.requireMember(roomId, userId);
    return roomEventService.getEvent(roomId, eventId);
  }

  /**
   * Pages backwards through the room history.
   *
   * @param roomId the room
   * @param userId the acting user
   * @param limit page size
   * @param from pagination token
   * @param bundleRelations whether to attach relation summaries
   * @return the page, newest first
   */
  @GetMapping(value = "/messages", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "List messages", description = "Room history, newest first")
  @ApiResponse(responseCode = "200", description = "Page of room events")
  @ApiResponse(responseCode = "400", description = "Invalid limit or token",
      content = @Content(mediaType = "application/problem+json"))
  public MessagesResponse messages(
      @PathVariable String roomId,
      @RequestHeader(RelationController.USER_HEADER) String userId,
      @RequestParam(required = false) Integer limit,
      @RequestParam(required = false) String from,
      @Parameter(description = "Attach relation summaries to each event")
      @RequestParam(name = "bundle_relations", defaultValue = "false") boolean bundleRelations
  ) {
    int pageSize = PaginationValidator.resolveLimit(limit, properties);
    accessGuard.requireMember(roomId, userId);
    return roomEventService.messages(roomId, pageSize, PaginationValidator.normalizeToken(from),
        bundleRelations);
  }

  /**
   * Sends a message-like event. Content carrying {@code m.relates_to} is
   * handled as a relation.
   *
   * @param roomId the room
   * @param eventType the event type
   * @param userId the acting user
   * @param content the event content
   * @return the new event id
   */
  @PostMapping(
      value = "/send/{eventType}",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE
  )
  @Operation(summary = "Send event")
  @ApiResponse(responseCode = "200", description = "Event sent")
  @ApiResponse(responseCode = "403", description = "Not a member of the room",
      content = @Content(mediaType = "application/problem+json"))
  public SendEventResponse send(
      @PathVariable String roomId,
      @PathVariable String eventType,
      @RequestHeader(RelationController.USER_HEADER) String userId,
      @RequestBody Map<String, Object> content
  ) {
    accessGuard.requireMember(roomId, userId);
    return new SendEventResponse(roomEventService.send(roomId, eventType, userId, content));
  }

  /**
   * Sets room state. Users may always set their own membership.
   *
   * @param roomId the room
   * @param eventType the state event type
   * @param stateKey the state key
   * @param userId the acting user
   * @param content the state content
   * @return the new event id
   */
  @PutMapping(
      value = "/state/{eventType}/{stateKey}",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE
  )
  @Operation(summary = "Set state")
  @ApiResponse(responseCode = "200", description = "State event sent")
  @ApiResponse(responseCode = "403", description = "Not a member of the room",
      content = @Content(mediaType = "application/problem+json"))
  public SendEventResponse setState(
      @PathVariable String roomId,
      @PathVariable String eventType,
      @PathVariable String stateKey,
      @RequestHeader(RelationController.USER_HEADER) String userId,
      @RequestBody Map<String, Object> content
  ) {
    accessGuard.requireCanSetState(roomId, userId, eventType, stateKey);
    return new SendEventResponse(
        roomEventService.sendState(roomId, eventType, stateKey, userId, content));
  }

  /**
   * Redacts an event.
   *
   * @param roomId the room
   * @param eventId the event to redact
   * @param userId the acting user
   * @param body optional body with a reason
   * @return the id of the redaction event
   */
  @PostMapping(value = "/redact/{eventId}", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Redact event",
      description = "Redacting a relation removes it from pagination, counts and bundles"
  )
  @ApiResponse(responseCode = "200", description = "Event redacted")
  @ApiResponse(responseCode = "404", description = "Event not found",
      content = @Content(mediaType = "application/problem+json"))
  public SendEventResponse redact(
      @PathVariable String roomId,
      @PathVariable String eventId,
      @RequestHeader(RelationController.USER_HEADER) String userId,
      @Valid @RequestBody(required = false) RedactRequest body
  ) {
    accessGuard.requireMember(roomId, userId);
    String reason = body != null ? body.reason() : null;
    return new SendEventResponse(roomEventService.redact(roomId, eventId, userId, reason));
  }
}
