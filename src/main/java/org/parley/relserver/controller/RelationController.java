package org.parley.relserver.controller;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Map;
import org.parley.relserver.command.SendRelationCommand;
import org.parley.relserver.command.SendRelationCommandHandler;
import org.parley.relserver.config.RelationsProperties;
import org.parley.relserver.controller.util.PaginationValidator;
import org.parley.relserver.domain.RelationFilter;
import org.parley.relserver.domain.RelationType;
import org.parley.relserver.dto.RelationChunkResponse;
import org.parley.relserver.dto.SendEventResponse;
import org.parley.relserver.event.RelationCreatedEvent;
import org.parley.relserver.service.RelationQueryService;
import org.parley.relserver.service.RoomAccessGuard;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Endpoints for sending relations and paging through a parent's relations.
 */
@RestController
@RequestMapping("/_matrix/client/unstable/rooms/{roomId}")
@Tag(name = "Relations", description = "Relation ingest and pagination")
public class RelationController {

  /** Header carrying the acting user id. */
  public static final String USER_HEADER = "Parley-User";

  private final SendRelationCommandHandler sendRelationCommandHandler;
  private final RelationQueryService relationQueryService;
  private final RoomAccessGuard accessGuard;
  private final RelationsProperties properties;

  /**
   * Constructs a RelationController.
   *
   * @param sendRelationCommandHandler the send relation command handler
   * @param relationQueryService the relation pagination service
   * @param accessGuard the room membership check
   * @param properties relation configuration
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Collaborators are Spring-managed beans and are intentionally shared")
  public RelationController(
      SendRelationCommandHandler sendRelationCommandHandler,
      RelationQueryService relationQueryService,
      RoomAccessGuard accessGuard,
      RelationsProperties properties) {
    this.sendRelationCommandHandler = sendRelationCommandHandler;
    this.relationQueryService = relationQueryService;
    this.accessGuard = accessGuard;
    this.properties = properties;
  }

  /**
   * Sends a new event relating to a parent event.
   *
   * @param roomId the room
   * @param parentId the parent event
   * @param relationType the relation type
   * @param eventType the type of the new event
   * @param key the aggregation key (annotations only)
   * @param userId the acting user
   * @param content the client content of the new event
   * @return the new event id
   */
  @PostMapping(
      value = "/send_relation/{parentId}/{relationType}/{eventType}",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE
  )
  @Operation(
      summary = "Send relation",
      description = "Sends a new event that relates to an existing event. The relation is "
          + "stored in the content under m.relates_to, replacing any client-supplied value."
  )
  @ApiResponse(responseCode = "200", description = "Relation sent",
      content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE))
  @ApiResponse(responseCode = "400", description = "Invalid relation",
      content = @Content(mediaType = "application/problem+json"))
  @ApiResponse(responseCode = "403", description = "Not a member of the room",
      content = @Content(mediaType = "application/problem+json"))
  @ApiResponse(responseCode = "404", description = "Parent event not found",
      content = @Content(mediaType = "application/problem+json"))
  public ResponseEntity<SendEventResponse> sendRelation(
      @PathVariable String roomId,
      @PathVariable String parentId,
      @PathVariable String relationType,
      @PathVariable String eventType,
      @Parameter(description = "Aggregation key, annotations only", example = "👍")
      @RequestParam(required = false) String key,
      @RequestHeader(USER_HEADER) String userId,
      @RequestBody Map<String, Object> content
  ) {
    accessGuard.requireMember(roomId, userId);

    RelationCreatedEvent event = sendRelationCommandHandler.handle(new SendRelationCommand(
        roomId, parentId, RelationType.of(relationType), eventType, key, userId, content));

    return ResponseEntity.ok(new SendEventResponse(event.relationEventId()));
  }

  /**
   * Pages through all relations of a parent event.
   *
   * @param roomId the room
   * @param parentId the parent event
   * @param userId the acting user
   * @param limit page size
   * @param from pagination token
   * @return the page
   */
  @GetMapping(value = "/relations/{parentId}", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "List relations", description = "Relations of an event, newest first")
  @ApiResponse(responseCode = "200", description = "Page of relation events")
  @ApiResponse(responseCode = "400", description = "Invalid limit or token",
      content = @Content(mediaType = "application/problem+json"))
  @ApiResponse(responseCode = "404", description = "Parent event not found",
      content = @Content(mediaType = "application/problem+json"))
  public RelationChunkResponse listRelations(
      @PathVariable String roomId,
      @PathVariable String parentId,
      @RequestHeader(USER_HEADER) String userId,
      @RequestParam(required = false) Integer limit,
      @RequestParam(required = false) String from
  ) {
    return paginate(roomId, parentId, RelationFilter.ANY, userId, limit, from);
  }

  /**
   * Pages through the relations of a parent event of one relation type.
   *
   * @param roomId the room
   * @param parentId the parent event
   * @param relationType the relation type
   * @param userId the acting user
   * @param limit page size
   * @param from pagination token
   * @return the page
   */
  @GetMapping(value = "/relations/{parentId}/{relationType}",
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "List relations of a type")
  public RelationChunkResponse listRelationsOfType(
      @PathVariable String roomId,
      @PathVariable String parentId,
      @PathVariable String relationType,
      @RequestHeader(USER_HEADER) String userId,
      @RequestParam(required = false) Integer limit,
      @RequestParam(required = false) String from
  ) {
    return paginate(roomId, parentId, RelationFilter.ofType(RelationType.of(relationType)),
        userId, limit, from);
  }

  /**
   * Pages through the relations of a parent event of one relation type and event type.
   *
   * @param roomId the room
   * @param parentId the parent event
   * @param relationType the relation type
   * @param eventType the relation event type
   * @param userId the acting user
   * @param limit page size
   * @param from pagination token
   * @return the page
   */
  @GetMapping(value = "/relations/{parentId}/{relationType}/{eventType}",
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "List relations of a type and event type")
  public RelationChunkResponse listRelationsOfEventType(
      @PathVariable String roomId,
      @PathVariable String parentId,
      @PathVariable String relationType,
      @PathVariable String eventType,
      @RequestHeader(USER_HEADER) String userId,
      @RequestParam(required = false) Integer limit,
      @RequestParam(required = false) String from
  ) {
    return paginate(roomId, parentId,
        new RelationFilter(RelationType.of(relationType), eventType, null),
        userId, limit, from);
  }

  private RelationChunkResponse paginate(String roomId, String parentId, RelationFilter filter,
      String userId, Integer limit, String from) {
    int pageSize = PaginationValidator.resolveLimit(limit, properties);
    accessGuard.requireMember(roomId, userId);
    return relationQueryService.paginate(roomId, parentId, filter, pageSize,
        PaginationValidator.normalizeToken(from));
  }
}
