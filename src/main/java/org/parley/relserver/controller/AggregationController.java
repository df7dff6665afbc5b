package org.parley.relserver.controller;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.parley.relserver.config.RelationsProperties;
import org.parley.relserver.controller.util.PaginationValidator;
import org.parley.relserver.domain.RelationType;
import org.parley.relserver.dto.AggregationChunkResponse;
import org.parley.relserver.dto.RelationChunkResponse;
import org.parley.relserver.service.AggregationService;
import org.parley.relserver.service.RelationQueryService;
import org.parley.relserver.service.RoomAccessGuard;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Endpoints for annotation aggregation groups.
 * Only annotations are aggregated; other relation types are rejected before
 * the parent event is looked up.
 */
@RestController
@RequestMapping("/_matrix/client/unstable/rooms/{roomId}/aggregations/{parentId}")
@Tag(name = "Aggregations", description = "Annotation group counts and group pagination")
public class AggregationController {

  private final AggregationService aggregationService;
  private final RelationQueryService relationQueryService;
  private final RoomAccessGuard accessGuard;
  private final RelationsProperties properties;

  /**
   * Constructs an AggregationController.
   *
   * @param aggregationService the aggregation engine
   * @param relationQueryService the relation pagination service
   * @param accessGuard the room membership check
   * @param properties relation configuration
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Collaborators are Spring-managed beans and are intentionally shared")
  public AggregationController(
      AggregationService aggregationService,
      RelationQueryService relationQueryService,
      RoomAccessGuard accessGuard,
      RelationsProperties properties) {
    this.aggregationService = aggregationService;
    this.relationQueryService = relationQueryService;
    this.accessGuard = accessGuard;
    this.properties = properties;
  }

  /**
   * Pages through all annotation groups of a parent, highest count first.
   *
   * @param roomId the room
   * @param parentId the parent event
   * @param userId the acting user
   * @param limit page size
   * @param from pagination token
   * @return the page of groups
   */
  @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "List aggregation groups",
      description = "Annotation groups ordered by count descending, ties by first appearance"
  )
  @ApiResponse(responseCode = "200", description = "Page of aggregation groups")
  @ApiResponse(responseCode = "400", description = "Invalid limit, token or relation type",
      content = @Content(mediaType = "application/problem+json"))
  @ApiResponse(responseCode = "404", description = "Parent event not found",
      content = @Content(mediaType = "application/problem+json"))
  public AggregationChunkResponse aggregate(
      @PathVariable String roomId,
      @PathVariable String parentId,
      @RequestHeader(RelationController.USER_HEADER) String userId,
      @RequestParam(required = false) Integer limit,
      @RequestParam(required = false) String from
  ) {
    return aggregate(roomId, parentId, null, null, userId, limit, from);
  }

  /**
   * Pages through the annotation groups of a parent for one relation type.
   *
   * @param roomId the room
   * @param parentId the parent event
   * @param relationType the relation type; only m.annotation is accepted
   * @param userId the acting user
   * @param limit page size
   * @param from pagination token
   * @return the page of groups
   */
  @GetMapping(value = "/{relationType}", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "List aggregation groups of a relation type")
  public AggregationChunkResponse aggregateOfType(
      @PathVariable String roomId,
      @PathVariable String parentId,
      @PathVariable String relationType,
      @RequestHeader(RelationController.USER_HEADER) String userId,
      @RequestParam(required = false) Integer limit,
      @RequestParam(required = false) String from
  ) {
    return aggregate(roomId, parentId, RelationType.of(relationType), null, userId, limit,
        from);
  }

  /**
   * Pages through the annotation groups of a parent for one event type.
   *
   * @param roomId the room
   * @param parentId the parent event
   * @param relationType the relation type; only m.annotation is accepted
   * @param eventType the annotation event type
   * @param userId the acting user
   * @param limit page size
   * @param from pagination token
   * @return the page of groups
   */
  @GetMapping(value = "/{relationType}/{eventType}", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "List aggregation groups of an event type")
  public AggregationChunkResponse aggregateOfEventType(
      @PathVariable String roomId,
      @PathVariable String parentId,
      @PathVariable String relationType,
      @PathVariable String eventType,
      @RequestHeader(RelationController.USER_HEADER) String userId,
      @RequestParam(required = false) Integer limit,
      @RequestParam(required = false) String from
  ) {
    return aggregate(roomId, parentId, RelationType.of(relationType), eventType, userId, limit,
        from);
  }

  /**
   * Pages through the annotations of a single group, newest first.
   *
   * @param roomId the room
   * @param parentId the parent event
   * @param relationType the relation type; only m.annotation is accepted
   * @param eventType the annotation event type
   * @param key the group key
   * @param userId the acting user
   * @param limit page size
   * @param from pagination token
   * @return the page of annotation events
   */
  @GetMapping(value = "/{relationType}/{eventType}/{key}",
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "List the annotations of one group")
  public RelationChunkResponse listGroup(
      @PathVariable String roomId,
      @PathVariable String parentId,
      @PathVariable String relationType,
      @PathVariable String eventType,
      @Parameter(description = "Group key", example = "👍")
      @PathVariable String key,
      @RequestHeader(RelationController.USER_HEADER) String userId,
      @RequestParam(required = false) Integer limit,
      @RequestParam(required = false) String from
  ) {
    int pageSize = PaginationValidator.resolveLimit(limit, properties);
    accessGuard.requireMember(roomId, userId);
    return relationQueryService.paginateGroup(roomId, parentId, RelationType.of(relationType),
        eventType, key, pageSize, PaginationValidator.normalizeToken(from));
  }

  private AggregationChunkResponse aggregate(String roomId, String parentId,
      RelationType relationType, String eventType, String userId, Integer limit, String from) {
    int pageSize = PaginationValidator.resolveLimit(limit, properties);
    accessGuard.requireMember(roomId, userId);
    return aggregationService.aggregate(roomId, parentId, relationType, eventType, pageSize,
        PaginationValidator.normalizeToken(from));
  }
}
