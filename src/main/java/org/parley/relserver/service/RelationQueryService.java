package org.parley.relserver.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import java.util.Optional;
import org.parley.relserver.domain.RelationEdge;
import org.parley.relserver.domain.RelationFilter;
import org.parley.relserver.domain.RelationType;
import org.parley.relserver.domain.StreamPosition;
import org.parley.relserver.dto.RelationChunkResponse;
import org.parley.relserver.dto.RoomEventView;
import org.parley.relserver.exception.EventNotFoundException;
import org.parley.relserver.exception.InvalidCursorException;
import org.parley.relserver.exception.InvalidRelationException;
import org.parley.relserver.pagination.CursorCodec;
import org.parley.relserver.pagination.GroupPageCursor;
import org.parley.relserver.pagination.RelationPageCursor;
import org.parley.relserver.repository.RelationRepository;
import org.parley.relserver.repository.RoomEventRepository;
import org.springframework.stereotype.Service;

/**
 * Pages through the raw relations of a parent event, newest first.
 *
 * <p>Each page is bounded by the watermark carried in the {@code from} token:
 * only edges strictly older than the last edge of the previous page are
 * returned, so relations added after the first request never appear on later
 * pages and already returned edges never shift.
 */
@Service
public class RelationQueryService {

  private final RoomEventRepository roomEventRepository;
  private final RelationRepository relationRepository;
  private final CursorCodec cursorCodec;

  /**
   * Constructor for RelationQueryService.
   *
   * @param roomEventRepository the event store
   * @param relationRepository the relation index
   * @param cursorCodec the pagination token codec
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Repositories are Spring-managed beans and are intentionally shared"
  )
  public RelationQueryService(RoomEventRepository roomEventRepository,
      RelationRepository relationRepository, CursorCodec cursorCodec) {
    this.roomEventRepository = roomEventRepository;
    this.relationRepository = relationRepository;
    this.cursorCodec = cursorCodec;
  }

  /**
   * Pages through a parent's relations, optionally narrowed by relation type and event type.
   *
   * @param roomId the room of the parent
   * @param parentId the parent event
   * @param filter relation type and event type filter
   * @param limit page size
   * @param from token from the previous page, or null for the newest page
   * @return the page
   * @throws EventNotFoundException if the parent is not in the room
   * @throws InvalidCursorException if the token is invalid or belongs to another query
   */
  @Timed(value = "relations.paginate", description = "Relation pagination latency")
  public RelationChunkResponse paginate(String roomId, String parentId, RelationFilter filter,
      int limit, String from) {
    requireParent(roomId, parentId);

    StreamPosition before = null;
    if (from != null) {
      RelationPageCursor cursor = cursorCodec.decode(from, RelationPageCursor.class);
      if (!cursor.belongsTo(parentId, filter)) {
        throw new InvalidCursorException("Pagination token was issued for a different query");
      }
      before = cursor.position();
    }

    List<RelationEdge> edges = relationRepository.findPage(parentId, filter, before, limit + 1);
    boolean hasMore = edges.size() > limit;
    List<RelationEdge> page = hasMore ? edges.subList(0, limit) : edges;

    String nextBatch = hasMore
        ? cursorCodec.encode(
            RelationPageCursor.at(parentId, filter, page.get(page.size() - 1).position()))
        : null;
    return new RelationChunkResponse(toViews(page), nextBatch);
  }

  /**
   * Pages through the annotations of a single aggregation group.
   *
   * @param roomId the room of the parent
   * @param parentId the parent event
   * @param relationType the relation type; must be an annotation
   * @param eventType the group's event type
   * @param key the group's key
   * @param limit page size
   * @param from token from the previous page, or null for the newest page
   * @return the page
   * @throws InvalidRelationException if the relation type is not an annotation
   * @throws EventNotFoundException if the parent is not in the room
   * @throws InvalidCursorException if the token is invalid or belongs to another group
   */
  @Timed(value = "relations.paginate.group", description = "Group pagination latency")
  public RelationChunkResponse paginateGroup(String roomId, String parentId,
      RelationType relationType, String eventType, String key, int limit, String from) {
    if (!relationType.isAnnotation()) {
      throw new InvalidRelationException(
          "Only " + RelationType.ANNOTATION + " relations are grouped by key, got "
              + relationType);
    }
    requireParent(roomId, parentId);

    StreamPosition before = null;
    if (from != null) {
      GroupPageCursor cursor = cursorCodec.decode(from, GroupPageCursor.class);
      if (!cursor.belongsTo(parentId, eventType, key)) {
        throw new InvalidCursorException("Pagination token was issued for a different group");
      }
      before = cursor.position();
    }

    RelationFilter filter = RelationFilter.group(eventType, key);
    List<RelationEdge> edges = relationRepository.findPage(parentId, filter, before, limit + 1);
    boolean hasMore = edges.size() > limit;
    List<RelationEdge> page = hasMore ? edges.subList(0, limit) : edges;

    String nextBatch = hasMore
        ? cursorCodec.encode(GroupPageCursor.at(parentId, eventType, key,
            page.get(page.size() - 1).position()))
        : null;
    return new RelationChunkResponse(toViews(page), nextBatch);
  }

  private void requireParent(String roomId, String parentId) {
    if (roomEventRepository.findInRoom(roomId, parentId).isEmpty()) {
      throw new EventNotFoundException(parentId);
    }
  }

  private List<RoomEventView> toViews(List<RelationEdge> edges) {
    return edges.stream()
        .map(edge -> roomEventRepository.findById(edge.sourceEventId()))
        .flatMap(Optional::stream)
        .map(RoomEventView::of)
        .toList();
  }
}
