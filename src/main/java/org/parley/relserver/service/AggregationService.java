package org.parley.relserver.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import org.parley.relserver.domain.AggregationGroup;
import org.parley.relserver.domain.RelationType;
import org.parley.relserver.dto.AggregationChunkResponse;
import org.parley.relserver.dto.AggregationGroupInfo;
import org.parley.relserver.exception.EventNotFoundException;
import org.parley.relserver.exception.InvalidCursorException;
import org.parley.relserver.exception.InvalidRelationException;
import org.parley.relserver.pagination.AggregationPageCursor;
import org.parley.relserver.pagination.CursorCodec;
import org.parley.relserver.repository.AggregationCounterRepository;
import org.parley.relserver.repository.RoomEventRepository;
import org.springframework.stereotype.Service;

/**
 * Serves annotation counts grouped by (event type, key).
 *
 * <p>Groups are read from the live counters, ordered by count descending with
 * ties broken by the order in which groups first appeared, and paged with a
 * (count, creation order) watermark.
 */
@Service
public class AggregationService {

  private final RoomEventRepository roomEventRepository;
  private final AggregationCounterRepository counterRepository;
  private final CursorCodec cursorCodec;

  /**
   * Constructor for AggregationService.
   *
   * @param roomEventRepository the event store
   * @param counterRepository the aggregation counters
   * @param cursorCodec the pagination token codec
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Repositories are Spring-managed beans and are intentionally shared"
  )
  public AggregationService(RoomEventRepository roomEventRepository,
      AggregationCounterRepository counterRepository, CursorCodec cursorCodec) {
    this.roomEventRepository = roomEventRepository;
    this.counterRepository = counterRepository;
    this.cursorCodec = cursorCodec;
  }

  /**
   * Pages through a parent's annotation groups.
   * The relation type is checked before the parent is looked up.
   *
   * @param roomId the room of the parent
   * @param parentId the parent event
   * @param relationType the requested relation type, or null for annotations
   * @param eventType restricts to one annotation event type, or null for all
   * @param limit page size
   * @param from token from the previous page, or null for the first page
   * @return the page
   * @throws InvalidRelationException if the relation type is not an annotation
   * @throws EventNotFoundException if the parent is not in the room
   * @throws InvalidCursorException if the token is invalid or belongs to another query
   */
  @Timed(value = "relations.aggregate", description = "Aggregation pagination latency")
  public AggregationChunkResponse aggregate(String roomId, String parentId,
      RelationType relationType, String eventType, int limit, String from) {
    if (relationType != null && !relationType.isAnnotation()) {
      throw new InvalidRelationException(
          "Aggregation is only supported for " + RelationType.ANNOTATION
              + " relations, got " + relationType);
    }
    if (roomEventRepository.findInRoom(roomId, parentId).isEmpty()) {
      throw new EventNotFoundException(parentId);
    }

    AggregationPageCursor cursor = null;
    if (from != null) {
      cursor = cursorCodec.decode(from, AggregationPageCursor.class);
      if (!cursor.belongsTo(parentId, eventType)) {
        throw new InvalidCursorException("Pagination token was issued for a different query");
      }
    }
    return page(parentId, eventType, cursor, limit);
  }

  /**
   * Returns the first page of a parent's annotation groups, for bundling.
   *
   * @param parentId the parent event
   * @param limit page size
   * @return the first page
   */
  public AggregationChunkResponse firstPage(String parentId, int limit) {
    return page(parentId, null, null, limit);
  }

  private AggregationChunkResponse page(String parentId, String eventType,
      AggregationPageCursor after, int limit) {
    List<AggregationGroup> remaining = counterRepository.findByTarget(parentId, eventType)
        .stream()
        .filter(group -> after == null || group.isAfter(after.count(), after.creationOrder()))
        .limit(limit + 1L)
        .toList();

    boolean hasMore = remaining.size() > limit;
    List<AggregationGroup> page = hasMore ? remaining.subList(0, limit) : remaining;

    String nextBatch = hasMore
        ? cursorCodec.encode(AggregationPageCursor.at(eventType, page.get(page.size() - 1)))
        : null;
    return new AggregationChunkResponse(
        page.stream().map(AggregationGroupInfo::of).toList(), nextBatch);
  }
}
