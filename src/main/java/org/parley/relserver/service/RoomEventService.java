package org.parley.relserver.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.parley.relserver.command.RedactEventCommand;
import org.parley.relserver.command.RedactEventCommandHandler;
import org.parley.relserver.command.SendRelationCommand;
import org.parley.relserver.command.SendRelationCommandHandler;
import org.parley.relserver.domain.EventDraft;
import org.parley.relserver.domain.RelationDescriptor;
import org.parley.relserver.domain.RoomEvent;
import org.parley.relserver.domain.StreamPosition;
import org.parley.relserver.dto.MessagesResponse;
import org.parley.relserver.dto.RoomEventView;
import org.parley.relserver.event.RelationCreatedEvent;
import org.parley.relserver.event.RelationRedactedEvent;
import org.parley.relserver.exception.EventNotFoundException;
import org.parley.relserver.exception.InvalidCursorException;
import org.parley.relserver.pagination.CursorCodec;
import org.parley.relserver.pagination.MessagesPageCursor;
import org.parley.relserver.repository.RoomEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Plain room event operations: sending, state, fetching and history.
 *
 * <p>Events whose content declares a relation are routed through the relation
 * ingest path so they are validated, indexed and counted like events sent via
 * {@code send_relation}.
 */
@Service
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class RoomEventService {

  private static final Logger logger = LoggerFactory.getLogger(RoomEventService.class);

  private final RoomEventRepository roomEventRepository;
  private final SendRelationCommandHandler sendRelationHandler;
  private final RedactEventCommandHandler redactHandler;
  private final BundlingService bundlingService;
  private final CursorCodec cursorCodec;

  /**
   * Constructor for RoomEventService.
   *
   * @param roomEventRepository the event store
   * @param sendRelationHandler relation ingest
   * @param redactHandler redaction handling
   * @param bundlingService relation summaries for served events
   * @param cursorCodec the pagination token codec
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Collaborators are Spring-managed beans and are intentionally shared"
  )
  public RoomEventService(RoomEventRepository roomEventRepository,
      SendRelationCommandHandler sendRelationHandler,
      RedactEventCommandHandler redactHandler,
      BundlingService bundlingService,
      CursorCodec cursorCodec) {
    this.roomEventRepository = roomEventRepository;
    this.sendRelationHandler = sendRelationHandler;
    this.redactHandler = redactHandler;
    this.bundlingService = bundlingService;
    this.cursorCodec = cursorCodec;
  }

  /**
   * Sends a message-like event.
   *
   * @param roomId the room
   * @param eventType the event type
   * @param sender the sending user
   * @param content the event content
   * @return the new event id
   */
  public String send(String roomId, String eventType, String sender,
      Map<String, Object> content) {
    Optional<RelationDescriptor> relation = RelationDescriptor.fromContent(content);
    if (relation.isPresent()) {
      RelationDescriptor descriptor = relation.get();
      RelationCreatedEvent created = sendRelationHandler.handle(
          new SendRelationCommand(roomId, descriptor.targetEventId(),
              descriptor.relationType(), eventType, descriptor.key(), sender, content));
      return created.relationEventId();
    }

    RoomEvent stored = roomEventRepository.persist(
        EventDraft.message(roomId, eventType, sender, content));
    logger.debug("Sent {} event {} in room {}", eventType, stored.eventId(), roomId);
    return stored.eventId();
  }

  /**
   * Sends a state event, replacing the room's current state for the type and key.
   *
   * @param roomId the room
   * @param eventType the state event type
   * @param stateKey the state key
   * @param sender the sending user
   * @param content the event content
   * @return the new event id
   */
  public String sendState(String roomId, String eventType, String stateKey, String sender,
      Map<String, Object> content) {
    RoomEvent stored = roomEventRepository.persist(
        EventDraft.state(roomId, eventType, stateKey, sender, content));
    logger.debug("Set state {}/{} in room {} to {}", eventType, stateKey, roomId,
        stored.eventId());
    return stored.eventId();
  }

  /**
   * Fetches an event with its relation summaries.
   *
   * @param roomId the room
   * @param eventId the event
   * @return the served event
   * @throws EventNotFoundException if the event is not in the room
   */
  public RoomEventView getEvent(String roomId, String eventId) {
    RoomEvent event = roomEventRepository.findInRoom(roomId, eventId)
        .orElseThrow(() -> new EventNotFoundException(eventId));
    return bundlingService.view(event);
  }

  /**
   * Pages backwards through a room's timeline.
   *
   * @param roomId the room
   * @param limit page size
   * @param from token from the previous page, or null for the newest events
   * @param bundleRelations whether to attach relation summaries
   * @return the page
   * @throws InvalidCursorException if the token is invalid or belongs to another room
   */
  public MessagesResponse messages(String roomId, int limit, String from,
      boolean bundleRelations) {
    StreamPosition before = null;
    if (from != null) {
      MessagesPageCursor cursor = cursorCodec.decode(from, MessagesPageCursor.class);
      if (!cursor.roomId().equals(roomId)) {
        throw new InvalidCursorException("Pagination token was issued for a different room");
      }
      before = cursor.position();
    }

    List<RoomEvent> events = roomEventRepository.findTimelinePage(roomId, before, limit + 1);
    boolean hasMore = events.size() > limit;
    List<RoomEvent> page = hasMore ? events.subList(0, limit) : events;

    List<RoomEventView> chunk = page.stream()
        .map(event -> bundleRelations ? bundlingService.view(event) : RoomEventView.of(event))
        .toList();
    String end = hasMore
        ? cursorCodec.encode(MessagesPageCursor.at(roomId, page.get(page.size() - 1).position()))
        : null;
    return new MessagesResponse(chunk, end);
  }

  /**
   * Redacts an event.
   *
   * @param roomId the room
   * @param eventId the event to redact
   * @param sender the redacting user
   * @param reason optional reason
   * @return the id of the redaction event
   */
  public String redact(String roomId, String eventId, String sender, String reason) {
    RelationRedactedEvent redacted = redactHandler.handle(
        new RedactEventCommand(roomId, eventId, sender, reason));
    return redacted.redactionEventId();
  }
}
