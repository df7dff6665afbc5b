package org.parley.relserver.repository;

import com.github.f4b6a3.uuid.UuidCreator;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import org.parley.relserver.config.RelationsProperties;
import org.parley.relserver.domain.EventDraft;
import org.parley.relserver.domain.RoomEvent;
import org.parley.relserver.domain.StreamPosition;
import org.springframework.stereotype.Repository;

/**
 * In-memory event store for room events.
 *
 * <p>Assigns each persisted event its stream position: the topological part
 * is the room depth (incremented per event in the room), the stream part is a
 * server-wide counter. Keeps a per-room timeline ordered by position and the
 * current state event per (room, type, state key).
 *
 * <p>Thread-safe: all maps are concurrent and counters atomic.
 */
@Repository
public class RoomEventRepository {

  private final Map<String, RoomEvent> events = new ConcurrentHashMap<>();

  // roomId -> position -> eventId
  private final Map<String, ConcurrentSkipListMap<StreamPosition, String>> timelines =
      new ConcurrentHashMap<>();

  // roomId -> "type|stateKey" -> eventId
  private final Map<String, Map<String, String>> currentState = new ConcurrentHashMap<>();

  private final Map<String, AtomicLong> roomDepths = new ConcurrentHashMap<>();
  private final AtomicLong streamOrdering = new AtomicLong();

  private final RelationsProperties properties;

  /**
   * Constructs the event store.
   *
   * @param properties relation configuration (server name for event ids)
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RelationsProperties is a Spring-managed configuration bean"
  )
  public RoomEventRepository(RelationsProperties properties) {
    this.properties = properties;
  }

  /**
   * Persists a draft, assigning its position and, if absent, its event id.
   *
   * @param draft the event draft
   * @return the persisted event
   * @throws IllegalStateException if an event with the draft's id already exists
   */
  public RoomEvent persist(EventDraft draft) {
    String eventId = draft.eventId() != null ? draft.eventId() : newEventId();
    long depth = roomDepths.computeIfAbsent(draft.roomId(), r -> new AtomicLong())
        .incrementAndGet();
    StreamPosition position = new StreamPosition(depth, streamOrdering.incrementAndGet());

    RoomEvent event = new RoomEvent(
        eventId,
        draft.roomId(),
        draft.type(),
        draft.stateKey(),
        draft.sender(),
        draft.content(),
        draft.originServerTs(),
        position,
        false);

    if (events.putIfAbsent(eventId, event) != null) {
      throw new IllegalStateException("Event already exists: " + eventId);
    }
    timelines.computeIfAbsent(event.roomId(), r -> new ConcurrentSkipListMap<>())
        .put(position, eventId);
    if (event.isState()) {
      currentState.computeIfAbsent(event.roomId(), r -> new ConcurrentHashMap<>())
          .put(stateKey(event.type(), event.stateKey()), eventId);
    }
    return event;
  }

  /**
   * Finds an event by id.
   *
   * @param eventId the event id
   * @return the event, if stored
   */
  public Optional<RoomEvent> findById(String eventId) {
    return Optional.ofNullable(events.get(eventId));
  }

  /**
   * Finds an event by id, only if it belongs to the given room.
   *
   * @param roomId the room id
   * @param eventId the event id
   * @return the event, if stored in that room
   */
  public Optional<RoomEvent> findInRoom(String roomId, String eventId) {
    return findById(eventId).filter(event -> event.roomId().equals(roomId));
  }

  /**
   * Finds the current state event of a room for a type and state key.
   *
   * @param roomId the room id
   * @param type the state event type
   * @param stateKey the state key
   * @return the current state event, if any
   */
  public Optional<RoomEvent> findCurrentState(String roomId, String type, String stateKey) {
    return Optional.ofNullable(currentState.get(roomId))
        .map(state -> state.get(stateKey(type, stateKey)))
        .map(events::get);
  }

  /**
   * Returns a page of a room's timeline, newest first.
   *
   * @param roomId the room id
   * @param before exclusive upper bound, or null to start from the newest event
   * @param limit maximum number of events
   * @return events in reverse-chronological order
   */
  public List<RoomEvent> findTimelinePage(String roomId, StreamPosition before, int limit) {
    ConcurrentSkipListMap<StreamPosition, String> timeline = timelines.get(roomId);
    if (timeline == null) {
      return List.of();
    }
    NavigableMap<StreamPosition, String> view = before == null
        ? timeline.descendingMap()
        : timeline.headMap(before, false).descendingMap();

    List<RoomEvent> page = new ArrayList<>(Math.min(limit, view.size()));
    for (String eventId : view.values()) {
      if (page.size() >= limit) {
        break;
      }
      RoomEvent event = events.get(eventId);
      if (event != null) {
        page.add(event);
      }
    }
    return page;
  }

  /**
   * Sets the redaction marker on an event.
   *
   * @param eventId the event id
   * @return the redacted event, or empty if the event is unknown or already redacted
   */
  public Optional<RoomEvent> markRedacted(String eventId) {
    RoomEvent[] changed = new RoomEvent[1];
    events.computeIfPresent(eventId, (id, event) -> {
      if (event.redacted()) {
        return event;
      }
      changed[0] = event.asRedacted();
      return changed[0];
    });
    return Optional.ofNullable(changed[0]);
  }

  /**
   * Clears the redaction marker on an event. Used to roll back a failed redaction.
   *
   * @param eventId the event id
   */
  public void clearRedaction(String eventId) {
    events.computeIfPresent(eventId, (id, event) -> new RoomEvent(
        event.eventId(), event.roomId(), event.type(), event.stateKey(), event.sender(),
        event.content(), event.originServerTs(), event.position(), false));
  }

  /**
   * Removes an event. Used to roll back a failed unit of work only.
   *
   * @param eventId the event id
   */
  public void remove(String eventId) {
    RoomEvent removed = events.remove(eventId);
    if (removed == null) {
      return;
    }
    Optional.ofNullable(timelines.get(removed.roomId()))
        .ifPresent(timeline -> timeline.remove(removed.position()));
    if (removed.isState()) {
      Optional.ofNullable(currentState.get(removed.roomId()))
          .ifPresent(state -> state.remove(
              stateKey(removed.type(), removed.stateKey()), eventId));
    }
  }

  public long count() {
    return events.size();
  }

  private String newEventId() {
    return "$" + UuidCreator.getTimeOrderedEpoch() + ":" + properties.getServerName();
  }

  private static String stateKey(String type, String stateKey) {
    return type + "|" + stateKey;
  }
}
