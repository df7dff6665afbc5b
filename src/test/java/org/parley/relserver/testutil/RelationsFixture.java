package org.parley.relserver.testutil;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.parley.relserver.command.RedactEventCommand;
import org.parley.relserver.command.RedactEventCommandHandler;
import org.parley.relserver.command.SendRelationCommand;
import org.parley.relserver.command.SendRelationCommandHandler;
import org.parley.relserver.config.RelationsProperties;
import org.parley.relserver.domain.EventDraft;
import org.parley.relserver.domain.RelationType;
import org.parley.relserver.domain.RoomEvent;
import org.parley.relserver.event.EventPublisher;
import org.parley.relserver.pagination.CursorCodec;
import org.parley.relserver.repository.AggregationCounterRepository;
import org.parley.relserver.repository.InMemoryRelationRepository;
import org.parley.relserver.repository.RoomEventRepository;
import org.parley.relserver.service.AggregationService;
import org.parley.relserver.service.BundlingService;
import org.parley.relserver.service.RelationIndexer;
import org.parley.relserver.service.RelationQueryService;

/**
 * Wires the relation engine from its in-memory parts with a mocked event
 * publisher, for service-level tests without a Spring context.
 */
public final class RelationsFixture {

  public static final String ROOM = "!room:test";
  public static final String ALICE = "@alice:test";
  public static final String BOB = "@bob:test";

  public final RelationsProperties properties = new RelationsProperties();
  public final RoomEventRepository events;
  public final InMemoryRelationRepository relations = new InMemoryRelationRepository();
  public final AggregationCounterRepository counters = new AggregationCounterRepository();
  public final RelationIndexer indexer = new RelationIndexer(relations, counters);
  public final CursorCodec cursorCodec = new CursorCodec(new ObjectMapper());
  public final EventPublisher publisher = mock(EventPublisher.class);
  public final SendRelationCommandHandler sendHandler;
  public final RedactEventCommandHandler redactHandler;
  public final AggregationService aggregationService;
  public final RelationQueryService queryService;
  public final BundlingService bundlingService;

  /**
   * Creates a fixture with default configuration.
   */
  public RelationsFixture() {
    properties.setServerName("test");
    events = new RoomEventRepository(properties);
    lenient().when(publisher.publish(any())).thenReturn(CompletableFuture.completedFuture(null));
    sendHandler = new SendRelationCommandHandler(publisher, events, indexer, properties);
    redactHandler = new RedactEventCommandHandler(publisher, events, indexer);
    aggregationService = new AggregationService(events, counters, cursorCodec);
    queryService = new RelationQueryService(events, relations, cursorCodec);
    bundlingService = new BundlingService(aggregationService, relations, properties);
  }

  /**
   * Sends a plain message.
   *
   * @param sender the sender
   * @param body the message body
   * @return the stored event
   */
  public RoomEvent message(String sender, String body) {
    return events.persist(EventDraft.message(ROOM, "m.room.message", sender,
        Map.of("msgtype", "m.text", "body", body)));
  }

  /**
   * Sends an annotation.
   *
   * @param parent the annotated event
   * @param eventType the annotation event type
   * @param key the key
   * @param sender the sender
   * @return the id of the annotation event
   */
  public String annotate(RoomEvent parent, String eventType, String key, String sender) {
    return relate(parent, RelationType.ANNOTATION, eventType, key, sender);
  }

  /**
   * Sends a relation.
   *
   * @param parent the target event
   * @param type the relation type
   * @param eventType the relation event type
   * @param key the key, or null
   * @param sender the sender
   * @return the id of the relation event
   */
  public String relate(RoomEvent parent, RelationType type, String eventType, String key,
      String sender) {
    return sendHandler.handle(new SendRelationCommand(ROOM, parent.eventId(), type, eventType,
        key, sender, Map.of())).relationEventId();
  }

  /**
   * Redacts an event.
   *
   * @param eventId the event
   * @return the id of the redaction event
   */
  public String redact(String eventId) {
    return redactHandler.handle(new RedactEventCommand(ROOM, eventId, ALICE, null))
        .redactionEventId();
  }
}
