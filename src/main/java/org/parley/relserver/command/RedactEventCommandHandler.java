package org.parley.relserver.command;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.parley.relserver.domain.EventDraft;
import org.parley.relserver.domain.EventTypes;
import org.parley.relserver.domain.RelationDescriptor;
import org.parley.relserver.domain.RoomEvent;
import org.parley.relserver.event.EventPublisher;
import org.parley.relserver.event.RelationRedactedEvent;
import org.parley.relserver.exception.EventNotFoundException;
import org.parley.relserver.repository.RoomEventRepository;
import org.parley.relserver.repository.UnitOfWork;
import org.parley.relserver.service.RelationIndexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.KafkaException;
import org.springframework.stereotype.Component;

/**
 * Handles RedactEventCommand by storing a redaction event and soft-deleting
 * the redacted event.
 *
 * <p>If the redacted event is a relation, its edge is hidden and its annotation
 * is uncounted. If it is a parent, it becomes stale: its edges are kept but it
 * is no longer bundled and cannot receive new relations. Redacting an event
 * that is already redacted only records another redaction event.
 */
@Component
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class RedactEventCommandHandler implements CommandHandler<RedactEventCommand> {

  private static final Logger logger = LoggerFactory.getLogger(RedactEventCommandHandler.class);

  static final String REDACTS = "redacts";
  static final String REASON = "reason";

  private final EventPublisher eventPublisher;
  private final RoomEventRepository roomEventRepository;
  private final RelationIndexer relationIndexer;

  /**
   * Constructs a RedactEventCommandHandler.
   *
   * @param eventPublisher the event publisher
   * @param roomEventRepository the event store
   * @param relationIndexer the relation index writer
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Repositories are Spring-managed beans and are intentionally shared")
  public RedactEventCommandHandler(
      EventPublisher eventPublisher,
      RoomEventRepository roomEventRepository,
      RelationIndexer relationIndexer) {
    this.eventPublisher = eventPublisher;
    this.roomEventRepository = roomEventRepository;
    this.relationIndexer = relationIndexer;
  }

  @Override
  public RelationRedactedEvent handle(RedactEventCommand command) {
    RoomEvent redacted = roomEventRepository.findInRoom(command.roomId(), command.eventId())
        .orElseThrow(() -> new EventNotFoundException(command.eventId()));

    // Relations lock on their target, everything else on itself
    String aggregateId = redacted.relation()
        .map(RelationDescriptor::targetEventId)
        .orElse(redacted.eventId());

    RelationRedactedEvent event = relationIndexer.withTargetLock(aggregateId,
        () -> redact(command, redacted, aggregateId));

    try {
      eventPublisher.publish(event)
          .whenComplete((result, ex) -> {
            if (ex != null) {
              logger.error("Failed to publish event {} to Kafka: {}",
                  event.getClass().getSimpleName(), ex.getMessage(), ex);
            }
          });
    } catch (KafkaException e) {
      logger.error("Failed to publish event {} to Kafka, local redaction is kept: {}",
          event.eventId(), e.getMessage(), e);
    }
    return event;
  }

  private RelationRedactedEvent redact(RedactEventCommand command, RoomEvent redacted,
      String aggregateId) {
    Map<String, Object> content = new LinkedHashMap<>();
    content.put(REDACTS, redacted.eventId());
    if (command.reason() != null) {
      content.put(REASON, command.reason());
    }

    UnitOfWork unitOfWork = new UnitOfWork();
    try {
      RoomEvent redaction = roomEventRepository.persist(new EventDraft(
          null, command.roomId(), EventTypes.REDACTION, null, command.sender(), content,
          Instant.now()));
      unitOfWork.onRollback(() -> roomEventRepository.remove(redaction.eventId()));

      if (roomEventRepository.markRedacted(redacted.eventId()).isPresent()) {
        unitOfWork.onRollback(() -> roomEventRepository.clearRedaction(redacted.eventId()));
      }
      relationIndexer.redact(redacted.eventId(), unitOfWork);
      unitOfWork.commit();

      logger.info("Redacted event {} in room {} with {}", redacted.eventId(),
          command.roomId(), redaction.eventId());
      return new RelationRedactedEvent(null, command.roomId(), redacted.eventId(), aggregateId,
          redaction.eventId(), command.sender(), Instant.now());
    } catch (RuntimeException e) {
      unitOfWork.rollback(e);
      throw e;
    }
  }
}
