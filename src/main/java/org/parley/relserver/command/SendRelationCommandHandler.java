package org.parley.relserver.command;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.annotation.Timed;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.parley.relserver.config.RelationsProperties;
import org.parley.relserver.domain.EventDraft;
import org.parley.relserver.domain.EventTypes;
import org.parley.relserver.domain.RelationDescriptor;
import org.parley.relserver.domain.RelationEdge;
import org.parley.relserver.domain.RelationType;
import org.parley.relserver.domain.RoomEvent;
import org.parley.relserver.event.EventPublisher;
import org.parley.relserver.event.RelationCreatedEvent;
import org.parley.relserver.event.RelationEvent;
import org.parley.relserver.exception.EventNotFoundException;
import org.parley.relserver.exception.InvalidRelationException;
import org.parley.relserver.repository.RoomEventRepository;
import org.parley.relserver.repository.UnitOfWork;
import org.parley.relserver.service.RelationIndexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.KafkaException;
import org.springframework.stereotype.Component;

/**
 * Handles SendRelationCommand: validates the relation, then persists the new
 * event, indexes its edge and counts it, all as one unit of work.
 *
 * <p>Validation happens before any write, so a rejected relation leaves no trace.
 * The resulting {@link RelationCreatedEvent} is published once the unit of work
 * has committed; a publish failure is logged and does not undo the ingest.
 */
@Component
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class SendRelationCommandHandler implements CommandHandler<SendRelationCommand> {

  private static final Logger logger = LoggerFactory.getLogger(SendRelationCommandHandler.class);

  private final EventPublisher eventPublisher;
  private final RoomEventRepository roomEventRepository;
  private final RelationIndexer relationIndexer;
  private final RelationsProperties properties;

  /**
   * Constructs a SendRelationCommandHandler.
   *
   * @param eventPublisher the event publisher
   * @param roomEventRepository the event store
   * @param relationIndexer the relation index writer
   * @param properties relation configuration
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Repositories are Spring-managed beans and are intentionally shared")
  public SendRelationCommandHandler(
      EventPublisher eventPublisher,
      RoomEventRepository roomEventRepository,
      RelationIndexer relationIndexer,
      RelationsProperties properties) {
    this.eventPublisher = eventPublisher;
    this.roomEventRepository = roomEventRepository;
    this.relationIndexer = relationIndexer;
    this.properties = properties;
  }

  @Override
  @Timed(value = "relations.ingest", description = "Relation ingest latency")
  public RelationCreatedEvent handle(SendRelationCommand command) {
    if (EventTypes.MEMBER.equals(command.eventType())) {
      throw new InvalidRelationException("Membership events cannot be sent as relations");
    }

    RelationCreatedEvent event = relationIndexer.withTargetLock(command.parentId(), () -> {
      RoomEvent parent = roomEventRepository.findInRoom(command.roomId(), command.parentId())
          .orElseThrow(() -> new EventNotFoundException(command.parentId()));
      validate(command, parent);
      return persistAndIndex(command);
    });

    publish(event);
    return event;
  }

  private void validate(SendRelationCommand command, RoomEvent parent) {
    if (parent.isMembership()) {
      throw new InvalidRelationException("Cannot relate to a membership event");
    }
    if (parent.redacted()) {
      throw new InvalidRelationException("Cannot relate to a redacted event");
    }

    String key = command.key();
    boolean annotation = command.relationType().isAnnotation();
    if (annotation && properties.isReactionType(command.eventType())
        && (key == null || key.trim().isEmpty())) {
      throw new InvalidRelationException(
          "A non-empty key is required for " + command.eventType() + " annotations");
    }
    if (key != null && !annotation) {
      throw new InvalidRelationException(
          "A key is only allowed on " + RelationType.ANNOTATION + " relations, got "
              + command.relationType());
    }
    if (key != null && key.trim().isEmpty()) {
      throw new InvalidRelationException("Annotation key cannot be blank");
    }
  }

  private RelationCreatedEvent persistAndIndex(SendRelationCommand command) {
    RelationDescriptor relation = new RelationDescriptor(
        command.relationType(), command.parentId(), command.key());
    Map<String, Object> content = new LinkedHashMap<>(command.content());
    content.put(EventTypes.RELATES_TO, relation.toContent());

    UnitOfWork unitOfWork = new UnitOfWork();
    try {
      RoomEvent stored = roomEventRepository.persist(new EventDraft(
          null, command.roomId(), command.eventType(), null, command.sender(), content,
          Instant.now()));
      unitOfWork.onRollback(() -> roomEventRepository.remove(stored.eventId()));

      RelationEdge edge = RelationEdge.of(stored);
      relationIndexer.index(edge, unitOfWork);
      unitOfWork.commit();

      logger.info("Sent {} relation {} -> {} in room {}", edge.relationType(),
          stored.eventId(), edge.targetEventId(), stored.roomId());
      return RelationCreatedEvent.of(stored, edge);
    } catch (RuntimeException e) {
      unitOfWork.rollback(e);
      throw e;
    }
  }

  private void publish(RelationEvent event) {
    try {
      eventPublisher.publish(event)
          .whenComplete((result, ex) -> {
            if (ex != null) {
              logger.error("Failed to publish event {} to Kafka: {}",
                  event.getClass().getSimpleName(), ex.getMessage(), ex);
            } else {
              logger.debug("Successfully published event {} to Kafka",
                  event.getClass().getSimpleName());
            }
          });
    } catch (KafkaException e) {
      logger.error("Failed to publish event {} to Kafka, local relation index is kept: {}",
          event.eventId(), e.getMessage(), e);
    }
  }
}
