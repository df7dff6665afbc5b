package org.parley.relserver.projection;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.StandardCharsets;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.Headers;
import org.parley.relserver.config.ProjectorProperties;
import org.parley.relserver.domain.EventDraft;
import org.parley.relserver.domain.RelationEdge;
import org.parley.relserver.domain.RoomEvent;
import org.parley.relserver.event.EventHeaders;
import org.parley.relserver.event.RelationCreatedEvent;
import org.parley.relserver.event.RelationEvent;
import org.parley.relserver.event.RelationRedactedEvent;
import org.parley.relserver.filter.CorrelationIdFilter;
import org.parley.relserver.repository.RoomEventRepository;
import org.parley.relserver.repository.UnitOfWork;
import org.parley.relserver.service.RelationIndexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

/**
 * Applies relation events from the event log to the local event store and
 * relation index.
 *
 * <p>Events written by this instance are already applied and are skipped.
 * Events from other instances, and replays after a restart, are stored with
 * their original event ids and indexed under the same per-target lock as
 * local writes. Applying an event twice changes nothing: the source event id
 * identifies the edge, and a redaction that already happened is a no-op.
 *
 * <p>Failures are rethrown as {@link ProjectionException} so the listener
 * container retries the record and finally routes it to the dead letter topic.
 * The offset is not committed for a failed record.
 */
@Service
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class RelationProjector {
  private static final Logger logger = LoggerFactory.getLogger(RelationProjector.class);

  private final RoomEventRepository roomEventRepository;
  private final RelationIndexer relationIndexer;
  private final ProjectorProperties projectorProperties;
  private final MeterRegistry meterRegistry;

  // Deduplication: LRU cache of processed log event IDs
  private final Cache<String, Boolean> processedEventIds;

  /**
   * Constructs a RelationProjector.
   *
   * @param roomEventRepository the event store
   * @param relationIndexer the relation index writer
   * @param projectorProperties the projector configuration properties
   * @param meterRegistry the meter registry
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Repositories are Spring-managed beans and are intentionally shared")
  public RelationProjector(
      RoomEventRepository roomEventRepository,
      RelationIndexer relationIndexer,
      ProjectorProperties projectorProperties,
      MeterRegistry meterRegistry) {
    this.roomEventRepository = roomEventRepository;
    this.relationIndexer = relationIndexer;
    this.projectorProperties = projectorProperties;
    this.meterRegistry = meterRegistry;

    this.processedEventIds = Caffeine.newBuilder()
        .maximumSize(projectorProperties.getDeduplication().getCacheSize())
        .expireAfterWrite(projectorProperties.getDeduplication().getRetention())
        .<String, Boolean>build();
  }

  /**
   * Kafka listener for relation events.
   *
   * @param record the Kafka consumer record containing event and headers
   * @throws ProjectionException if the event cannot be applied (triggers Kafka retry)
   */
  @KafkaListener(
      topics = "${kafka.topic:parley.relations.events}",
      groupId = "${kafka.consumer.group-id:relation-projector}",
      containerFactory = "kafkaListenerContainerFactory",
      autoStartup = "${projector.kafka-listener.enabled:true}"
  )
  @SuppressFBWarnings(
      value = "REC_CATCH_EXCEPTION",
      justification = "Catch-all exception handler delegates to the container's retry/DLQ logic")
  public void handleEvent(ConsumerRecord<String, RelationEvent> record) {
    RelationEvent event = record.value();

    String correlationId = extractHeader(record.headers(), EventHeaders.CORRELATION_ID);
    if (correlationId != null) {
      MDC.put(CorrelationIdFilter.CORRELATION_ID_KEY, correlationId);
    }

    try {
      logger.debug("Received event: {} (id={}) for room: {}",
          event.getClass().getSimpleName(), event.eventId(), event.roomId());

      if (projectorProperties.getDeduplication().isEnabled()) {
        if (processedEventIds.getIfPresent(event.eventId()) != null) {
          logger.warn("Skipping duplicate event: {} (id={})",
              event.getClass().getSimpleName(), event.eventId());
          return;
        }
      }

      boolean applied;
      if (event instanceof RelationCreatedEvent created) {
        applied = handleRelationCreated(created);
      } else if (event instanceof RelationRedactedEvent redacted) {
        applied = handleRelationRedacted(redacted);
      } else {
        throw new IllegalArgumentException(
            "Unsupported event type: " + event.getClass().getName());
      }

      if (projectorProperties.getDeduplication().isEnabled()) {
        processedEventIds.put(event.eventId(), Boolean.TRUE);
      }
      meterRegistry.counter("relations.projected",
          "type", event.getClass().getSimpleName(),
          "outcome", applied ? "applied" : "skipped").increment();

      logger.debug("Projected event: {} (id={}) applied={}",
          event.getClass().getSimpleName(), event.eventId(), applied);
    } catch (Exception ex) {
      logger.error("Failed to project event: {} (id={}) for room: {}",
          event.getClass().getSimpleName(), event.eventId(), event.roomId(), ex);
      throw new ProjectionException("Failed to project event " + event.eventId(), ex);
    } finally {
      MDC.remove(CorrelationIdFilter.CORRELATION_ID_KEY);
    }
  }

  /**
   * Stores and indexes a relation event written elsewhere.
   *
   * @param event the relation created event
   * @return true if the relation was new to this instance
   */
  boolean handleRelationCreated(RelationCreatedEvent event) {
    return relationIndexer.withTargetLock(event.targetEventId(), () -> {
      if (roomEventRepository.findById(event.relationEventId()).isPresent()) {
        logger.debug("Relation event {} already stored, skipping", event.relationEventId());
        return false;
      }

      UnitOfWork unitOfWork = new UnitOfWork();
      try {
        RoomEvent stored = roomEventRepository.persist(new EventDraft(
            event.relationEventId(), event.roomId(), event.sourceType(), null, event.sender(),
            event.content(), event.originServerTs()));
        unitOfWork.onRollback(() -> roomEventRepository.remove(stored.eventId()));

        boolean indexed = relationIndexer.index(RelationEdge.of(stored), unitOfWork);
        unitOfWork.commit();
        logger.info("Projected {} relation {} -> {} in room {}", event.relationType(),
            stored.eventId(), event.targetEventId(), event.roomId());
        return indexed;
      } catch (RuntimeException e) {
        unitOfWork.rollback(e);
        throw e;
      }
    });
  }

  /**
   * Applies a redaction written elsewhere.
   * Redactions of events unknown to this instance are skipped.
   *
   * @param event the relation redacted event
   * @return true if the redaction changed local state
   */
  boolean handleRelationRedacted(RelationRedactedEvent event) {
    return relationIndexer.withTargetLock(event.targetEventId(), () -> {
      if (roomEventRepository.findById(event.redactedEventId()).isEmpty()) {
        logger.debug("Redacted event {} unknown here, skipping", event.redactedEventId());
        return false;
      }

      UnitOfWork unitOfWork = new UnitOfWork();
      try {
        boolean changed = roomEventRepository.markRedacted(event.redactedEventId()).isPresent();
        if (changed) {
          unitOfWork.onRollback(
              () -> roomEventRepository.clearRedaction(event.redactedEventId()));
        }
        changed |= relationIndexer.redact(event.redactedEventId(), unitOfWork).isPresent();
        unitOfWork.commit();
        if (changed) {
          logger.info("Projected redaction of {} in room {}", event.redactedEventId(),
              event.roomId());
        }
        return changed;
      } catch (RuntimeException e) {
        unitOfWork.rollback(e);
        throw e;
      }
    });
  }

  private String extractHeader(Headers headers, String key) {
    Header header = headers.lastHeader(key);
    return header != null ? new String(header.value(), StandardCharsets.UTF_8) : null;
  }

  /**
   * Exception thrown when event projection fails.
   */
  public static class ProjectionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new ProjectionException with the specified message and cause.
     *
     * @param message the detail message
     * @param cause the cause of this exception
     */
    public ProjectionException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
