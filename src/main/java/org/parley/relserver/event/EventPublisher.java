package org.parley.relserver.event;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.annotation.Counted;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Headers;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.parley.relserver.config.KafkaProperties;
import org.parley.relserver.filter.CorrelationIdFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

/**
 * Service for publishing relation events to Kafka.
 * Handles partitioning by relation target, header creation and failure logging.
 */
@Service
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class EventPublisher {
  private static final Logger logger = LoggerFactory.getLogger(EventPublisher.class);

  private final KafkaTemplate<String, RelationEvent> kafkaTemplate;
  private final KafkaProperties kafkaProperties;

  /**
   * Constructs an EventPublisher with the specified Kafka template and properties.
   *
   * @param kafkaTemplate the Kafka template for sending events
   * @param kafkaProperties the Kafka configuration properties
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Both KafkaTemplate and KafkaProperties are Spring beans,"
          + " thread-safe and immutable after initialization")
  public EventPublisher(
      KafkaTemplate<String, RelationEvent> kafkaTemplate,
      KafkaProperties kafkaProperties) {
    this.kafkaTemplate = kafkaTemplate;
    this.kafkaProperties = kafkaProperties;
  }

  /**
   * Publishes a relation event to the relation topic, keyed by its target event.
   *
   * @param event the event to publish
   * @return a CompletableFuture with the send result
   */
  @Counted(
      value = "relations.events.published",
      description = "Relation events published count"
  )
  public CompletableFuture<SendResult<String, RelationEvent>> publish(RelationEvent event) {
    String topic = kafkaProperties.getTopic();
    String key = event.getAggregateIdentity().getPartitionKey();

    ProducerRecord<String, RelationEvent> record = new ProducerRecord<>(topic, null, key, event);
    addHeaders(record.headers(), event);

    logger.info("Publishing event {} to topic {} with key {}",
        event.getClass().getSimpleName(), topic, key);

    return kafkaTemplate.send(record)
        .whenComplete((result, ex) -> {
          if (ex != null) {
            logger.error("Failed to publish event {} to topic {}: {}",
                event.eventId(), topic, ex.getMessage(), ex);
          } else {
            logger.debug("Event published successfully to topic {} partition {} offset {}",
                topic, result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset());
          }
        });
  }

  private void addHeaders(Headers headers, RelationEvent event) {
    put(headers, EventHeaders.EVENT_ID, event.eventId());
    put(headers, EventHeaders.ROOM_ID, event.roomId());
    put(headers, EventHeaders.EVENT_TYPE, event.getClass().getSimpleName().replace("Event", ""));
    put(headers, EventHeaders.TIMESTAMP, String.valueOf(Instant.now().toEpochMilli()));

    String correlationId = MDC.get(CorrelationIdFilter.CORRELATION_ID_KEY);
    if (correlationId != null) {
      put(headers, EventHeaders.CORRELATION_ID, correlationId);
    }

    AggregateIdentity aggregateId = event.getAggregateIdentity();
    put(headers, EventHeaders.AGGREGATE_TYPE, aggregateId.getAggregateType());
    put(headers, EventHeaders.AGGREGATE_ID, aggregateId.getPartitionKey());

    if (event instanceof RelationCreatedEvent created) {
      put(headers, EventHeaders.REL_TYPE, created.relationType());
    }
  }

  private static void put(Headers headers, String name, String value) {
    headers.add(new RecordHeader(name, value.getBytes(StandardCharsets.UTF_8)));
  }
}
