package org.parley.relserver.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.parley.relserver.config.KafkaProperties;
import org.parley.relserver.filter.CorrelationIdFilter;
import org.slf4j.MDC;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

/**
 * Unit tests for EventPublisher.
 */
@ExtendWith(MockitoExtension.class)
class EventPublisherTest {

  @Mock
  private KafkaTemplate<String, RelationEvent> kafkaTemplate;

  @Mock
  private SendResult<String, RelationEvent> sendResult;

  @Captor
  private ArgumentCaptor<ProducerRecord<String, RelationEvent>> recordCaptor;

  private EventPublisher eventPublisher;

  @BeforeEach
  @SuppressWarnings("unchecked") // ProducerRecord with generics, safe for mocking
  void setUp() {
    KafkaProperties kafkaProperties = new KafkaProperties();
    kafkaProperties.setTopic("relations.test");
    eventPublisher = new EventPublisher(kafkaTemplate, kafkaProperties);

    when(kafkaTemplate.send(any(ProducerRecord.class)))
        .thenReturn(CompletableFuture.completedFuture(sendResult));
  }

  @AfterEach
  void tearDown() {
    MDC.clear();
  }

  @Test
  void publish_shouldKeyRelationEventsByTarget() {
    RelationCreatedEvent event = new RelationCreatedEvent(null, "!room", "$reaction",
        "$parent", "m.annotation", "m.reaction", "@alice", Map.of(), Instant.now(),
        Instant.now());

    eventPublisher.publish(event);

    verify(kafkaTemplate).send(recordCaptor.capture());
    ProducerRecord<String, RelationEvent> record = recordCaptor.getValue();
    assertThat(record.topic()).isEqualTo("relations.test");
    assertThat(record.key()).isEqualTo("$parent");
    assertThat(record.value()).isEqualTo(event);
    assertThat(header(record, EventHeaders.EVENT_ID)).isEqualTo(event.eventId());
    assertThat(header(record, EventHeaders.ROOM_ID)).isEqualTo("!room");
    assertThat(header(record, EventHeaders.EVENT_TYPE)).isEqualTo("RelationCreated");
    assertThat(header(record, EventHeaders.AGGREGATE_TYPE)).isEqualTo("RelationTarget");
    assertThat(header(record, EventHeaders.AGGREGATE_ID)).isEqualTo("$parent");
    assertThat(header(record, EventHeaders.REL_TYPE)).isEqualTo("m.annotation");
    assertThat(record.headers().lastHeader(EventHeaders.CORRELATION_ID)).isNull();
  }

  @Test
  void publish_shouldPropagateCorrelationId() {
    MDC.put(CorrelationIdFilter.CORRELATION_ID_KEY, "req-42");
    RelationRedactedEvent event = new RelationRedactedEvent(null, "!room", "$reaction",
        "$parent", "$redaction", "@alice", Instant.now());

    eventPublisher.publish(event);

    verify(kafkaTemplate).send(recordCaptor.capture());
    ProducerRecord<String, RelationEvent> record = recordCaptor.getValue();
    assertThat(record.key()).isEqualTo("$parent");
    assertThat(header(record, EventHeaders.CORRELATION_ID)).isEqualTo("req-42");
    assertThat(header(record, EventHeaders.EVENT_TYPE)).isEqualTo("RelationRedacted");
    assertThat(record.headers().lastHeader(EventHeaders.REL_TYPE)).isNull();
  }

  private static String header(ProducerRecord<String, RelationEvent> record, String name) {
    Header header = record.headers().lastHeader(name);
    return header == null ? null : new String(header.value(), StandardCharsets.UTF_8);
  }
}
