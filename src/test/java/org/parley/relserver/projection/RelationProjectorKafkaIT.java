package org.parley.relserver.projection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.parley.relserver.domain.AggregationGroup;
import org.parley.relserver.domain.EventDraft;
import org.parley.relserver.domain.RelationDescriptor;
import org.parley.relserver.domain.RelationType;
import org.parley.relserver.domain.RoomEvent;
import org.parley.relserver.event.EventPublisher;
import org.parley.relserver.event.RelationCreatedEvent;
import org.parley.relserver.event.RelationRedactedEvent;
import org.parley.relserver.repository.AggregationCounterRepository;
import org.parley.relserver.repository.RelationRepository;
import org.parley.relserver.repository.RoomEventRepository;
import org.parley.relserver.testutil.KafkaTestContainers;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.TestPropertySource;
import org.testcontainers.kafka.KafkaContainer;

/**
 * Integration test for relation event projection over a real Kafka broker.
 *
 * <p>Events published by another server are consumed by the projector and
 * become visible in the local relation index and counters.
 */
@SpringBootTest
@ActiveProfiles("it")
@TestPropertySource(properties = "projector.kafka-listener.enabled=true")
class RelationProjectorKafkaIT {

  private static final String REMOTE_USER = "@carol:other.server";

  private static final KafkaContainer kafka = KafkaTestContainers.sharedKafka();

  @DynamicPropertySource
  static void kafkaProperties(DynamicPropertyRegistry registry) {
    registry.add("kafka.bootstrap-servers", kafka::getBootstrapServers);
    registry.add("kafka.auto-create-topics", () -> "true");
    registry.add("kafka.consumer.group-id", () -> "projector-it-" + UUID.randomUUID());
  }

  @Autowired
  private EventPublisher eventPublisher;

  @Autowired
  private RoomEventRepository roomEventRepository;

  @Autowired
  private RelationRepository relationRepository;

  @Autowired
  private AggregationCounterRepository counterRepository;

  private String room;
  private RoomEvent parent;

  @BeforeEach
  void setUp() {
    room = "!" + UUID.randomUUID() + ":test.local";
    parent = roomEventRepository.persist(EventDraft.message(room, "m.room.message",
        "@alice:test.local", Map.of("body", "hello")));
  }

  @Test
  void remoteAnnotation_shouldBeIndexedAndCounted() throws Exception {
    String remoteId = "$" + UUID.randomUUID() + ":other.server";

    eventPublisher.publish(remoteReaction(remoteId, "👍")).get();

    await().atMost(Duration.ofSeconds(10))
        .untilAsserted(() -> {
          assertThat(roomEventRepository.findById(remoteId)).isPresent();
          assertThat(relationRepository.findBySource(remoteId)).isPresent();
          assertThat(counterRepository.find(parent.eventId(), "m.reaction", "👍"))
              .map(AggregationGroup::count)
              .contains(1L);
        });
  }

  @Test
  void redeliveredAnnotation_shouldBeCountedOnce() throws Exception {
    String remoteId = "$" + UUID.randomUUID() + ":other.server";
    String markerId = "$" + UUID.randomUUID() + ":other.server";

    eventPublisher.publish(remoteReaction(remoteId, "a")).get();
    eventPublisher.publish(remoteReaction(remoteId, "a")).get();
    eventPublisher.publish(remoteReaction(markerId, "b")).get();

    // Events for one parent share a partition, so the marker is applied last.
    await().atMost(Duration.ofSeconds(10))
        .untilAsserted(() -> assertThat(roomEventRepository.findById(markerId)).isPresent());
    assertThat(counterRepository.find(parent.eventId(), "m.reaction", "a"))
        .map(AggregationGroup::count)
        .contains(1L);
  }

  @Test
  void remoteRedaction_shouldRemoveAnnotationFromCounts() throws Exception {
    String remoteId = "$" + UUID.randomUUID() + ":other.server";
    eventPublisher.publish(remoteReaction(remoteId, "x")).get();
    await().atMost(Duration.ofSeconds(10))
        .untilAsserted(() -> assertThat(relationRepository.findBySource(remoteId)).isPresent());

    eventPublisher.publish(new RelationRedactedEvent(null, room, remoteId, parent.eventId(),
        "$" + UUID.randomUUID() + ":other.server", REMOTE_USER, Instant.now())).get();

    await().atMost(Duration.ofSeconds(10))
        .untilAsserted(() -> {
          assertThat(relationRepository.findBySource(remoteId)).isEmpty();
          assertThat(counterRepository.find(parent.eventId(), "m.reaction", "x")).isEmpty();
          assertThat(roomEventRepository.findById(remoteId))
              .map(RoomEvent::redacted)
              .contains(true);
        });
  }

  private RelationCreatedEvent remoteReaction(String eventId, String key) {
    Map<String, Object> content = Map.of("m.relates_to",
        new RelationDescriptor(RelationType.ANNOTATION, parent.eventId(), key).toContent());
    return new RelationCreatedEvent(null, room, eventId, parent.eventId(), "m.annotation",
        "m.reaction", REMOTE_USER, content, Instant.now(), Instant.now());
  }
}
