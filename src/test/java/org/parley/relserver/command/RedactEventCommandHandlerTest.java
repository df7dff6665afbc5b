package org.parley.relserver.command;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.parley.relserver.testutil.RelationsFixture.ALICE;
import static org.parley.relserver.testutil.RelationsFixture.BOB;
import static org.parley.relserver.testutil.RelationsFixture.ROOM;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.parley.relserver.domain.AggregationGroup;
import org.parley.relserver.domain.EventTypes;
import org.parley.relserver.domain.RoomEvent;
import org.parley.relserver.event.RelationRedactedEvent;
import org.parley.relserver.exception.EventNotFoundException;
import org.parley.relserver.testutil.RelationsFixture;

/**
 * Unit tests for RedactEventCommandHandler.
 */
class RedactEventCommandHandlerTest {

  private RelationsFixture fixture;
  private RoomEvent parent;

  @BeforeEach
  void setUp() {
    fixture = new RelationsFixture();
    parent = fixture.message(ALICE, "hello");
  }

  @Test
  void handle_shouldUncountRedactedAnnotation() {
    String first = fixture.annotate(parent, "m.reaction", "a", ALICE);
    fixture.annotate(parent, "m.reaction", "a", BOB);

    RelationRedactedEvent event = fixture.redactHandler.handle(
        new RedactEventCommand(ROOM, first, ALICE, "oops"));

    assertThat(event.redactedEventId()).isEqualTo(first);
    assertThat(event.targetEventId()).isEqualTo(parent.eventId());
    assertThat(fixture.counters.find(parent.eventId(), "m.reaction", "a"))
        .map(AggregationGroup::count).contains(1L);
    assertThat(fixture.relations.findBySource(first).orElseThrow().redacted()).isTrue();
    assertThat(fixture.events.findById(first).orElseThrow().redacted()).isTrue();

    RoomEvent redaction = fixture.events.findById(event.redactionEventId()).orElseThrow();
    assertThat(redaction.type()).isEqualTo(EventTypes.REDACTION);
    assertThat(redaction.content()).containsEntry("redacts", first)
        .containsEntry("reason", "oops");
  }

  @Test
  void handle_shouldRemoveGroupWhenLastAnnotationIsRedacted() {
    String only = fixture.annotate(parent, "m.reaction", "a", ALICE);

    fixture.redact(only);

    assertThat(fixture.counters.find(parent.eventId(), "m.reaction", "a")).isEmpty();
  }

  @Test
  void handle_shouldBeNoOpOnIndexWhenRepeated() {
    String first = fixture.annotate(parent, "m.reaction", "a", ALICE);
    fixture.annotate(parent, "m.reaction", "a", BOB);

    fixture.redact(first);
    fixture.redact(first);

    assertThat(fixture.counters.find(parent.eventId(), "m.reaction", "a"))
        .map(AggregationGroup::count).contains(1L);
    verify(fixture.publisher, times(4)).publish(any());
  }

  @Test
  void handle_shouldKeepEdgesOfRedactedParent() {
    fixture.annotate(parent, "m.reaction", "a", ALICE);

    RelationRedactedEvent event = fixture.redactHandler.handle(
        new RedactEventCommand(ROOM, parent.eventId(), ALICE, null));

    assertThat(event.targetEventId()).isEqualTo(parent.eventId());
    assertThat(fixture.events.findById(parent.eventId()).orElseThrow().redacted()).isTrue();
    assertThat(fixture.counters.find(parent.eventId(), "m.reaction", "a")).isPresent();
    assertThat(fixture.events.findById(event.redactionEventId()).orElseThrow().content())
        .doesNotContainKey("reason");
  }

  @Test
  void handle_shouldRejectUnknownEvent() {
    assertThatThrownBy(() -> fixture.redactHandler.handle(
        new RedactEventCommand(ROOM, "$missing", ALICE, null)))
        .isInstanceOf(EventNotFoundException.class);
  }
}
