package org.parley.relserver.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.parley.relserver.testutil.RelationsFixture.ALICE;
import static org.parley.relserver.testutil.RelationsFixture.BOB;
import static org.parley.relserver.testutil.RelationsFixture.ROOM;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.parley.relserver.domain.RelationType;
import org.parley.relserver.domain.RoomEvent;
import org.parley.relserver.dto.MessagesResponse;
import org.parley.relserver.dto.RoomEventView;
import org.parley.relserver.exception.EventNotFoundException;
import org.parley.relserver.exception.InvalidCursorException;
import org.parley.relserver.testutil.RelationsFixture;

/**
 * Unit tests for RoomEventService.
 */
class RoomEventServiceTest {

  private RelationsFixture fixture;
  private RoomEventService service;

  @BeforeEach
  void setUp() {
    fixture = new RelationsFixture();
    service = new RoomEventService(fixture.events, fixture.sendHandler, fixture.redactHandler,
        fixture.bundlingService, fixture.cursorCodec);
  }

  @Test
  void send_shouldRouteContentWithRelationThroughIngest() {
    RoomEvent parent = fixture.message(ALICE, "hello");

    String id = service.send(ROOM, "m.reaction", BOB, Map.of("m.relates_to",
        Map.of("rel_type", "m.annotation", "event_id", parent.eventId(), "key", "👍")));

    assertThat(fixture.relations.findBySource(id)).isPresent();
    assertThat(fixture.counters.find(parent.eventId(), "m.reaction", "👍")).isPresent();
  }

  @Test
  void send_shouldStorePlainEvents() {
    String id = service.send(ROOM, "m.room.message", ALICE, Map.of("body", "hi"));

    assertThat(fixture.events.findById(id)).isPresent();
    assertThat(fixture.relations.countEdges()).isZero();
  }

  @Test
  void sendState_shouldReplaceCurrentState() {
    service.sendState(ROOM, "m.room.member", BOB, BOB, Map.of("membership", "join"));
    String leave = service.sendState(ROOM, "m.room.member", BOB, BOB,
        Map.of("membership", "leave"));

    assertThat(fixture.events.findCurrentState(ROOM, "m.room.member", BOB))
        .map(RoomEvent::eventId).contains(leave);
  }

  @Test
  void getEvent_shouldBundleRelations() {
    RoomEvent parent = fixture.message(ALICE, "hello");
    fixture.annotate(parent, "m.reaction", "a", BOB);

    RoomEventView view = service.getEvent(ROOM, parent.eventId());

    assertThat(view.unsigned().relations().annotations().chunk()).hasSize(1);
    assertThatThrownBy(() -> service.getEvent("!other:test", parent.eventId()))
        .isInstanceOf(EventNotFoundException.class);
  }

  @Test
  void messages_shouldPageBackwardsThroughTimeline() {
    List<String> sent = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      sent.add(fixture.message(ALICE, "m" + i).eventId());
    }

    List<String> seen = new ArrayList<>();
    String from = null;
    do {
      MessagesResponse page = service.messages(ROOM, 2, from, false);
      page.chunk().forEach(view -> seen.add(view.eventId()));
      from = page.end();
    } while (from != null);

    assertThat(seen).containsExactly(sent.get(4), sent.get(3), sent.get(2), sent.get(1),
        sent.get(0));
  }

  @Test
  void messages_shouldBundleOnRequest() {
    RoomEvent parent = fixture.message(ALICE, "hello");
    fixture.relate(parent, RelationType.REFERENCE,
        "m.room.message", null, BOB);

    MessagesResponse plain = service.messages(ROOM, 5, null, false);
    MessagesResponse bundled = service.messages(ROOM, 5, null, true);

    RoomEventView plainParent = plain.chunk().get(1);
    RoomEventView bundledParent = bundled.chunk().get(1);
    assertThat(plainParent.unsigned()).isNull();
    assertThat(bundledParent.unsigned().relations().references().chunk()).hasSize(1);
  }

  @Test
  void messages_shouldRejectTokenOfAnotherRoom() {
    fixture.message(ALICE, "1");
    fixture.message(ALICE, "2");
    String token = service.messages(ROOM, 1, null, false).end();

    assertThatThrownBy(() -> service.messages("!other:test", 1, token, false))
        .isInstanceOf(InvalidCursorException.class);
  }

  @Test
  void redact_shouldReturnRedactionEventId() {
    RoomEvent parent = fixture.message(ALICE, "hello");

    String redactionId = service.redact(ROOM, parent.eventId(), ALICE, "spam");

    assertThat(fixture.events.findById(redactionId)).isPresent();
    assertThat(fixture.events.findById(parent.eventId()).orElseThrow().redacted()).isTrue();
  }
}
