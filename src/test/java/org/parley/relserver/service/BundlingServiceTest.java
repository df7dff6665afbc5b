package org.parley.relserver.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.parley.relserver.testutil.RelationsFixture.ALICE;
import static org.parley.relserver.testutil.RelationsFixture.BOB;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.parley.relserver.domain.RelationType;
import org.parley.relserver.domain.RoomEvent;
import org.parley.relserver.dto.AggregationGroupInfo;
import org.parley.relserver.dto.BundledRelations;
import org.parley.relserver.dto.RoomEventView;
import org.parley.relserver.testutil.RelationsFixture;

/**
 * Unit tests for BundlingService.
 */
class BundlingServiceTest {

  private RelationsFixture fixture;
  private BundlingService service;
  private RoomEvent parent;

  @BeforeEach
  void setUp() {
    fixture = new RelationsFixture();
    service = fixture.bundlingService;
    parent = fixture.message(ALICE, "hello");
  }

  @Test
  void bundle_shouldBeEmptyWithoutRelations() {
    assertThat(service.bundle(parent)).isEmpty();
    assertThat(service.view(parent).unsigned()).isNull();
  }

  @Test
  void bundle_shouldCarryFirstAnnotationPageWithNextBatch() {
    fixture.properties.setBundleLimit(2);
    fixture.annotate(parent, "m.reaction", "a", ALICE);
    fixture.annotate(parent, "m.reaction", "a", BOB);
    fixture.annotate(parent, "m.reaction", "b", ALICE);
    fixture.annotate(parent, "m.reaction", "c", ALICE);

    BundledRelations bundled = service.bundle(parent).orElseThrow();

    assertThat(bundled.annotations().chunk()).containsExactly(
        new AggregationGroupInfo("m.reaction", "a", 2),
        new AggregationGroupInfo("m.reaction", "b", 1));
    assertThat(bundled.annotations().nextBatch()).isNotNull();
    assertThat(bundled.references()).isNull();
    assertThat(bundled.replacement()).isNull();
  }

  @Test
  void bundle_shouldListOldestReferencesInOrder() {
    String first = fixture.relate(parent, RelationType.REFERENCE, "m.room.message", null, BOB);
    String second = fixture.relate(parent, RelationType.REFERENCE, "m.room.message", null, BOB);

    BundledRelations bundled = service.bundle(parent).orElseThrow();

    assertThat(bundled.references().chunk()).containsExactly(
        new BundledRelations.EventReference(first),
        new BundledRelations.EventReference(second));
    assertThat(bundled.annotations()).isNull();
  }

  @Test
  void bundle_shouldOnlyConsiderEditsBySameSender() {
    fixture.relate(parent, RelationType.REPLACE, "m.room.message", null, ALICE);
    String latest = fixture.relate(parent, RelationType.REPLACE, "m.room.message", null, ALICE);
    fixture.relate(parent, RelationType.REPLACE, "m.room.message", null, BOB);

    BundledRelations bundled = service.bundle(parent).orElseThrow();

    assertThat(bundled.replacement().eventId()).isEqualTo(latest);
    assertThat(bundled.replacement().sender()).isEqualTo(ALICE);
  }

  @Test
  void bundle_shouldIgnoreRedactedRelations() {
    String edit = fixture.relate(parent, RelationType.REPLACE, "m.room.message", null, ALICE);
    fixture.redact(edit);

    assertThat(service.bundle(parent)).isEmpty();
  }

  @Test
  void bundle_shouldSkipRedactedParent() {
    fixture.annotate(parent, "m.reaction", "a", ALICE);
    fixture.redact(parent.eventId());

    RoomEvent redacted = fixture.events.findById(parent.eventId()).orElseThrow();
    RoomEventView view = service.view(redacted);

    assertThat(service.bundle(redacted)).isEmpty();
    assertThat(view.content()).isEmpty();
    assertThat(view.unsigned().redacted()).isTrue();
    assertThat(view.unsigned().relations()).isNull();
  }
}
