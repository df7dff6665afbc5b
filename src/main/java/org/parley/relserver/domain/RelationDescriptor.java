package org.parley.relserver.domain;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The reserved relation descriptor stored in an event's content under
 * {@code m.relates_to}.
 *
 * @param relationType the relation type
 * @param targetEventId the event this relation points at
 * @param key the aggregation key (annotations only, may be null)
 */
public record RelationDescriptor(
    RelationType relationType,
    String targetEventId,
    String key) {

  static final String REL_TYPE = "rel_type";
  static final String EVENT_ID = "event_id";
  static final String KEY = "key";

  /**
   * Creates a relation descriptor.
   *
   * @throws IllegalArgumentException if the target event id is blank
   */
  public RelationDescriptor {
    Objects.requireNonNull(relationType, "Relation type cannot be null");
    Objects.requireNonNull(targetEventId, "Target event ID cannot be null");
    if (targetEventId.isBlank()) {
      throw new IllegalArgumentException("Target event ID cannot be blank");
    }
  }

  /**
   * Renders this descriptor as the JSON object placed in event content.
   *
   * @return an insertion-ordered map
   */
  public Map<String, Object> toContent() {
    Map<String, Object> content = new LinkedHashMap<>();
    content.put(EVENT_ID, targetEventId);
    if (key != null) {
      content.put(KEY, key);
    }
    content.put(REL_TYPE, relationType.value());
    return content;
  }

  /**
   * Reads a descriptor back out of event content.
   * Content without a well-formed {@code m.relates_to} object yields empty.
   *
   * @param content the event content
   * @return the descriptor, if the content carries one
   */
  public static Optional<RelationDescriptor> fromContent(Map<String, Object> content) {
    if (content == null || !(content.get(EventTypes.RELATES_TO) instanceof Map<?, ?> raw)) {
      return Optional.empty();
    }
    Object relType = raw.get(REL_TYPE);
    Object eventId = raw.get(EVENT_ID);
    Object key = raw.get(KEY);
    if (!(relType instanceof String rel) || !(eventId instanceof String target)
        || rel.isBlank() || target.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(new RelationDescriptor(
          RelationType.of(rel), target, key instanceof String k ? k : null));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
