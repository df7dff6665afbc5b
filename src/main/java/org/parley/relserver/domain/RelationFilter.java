package org.parley.relserver.domain;

/**
 * Narrows a relation query to one partition of a target's relations.
 * Each component is optional; supplying a key implies an annotation.
 *
 * @param relationType the relation type, or null for any
 * @param eventType the relation event type, or null for any
 * @param key the aggregation key, or null for any
 */
public record RelationFilter(RelationType relationType, String eventType, String key) {

  /** Matches every relation. */
  public static final RelationFilter ANY = new RelationFilter(null, null, null);

  /**
   * Creates a filter, defaulting the relation type to annotation when a key is given.
   *
   * @throws IllegalArgumentException if a key is combined with a non-annotation type
   */
  public RelationFilter {
    if (key != null) {
      if (relationType == null) {
        relationType = RelationType.ANNOTATION;
      } else if (!relationType.isAnnotation()) {
        throw new IllegalArgumentException(
            "A key filter requires relation type " + RelationType.ANNOTATION);
      }
    }
  }

  /**
   * Creates a filter for a single aggregation group.
   *
   * @param eventType the relation event type
   * @param key the aggregation key
   * @return the filter
   */
  public static RelationFilter group(String eventType, String key) {
    return new RelationFilter(RelationType.ANNOTATION, eventType, key);
  }

  /**
   * Creates a filter on relation type only.
   *
   * @param relationType the relation type
   * @return the filter
   */
  public static RelationFilter ofType(RelationType relationType) {
    return new RelationFilter(relationType, null, null);
  }

  /**
   * Tests an edge against this filter.
   *
   * @param edge the edge
   * @return true if every supplied component matches
   */
  public boolean matches(RelationEdge edge) {
    return (relationType == null || relationType.equals(edge.relationType()))
        && (eventType == null || eventType.equals(edge.eventType()))
        && (key == null || key.equals(edge.aggregationKey()));
  }
}
