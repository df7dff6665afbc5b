package org.parley.relserver.repository;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import org.parley.relserver.domain.RelationEdge;
import org.parley.relserver.domain.RelationFilter;
import org.parley.relserver.domain.StreamPosition;

/**
 * Append-only index of relation edges, keyed by target event.
 * Edges are never physically deleted except to roll back a failed ingest;
 * redaction only sets the soft-delete marker and hides the edge from queries.
 */
public interface RelationRepository {

  /**
   * Indexes an edge.
   * Indexing is idempotent per source event: an edge whose source event is
   * already indexed is ignored.
   *
   * @param edge the edge to index
   * @return true if the edge was added, false if its source was already indexed
   */
  boolean index(RelationEdge edge);

  /**
   * Finds the edge declared by a source event.
   *
   * @param sourceEventId the relation event id
   * @return the edge, redacted or not
   */
  Optional<RelationEdge> findBySource(String sourceEventId);

  /**
   * Returns live edges of a target strictly older than {@code before}, newest first.
   *
   * @param targetEventId the target event id
   * @param filter narrows the scan to matching partitions
   * @param before exclusive watermark, or null to start from the newest edge
   * @param limit maximum number of edges
   * @return edges in reverse-chronological order
   */
  List<RelationEdge> findPage(String targetEventId, RelationFilter filter,
      StreamPosition before, int limit);

  /**
   * Returns the oldest live edges of a target, oldest first.
   *
   * @param targetEventId the target event id
   * @param filter narrows the scan to matching partitions
   * @param limit maximum number of edges
   * @return edges in chronological order
   */
  List<RelationEdge> findOldest(String targetEventId, RelationFilter filter, int limit);

  /**
   * Returns the newest live edge of a target that satisfies a condition.
   *
   * @param targetEventId the target event id
   * @param filter narrows the scan to matching partitions
   * @param condition additional condition on the edge
   * @return the newest matching edge
   */
  Optional<RelationEdge> findNewest(String targetEventId, RelationFilter filter,
      Predicate<RelationEdge> condition);

  /**
   * Sets the soft-delete marker on the edge declared by a source event.
   *
   * @param sourceEventId the relation event id
   * @return the redacted edge, or empty if no live edge exists for that source
   */
  Optional<RelationEdge> markRedacted(String sourceEventId);

  /**
   * Clears the soft-delete marker. Used to roll back a failed redaction only.
   *
   * @param sourceEventId the relation event id
   */
  void clearRedaction(String sourceEventId);

  /**
   * Removes an edge. Used to roll back a failed ingest only.
   *
   * @param sourceEventId the relation event id
   */
  void remove(String sourceEventId);

  /**
   * Counts indexed edges, including redacted ones.
   *
   * @return the number of edges
   */
  long countEdges();

  /**
   * Counts targets that have at least one indexed edge.
   *
   * @return the number of targets
   */
  long countTargets();
}
