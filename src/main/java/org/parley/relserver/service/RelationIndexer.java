package org.parley.relserver.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.parley.relserver.domain.RelationEdge;
import org.parley.relserver.repository.AggregationCounterRepository;
import org.parley.relserver.repository.RelationRepository;
import org.parley.relserver.repository.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes relation edges and their aggregation counters as part of a unit of work.
 *
 * <p>Writes for one target are serialized by a striped lock, held across
 * position allocation, persistence and indexing. An edge indexed later for a
 * target therefore always has a larger position than any edge already visible,
 * which keeps pagination cursors valid as watermarks. Different targets rarely
 * share a stripe and never wait on a global lock.
 */
@Component
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class RelationIndexer {

  private static final Logger logger = LoggerFactory.getLogger(RelationIndexer.class);

  private static final int STRIPES = 256;

  private final Lock[] targetLocks = new Lock[STRIPES];
  private final RelationRepository relationRepository;
  private final AggregationCounterRepository counterRepository;

  /**
   * Constructs a RelationIndexer.
   *
   * @param relationRepository the relation index
   * @param counterRepository the aggregation counters
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Repositories are Spring-managed beans and are intentionally shared"
  )
  public RelationIndexer(RelationRepository relationRepository,
      AggregationCounterRepository counterRepository) {
    this.relationRepository = relationRepository;
    this.counterRepository = counterRepository;
    for (int i = 0; i < STRIPES; i++) {
      targetLocks[i] = new ReentrantLock();
    }
  }

  /**
   * Runs an action while holding the write lock of a target event.
   *
   * @param targetEventId the target event id
   * @param action the action
   * @param <T> the result type
   * @return the action's result
   */
  public <T> T withTargetLock(String targetEventId, Supplier<T> action) {
    Lock lock = targetLocks[Math.floorMod(targetEventId.hashCode(), STRIPES)];
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Indexes an edge and counts it towards its aggregation group.
   * Both writes are undone if the unit of work rolls back.
   *
   * @param edge the edge
   * @param unitOfWork the enclosing unit of work
   * @return true if the edge was new, false if its source was already indexed
   */
  public boolean index(RelationEdge edge, UnitOfWork unitOfWork) {
    if (!relationRepository.index(edge)) {
      logger.debug("Relation {} already indexed, skipping", edge.sourceEventId());
      return false;
    }
    unitOfWork.onRollback(() -> relationRepository.remove(edge.sourceEventId()));

    if (edge.isAggregatable()) {
      counterRepository.increment(edge.targetEventId(), edge.eventType(), edge.aggregationKey());
      unitOfWork.onRollback(() -> counterRepository.decrement(
          edge.targetEventId(), edge.eventType(), edge.aggregationKey()));
    }

    logger.debug("Indexed {} relation {} -> {}", edge.relationType(),
        edge.sourceEventId(), edge.targetEventId());
    return true;
  }

  /**
   * Soft-deletes the edge declared by a redacted event and uncounts it.
   * Redacting an edge twice, or an event that declares no relation, is a no-op.
   *
   * @param sourceEventId the redacted event
   * @param unitOfWork the enclosing unit of work
   * @return the redacted edge, if one was live
   */
  public Optional<RelationEdge> redact(String sourceEventId, UnitOfWork unitOfWork) {
    Optional<RelationEdge> redacted = relationRepository.markRedacted(sourceEventId);
    redacted.ifPresent(edge -> {
      unitOfWork.onRollback(() -> relationRepository.clearRedaction(sourceEventId));
      if (edge.relationType().isAnnotation() && edge.aggregationKey() != null) {
        counterRepository.decrement(edge.targetEventId(), edge.eventType(),
            edge.aggregationKey());
        unitOfWork.onRollback(() -> counterRepository.increment(
            edge.targetEventId(), edge.eventType(), edge.aggregationKey()));
      }
      logger.debug("Redacted {} relation {} -> {}", edge.relationType(),
          edge.sourceEventId(), edge.targetEventId());
    });
    return redacted;
  }
}
