package org.parley.relserver.health;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.parley.relserver.repository.AggregationCounterRepository;
import org.parley.relserver.repository.RelationRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for relation index accessibility.
 */
@Component
public class RelationIndexHealthIndicator implements HealthIndicator {

  private final RelationRepository relationRepository;
  private final AggregationCounterRepository counterRepository;

  /**
   * Creates a new relation index health indicator.
   *
   * @param relationRepository the relation index
   * @param counterRepository the aggregation counters
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Repositories are Spring-managed beans and are intentionally shared"
  )
  public RelationIndexHealthIndicator(RelationRepository relationRepository,
      AggregationCounterRepository counterRepository) {
    this.relationRepository = relationRepository;
    this.counterRepository = counterRepository;
  }

  @Override
  public Health health() {
    try {
      return Health.up()
          .withDetail("edges", relationRepository.countEdges())
          .withDetail("targets", relationRepository.countTargets())
          .withDetail("aggregationGroups", counterRepository.countGroups())
          .build();
    } catch (RuntimeException e) {
      return Health.down()
          .withDetail("error", e.getMessage())
          .withException(e)
          .build();
    }
  }
}
