package org.parley.relserver.config;

import io.micrometer.core.aop.CountedAspect;
import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.parley.relserver.repository.AggregationCounterRepository;
import org.parley.relserver.repository.RelationRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

/**
 * Configuration for annotation-based metrics and relation index gauges.
 */
@Configuration
@EnableAspectJAutoProxy
public class MetricsConfiguration {

  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public CountedAspect countedAspect(MeterRegistry registry) {
    return new CountedAspect(registry);
  }

  /**
   * Registers gauges for the size of the relation index.
   *
   * @param relationRepository the relation index
   * @param counterRepository the aggregation counters
   * @return binder registering the gauges
   */
  @Bean
  public MeterBinder relationIndexGauges(RelationRepository relationRepository,
      AggregationCounterRepository counterRepository) {
    return registry -> {
      Gauge.builder("relations.index.edges", relationRepository,
              RelationRepository::countEdges)
          .description("Relation edges indexed, including redacted ones")
          .register(registry);
      Gauge.builder("relations.index.targets", relationRepository,
              RelationRepository::countTargets)
          .description("Events with at least one relation")
          .register(registry);
      Gauge.builder("relations.aggregation.groups", counterRepository,
              AggregationCounterRepository::countGroups)
          .description("Live annotation aggregation groups")
          .register(registry);
    };
  }
}
