package org.parley.relserver.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Optional;
import org.parley.relserver.config.RelationsProperties;
import org.parley.relserver.domain.RelationEdge;
import org.parley.relserver.domain.RelationFilter;
import org.parley.relserver.domain.RelationType;
import org.parley.relserver.domain.RoomEvent;
import org.parley.relserver.dto.AggregationChunkResponse;
import org.parley.relserver.dto.BundledRelations;
import org.parley.relserver.dto.RoomEventView;
import org.parley.relserver.repository.RelationRepository;
import org.springframework.stereotype.Service;

/**
 * Computes the relation summaries bundled into a served event.
 * Never modifies the stored event.
 */
@Service
public class BundlingService {

  private final AggregationService aggregationService;
  private final RelationRepository relationRepository;
  private final RelationsProperties properties;

  /**
   * Constructor for BundlingService.
   *
   * @param aggregationService the aggregation engine
   * @param relationRepository the relation index
   * @param properties relation configuration (bundle size)
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Collaborators are Spring-managed beans and are intentionally shared"
  )
  public BundlingService(AggregationService aggregationService,
      RelationRepository relationRepository, RelationsProperties properties) {
    this.aggregationService = aggregationService;
    this.relationRepository = relationRepository;
    this.properties = properties;
  }

  /**
   * Computes the summaries for a parent event.
   * Redacted events are stale and get no summaries.
   *
   * @param event the parent event
   * @return the summaries, or empty if the event has no live relations
   */
  public Optional<BundledRelations> bundle(RoomEvent event) {
    if (event.redacted()) {
      return Optional.empty();
    }
    int limit = properties.getBundleLimit();

    AggregationChunkResponse annotations = aggregationService.firstPage(event.eventId(), limit);

    List<RelationEdge> references = relationRepository.findOldest(
        event.eventId(), RelationFilter.ofType(RelationType.REFERENCE), limit);

    Optional<RelationEdge> replacement = relationRepository.findNewest(
        event.eventId(), RelationFilter.ofType(RelationType.REPLACE),
        edge -> edge.sender().equals(event.sender()));

    BundledRelations bundled = new BundledRelations(
        annotations.chunk().isEmpty() ? null : annotations,
        references.isEmpty() ? null : new BundledRelations.ReferenceChunk(references.stream()
            .map(edge -> new BundledRelations.EventReference(edge.sourceEventId()))
            .toList()),
        replacement.map(edge -> new BundledRelations.Replacement(
            edge.sourceEventId(), edge.originServerTs().toEpochMilli(), edge.sender()))
            .orElse(null));
    return bundled.isEmpty() ? Optional.empty() : Optional.of(bundled);
  }

  /**
   * Builds the served view of an event with its summaries attached.
   *
   * @param event the event
   * @return the view
   */
  public RoomEventView view(RoomEvent event) {
    return RoomEventView.of(event, bundle(event).orElse(null));
  }
}
