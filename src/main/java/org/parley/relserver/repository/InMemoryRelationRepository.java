package org.parley.relserver.repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.Predicate;
import org.parley.relserver.domain.RelationEdge;
import org.parley.relserver.domain.RelationFilter;
import org.parley.relserver.domain.RelationType;
import org.parley.relserver.domain.StreamPosition;
import org.springframework.stereotype.Repository;

/**
 * In-memory implementation of {@link RelationRepository}.
 *
 * <p>Each target keeps one skip list of all its edges plus one skip list per
 * partition (relation type, event type, key), all ordered by stream position.
 * Filtered queries scan only the matching partitions. Adding an edge to a
 * skip list is a single atomic insertion, so a reader sees an edge either in
 * full or not at all.
 */
@Repository
public class InMemoryRelationRepository implements RelationRepository {

  private final Map<String, TargetRelations> targets = new ConcurrentHashMap<>();
  private final Map<String, RelationEdge> bySource = new ConcurrentHashMap<>();

  @Override
  public boolean index(RelationEdge edge) {
    if (bySource.putIfAbsent(edge.sourceEventId(), edge) != null) {
      return false;
    }
    targets.computeIfAbsent(edge.targetEventId(), t -> new TargetRelations()).put(edge);
    return true;
  }

  @Override
  public Optional<RelationEdge> findBySource(String sourceEventId) {
    return Optional.ofNullable(bySource.get(sourceEventId));
  }

  @Override
  public List<RelationEdge> findPage(String targetEventId, RelationFilter filter,
      StreamPosition before, int limit) {
    TargetRelations relations = targets.get(targetEventId);
    if (relations == null || limit < 1) {
      return List.of();
    }

    List<RelationEdge> page = new ArrayList<>();
    for (NavigableMap<StreamPosition, RelationEdge> partition : relations.scan(filter)) {
      NavigableMap<StreamPosition, RelationEdge> older = before == null
          ? partition.descendingMap()
          : partition.headMap(before, false).descendingMap();
      collectLive(older, filter, limit, page);
    }
    page.sort(Comparator.comparing(RelationEdge::position).reversed());
    return page.size() > limit ? List.copyOf(page.subList(0, limit)) : page;
  }

  @Override
  public List<RelationEdge> findOldest(String targetEventId, RelationFilter filter, int limit) {
    TargetRelations relations = targets.get(targetEventId);
    if (relations == null || limit < 1) {
      return List.of();
    }

    List<RelationEdge> oldest = new ArrayList<>();
    for (NavigableMap<StreamPosition, RelationEdge> partition : relations.scan(filter)) {
      collectLive(partition, filter, limit, oldest);
    }
    oldest.sort(Comparator.comparing(RelationEdge::position));
    return oldest.size() > limit ? List.copyOf(oldest.subList(0, limit)) : oldest;
  }

  @Override
  public Optional<RelationEdge> findNewest(String targetEventId, RelationFilter filter,
      Predicate<RelationEdge> condition) {
    TargetRelations relations = targets.get(targetEventId);
    if (relations == null) {
      return Optional.empty();
    }

    RelationEdge newest = null;
    for (NavigableMap<StreamPosition, RelationEdge> partition : relations.scan(filter)) {
      for (RelationEdge edge : partition.descendingMap().values()) {
        if (!edge.redacted() && filter.matches(edge) && condition.test(edge)) {
          if (newest == null || newest.position().isBefore(edge.position())) {
            newest = edge;
          }
          break;
        }
      }
    }
    return Optional.ofNullable(newest);
  }

  @Override
  public Optional<RelationEdge> markRedacted(String sourceEventId) {
    RelationEdge current = bySource.get(sourceEventId);
    if (current == null || current.redacted()) {
      return Optional.empty();
    }
    RelationEdge redacted = current.asRedacted();
    if (!bySource.replace(sourceEventId, current, redacted)) {
      return Optional.empty();
    }
    Optional.ofNullable(targets.get(redacted.targetEventId()))
        .ifPresent(relations -> relations.put(redacted));
    return Optional.of(redacted);
  }

  @Override
  public void clearRedaction(String sourceEventId) {
    RelationEdge current = bySource.get(sourceEventId);
    if (current == null || !current.redacted()) {
      return;
    }
    RelationEdge live = restore(current);
    bySource.put(sourceEventId, live);
    Optional.ofNullable(targets.get(live.targetEventId()))
        .ifPresent(relations -> relations.put(live));
  }

  @Override
  public void remove(String sourceEventId) {
    RelationEdge removed = bySource.remove(sourceEventId);
    if (removed == null) {
      return;
    }
    Optional.ofNullable(targets.get(removed.targetEventId()))
        .ifPresent(relations -> relations.remove(removed));
  }

  @Override
  public long countEdges() {
    return bySource.size();
  }

  @Override
  public long countTargets() {
    return targets.size();
  }

  private static RelationEdge restore(RelationEdge edge) {
    return new RelationEdge(edge.sourceEventId(), edge.targetEventId(), edge.roomId(),
        edge.relationType(), edge.aggregationKey(), edge.eventType(), edge.originServerTs(),
        edge.sender(), edge.position(), false);
  }

  private static void collectLive(NavigableMap<StreamPosition, RelationEdge> ordered,
      RelationFilter filter, int limit, List<RelationEdge> into) {
    int taken = 0;
    for (RelationEdge edge : ordered.values()) {
      if (taken >= limit) {
        break;
      }
      if (!edge.redacted() && filter.matches(edge)) {
        into.add(edge);
        taken++;
      }
    }
  }

  /**
   * Partition of a target's edges sharing relation type, event type and key.
   */
  private record PartitionKey(RelationType relationType, String eventType, String key) {

    static PartitionKey of(RelationEdge edge) {
      return new PartitionKey(edge.relationType(), edge.eventType(), edge.aggregationKey());
    }

    boolean matches(RelationFilter filter) {
      return (filter.relationType() == null || filter.relationType().equals(relationType))
          && (filter.eventType() == null || filter.eventType().equals(eventType))
          && (filter.key() == null || filter.key().equals(key));
    }
  }

  /**
   * All edges pointing at one target.
   */
  private static final class TargetRelations {

    private final ConcurrentSkipListMap<StreamPosition, RelationEdge> all =
        new ConcurrentSkipListMap<>();
    private final Map<PartitionKey, ConcurrentSkipListMap<StreamPosition, RelationEdge>>
        partitions = new ConcurrentHashMap<>();

    void put(RelationEdge edge) {
      partitions.computeIfAbsent(PartitionKey.of(edge), k -> new ConcurrentSkipListMap<>())
          .put(edge.position(), edge);
      all.put(edge.position(), edge);
    }

    void remove(RelationEdge edge) {
      all.remove(edge.position());
      Optional.ofNullable(partitions.get(PartitionKey.of(edge)))
          .ifPresent(partition -> partition.remove(edge.position()));
    }

    List<NavigableMap<StreamPosition, RelationEdge>> scan(RelationFilter filter) {
      if (filter.relationType() == null && filter.eventType() == null && filter.key() == null) {
        return List.of(all);
      }
      List<NavigableMap<StreamPosition, RelationEdge>> matching = new ArrayList<>();
      partitions.forEach((key, partition) -> {
        if (key.matches(filter)) {
          matching.add(partition);
        }
      });
      return matching;
    }
  }
}
