package org.parley.relserver.repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.parley.relserver.domain.AggregationGroup;
import org.springframework.stereotype.Repository;

/**
 * Live annotation counters keyed by (target event, event type, key).
 *
 * <p>A group is created lazily by its first increment, taking the next value of
 * a global creation sequence, and removed when its count drops to zero. All
 * updates for one target run inside {@link ConcurrentHashMap#compute}, so
 * concurrent increments and decrements never lose an update.
 */
@Repository
public class AggregationCounterRepository {

  private final Map<String, Map<GroupKey, AggregationGroup>> groupsByTarget =
      new ConcurrentHashMap<>();
  private final AtomicLong creationSequence = new AtomicLong();

  /**
   * Adds one to a group's count, creating the group if needed.
   *
   * @param targetEventId the annotated event
   * @param eventType the annotation event type
   * @param key the aggregation key
   * @return the group after the update
   */
  public AggregationGroup increment(String targetEventId, String eventType, String key) {
    GroupKey groupKey = new GroupKey(eventType, key);
    AggregationGroup[] updated = new AggregationGroup[1];
    groupsByTarget.compute(targetEventId, (target, groups) -> {
      Map<GroupKey, AggregationGroup> current = groups != null ? groups : new ConcurrentHashMap<>();
      updated[0] = current.compute(groupKey, (k, group) -> group == null
          ? new AggregationGroup(target, eventType, key, 1,
              creationSequence.incrementAndGet())
          : group.adjustedBy(1));
      return current;
    });
    return updated[0];
  }

  /**
   * Subtracts one from a group's count, removing the group at zero.
   *
   * @param targetEventId the annotated event
   * @param eventType the annotation event type
   * @param key the aggregation key
   * @return the group after the update, or empty if it was removed or never existed
   */
  public Optional<AggregationGroup> decrement(String targetEventId, String eventType,
      String key) {
    GroupKey groupKey = new GroupKey(eventType, key);
    AggregationGroup[] updated = new AggregationGroup[1];
    groupsByTarget.computeIfPresent(targetEventId, (target, groups) -> {
      updated[0] = groups.computeIfPresent(groupKey,
          (k, group) -> group.count() <= 1 ? null : group.adjustedBy(-1));
      return groups.isEmpty() ? null : groups;
    });
    return Optional.ofNullable(updated[0]);
  }

  /**
   * Finds a single group.
   *
   * @param targetEventId the annotated event
   * @param eventType the annotation event type
   * @param key the aggregation key
   * @return the group, if its count is positive
   */
  public Optional<AggregationGroup> find(String targetEventId, String eventType, String key) {
    return Optional.ofNullable(groupsByTarget.get(targetEventId))
        .map(groups -> groups.get(new GroupKey(eventType, key)));
  }

  /**
   * Lists a target's groups in serving order.
   *
   * @param targetEventId the annotated event
   * @param eventType restricts to one event type, or null for all
   * @return groups ordered by count descending, then creation order
   */
  public List<AggregationGroup> findByTarget(String targetEventId, String eventType) {
    Map<GroupKey, AggregationGroup> groups = groupsByTarget.get(targetEventId);
    if (groups == null) {
      return List.of();
    }
    return groups.values().stream()
        .filter(group -> eventType == null || eventType.equals(group.eventType()))
        .sorted(AggregationGroup.SERVING_ORDER)
        .toList();
  }

  /**
   * Counts groups across all targets.
   *
   * @return the number of live groups
   */
  public long countGroups() {
    return groupsByTarget.values().stream().mapToLong(Map::size).sum();
  }

  private record GroupKey(String eventType, String key) {
  }
}
