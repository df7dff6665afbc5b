package org.parley.relserver.repository;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.parley.relserver.domain.AggregationGroup;

/**
 * Unit tests for AggregationCounterRepository.
 */
class AggregationCounterRepositoryTest {

  private AggregationCounterRepository repository;

  @BeforeEach
  void setUp() {
    repository = new AggregationCounterRepository();
  }

  @Test
  void increment_shouldCreateGroupOnFirstUse() {
    AggregationGroup group = repository.increment("$t", "m.reaction", "👍");

    assertThat(group.count()).isEqualTo(1);
    assertThat(repository.increment("$t", "m.reaction", "👍").count()).isEqualTo(2);
    assertThat(repository.countGroups()).isEqualTo(1);
  }

  @Test
  void decrement_shouldRemoveGroupAtZero() {
    repository.increment("$t", "m.reaction", "a");
    repository.increment("$t", "m.reaction", "a");

    assertThat(repository.decrement("$t", "m.reaction", "a"))
        .map(AggregationGroup::count).contains(1L);
    assertThat(repository.decrement("$t", "m.reaction", "a")).isEmpty();
    assertThat(repository.find("$t", "m.reaction", "a")).isEmpty();
    assertThat(repository.countGroups()).isZero();
  }

  @Test
  void decrement_shouldIgnoreUnknownGroup() {
    assertThat(repository.decrement("$t", "m.reaction", "a")).isEmpty();
  }

  @Test
  void findByTarget_shouldOrderByCountThenCreation() {
    repository.increment("$t", "m.reaction", "b");
    repository.increment("$t", "m.reaction", "a");
    repository.increment("$t", "m.reaction", "a");
    repository.increment("$t", "m.reaction", "c");
    repository.increment("$t", "m.custom", "x");

    assertThat(repository.findByTarget("$t", null))
        .extracting(AggregationGroup::key).containsExactly("a", "b", "c", "x");
    assertThat(repository.findByTarget("$t", "m.custom"))
        .extracting(AggregationGroup::key).containsExactly("x");
    assertThat(repository.findByTarget("$other", null)).isEmpty();
  }

  @Test
  void keysAreCaseSensitive() {
    repository.increment("$t", "m.reaction", "A");
    repository.increment("$t", "m.reaction", "a");

    assertThat(repository.findByTarget("$t", null)).hasSize(2);
  }

  @Test
  void concurrentIncrements_shouldNotLoseUpdates() throws InterruptedException {
    int threads = 8;
    int perThread = 500;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    for (int i = 0; i < threads; i++) {
      executor.submit(() -> {
        start.await();
        for (int j = 0; j < perThread; j++) {
          repository.increment("$t", "m.reaction", "👍");
        }
        return null;
      });
    }
    start.countDown();
    executor.shutdown();
    assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

    assertThat(repository.find("$t", "m.reaction", "👍"))
        .map(AggregationGroup::count).contains((long) threads * perThread);
  }
}
