package org.parley.relserver.repository;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Groups the writes of one ingest (event persistence, edge indexing, counter
 * update) so that they either all take effect or are all undone.
 *
 * <p>Each participant registers a compensating action after its write succeeds.
 * {@link #rollback(Throwable)} runs them in reverse order. Not thread-safe: a
 * unit of work belongs to the thread that opened it.
 */
public final class UnitOfWork {

  private final Deque<Runnable> compensations = new ArrayDeque<>();
  private boolean completed;

  /**
   * Registers an action that undoes a write already performed.
   *
   * @param compensation the undo action
   */
  public void onRollback(Runnable compensation) {
    Objects.requireNonNull(compensation, "Compensation cannot be null");
    if (completed) {
      throw new IllegalStateException("Unit of work already completed");
    }
    compensations.push(compensation);
  }

  /**
   * Marks the unit of work as committed; compensations are discarded.
   */
  public void commit() {
    completed = true;
    compensations.clear();
  }

  /**
   * Undoes every registered write, newest first.
   * Failures of individual compensations are attached to the cause as suppressed.
   *
   * @param cause the failure that aborted the unit of work
   */
  public void rollback(Throwable cause) {
    completed = true;
    while (!compensations.isEmpty()) {
      try {
        compensations.pop().run();
      } catch (RuntimeException e) {
        cause.addSuppressed(e);
      }
    }
  }
}
