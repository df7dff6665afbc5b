package org.parley.relserver.domain;

import java.util.Comparator;

/**
 * Position of an event in a room's history.
 * Ordered by topological position (room depth) first, then by the server-local
 * stream position, which is unique per event.
 *
 * @param topological the room depth of the event
 * @param stream the server-local stream ordering of the event
 */
public record StreamPosition(long topological, long stream)
    implements Comparable<StreamPosition> {

  private static final Comparator<StreamPosition> ORDER =
      Comparator.comparingLong(StreamPosition::topological)
          .thenComparingLong(StreamPosition::stream);

  /**
   * Creates a stream position.
   *
   * @param topological the room depth (must be non-negative)
   * @param stream the stream ordering (must be non-negative)
   */
  public StreamPosition {
    if (topological < 0) {
      throw new IllegalArgumentException("Topological position cannot be negative");
    }
    if (stream < 0) {
      throw new IllegalArgumentException("Stream position cannot be negative");
    }
  }

  @Override
  public int compareTo(StreamPosition other) {
    return ORDER.compare(this, other);
  }

  /**
   * Checks whether this position was reached before the other one.
   *
   * @param other the position to compare with
   * @return true if this position is strictly older
   */
  public boolean isBefore(StreamPosition other) {
    return compareTo(other) < 0;
  }

  @Override
  public String toString() {
    return "t" + topological + "-s" + stream;
  }
}
