package io.eventstats.model;

import java.util.Objects;

/**
 * Running statistics for one event type: how many events were aggregated and the sum of
 * their values since the last reset.
 *
 * @param eventType the aggregation key
 * @param count     number of aggregated events (never negative)
 * @param sum       sum of the aggregated values
 */
public record AggregateRecord(String eventType, long count, double sum) {
  public AggregateRecord {
    Objects.requireNonNull(eventType, "eventType");
    if (count < 0) {
      throw new IllegalArgumentException("count must be >= 0, got: " + count);
    }
  }

  /**
   * Returns {@code sum / count}, or {@code 0} when nothing has been aggregated.
   */
  public double average() {
    return count == 0 ? 0.0 : sum / count;
  }

  /**
   * Returns a copy with one more event of the given value folded in.
   */
  public AggregateRecord plus(double amount) {
    return new AggregateRecord(eventType, count + 1, sum + amount);
  }
}
