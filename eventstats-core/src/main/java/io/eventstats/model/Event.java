package io.eventstats.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A validated e-commerce event, as decoded from a queue message body.
 *
 * <p>{@code occurredAt} is advisory only; aggregation never orders by it.
 *
 * @param type       aggregation key (non-blank)
 * @param value      numeric amount added to the running sum (finite)
 * @param occurredAt when the producer says the event happened
 * @see io.eventstats.validate.EventValidator
 */
public record Event(String type, double value, LocalDateTime occurredAt) {
  public Event {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(occurredAt, "occurredAt");
    if (type.isBlank()) {
      throw new IllegalArgumentException("type must not be blank");
    }
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException("value must be finite, got: " + value);
    }
  }
}
