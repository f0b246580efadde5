package io.eventstats.validate;

import java.util.Objects;

/**
 * Thrown by {@link EventValidator} when a message body does not describe a well-formed event.
 * The message is poison and will never succeed on redelivery.
 */
public final class EventValidationException extends RuntimeException {
  private final ValidationError error;

  public EventValidationException(ValidationError error) {
    this(error, null);
  }

  public EventValidationException(ValidationError error, Throwable cause) {
    super(Objects.requireNonNull(error, "error").describe(), cause);
    this.error = error;
  }

  public ValidationError error() {
    return error;
  }
}
