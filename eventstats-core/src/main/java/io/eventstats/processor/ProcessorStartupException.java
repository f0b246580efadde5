package io.eventstats.processor;

/**
 * The processor could not reach its aggregate store or queues within the connect budget,
 * or a queue turned out not to exist.
 */
public final class ProcessorStartupException extends RuntimeException {
  public ProcessorStartupException(String message) {
    super(message);
  }

  public ProcessorStartupException(String message, Throwable cause) {
    super(message, cause);
  }
}
