package io.eventstats.processor;

/**
 * Lifecycle of a {@link ProcessorLoop}.
 *
 * <pre>
 * STARTING -&gt; CONNECTING -&gt; RUNNING -&gt; DRAINING -&gt; STOPPED
 *                  \              \
 *                   +-&gt; FAILED    +-&gt; FAILED
 * </pre>
 */
public enum ProcessorState {
  /** Built but {@code run()} has not been called yet. */
  STARTING,
  /** Waiting for the aggregate store and the queues to become reachable. */
  CONNECTING,
  /** Receiving and processing batches. */
  RUNNING,
  /** Shutdown requested; finishing the in-flight batch. */
  DRAINING,
  /** Exited normally. */
  STOPPED,
  /** Exited because of a fatal startup or queue error. */
  FAILED;

  public boolean isTerminal() {
    return this == STOPPED || this == FAILED;
  }
}
