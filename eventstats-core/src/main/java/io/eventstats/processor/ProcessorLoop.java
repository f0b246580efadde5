package io.eventstats.processor;

import io.eventstats.backoff.BackoffPolicy;
import io.eventstats.backoff.ExponentialBackoffPolicy;
import io.eventstats.model.Event;
import io.eventstats.model.HealthStatus;
import io.eventstats.model.QueueMessage;
import io.eventstats.spi.AggregateStore;
import io.eventstats.spi.MetricsExporter;
import io.eventstats.spi.PermanentQueueException;
import io.eventstats.spi.QueueGateway;
import io.eventstats.spi.StoreUnavailableException;
import io.eventstats.util.DaemonThreadFactory;
import io.eventstats.validate.EventValidationException;
import io.eventstats.validate.EventValidator;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Consumer loop that claims messages from a {@link QueueGateway}, validates them and folds
 * them into an {@link AggregateStore}.
 *
 * <p>For every received message exactly one {@link MessageOutcome} is decided and applied:
 * <ul>
 *   <li>receive count above {@code maxReceiveCount}: moved to the dead-letter queue
 *       (left in place if the dead-letter publish fails);</li>
 *   <li>invalid body: deleted immediately;</li>
 *   <li>store unavailable: left alone so it reappears after the visibility timeout;</li>
 *   <li>otherwise: aggregated, then deleted.</li>
 * </ul>
 *
 * <p>If the delete after a successful increment fails, the message is redelivered and counted
 * twice. Delivery is at-least-once and the store does not deduplicate.
 *
 * <p>Messages of a batch are processed sequentially on the loop thread. One batch is in
 * flight at a time; {@link #requestShutdown()} stops further receives and lets the current
 * batch finish.
 *
 * <p>Create instances via {@link #builder()}. Use {@link #run()} to block the calling thread,
 * or {@link #start()} to run on a dedicated daemon thread and {@link #close()} to drain it.
 *
 * @see ProcessorLoop.Builder
 */
public final class ProcessorLoop implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ProcessorLoop.class.getName());

  private final QueueGateway queueGateway;
  private final AggregateStore aggregateStore;
  private final EventValidator validator;
  private final int batchSize;
  private final Duration waitTime;
  private final int maxReceiveCount;
  private final Duration visibilityTimeout;
  private final BackoffPolicy connectBackoff;
  private final int maxConnectAttempts;
  private final BackoffPolicy retryBackoff;
  private final BackoffPolicy idleBackoff;
  private final Duration drainTimeout;
  private final MetricsExporter metrics;
  private final Consumer<Throwable> failureHandler;

  private final AtomicReference<ProcessorState> state = new AtomicReference<>(ProcessorState.STARTING);
  private final ShutdownSignal shutdownSignal = new ShutdownSignal();
  private final CountDownLatch connected = new CountDownLatch(1);
  private final CountDownLatch terminated = new CountDownLatch(1);
  private volatile Throwable failure;
  private Thread worker;

  // Touched only by the loop thread.
  private int consecutiveEmptyReceives;
  private int consecutiveReceiveFailures;

  private ProcessorLoop(Builder builder) {
    this.queueGateway = Objects.requireNonNull(builder.queueGateway, "queueGateway");
    this.aggregateStore = Objects.requireNonNull(builder.aggregateStore, "aggregateStore");

    if (builder.batchSize < 1 || builder.batchSize > 10) {
      throw new IllegalArgumentException("batchSize must be between 1 and 10, got: " + builder.batchSize);
    }
    if (builder.maxReceiveCount < 1) {
      throw new IllegalArgumentException("maxReceiveCount must be >= 1");
    }
    if (builder.maxConnectAttempts < 1) {
      throw new IllegalArgumentException("maxConnectAttempts must be >= 1");
    }
    requireNonNegative(builder.waitTime, "waitTime");
    requireNonNegative(builder.visibilityTimeout, "visibilityTimeout");
    requireNonNegative(builder.drainTimeout, "drainTimeout");

    this.validator = builder.validator != null ? builder.validator : new EventValidator();
    this.batchSize = builder.batchSize;
    this.waitTime = builder.waitTime;
    this.maxReceiveCount = builder.maxReceiveCount;
    this.visibilityTimeout = builder.visibilityTimeout;
    this.connectBackoff = Objects.requireNonNull(builder.connectBackoff, "connectBackoff");
    this.maxConnectAttempts = builder.maxConnectAttempts;
    this.retryBackoff = Objects.requireNonNull(builder.retryBackoff, "retryBackoff");
    this.idleBackoff = Objects.requireNonNull(builder.idleBackoff, "idleBackoff");
    this.drainTimeout = builder.drainTimeout;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.failureHandler = builder.failureHandler;
  }

  public static Builder builder() {
    return new Builder();
  }

  public ProcessorState state() {
    return state.get();
  }

  /**
   * Returns the fatal error that moved the loop to {@link ProcessorState#FAILED}, or {@code null}.
   */
  public Throwable failure() {
    return failure;
  }

  /**
   * Runs the loop on the calling thread until shutdown is requested or a fatal error occurs.
   *
   * @throws ProcessorStartupException if the store or the queues could not be reached
   * @throws IllegalStateException     if the loop was already started or closed
   */
  public void run() {
    if (!state.compareAndSet(ProcessorState.STARTING, ProcessorState.CONNECTING)) {
      throw new IllegalStateException("ProcessorLoop already started (state=" + state.get() + ")");
    }
    runLoop();
    if (failure instanceof ProcessorStartupException startupFailure) {
      throw startupFailure;
    }
  }

  /**
   * Runs the loop on a dedicated daemon thread. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (worker != null) {
      return;
    }
    if (!state.compareAndSet(ProcessorState.STARTING, ProcessorState.CONNECTING)) {
      throw new IllegalStateException("ProcessorLoop already started (state=" + state.get() + ")");
    }
    worker = new DaemonThreadFactory("eventstats-processor-").newThread(this::runLoop);
    worker.start();
  }

  /**
   * Stops further receives. The in-flight batch, if any, is finished first.
   */
  public void requestShutdown() {
    shutdownSignal.request();
    if (state.compareAndSet(ProcessorState.STARTING, ProcessorState.STOPPED)) {
      connected.countDown();
      terminated.countDown();
      return;
    }
    state.compareAndSet(ProcessorState.RUNNING, ProcessorState.DRAINING);
  }

  /**
   * Waits until the loop has left {@link ProcessorState#CONNECTING}, successfully or not.
   *
   * @return the state at that point, or {@link ProcessorState#CONNECTING} if the timeout elapsed first
   */
  public ProcessorState awaitConnected(Duration timeout) throws InterruptedException {
    connected.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    return state.get();
  }

  /**
   * Waits for the loop to reach {@link ProcessorState#STOPPED} or {@link ProcessorState#FAILED}.
   *
   * @return {@code true} if the loop terminated within the timeout
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    return terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  /**
   * Requests shutdown and waits up to the drain timeout for the in-flight batch to finish.
   */
  @Override
  public synchronized void close() {
    requestShutdown();
    if (worker == null) {
      return;
    }
    try {
      if (!awaitTermination(drainTimeout)) {
        logger.log(Level.WARNING, "Processor did not drain within {0}; interrupting {1}",
          new Object[]{drainTimeout, worker.getName()});
        worker.interrupt();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private void runLoop() {
    try {
      logger.info("Processor connecting");
      if (connect()) {
        if (state.compareAndSet(ProcessorState.CONNECTING, ProcessorState.RUNNING)) {
          logger.log(Level.INFO, "Processor running (batchSize={0}, maxReceiveCount={1})",
            new Object[]{batchSize, maxReceiveCount});
        }
        connected.countDown();
        while (!shutdownSignal.isRequested()) {
          pollOnce();
        }
        state.compareAndSet(ProcessorState.RUNNING, ProcessorState.DRAINING);
      }
      state.set(ProcessorState.STOPPED);
      logger.info("Processor stopped");
    } catch (ProcessorStartupException | PermanentQueueException e) {
      fail(e);
    } catch (RuntimeException | Error e) {
      fail(e);
      throw e;
    } finally {
      connected.countDown();
      terminated.countDown();
    }
  }

  private void fail(Throwable e) {
    failure = e;
    state.set(ProcessorState.FAILED);
    logger.log(Level.SEVERE, "Processor failed", e);
    if (failureHandler != null) {
      failureHandler.accept(e);
    }
  }

  /**
   * Waits for the store and the queues. Returns {@code false} if shutdown was requested meanwhile.
   */
  private boolean connect() {
    for (int attempt = 0; ; attempt++) {
      if (shutdownSignal.isRequested()) {
        return false;
      }
      if (aggregateStore.healthCheck() == HealthStatus.HEALTHY) {
        break;
      }
      if (attempt + 1 >= maxConnectAttempts) {
        throw new ProcessorStartupException(
          "Aggregate store unavailable after " + maxConnectAttempts + " attempts");
      }
      Duration delay = connectBackoff.computeDelay(attempt);
      logger.log(Level.WARNING, "Aggregate store unavailable (attempt {0}/{1}), retrying in {2}ms",
        new Object[]{attempt + 1, maxConnectAttempts, delay.toMillis()});
      shutdownSignal.await(delay);
    }
    for (int attempt = 0; ; attempt++) {
      if (shutdownSignal.isRequested()) {
        return false;
      }
      try {
        queueGateway.verify();
        return true;
      } catch (PermanentQueueException e) {
        throw new ProcessorStartupException("Queue verification failed: " + e.getMessage(), e);
      } catch (RuntimeException e) {
        if (attempt + 1 >= maxConnectAttempts) {
          throw new ProcessorStartupException(
            "Queue unavailable after " + maxConnectAttempts + " attempts", e);
        }
        Duration delay = connectBackoff.computeDelay(attempt);
        logger.log(Level.WARNING, "Queue unavailable (attempt " + (attempt + 1) + "/" +
          maxConnectAttempts + "), retrying in " + delay.toMillis() + "ms", e);
        shutdownSignal.await(delay);
      }
    }
  }

  /**
   * Executes a single receive-and-process cycle, including any idle or retry wait it triggers.
   * Called repeatedly by the loop, but may also be invoked directly for testing.
   *
   * @return number of messages received
   * @throws PermanentQueueException if the source queue rejected the receive
   */
  public int pollOnce() {
    List<QueueMessage> batch;
    try {
      batch = queueGateway.receiveBatch(batchSize, waitTime);
    } catch (PermanentQueueException e) {
      throw e;
    } catch (RuntimeException e) {
      metrics.incrementReceiveFailure();
      Duration delay = retryBackoff.computeDelay(consecutiveReceiveFailures++);
      logger.log(Level.WARNING, "Receive failed, retrying in " + delay.toMillis() + "ms", e);
      shutdownSignal.await(delay);
      return 0;
    }
    consecutiveReceiveFailures = 0;
    metrics.recordBatchSize(batch.size());

    if (batch.isEmpty()) {
      metrics.incrementEmptyReceive();
      shutdownSignal.await(idleBackoff.computeDelay(consecutiveEmptyReceives++));
      return 0;
    }
    consecutiveEmptyReceives = 0;

    logger.log(Level.FINE, "Received {0} messages", batch.size());
    // The whole batch is processed even if shutdown is requested meanwhile.
    for (QueueMessage message : batch) {
      metrics.incrementReceived();
      try {
        apply(message, evaluate(message));
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Unexpected failure processing message " + message.messageId() +
          "; leaving it for redelivery", e);
      }
    }
    return batch.size();
  }

  MessageOutcome evaluate(QueueMessage message) {
    if (message.receiveCount() > maxReceiveCount) {
      return new MessageOutcome.ExceededRetries(message.receiveCount(), maxReceiveCount);
    }
    if (message.receiveCount() > 1) {
      extendVisibility(message);
    }
    Event event;
    try {
      event = validator.validate(message.body());
    } catch (EventValidationException e) {
      return new MessageOutcome.ValidationFailed(e.error());
    }
    try {
      return new MessageOutcome.Delivered(aggregateStore.increment(event.type(), event.value()));
    } catch (StoreUnavailableException e) {
      return new MessageOutcome.StoreUnavailable(e);
    }
  }

  private void apply(QueueMessage message, MessageOutcome outcome) {
    if (outcome instanceof MessageOutcome.Delivered delivered) {
      metrics.incrementAggregated();
      logger.log(Level.FINE, "Aggregated message {0} into {1}",
        new Object[]{message.messageId(), delivered.aggregate()});
      delete(message);
    } else if (outcome instanceof MessageOutcome.ValidationFailed invalid) {
      metrics.incrementDiscarded();
      logger.log(Level.WARNING, "Discarding invalid message {0}: {1}",
        new Object[]{message.messageId(), invalid.error().describe()});
      delete(message);
    } else if (outcome instanceof MessageOutcome.StoreUnavailable unavailable) {
      metrics.incrementStoreFailure();
      // Last attempt before the message is dead-lettered on its next delivery.
      Level level = message.receiveCount() >= maxReceiveCount ? Level.SEVERE : Level.WARNING;
      logger.log(level, "Store unavailable for message " + message.messageId() + " (receive " +
        message.receiveCount() + "/" + maxReceiveCount + "); leaving it for redelivery",
        unavailable.cause());
    } else if (outcome instanceof MessageOutcome.ExceededRetries exceeded) {
      moveToDeadLetter(message, exceeded.reason());
    }
  }

  private void moveToDeadLetter(QueueMessage message, String reason) {
    try {
      queueGateway.moveToDeadLetter(message, reason);
      metrics.incrementDeadLettered();
      logger.log(Level.WARNING, "Moved message {0} to dead-letter queue: {1}",
        new Object[]{message.messageId(), reason});
    } catch (RuntimeException e) {
      metrics.incrementDeadLetterFailure();
      logger.log(Level.SEVERE, "Failed to dead-letter message " + message.messageId() +
        "; it stays on the source queue", e);
    }
  }

  private void delete(QueueMessage message) {
    try {
      queueGateway.delete(message);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to delete message " + message.messageId() +
        "; it will be redelivered", e);
    }
  }

  private void extendVisibility(QueueMessage message) {
    try {
      queueGateway.extendVisibility(message, visibilityTimeout);
      logger.log(Level.FINE, "Extended visibility of redelivered message {0} (receive {1})",
        new Object[]{message.messageId(), message.receiveCount()});
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to extend visibility of message " + message.messageId(), e);
    }
  }

  private static void requireNonNegative(Duration duration, String name) {
    Objects.requireNonNull(duration, name);
    if (duration.isNegative()) {
      throw new IllegalArgumentException(name + " must be >= 0");
    }
  }

  /**
   * Builder for {@link ProcessorLoop}.
   */
  public static final class Builder {
    private QueueGateway queueGateway;
    private AggregateStore aggregateStore;
    private EventValidator validator;
    private int batchSize = 10;
    private Duration waitTime = Duration.ofSeconds(20);
    private int maxReceiveCount = 3;
    private Duration visibilityTimeout = Duration.ofSeconds(300);
    private BackoffPolicy connectBackoff =
      new ExponentialBackoffPolicy(Duration.ofMillis(100), Duration.ofSeconds(5));
    private int maxConnectAttempts = 30;
    private BackoffPolicy retryBackoff =
      new ExponentialBackoffPolicy(Duration.ofMillis(100), Duration.ofSeconds(5));
    private BackoffPolicy idleBackoff =
      new ExponentialBackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(20));
    private Duration drainTimeout = Duration.ofSeconds(30);
    private MetricsExporter metrics;
    private Consumer<Throwable> failureHandler;

    private Builder() {
    }

    /**
     * Sets the source of messages.
     *
     * <p><b>Required.</b>
     *
     * @param queueGateway the queue gateway
     * @return this builder
     */
    public Builder queueGateway(QueueGateway queueGateway) {
      this.queueGateway = queueGateway;
      return this;
    }

    /**
     * Sets the store aggregates are written to.
     *
     * <p><b>Required.</b>
     *
     * @param aggregateStore the shared aggregate store
     * @return this builder
     */
    public Builder aggregateStore(AggregateStore aggregateStore) {
      this.aggregateStore = aggregateStore;
      return this;
    }

    /**
     * Sets the validator that decodes message bodies.
     *
     * <p>Optional. Defaults to a new {@link EventValidator} using the default JSON codec.
     *
     * @param validator the event validator
     * @return this builder
     */
    public Builder validator(EventValidator validator) {
      this.validator = validator;
      return this;
    }

    /**
     * Sets the maximum number of messages per receive call.
     *
     * <p>Optional. Defaults to {@code 10}. Must be between 1 and 10.
     *
     * @param batchSize max messages per receive
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the long-poll wait of each receive call.
     *
     * <p>Optional. Defaults to 20 seconds.
     *
     * @param waitTime long-poll wait
     * @return this builder
     */
    public Builder waitTime(Duration waitTime) {
      this.waitTime = waitTime;
      return this;
    }

    /**
     * Sets how many receives a message gets before it is moved to the dead-letter queue.
     *
     * <p>Optional. Defaults to {@code 3}. A message received for the 4th time is dead-lettered.
     *
     * @param maxReceiveCount maximum receive count
     * @return this builder
     */
    public Builder maxReceiveCount(int maxReceiveCount) {
      this.maxReceiveCount = maxReceiveCount;
      return this;
    }

    /**
     * Sets the visibility timeout applied again to redelivered messages before processing.
     *
     * <p>Optional. Defaults to 300 seconds.
     *
     * @param visibilityTimeout visibility timeout
     * @return this builder
     */
    public Builder visibilityTimeout(Duration visibilityTimeout) {
      this.visibilityTimeout = visibilityTimeout;
      return this;
    }

    /**
     * Sets the backoff between connect attempts at startup.
     *
     * <p>Optional. Defaults to exponential 100ms doubling up to 5s.
     *
     * @param connectBackoff connect backoff
     * @return this builder
     */
    public Builder connectBackoff(BackoffPolicy connectBackoff) {
      this.connectBackoff = connectBackoff;
      return this;
    }

    /**
     * Sets how many times the store and the queues are probed before startup fails.
     *
     * <p>Optional. Defaults to {@code 30}.
     *
     * @param maxConnectAttempts connect attempt budget
     * @return this builder
     */
    public Builder maxConnectAttempts(int maxConnectAttempts) {
      this.maxConnectAttempts = maxConnectAttempts;
      return this;
    }

    /**
     * Sets the backoff after a failed receive. The attempt counter resets on the next success.
     *
     * <p>Optional. Defaults to exponential 100ms doubling up to 5s.
     *
     * @param retryBackoff receive retry backoff
     * @return this builder
     */
    public Builder retryBackoff(BackoffPolicy retryBackoff) {
      this.retryBackoff = retryBackoff;
      return this;
    }

    /**
     * Sets the backoff after a receive that returned no messages.
     *
     * <p>Optional. Defaults to exponential 1s doubling up to 20s.
     *
     * @param idleBackoff idle backoff
     * @return this builder
     */
    public Builder idleBackoff(BackoffPolicy idleBackoff) {
      this.idleBackoff = idleBackoff;
      return this;
    }

    /**
     * Sets how long {@link ProcessorLoop#close()} waits for the in-flight batch.
     *
     * <p>Optional. Defaults to 30 seconds.
     *
     * @param drainTimeout drain timeout
     * @return this builder
     */
    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets a callback invoked on the loop thread when the loop enters {@link ProcessorState#FAILED}.
     *
     * <p>Optional.
     *
     * @param failureHandler receives the fatal error
     * @return this builder
     */
    public Builder failureHandler(Consumer<Throwable> failureHandler) {
      this.failureHandler = failureHandler;
      return this;
    }

    /**
     * Builds the loop. Call {@link ProcessorLoop#run()} or {@link ProcessorLoop#start()} to begin.
     *
     * @return a new {@link ProcessorLoop}
     * @throws NullPointerException     if {@code queueGateway} or {@code aggregateStore} is null
     * @throws IllegalArgumentException if a numeric setting is out of range
     */
    public ProcessorLoop build() {
      return new ProcessorLoop(this);
    }
  }
}
