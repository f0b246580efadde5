package io.eventstats.spring.boot;

import io.eventstats.processor.ProcessorLoop;
import io.eventstats.processor.ProcessorStartupException;
import io.eventstats.processor.ProcessorState;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Starts the {@link ProcessorLoop} with the application context and drains it on shutdown.
 *
 * <p>{@link #start()} blocks until the loop has connected, so a store or queue that cannot be
 * reached fails application startup with the loop's {@link ProcessorStartupException}.
 * Stopping runs in a late phase, after the web server has stopped accepting requests.
 */
public class ProcessorLifecycle implements SmartLifecycle {
  private static final Logger logger = Logger.getLogger(ProcessorLifecycle.class.getName());

  private final ProcessorLoop loop;
  private final Duration startupTimeout;
  private volatile boolean running;

  public ProcessorLifecycle(ProcessorLoop loop, Duration startupTimeout) {
    this.loop = Objects.requireNonNull(loop, "loop");
    this.startupTimeout = Objects.requireNonNull(startupTimeout, "startupTimeout");
  }

  @Override
  public void start() {
    loop.start();
    running = true;
    ProcessorState state;
    try {
      state = loop.awaitConnected(startupTimeout);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for the processor to connect", e);
    }
    if (state == ProcessorState.FAILED) {
      running = false;
      Throwable failure = loop.failure();
      if (failure instanceof ProcessorStartupException startupFailure) {
        throw startupFailure;
      }
      throw new ProcessorStartupException("Processor failed during startup", failure);
    }
    if (state == ProcessorState.CONNECTING) {
      logger.log(Level.WARNING, "Processor still connecting after {0}; continuing startup", startupTimeout);
    }
  }

  @Override
  public void stop() {
    running = false;
    loop.close();
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  /**
   * Late start and early stop relative to default-phase beans such as the web server.
   */
  @Override
  public int getPhase() {
    return DEFAULT_PHASE - 1024;
  }
}
