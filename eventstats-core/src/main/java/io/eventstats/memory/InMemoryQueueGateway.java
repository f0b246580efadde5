package io.eventstats.memory;

import io.eventstats.model.HealthStatus;
import io.eventstats.model.QueueMessage;
import io.eventstats.spi.PermanentQueueException;
import io.eventstats.spi.QueueGateway;
import io.eventstats.spi.TransientQueueException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Process-local {@link QueueGateway} that behaves like an SQS standard queue with a
 * dead-letter queue attached.
 *
 * <p>Received messages become invisible for the visibility timeout and then reappear with an
 * incremented receive count and a fresh receipt handle. Only the latest receipt handle of a
 * message can delete it. Several processors may share one instance.
 *
 * <p>Faults can be injected with {@link #failNextReceives(int)}, {@link #failDeadLetterPublish(boolean)},
 * {@link #queueMissing(boolean)} and {@link #unhealthy(boolean)}.
 */
public final class InMemoryQueueGateway implements QueueGateway {
  private static final long MAX_WAIT_SLICE_MS = 20;

  private final Object lock = new Object();
  private final Map<String, Entry> entries = new LinkedHashMap<>();
  private final List<DeadLetter> deadLetters = new ArrayList<>();
  private final Duration visibilityTimeout;
  private final Clock clock;

  private int failingReceives;
  private boolean failDeadLetterPublish;
  private boolean queueMissing;
  private boolean unhealthy;

  public InMemoryQueueGateway(Duration visibilityTimeout) {
    this(visibilityTimeout, Clock.systemUTC());
  }

  public InMemoryQueueGateway(Duration visibilityTimeout, Clock clock) {
    Objects.requireNonNull(visibilityTimeout, "visibilityTimeout");
    if (visibilityTimeout.isNegative()) {
      throw new IllegalArgumentException("visibilityTimeout must be >= 0");
    }
    this.visibilityTimeout = visibilityTimeout;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Enqueues a message body and returns its message id.
   */
  public String send(String body) {
    Objects.requireNonNull(body, "body");
    String messageId = UUID.randomUUID().toString();
    synchronized (lock) {
      entries.put(messageId, new Entry(messageId, body, clock.instant()));
      lock.notifyAll();
    }
    return messageId;
  }

  @Override
  public List<QueueMessage> receiveBatch(int maxMessages, Duration wait) {
    if (maxMessages < 1) {
      throw new IllegalArgumentException("maxMessages must be >= 1");
    }
    long deadline = System.nanoTime() + (wait == null ? 0L : wait.toNanos());
    synchronized (lock) {
      if (queueMissing) {
        throw new PermanentQueueException("Queue does not exist");
      }
      if (failingReceives > 0) {
        failingReceives--;
        throw new TransientQueueException("Injected receive failure");
      }
      while (true) {
        List<QueueMessage> batch = claimVisible(maxMessages);
        long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
        if (!batch.isEmpty() || remainingMs <= 0) {
          return batch;
        }
        try {
          // Sliced so that messages whose visibility expires are picked up without a send.
          lock.wait(Math.min(remainingMs, MAX_WAIT_SLICE_MS));
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new TransientQueueException("Interrupted while waiting for messages", e);
        }
      }
    }
  }

  private List<QueueMessage> claimVisible(int maxMessages) {
    Instant now = clock.instant();
    List<QueueMessage> batch = new ArrayList<>();
    for (Entry entry : entries.values()) {
      if (batch.size() >= maxMessages) {
        break;
      }
      if (entry.visibleAt.isAfter(now)) {
        continue;
      }
      entry.receiveCount++;
      entry.receiptHandle = UUID.randomUUID().toString();
      entry.visibleAt = now.plus(visibilityTimeout);
      batch.add(new QueueMessage(entry.messageId, entry.body, entry.receiptHandle,
          entry.receiveCount, entry.sentAt));
    }
    return batch;
  }

  @Override
  public void delete(QueueMessage message) {
    synchronized (lock) {
      Entry entry = entries.get(message.messageId());
      if (entry != null && message.receiptHandle().equals(entry.receiptHandle)) {
        entries.remove(message.messageId());
      }
    }
  }

  @Override
  public void extendVisibility(QueueMessage message, Duration timeout) {
    synchronized (lock) {
      Entry entry = entries.get(message.messageId());
      if (entry != null && message.receiptHandle().equals(entry.receiptHandle)) {
        entry.visibleAt = clock.instant().plus(timeout);
      }
    }
  }

  @Override
  public void moveToDeadLetter(QueueMessage message, String reason) {
    synchronized (lock) {
      if (failDeadLetterPublish) {
        throw new TransientQueueException("Injected dead-letter publish failure");
      }
      deadLetters.add(new DeadLetter(message.messageId(), message.body(), message.receiveCount(), reason));
      Entry entry = entries.get(message.messageId());
      if (entry != null && message.receiptHandle().equals(entry.receiptHandle)) {
        entries.remove(message.messageId());
      }
    }
  }

  @Override
  public HealthStatus healthCheck() {
    synchronized (lock) {
      return unhealthy || queueMissing ? HealthStatus.UNHEALTHY : HealthStatus.HEALTHY;
    }
  }

  @Override
  public long approximateDeadLetterCount() {
    synchronized (lock) {
      return deadLetters.size();
    }
  }

  @Override
  public void verify() {
    synchronized (lock) {
      if (queueMissing) {
        throw new PermanentQueueException("Queue does not exist");
      }
    }
  }

  /**
   * Number of messages still on the source queue, visible or in flight.
   */
  public int size() {
    synchronized (lock) {
      return entries.size();
    }
  }

  /**
   * Messages moved to the dead-letter queue, oldest first.
   */
  public List<DeadLetter> deadLetters() {
    synchronized (lock) {
      return List.copyOf(deadLetters);
    }
  }

  /**
   * Makes every in-flight message visible again, as if its visibility timeout had elapsed.
   */
  public void expireVisibility() {
    synchronized (lock) {
      Instant now = clock.instant();
      for (Entry entry : entries.values()) {
        entry.visibleAt = now;
      }
      lock.notifyAll();
    }
  }

  /**
   * Makes the next {@code count} receive calls throw {@link TransientQueueException}.
   */
  public void failNextReceives(int count) {
    synchronized (lock) {
      failingReceives = count;
    }
  }

  public void failDeadLetterPublish(boolean fail) {
    synchronized (lock) {
      failDeadLetterPublish = fail;
    }
  }

  /**
   * Simulates a deleted or never-created queue: {@link #verify()} and receives fail permanently.
   */
  public void queueMissing(boolean missing) {
    synchronized (lock) {
      queueMissing = missing;
    }
  }

  public void unhealthy(boolean unhealthy) {
    synchronized (lock) {
      this.unhealthy = unhealthy;
    }
  }

  /**
   * A message as it was published to the dead-letter queue.
   */
  public record DeadLetter(String originalMessageId, String body, int receiveCount, String reason) {
  }

  private static final class Entry {
    private final String messageId;
    private final String body;
    private final Instant sentAt;
    private int receiveCount;
    private String receiptHandle;
    private Instant visibleAt;

    private Entry(String messageId, String body, Instant sentAt) {
      this.messageId = messageId;
      this.body = body;
      this.sentAt = sentAt;
      this.visibleAt = sentAt;
    }
  }
}
