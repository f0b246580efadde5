package io.eventstats.dead;

import io.eventstats.memory.InMemoryQueueGateway;
import io.eventstats.model.HealthStatus;
import io.eventstats.model.QueueMessage;
import io.eventstats.spi.QueueGateway;
import io.eventstats.spi.TransientQueueException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeadLetterInspectorTest {

  @Test
  void countsDeadLetteredMessages() {
    InMemoryQueueGateway gateway = new InMemoryQueueGateway(Duration.ofSeconds(30));
    gateway.send("a");
    gateway.send("b");
    for (QueueMessage message : gateway.receiveBatch(10, Duration.ZERO)) {
      gateway.moveToDeadLetter(message, "test");
    }

    assertEquals(2, new DeadLetterInspector(gateway).count());
  }

  @Test
  void emptyDeadLetterQueueCountsZero() {
    assertEquals(0, new DeadLetterInspector(new InMemoryQueueGateway(Duration.ZERO)).count());
  }

  @Test
  void unreadableDepthIsUnknown() {
    DeadLetterInspector inspector = new DeadLetterInspector(new FailingDepthGateway());

    assertEquals(DeadLetterInspector.UNKNOWN, inspector.count());
  }

  private static final class FailingDepthGateway implements QueueGateway {
    @Override
    public List<QueueMessage> receiveBatch(int maxMessages, Duration wait) {
      return List.of();
    }

    @Override
    public void delete(QueueMessage message) {
    }

    @Override
    public void extendVisibility(QueueMessage message, Duration timeout) {
    }

    @Override
    public void moveToDeadLetter(QueueMessage message, String reason) {
    }

    @Override
    public HealthStatus healthCheck() {
      return HealthStatus.UNHEALTHY;
    }

    @Override
    public long approximateDeadLetterCount() {
      throw new TransientQueueException("connection refused");
    }

    @Override
    public void verify() {
    }
  }
}
