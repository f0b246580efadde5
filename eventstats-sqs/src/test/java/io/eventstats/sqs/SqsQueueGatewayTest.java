package io.eventstats.sqs;

import io.eventstats.model.HealthStatus;
import io.eventstats.model.QueueMessage;
import io.eventstats.spi.PermanentQueueException;
import io.eventstats.spi.QueueGatewayException;
import io.eventstats.spi.TransientQueueException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.ChangeMessageVisibilityRequest;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesResponse;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlResponse;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.MessageSystemAttributeName;
import software.amazon.awssdk.services.sqs.model.QueueAttributeName;
import software.amazon.awssdk.services.sqs.model.QueueDoesNotExistException;
import software.amazon.awssdk.services.sqs.model.ReceiptHandleIsInvalidException;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageResponse;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SqsException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SqsQueueGatewayTest {
  private static final String QUEUE_URL = "https://sqs.us-east-1.amazonaws.com/000000000000/events";
  private static final String DLQ_URL = "https://sqs.us-east-1.amazonaws.com/000000000000/events-dlq";

  private SqsClient sqsClient;
  private SqsQueueGateway gateway;

  @BeforeEach
  void setup() {
    sqsClient = mock(SqsClient.class);
    when(sqsClient.getQueueUrl(any(GetQueueUrlRequest.class))).thenAnswer(inv -> {
      GetQueueUrlRequest request = inv.getArgument(0);
      return GetQueueUrlResponse.builder()
          .queueUrl("https://sqs.us-east-1.amazonaws.com/000000000000/" + request.queueName())
          .build();
    });
    gateway = SqsQueueGateway.builder()
        .sqsClient(sqsClient)
        .queueName("events")
        .visibilityTimeout(Duration.ofSeconds(120))
        .build();
  }

  private static QueueMessage message(int receiveCount) {
    return new QueueMessage("m-1", "{\"type\":\"a\"}", "rh-1", receiveCount, null);
  }

  // ── Builder validation ───────────────────────────────────────────

  @Test
  void deadLetterQueueNameDefaultsToSuffix() {
    assertEquals("events-dlq", gateway.deadLetterQueueName());
  }

  @Test
  void builderRejectsMissingOrConflictingNames() {
    assertThrows(NullPointerException.class, () -> SqsQueueGateway.builder().sqsClient(sqsClient).build());
    assertThrows(NullPointerException.class, () -> SqsQueueGateway.builder().queueName("events").build());
    assertThrows(IllegalArgumentException.class, () -> SqsQueueGateway.builder()
        .sqsClient(sqsClient).queueName("events").deadLetterQueueName("events").build());
    assertThrows(IllegalArgumentException.class, () -> SqsQueueGateway.builder()
        .sqsClient(sqsClient).queueName("events").visibilityTimeout(Duration.ofHours(13)).build());
  }

  // ── Receive ──────────────────────────────────────────────────────

  @Test
  void receiveMapsSystemAttributes() {
    long sent = 1_700_000_000_000L;
    when(sqsClient.receiveMessage(any(ReceiveMessageRequest.class))).thenReturn(ReceiveMessageResponse.builder()
        .messages(Message.builder()
            .messageId("m-1")
            .receiptHandle("rh-1")
            .body("{}")
            .attributes(Map.of(
                MessageSystemAttributeName.APPROXIMATE_RECEIVE_COUNT, "3",
                MessageSystemAttributeName.SENT_TIMESTAMP, Long.toString(sent)))
            .build())
        .build());

    List<QueueMessage> batch = gateway.receiveBatch(10, Duration.ofSeconds(20));

    assertEquals(1, batch.size());
    QueueMessage received = batch.get(0);
    assertEquals("m-1", received.messageId());
    assertEquals("rh-1", received.receiptHandle());
    assertEquals(3, received.receiveCount());
    assertEquals(Instant.ofEpochMilli(sent), received.sentAt());

    ArgumentCaptor<ReceiveMessageRequest> captor = ArgumentCaptor.forClass(ReceiveMessageRequest.class);
    verify(sqsClient).receiveMessage(captor.capture());
    ReceiveMessageRequest request = captor.getValue();
    assertEquals(QUEUE_URL, request.queueUrl());
    assertEquals(10, request.maxNumberOfMessages());
    assertEquals(20, request.waitTimeSeconds());
    assertEquals(120, request.visibilityTimeout());
    assertTrue(request.attributeNamesAsStrings().contains("ApproximateReceiveCount"));
  }

  @Test
  void missingReceiveCountDefaultsToOne() {
    when(sqsClient.receiveMessage(any(ReceiveMessageRequest.class))).thenReturn(ReceiveMessageResponse.builder()
        .messages(Message.builder().messageId("m-1").receiptHandle("rh-1").body("{}").build())
        .build());

    QueueMessage received = gateway.receiveBatch(1, Duration.ZERO).get(0);

    assertEquals(1, received.receiveCount());
    assertNull(received.sentAt());
  }

  @Test
  void waitIsClampedToLongPollLimit() {
    when(sqsClient.receiveMessage(any(ReceiveMessageRequest.class)))
        .thenReturn(ReceiveMessageResponse.builder().build());

    assertTrue(gateway.receiveBatch(5, Duration.ofMinutes(5)).isEmpty());

    ArgumentCaptor<ReceiveMessageRequest> captor = ArgumentCaptor.forClass(ReceiveMessageRequest.class);
    verify(sqsClient).receiveMessage(captor.capture());
    assertEquals(20, captor.getValue().waitTimeSeconds());
  }

  @Test
  void batchSizeOutOfRangeRejected() {
    assertThrows(IllegalArgumentException.class, () -> gateway.receiveBatch(0, Duration.ZERO));
    assertThrows(IllegalArgumentException.class, () -> gateway.receiveBatch(11, Duration.ZERO));
  }

  @Test
  void queueUrlResolvedOnce() {
    when(sqsClient.receiveMessage(any(ReceiveMessageRequest.class)))
        .thenReturn(ReceiveMessageResponse.builder().build());

    gateway.receiveBatch(1, Duration.ZERO);
    gateway.receiveBatch(1, Duration.ZERO);

    verify(sqsClient, times(1)).getQueueUrl(any(GetQueueUrlRequest.class));
  }

  // ── Error mapping ────────────────────────────────────────────────

  @Test
  void missingQueueIsPermanent() {
    reset(sqsClient);
    when(sqsClient.getQueueUrl(any(GetQueueUrlRequest.class)))
        .thenThrow(QueueDoesNotExistException.builder().message("nope").statusCode(400).build());

    PermanentQueueException ex = assertThrows(PermanentQueueException.class, gateway::verify);
    assertTrue(ex.getMessage().contains("events"));
    assertFalse(ex.isRetryable());
  }

  @Test
  void clientFailureIsTransient() {
    when(sqsClient.receiveMessage(any(ReceiveMessageRequest.class)))
        .thenThrow(SdkClientException.create("connection refused"));

    TransientQueueException ex = assertThrows(TransientQueueException.class,
        () -> gateway.receiveBatch(1, Duration.ZERO));
    assertTrue(ex.isRetryable());
  }

  @Test
  void serverErrorsAndThrottlingAreTransient() {
    QueueGatewayException server = SqsQueueGateway.translate("receive",
        SqsException.builder().statusCode(503).message("unavailable").build());
    QueueGatewayException throttled = SqsQueueGateway.translate("receive",
        SqsException.builder().statusCode(429).message("slow down").build());

    assertInstanceOf(TransientQueueException.class, server);
    assertInstanceOf(TransientQueueException.class, throttled);
  }

  @Test
  void otherClientErrorsArePermanent() {
    QueueGatewayException denied = SqsQueueGateway.translate("receive",
        SqsException.builder().statusCode(403).message("access denied").build());

    assertInstanceOf(PermanentQueueException.class, denied);
    assertTrue(denied.getMessage().startsWith("Failed to receive"));
  }

  // ── Delete and visibility ────────────────────────────────────────

  @Test
  void deleteUsesReceiptHandle() {
    gateway.delete(message(1));

    ArgumentCaptor<DeleteMessageRequest> captor = ArgumentCaptor.forClass(DeleteMessageRequest.class);
    verify(sqsClient).deleteMessage(captor.capture());
    assertEquals(QUEUE_URL, captor.getValue().queueUrl());
    assertEquals("rh-1", captor.getValue().receiptHandle());
  }

  @Test
  void deleteWithStaleReceiptHandleIsNoop() {
    when(sqsClient.deleteMessage(any(DeleteMessageRequest.class)))
        .thenThrow(ReceiptHandleIsInvalidException.builder().message("stale").statusCode(400).build());

    assertDoesNotThrow(() -> gateway.delete(message(1)));
  }

  @Test
  void extendVisibilitySendsSeconds() {
    gateway.extendVisibility(message(2), Duration.ofMinutes(5));

    ArgumentCaptor<ChangeMessageVisibilityRequest> captor =
        ArgumentCaptor.forClass(ChangeMessageVisibilityRequest.class);
    verify(sqsClient).changeMessageVisibility(captor.capture());
    assertEquals(300, captor.getValue().visibilityTimeout());
    assertEquals("rh-1", captor.getValue().receiptHandle());
  }

  // ── Dead letter ──────────────────────────────────────────────────

  @Test
  void moveToDeadLetterPublishesThenDeletes() {
    gateway.moveToDeadLetter(message(4), "receive count 4 exceeded maximum of 3");

    InOrder order = inOrder(sqsClient);
    ArgumentCaptor<SendMessageRequest> captor = ArgumentCaptor.forClass(SendMessageRequest.class);
    order.verify(sqsClient).sendMessage(captor.capture());
    order.verify(sqsClient).deleteMessage(any(DeleteMessageRequest.class));

    SendMessageRequest sent = captor.getValue();
    assertEquals(DLQ_URL, sent.queueUrl());
    assertEquals("{\"type\":\"a\"}", sent.messageBody());
    assertEquals("m-1", sent.messageAttributes().get(SqsQueueGateway.ATTR_ORIGINAL_MESSAGE_ID).stringValue());
    assertEquals("4", sent.messageAttributes().get(SqsQueueGateway.ATTR_RECEIVE_COUNT).stringValue());
    assertEquals("Number", sent.messageAttributes().get(SqsQueueGateway.ATTR_RECEIVE_COUNT).dataType());
    assertEquals("receive count 4 exceeded maximum of 3",
        sent.messageAttributes().get(SqsQueueGateway.ATTR_REASON).stringValue());
  }

  @Test
  void failedPublishLeavesSourceMessage() {
    when(sqsClient.sendMessage(any(SendMessageRequest.class)))
        .thenThrow(SdkClientException.create("timeout"));

    assertThrows(TransientQueueException.class, () -> gateway.moveToDeadLetter(message(4), "too many"));

    verify(sqsClient, never()).deleteMessage(any(DeleteMessageRequest.class));
  }

  @Test
  void approximateDeadLetterCountReadsDlqAttributes() {
    when(sqsClient.getQueueAttributes(any(GetQueueAttributesRequest.class)))
        .thenReturn(GetQueueAttributesResponse.builder()
            .attributes(Map.of(QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES, "7"))
            .build());

    assertEquals(7, gateway.approximateDeadLetterCount());

    ArgumentCaptor<GetQueueAttributesRequest> captor = ArgumentCaptor.forClass(GetQueueAttributesRequest.class);
    verify(sqsClient).getQueueAttributes(captor.capture());
    assertEquals(DLQ_URL, captor.getValue().queueUrl());
  }

  // ── Health ───────────────────────────────────────────────────────

  @Test
  void healthCheckNeverThrows() {
    when(sqsClient.getQueueAttributes(any(GetQueueAttributesRequest.class)))
        .thenReturn(GetQueueAttributesResponse.builder().build())
        .thenThrow(SdkClientException.create("down"));

    assertEquals(HealthStatus.HEALTHY, gateway.healthCheck());
    assertEquals(HealthStatus.UNHEALTHY, gateway.healthCheck());
  }

  @Test
  void verifyResolvesBothQueues() {
    gateway.verify();

    ArgumentCaptor<GetQueueUrlRequest> captor = ArgumentCaptor.forClass(GetQueueUrlRequest.class);
    verify(sqsClient, times(2)).getQueueUrl(captor.capture());
    assertEquals(List.of("events", "events-dlq"),
        captor.getAllValues().stream().map(GetQueueUrlRequest::queueName).toList());
  }
}
