package io.eventstats.sqs;

import io.eventstats.model.HealthStatus;
import io.eventstats.model.QueueMessage;
import io.eventstats.spi.PermanentQueueException;
import io.eventstats.spi.QueueGateway;
import io.eventstats.spi.QueueGatewayException;
import io.eventstats.spi.TransientQueueException;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.ChangeMessageVisibilityRequest;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesResponse;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.MessageAttributeValue;
import software.amazon.awssdk.services.sqs.model.MessageNotInflightException;
import software.amazon.awssdk.services.sqs.model.QueueAttributeName;
import software.amazon.awssdk.services.sqs.model.QueueDoesNotExistException;
import software.amazon.awssdk.services.sqs.model.ReceiptHandleIsInvalidException;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link QueueGateway} over an Amazon SQS standard queue and its dead-letter queue.
 *
 * <p>Queue URLs are resolved lazily with {@code GetQueueUrl} and cached. Queues are never
 * created; a missing queue surfaces as {@link PermanentQueueException}.
 *
 * <p>Dead-lettering is explicit: the body is sent to the dead-letter queue with the message
 * attributes {@value #ATTR_ORIGINAL_MESSAGE_ID}, {@value #ATTR_RECEIVE_COUNT} and
 * {@value #ATTR_REASON}, and only then deleted from the source queue.
 *
 * <p>The {@link SqsClient} is not owned by this class and is not closed by it.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class SqsQueueGateway implements QueueGateway {
  private static final Logger logger = Logger.getLogger(SqsQueueGateway.class.getName());

  public static final String ATTR_ORIGINAL_MESSAGE_ID = "OriginalMessageId";
  public static final String ATTR_RECEIVE_COUNT = "ReceiveCount";
  public static final String ATTR_REASON = "DeadLetterReason";

  static final String DEAD_LETTER_SUFFIX = "-dlq";
  private static final int MAX_BATCH = 10;
  private static final long MAX_WAIT_SECONDS = 20;
  private static final long MAX_VISIBILITY_SECONDS = 43_200;

  private final SqsClient sqsClient;
  private final String queueName;
  private final String deadLetterQueueName;
  private final Duration visibilityTimeout;

  private volatile String queueUrl;
  private volatile String deadLetterQueueUrl;

  private SqsQueueGateway(Builder builder) {
    this.sqsClient = Objects.requireNonNull(builder.sqsClient, "sqsClient");
    this.queueName = Objects.requireNonNull(builder.queueName, "queueName");
    if (queueName.isBlank()) {
      throw new IllegalArgumentException("queueName must not be blank");
    }
    this.deadLetterQueueName = builder.deadLetterQueueName != null
        ? builder.deadLetterQueueName
        : queueName + DEAD_LETTER_SUFFIX;
    if (deadLetterQueueName.equals(queueName)) {
      throw new IllegalArgumentException("deadLetterQueueName must differ from queueName");
    }
    this.visibilityTimeout = builder.visibilityTimeout != null ? builder.visibilityTimeout : Duration.ofSeconds(300);
    if (visibilityTimeout.isNegative() || visibilityTimeout.getSeconds() > MAX_VISIBILITY_SECONDS) {
      throw new IllegalArgumentException("visibilityTimeout must be between 0 and 12 hours");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public String queueName() {
    return queueName;
  }

  public String deadLetterQueueName() {
    return deadLetterQueueName;
  }

  @Override
  public List<QueueMessage> receiveBatch(int maxMessages, Duration wait) {
    if (maxMessages < 1 || maxMessages > MAX_BATCH) {
      throw new IllegalArgumentException("maxMessages must be between 1 and " + MAX_BATCH);
    }
    long waitSeconds = wait == null ? 0 : Math.max(0, Math.min(wait.getSeconds(), MAX_WAIT_SECONDS));
    ReceiveMessageRequest request = ReceiveMessageRequest.builder()
        .queueUrl(queueUrl())
        .maxNumberOfMessages(maxMessages)
        .waitTimeSeconds((int) waitSeconds)
        .visibilityTimeout((int) visibilityTimeout.getSeconds())
        .attributeNamesWithStrings("ApproximateReceiveCount", "SentTimestamp")
        .build();
    List<Message> messages;
    try {
      messages = sqsClient.receiveMessage(request).messages();
    } catch (SdkException e) {
      throw translate("receive from " + queueName, e);
    }
    List<QueueMessage> batch = new ArrayList<>(messages.size());
    for (Message message : messages) {
      batch.add(toQueueMessage(message));
    }
    return batch;
  }

  static QueueMessage toQueueMessage(Message message) {
    Map<String, String> attributes = message.attributesAsStrings();
    int receiveCount = parseReceiveCount(attributes.get("ApproximateReceiveCount"));
    Instant sentAt = null;
    String sent = attributes.get("SentTimestamp");
    if (sent != null) {
      try {
        sentAt = Instant.ofEpochMilli(Long.parseLong(sent));
      } catch (NumberFormatException e) {
        logger.log(Level.FINE, "Ignoring unparseable SentTimestamp {0}", sent);
      }
    }
    return new QueueMessage(message.messageId(), message.body(), message.receiptHandle(), receiveCount, sentAt);
  }

  private static int parseReceiveCount(String value) {
    if (value == null) {
      return 1;
    }
    try {
      return Math.max(1, Integer.parseInt(value));
    } catch (NumberFormatException e) {
      logger.log(Level.FINE, "Ignoring unparseable ApproximateReceiveCount {0}", value);
      return 1;
    }
  }

  @Override
  public void delete(QueueMessage message) {
    deleteFrom(queueUrl(), message);
  }

  private void deleteFrom(String url, QueueMessage message) {
    try {
      sqsClient.deleteMessage(DeleteMessageRequest.builder()
          .queueUrl(url)
          .receiptHandle(message.receiptHandle())
          .build());
    } catch (ReceiptHandleIsInvalidException e) {
      logger.log(Level.FINE, "Receipt handle for message {0} is no longer valid; already deleted or redelivered",
          message.messageId());
    } catch (SdkException e) {
      throw translate("delete message " + message.messageId(), e);
    }
  }

  @Override
  public void extendVisibility(QueueMessage message, Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    long seconds = Math.max(0, Math.min(timeout.getSeconds(), MAX_VISIBILITY_SECONDS));
    try {
      sqsClient.changeMessageVisibility(ChangeMessageVisibilityRequest.builder()
          .queueUrl(queueUrl())
          .receiptHandle(message.receiptHandle())
          .visibilityTimeout((int) seconds)
          .build());
    } catch (ReceiptHandleIsInvalidException | MessageNotInflightException e) {
      logger.log(Level.FINE, "Message {0} is no longer in flight; visibility unchanged", message.messageId());
    } catch (SdkException e) {
      throw translate("extend visibility of " + message.messageId(), e);
    }
  }

  @Override
  public void moveToDeadLetter(QueueMessage message, String reason) {
    String why = reason == null || reason.isBlank() ? "unspecified" : reason;
    SendMessageRequest request = SendMessageRequest.builder()
        .queueUrl(deadLetterQueueUrl())
        .messageBody(message.body())
        .messageAttributes(Map.of(
            ATTR_ORIGINAL_MESSAGE_ID, stringAttribute(message.messageId()),
            ATTR_RECEIVE_COUNT, MessageAttributeValue.builder()
                .dataType("Number")
                .stringValue(Integer.toString(message.receiveCount()))
                .build(),
            ATTR_REASON, stringAttribute(why)))
        .build();
    try {
      sqsClient.sendMessage(request);
    } catch (SdkException e) {
      throw translate("publish message " + message.messageId() + " to " + deadLetterQueueName, e);
    }
    deleteFrom(queueUrl(), message);
    logger.log(Level.FINE, "Moved message {0} to {1}", new Object[]{message.messageId(), deadLetterQueueName});
  }

  private static MessageAttributeValue stringAttribute(String value) {
    return MessageAttributeValue.builder().dataType("String").stringValue(value).build();
  }

  @Override
  public HealthStatus healthCheck() {
    try {
      sqsClient.getQueueAttributes(GetQueueAttributesRequest.builder()
          .queueUrl(queueUrl())
          .attributeNames(QueueAttributeName.QUEUE_ARN)
          .build());
      return HealthStatus.HEALTHY;
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Queue health check failed", e);
      return HealthStatus.UNHEALTHY;
    }
  }

  @Override
  public long approximateDeadLetterCount() {
    GetQueueAttributesResponse response;
    try {
      response = sqsClient.getQueueAttributes(GetQueueAttributesRequest.builder()
          .queueUrl(deadLetterQueueUrl())
          .attributeNames(QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES)
          .build());
    } catch (SdkException e) {
      throw translate("read attributes of " + deadLetterQueueName, e);
    }
    String value = response.attributes().get(QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES);
    if (value == null) {
      throw new TransientQueueException("No ApproximateNumberOfMessages reported for " + deadLetterQueueName);
    }
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new TransientQueueException("Unparseable ApproximateNumberOfMessages: " + value, e);
    }
  }

  @Override
  public void verify() {
    queueUrl();
    deadLetterQueueUrl();
    logger.log(Level.INFO, "Using queue {0} with dead-letter queue {1}", new Object[]{queueName, deadLetterQueueName});
  }

  private String queueUrl() {
    String url = queueUrl;
    if (url == null) {
      url = resolve(queueName);
      queueUrl = url;
    }
    return url;
  }

  private String deadLetterQueueUrl() {
    String url = deadLetterQueueUrl;
    if (url == null) {
      url = resolve(deadLetterQueueName);
      deadLetterQueueUrl = url;
    }
    return url;
  }

  private String resolve(String name) {
    try {
      return sqsClient.getQueueUrl(GetQueueUrlRequest.builder().queueName(name).build()).queueUrl();
    } catch (QueueDoesNotExistException e) {
      throw new PermanentQueueException("Queue does not exist: " + name, e);
    } catch (SdkException e) {
      throw translate("resolve queue " + name, e);
    }
  }

  /**
   * Maps an SDK failure to the gateway's error taxonomy. Client-side failures, throttling and
   * 5xx responses are transient; any other service error is permanent.
   */
  static QueueGatewayException translate(String operation, SdkException e) {
    String message = "Failed to " + operation + ": " + e.getMessage();
    if (e instanceof QueueDoesNotExistException) {
      return new PermanentQueueException(message, e);
    }
    if (e instanceof AwsServiceException service) {
      if (service.isThrottlingException() || service.statusCode() >= 500) {
        return new TransientQueueException(message, e);
      }
      return new PermanentQueueException(message, e);
    }
    return new TransientQueueException(message, e);
  }

  public static final class Builder {
    private SqsClient sqsClient;
    private String queueName;
    private String deadLetterQueueName;
    private Duration visibilityTimeout;

    private Builder() {
    }

    /**
     * Sets the SQS client used for every call.
     *
     * <p><b>Required.</b>
     *
     * @param sqsClient the client; its lifecycle stays with the caller
     * @return this builder
     */
    public Builder sqsClient(SqsClient sqsClient) {
      this.sqsClient = sqsClient;
      return this;
    }

    /**
     * Sets the name of the source queue.
     *
     * <p><b>Required.</b> The queue must already exist.
     *
     * @param queueName source queue name
     * @return this builder
     */
    public Builder queueName(String queueName) {
      this.queueName = queueName;
      return this;
    }

    /**
     * Sets the name of the dead-letter queue.
     *
     * <p>Optional. Defaults to the source queue name with a {@code -dlq} suffix.
     *
     * @param deadLetterQueueName dead-letter queue name
     * @return this builder
     */
    public Builder deadLetterQueueName(String deadLetterQueueName) {
      this.deadLetterQueueName = deadLetterQueueName;
      return this;
    }

    /**
     * Sets the visibility timeout requested on every receive.
     *
     * <p>Optional. Defaults to 300 seconds. Must be between 0 and 12 hours.
     *
     * @param visibilityTimeout visibility timeout, truncated to whole seconds
     * @return this builder
     */
    public Builder visibilityTimeout(Duration visibilityTimeout) {
      this.visibilityTimeout = visibilityTimeout;
      return this;
    }

    /**
     * @throws NullPointerException     if {@code sqsClient} or {@code queueName} is null
     * @throws IllegalArgumentException if the queue names are blank or equal, or the
     *                                  visibility timeout is out of range
     */
    public SqsQueueGateway build() {
      return new SqsQueueGateway(this);
    }
  }
}
