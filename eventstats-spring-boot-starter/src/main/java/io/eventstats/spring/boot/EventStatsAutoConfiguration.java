package io.eventstats.spring.boot;

import io.eventstats.backoff.ExponentialBackoffPolicy;
import io.eventstats.dead.DeadLetterInspector;
import io.eventstats.jdbc.store.AbstractJdbcAggregateStore;
import io.eventstats.jdbc.store.JdbcAggregateStores;
import io.eventstats.processor.ProcessorLoop;
import io.eventstats.spi.AggregateStore;
import io.eventstats.spi.MetricsExporter;
import io.eventstats.spi.QueueGateway;
import io.eventstats.sqs.SqsQueueGateway;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.SqsClientBuilder;

import javax.sql.DataSource;
import java.net.URI;

/**
 * Auto-configuration for the event stats processor.
 *
 * <p>Wires an {@link AggregateStore} for the detected database, an SQS-backed
 * {@link QueueGateway} and a {@link ProcessorLoop} from {@link EventStatsProperties}.
 * Every bean backs off when the application defines its own.
 *
 * @see EventStatsProperties
 * @see EventStatsMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(ProcessorLoop.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(EventStatsProperties.class)
public class EventStatsAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(AggregateStore.class)
  public AbstractJdbcAggregateStore aggregateStore(DataSource dataSource, EventStatsProperties props) {
    return JdbcAggregateStores.detect(dataSource, props.getStore().getTableName());
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public ProcessorLoop processorLoop(EventStatsProperties props,
      QueueGateway queueGateway,
      AggregateStore aggregateStore,
      ObjectProvider<MetricsExporter> metricsProvider) {
    EventStatsProperties.Queue queue = props.getQueue();
    EventStatsProperties.Processor processor = props.getProcessor();
    var builder = ProcessorLoop.builder()
        .queueGateway(queueGateway)
        .aggregateStore(aggregateStore)
        .batchSize(queue.getBatchSize())
        .waitTime(queue.getWaitTime())
        .maxReceiveCount(queue.getMaxReceiveCount())
        .visibilityTimeout(queue.getVisibilityTimeout())
        .connectBackoff(new ExponentialBackoffPolicy(
            processor.getConnectBaseDelay(), processor.getConnectMaxDelay()))
        .maxConnectAttempts(processor.getMaxConnectAttempts())
        .retryBackoff(new ExponentialBackoffPolicy(
            processor.getRetryBaseDelay(), processor.getRetryMaxDelay()))
        .idleBackoff(new ExponentialBackoffPolicy(
            processor.getIdleSleepInterval(), processor.getMaxIdleSleep()))
        .drainTimeout(processor.getDrainTimeout());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "eventstats.processor", name = "enabled", matchIfMissing = true)
  public ProcessorLifecycle processorLifecycle(ProcessorLoop processorLoop, EventStatsProperties props) {
    return new ProcessorLifecycle(processorLoop, props.getProcessor().getStartupTimeout());
  }

  @Bean
  @ConditionalOnMissingBean
  public DeadLetterInspector deadLetterInspector(QueueGateway queueGateway) {
    return new DeadLetterInspector(queueGateway);
  }

  /**
   * SQS client and gateway, skipped entirely when the application provides a {@link QueueGateway}.
   */
  @Configuration(proxyBeanMethods = false)
  @ConditionalOnMissingBean(QueueGateway.class)
  static class SqsConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public SqsClient sqsClient(EventStatsProperties props) {
      EventStatsProperties.Queue queue = props.getQueue();
      SqsClientBuilder builder = SqsClient.builder().region(Region.of(queue.getRegion()));
      if (hasText(queue.getEndpoint())) {
        builder.endpointOverride(URI.create(queue.getEndpoint()));
      }
      if (hasText(queue.getAccessKeyId()) && hasText(queue.getSecretAccessKey())) {
        builder.credentialsProvider(StaticCredentialsProvider.create(
            AwsBasicCredentials.create(queue.getAccessKeyId(), queue.getSecretAccessKey())));
      }
      return builder.build();
    }

    @Bean
    public SqsQueueGateway sqsQueueGateway(SqsClient sqsClient, EventStatsProperties props) {
      EventStatsProperties.Queue queue = props.getQueue();
      var builder = SqsQueueGateway.builder()
          .sqsClient(sqsClient)
          .queueName(queue.getName())
          .visibilityTimeout(queue.getVisibilityTimeout());
      if (hasText(queue.getDeadLetterName())) {
        builder.deadLetterQueueName(queue.getDeadLetterName());
      }
      return builder.build();
    }

    private static boolean hasText(String value) {
      return value != null && !value.isBlank();
    }
  }
}
