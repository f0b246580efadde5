package io.eventstats.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventStatsPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(EventStatsProperties.class);
            assertEquals("hands-on-interview", props.getQueue().getName());
            assertNull(props.getQueue().getDeadLetterName());
            assertEquals(Duration.ofSeconds(300), props.getQueue().getVisibilityTimeout());
            assertEquals(3, props.getQueue().getMaxReceiveCount());
            assertEquals(10, props.getQueue().getBatchSize());
            assertEquals(Duration.ofSeconds(20), props.getQueue().getWaitTime());
            assertNull(props.getQueue().getEndpoint());
            assertEquals("us-east-1", props.getQueue().getRegion());
            assertTrue(props.getProcessor().isEnabled());
            assertEquals(Duration.ofSeconds(1), props.getProcessor().getIdleSleepInterval());
            assertEquals(Duration.ofSeconds(20), props.getProcessor().getMaxIdleSleep());
            assertEquals(Duration.ofMillis(100), props.getProcessor().getConnectBaseDelay());
            assertEquals(Duration.ofSeconds(5), props.getProcessor().getConnectMaxDelay());
            assertEquals(30, props.getProcessor().getMaxConnectAttempts());
            assertEquals(Duration.ofMillis(100), props.getProcessor().getRetryBaseDelay());
            assertEquals(Duration.ofSeconds(5), props.getProcessor().getRetryMaxDelay());
            assertEquals(Duration.ofSeconds(30), props.getProcessor().getDrainTimeout());
            assertEquals(Duration.ofMinutes(5), props.getProcessor().getStartupTimeout());
            assertEquals("event_stats", props.getStore().getTableName());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("eventstats", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void bareNumbersAreSeconds() {
        runner.withPropertyValues(
                "eventstats.queue.visibility-timeout=60",
                "eventstats.queue.wait-time=5",
                "eventstats.processor.idle-sleep-interval=2",
                "eventstats.processor.connect-base-delay=250"
        ).run(ctx -> {
            var props = ctx.getBean(EventStatsProperties.class);
            assertEquals(Duration.ofSeconds(60), props.getQueue().getVisibilityTimeout());
            assertEquals(Duration.ofSeconds(5), props.getQueue().getWaitTime());
            assertEquals(Duration.ofSeconds(2), props.getProcessor().getIdleSleepInterval());
            assertEquals(Duration.ofMillis(250), props.getProcessor().getConnectBaseDelay());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "eventstats.queue.name=events",
                "eventstats.queue.dead-letter-name=events-parking",
                "eventstats.queue.max-receive-count=5",
                "eventstats.queue.batch-size=4",
                "eventstats.queue.endpoint=http://localstack:4566",
                "eventstats.queue.region=eu-west-1",
                "eventstats.queue.access-key-id=key",
                "eventstats.queue.secret-access-key=secret",
                "eventstats.processor.enabled=false",
                "eventstats.processor.max-connect-attempts=3",
                "eventstats.processor.startup-timeout=30s",
                "eventstats.store.table-name=stats",
                "eventstats.metrics.enabled=false",
                "eventstats.metrics.name-prefix=custom"
        ).run(ctx -> {
            var props = ctx.getBean(EventStatsProperties.class);
            assertEquals("events", props.getQueue().getName());
            assertEquals("events-parking", props.getQueue().getDeadLetterName());
            assertEquals(5, props.getQueue().getMaxReceiveCount());
            assertEquals(4, props.getQueue().getBatchSize());
            assertEquals("http://localstack:4566", props.getQueue().getEndpoint());
            assertEquals("eu-west-1", props.getQueue().getRegion());
            assertEquals("key", props.getQueue().getAccessKeyId());
            assertEquals("secret", props.getQueue().getSecretAccessKey());
            assertFalse(props.getProcessor().isEnabled());
            assertEquals(3, props.getProcessor().getMaxConnectAttempts());
            assertEquals(Duration.ofSeconds(30), props.getProcessor().getStartupTimeout());
            assertEquals("stats", props.getStore().getTableName());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("custom", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(EventStatsProperties.class)
    static class PropsConfig {
    }
}
