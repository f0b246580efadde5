package io.eventstats.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Configuration properties for the event stats processor.
 *
 * <p>Durations without a unit suffix are read as seconds, except the connect and retry delays
 * which are read as milliseconds.
 *
 * @see EventStatsAutoConfiguration
 */
@ConfigurationProperties(prefix = "eventstats")
public class EventStatsProperties {

    private final Queue queue = new Queue();
    private final Processor processor = new Processor();
    private final Store store = new Store();
    private final Metrics metrics = new Metrics();

    public Queue getQueue() {
        return queue;
    }

    public Processor getProcessor() {
        return processor;
    }

    public Store getStore() {
        return store;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Queue {
        /**
         * Source queue name. Must already exist.
         */
        private String name = "hands-on-interview";

        /**
         * Dead-letter queue name. Defaults to the source queue name with a "-dlq" suffix.
         */
        private String deadLetterName;

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration visibilityTimeout = Duration.ofSeconds(300);

        private int maxReceiveCount = 3;

        private int batchSize = 10;

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration waitTime = Duration.ofSeconds(20);

        /**
         * Endpoint override, e.g. http://localhost:4566 for LocalStack.
         */
        private String endpoint;

        private String region = "us-east-1";

        /**
         * Static credentials. When unset, the AWS SDK default credentials chain is used.
         */
        private String accessKeyId;

        private String secretAccessKey;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDeadLetterName() {
            return deadLetterName;
        }

        public void setDeadLetterName(String deadLetterName) {
            this.deadLetterName = deadLetterName;
        }

        public Duration getVisibilityTimeout() {
            return visibilityTimeout;
        }

        public void setVisibilityTimeout(Duration visibilityTimeout) {
            this.visibilityTimeout = visibilityTimeout;
        }

        public int getMaxReceiveCount() {
            return maxReceiveCount;
        }

        public void setMaxReceiveCount(int maxReceiveCount) {
            this.maxReceiveCount = maxReceiveCount;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getWaitTime() {
            return waitTime;
        }

        public void setWaitTime(Duration waitTime) {
            this.waitTime = waitTime;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getAccessKeyId() {
            return accessKeyId;
        }

        public void setAccessKeyId(String accessKeyId) {
            this.accessKeyId = accessKeyId;
        }

        public String getSecretAccessKey() {
            return secretAccessKey;
        }

        public void setSecretAccessKey(String secretAccessKey) {
            this.secretAccessKey = secretAccessKey;
        }
    }

    public static class Processor {
        /**
         * Whether to run the processor loop. Disable for API-only instances.
         */
        private boolean enabled = true;

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration idleSleepInterval = Duration.ofSeconds(1);

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration maxIdleSleep = Duration.ofSeconds(20);

        @DurationUnit(ChronoUnit.MILLIS)
        private Duration connectBaseDelay = Duration.ofMillis(100);

        @DurationUnit(ChronoUnit.MILLIS)
        private Duration connectMaxDelay = Duration.ofSeconds(5);

        private int maxConnectAttempts = 30;

        /**
         * Backoff after a failed receive.
         */
        @DurationUnit(ChronoUnit.MILLIS)
        private Duration retryBaseDelay = Duration.ofMillis(100);

        @DurationUnit(ChronoUnit.MILLIS)
        private Duration retryMaxDelay = Duration.ofSeconds(5);

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration drainTimeout = Duration.ofSeconds(30);

        /**
         * How long application startup waits for the processor to connect.
         */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration startupTimeout = Duration.ofMinutes(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getIdleSleepInterval() {
            return idleSleepInterval;
        }

        public void setIdleSleepInterval(Duration idleSleepInterval) {
            this.idleSleepInterval = idleSleepInterval;
        }

        public Duration getMaxIdleSleep() {
            return maxIdleSleep;
        }

        public void setMaxIdleSleep(Duration maxIdleSleep) {
            this.maxIdleSleep = maxIdleSleep;
        }

        public Duration getConnectBaseDelay() {
            return connectBaseDelay;
        }

        public void setConnectBaseDelay(Duration connectBaseDelay) {
            this.connectBaseDelay = connectBaseDelay;
        }

        public Duration getConnectMaxDelay() {
            return connectMaxDelay;
        }

        public void setConnectMaxDelay(Duration connectMaxDelay) {
            this.connectMaxDelay = connectMaxDelay;
        }

        public int getMaxConnectAttempts() {
            return maxConnectAttempts;
        }

        public void setMaxConnectAttempts(int maxConnectAttempts) {
            this.maxConnectAttempts = maxConnectAttempts;
        }

        public Duration getRetryBaseDelay() {
            return retryBaseDelay;
        }

        public void setRetryBaseDelay(Duration retryBaseDelay) {
            this.retryBaseDelay = retryBaseDelay;
        }

        public Duration getRetryMaxDelay() {
            return retryMaxDelay;
        }

        public void setRetryMaxDelay(Duration retryMaxDelay) {
            this.retryMaxDelay = retryMaxDelay;
        }

        public Duration getDrainTimeout() {
            return drainTimeout;
        }

        public void setDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
        }

        public Duration getStartupTimeout() {
            return startupTimeout;
        }

        public void setStartupTimeout(Duration startupTimeout) {
            this.startupTimeout = startupTimeout;
        }
    }

    public static class Store {
        /**
         * Database table holding the aggregates.
         */
        private String tableName = "event_stats";

        public String getTableName() {
            return tableName;
        }

        public void setTableName(String tableName) {
            this.tableName = tableName;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "eventstats";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
