package io.eventstats.model;

/**
 * Result of a connectivity probe against the queue or the aggregate store.
 */
public enum HealthStatus {
  HEALTHY,
  UNHEALTHY;

  public boolean isHealthy() {
    return this == HEALTHY;
  }
}
