package workqueue.health;

/**
 * Overall health of a queue instance.
 */
public enum HealthStatus {
  /** Every store is reachable and responsive. */
  HEALTHY,
  /** An optional store is failing or a store is slow; work can continue. */
  DEGRADED,
  /** A required store is failing; workers should not claim. */
  UNHEALTHY
}
