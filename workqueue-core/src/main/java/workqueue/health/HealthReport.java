package workqueue.health;

import workqueue.model.QueueStatus;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Point-in-time health snapshot of a queue instance.
 *
 * @param status      overall status
 * @param stores      per-store probe results, in registration order
 * @param queueCounts counts per category, {@code null} when the queue store could not be read
 * @param instanceId  identity of the reporting instance
 * @param hostname    host the instance runs on
 * @param checkedAt   time of the check
 */
public record HealthReport(
    HealthStatus status,
    Map<String, StoreHealth> stores,
    Map<String, QueueStatus> queueCounts,
    String instanceId,
    String hostname,
    Instant checkedAt
) {

  public boolean isHealthy() {
    return status == HealthStatus.HEALTHY;
  }

  public Optional<Map<String, QueueStatus>> queue() {
    return Optional.ofNullable(queueCounts);
  }
}
