package workqueue.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;
import workqueue.WorkQueueConfig;
import workqueue.jdbc.TableNames;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the work queue.
 *
 * @see WorkQueueAutoConfiguration
 */
@ConfigurationProperties(prefix = "workqueue")
public class WorkQueueProperties {

  /**
   * Database table name for queue rows.
   */
  private String tableName = TableNames.DEFAULT_TABLE;

  /**
   * Default number of rows taken per claim (1-1000).
   */
  private int batchSize = 100;

  /**
   * Hours a row may stay processing before it is treated as orphaned (1-24).
   */
  private int cleanupTimeoutHours = 1;

  /**
   * Failed attempts allowed before a row is marked failed (1-10).
   */
  private int maxRetries = 3;

  /**
   * Seconds between periodic health checks (60-3600).
   */
  private int healthCheckIntervalSeconds = 300;

  /**
   * When false the queue accepts work but claims nothing.
   */
  private boolean enabled = true;

  /**
   * Backing stores whose failure makes the instance unhealthy.
   */
  private List<String> requiredBackingStores = new ArrayList<>(List.of(WorkQueueConfig.QUEUE_STORE));

  /**
   * Fixed instance identity; generated from the host name when empty.
   */
  private String instanceId;

  private final Reclaim reclaim = new Reclaim();
  private final Health health = new Health();
  private final Metrics metrics = new Metrics();

  public String getTableName() {
    return tableName;
  }

  public void setTableName(String tableName) {
    this.tableName = tableName;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }

  public int getCleanupTimeoutHours() {
    return cleanupTimeoutHours;
  }

  public void setCleanupTimeoutHours(int cleanupTimeoutHours) {
    this.cleanupTimeoutHours = cleanupTimeoutHours;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public void setMaxRetries(int maxRetries) {
    this.maxRetries = maxRetries;
  }

  public int getHealthCheckIntervalSeconds() {
    return healthCheckIntervalSeconds;
  }

  public void setHealthCheckIntervalSeconds(int healthCheckIntervalSeconds) {
    this.healthCheckIntervalSeconds = healthCheckIntervalSeconds;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public List<String> getRequiredBackingStores() {
    return requiredBackingStores;
  }

  public void setRequiredBackingStores(List<String> requiredBackingStores) {
    this.requiredBackingStores = requiredBackingStores;
  }

  public String getInstanceId() {
    return instanceId;
  }

  public void setInstanceId(String instanceId) {
    this.instanceId = instanceId;
  }

  public Reclaim getReclaim() {
    return reclaim;
  }

  public Health getHealth() {
    return health;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  /** Builds the validated core configuration. */
  public WorkQueueConfig toConfig() {
    return WorkQueueConfig.builder()
        .batchSize(batchSize)
        .cleanupTimeoutHours(cleanupTimeoutHours)
        .maxRetries(maxRetries)
        .healthCheckIntervalSeconds(healthCheckIntervalSeconds)
        .enabled(enabled)
        .requiredBackingStores(requiredBackingStores)
        .build();
  }

  public static class Reclaim {
    /**
     * Whether orphaned rows are reclaimed on a schedule.
     */
    private boolean enabled = true;

    /**
     * Seconds between reclaim runs.
     */
    private long intervalSeconds = 300;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public long getIntervalSeconds() {
      return intervalSeconds;
    }

    public void setIntervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
    }
  }

  public static class Health {
    /**
     * Whether health checks run periodically in the background.
     */
    private boolean monitorEnabled = false;

    public boolean isMonitorEnabled() {
      return monitorEnabled;
    }

    public void setMonitorEnabled(boolean monitorEnabled) {
      this.monitorEnabled = monitorEnabled;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "workqueue";

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
