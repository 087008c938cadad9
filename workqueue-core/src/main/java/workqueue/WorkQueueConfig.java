package workqueue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Immutable, eagerly validated settings for a {@link WorkQueue}.
 *
 * <p>Out-of-range values raise {@link ConfigurationException} from {@link Builder#build()};
 * nothing is clamped.
 *
 * <table>
 *   <caption>Settings</caption>
 *   <tr><th>Setting</th><th>Range</th><th>Default</th></tr>
 *   <tr><td>{@code batchSize}</td><td>1..1000</td><td>100</td></tr>
 *   <tr><td>{@code cleanupTimeoutHours}</td><td>1..24</td><td>1</td></tr>
 *   <tr><td>{@code maxRetries}</td><td>1..10</td><td>3</td></tr>
 *   <tr><td>{@code healthCheckIntervalSeconds}</td><td>60..3600</td><td>300</td></tr>
 *   <tr><td>{@code enabled}</td><td></td><td>true</td></tr>
 *   <tr><td>{@code requiredBackingStores}</td><td>non-blank names</td><td>[queue]</td></tr>
 * </table>
 */
public final class WorkQueueConfig {
  public static final int MIN_BATCH_SIZE = 1;
  public static final int MAX_BATCH_SIZE = 1000;
  public static final int MIN_CLEANUP_TIMEOUT_HOURS = 1;
  public static final int MAX_CLEANUP_TIMEOUT_HOURS = 24;
  public static final int MIN_MAX_RETRIES = 1;
  public static final int MAX_MAX_RETRIES = 10;
  public static final int MIN_HEALTH_CHECK_INTERVAL_SECONDS = 60;
  public static final int MAX_HEALTH_CHECK_INTERVAL_SECONDS = 3600;

  /** Name of the built-in health check for the queue table's own store. */
  public static final String QUEUE_STORE = "queue";

  private final int batchSize;
  private final int cleanupTimeoutHours;
  private final int maxRetries;
  private final int healthCheckIntervalSeconds;
  private final boolean enabled;
  private final Set<String> requiredBackingStores;

  private WorkQueueConfig(Builder builder) {
    this.batchSize = checkRange("batchSize", builder.batchSize, MIN_BATCH_SIZE, MAX_BATCH_SIZE);
    this.cleanupTimeoutHours = checkRange("cleanupTimeoutHours", builder.cleanupTimeoutHours,
        MIN_CLEANUP_TIMEOUT_HOURS, MAX_CLEANUP_TIMEOUT_HOURS);
    this.maxRetries = checkRange("maxRetries", builder.maxRetries, MIN_MAX_RETRIES, MAX_MAX_RETRIES);
    this.healthCheckIntervalSeconds = checkRange("healthCheckIntervalSeconds",
        builder.healthCheckIntervalSeconds,
        MIN_HEALTH_CHECK_INTERVAL_SECONDS, MAX_HEALTH_CHECK_INTERVAL_SECONDS);
    this.enabled = builder.enabled;
    this.requiredBackingStores = validateStores(builder.requiredBackingStores);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Configuration with every setting at its default. */
  public static WorkQueueConfig defaults() {
    return builder().build();
  }

  /**
   * Reads settings from properties using snake_case keys, optionally prefixed
   * (e.g. {@code workqueue.batch_size}). Missing keys keep their defaults.
   *
   * @param properties source properties
   * @param prefix     key prefix, e.g. {@code "workqueue."}, or empty
   * @throws ConfigurationException if a value is not a valid number or out of range
   */
  public static WorkQueueConfig fromProperties(Properties properties, String prefix) {
    Objects.requireNonNull(properties, "properties");
    Objects.requireNonNull(prefix, "prefix");
    Builder builder = builder();
    String value;
    if ((value = properties.getProperty(prefix + "batch_size")) != null) {
      builder.batchSize(parseInt("batchSize", value));
    }
    if ((value = properties.getProperty(prefix + "cleanup_timeout_hours")) != null) {
      builder.cleanupTimeoutHours(parseInt("cleanupTimeoutHours", value));
    }
    if ((value = properties.getProperty(prefix + "max_retries")) != null) {
      builder.maxRetries(parseInt("maxRetries", value));
    }
    if ((value = properties.getProperty(prefix + "health_check_interval_seconds")) != null) {
      builder.healthCheckIntervalSeconds(parseInt("healthCheckIntervalSeconds", value));
    }
    if ((value = properties.getProperty(prefix + "enabled")) != null) {
      builder.enabled(parseBoolean("enabled", value));
    }
    if ((value = properties.getProperty(prefix + "required_backing_stores")) != null) {
      List<String> stores = new ArrayList<>();
      for (String name : value.split(",")) {
        if (!name.isBlank()) {
          stores.add(name.trim());
        }
      }
      builder.requiredBackingStores(stores);
    }
    return builder.build();
  }

  public int batchSize() {
    return batchSize;
  }

  public int cleanupTimeoutHours() {
    return cleanupTimeoutHours;
  }

  /** Orphan timeout derived from {@link #cleanupTimeoutHours()}. */
  public Duration cleanupTimeout() {
    return Duration.ofHours(cleanupTimeoutHours);
  }

  public int maxRetries() {
    return maxRetries;
  }

  public int healthCheckIntervalSeconds() {
    return healthCheckIntervalSeconds;
  }

  public boolean enabled() {
    return enabled;
  }

  /** Store names whose failure makes the instance unhealthy. Unmodifiable. */
  public Set<String> requiredBackingStores() {
    return requiredBackingStores;
  }

  /** Returns a builder pre-populated with this configuration's values. */
  public Builder toBuilder() {
    return builder()
        .batchSize(batchSize)
        .cleanupTimeoutHours(cleanupTimeoutHours)
        .maxRetries(maxRetries)
        .healthCheckIntervalSeconds(healthCheckIntervalSeconds)
        .enabled(enabled)
        .requiredBackingStores(requiredBackingStores);
  }

  @Override
  public String toString() {
    return "WorkQueueConfig{batchSize=" + batchSize +
        ", cleanupTimeoutHours=" + cleanupTimeoutHours +
        ", maxRetries=" + maxRetries +
        ", healthCheckIntervalSeconds=" + healthCheckIntervalSeconds +
        ", enabled=" + enabled +
        ", requiredBackingStores=" + requiredBackingStores + '}';
  }

  private static int checkRange(String field, int value, int min, int max) {
    if (value < min || value > max) {
      throw new ConfigurationException(field, "must be between " + min + " and " + max + ", got: " + value);
    }
    return value;
  }

  private static Set<String> validateStores(Collection<String> stores) {
    if (stores == null) {
      throw new ConfigurationException("requiredBackingStores", "must not be null");
    }
    Set<String> result = new LinkedHashSet<>();
    for (String store : stores) {
      if (store == null || store.isBlank()) {
        throw new ConfigurationException("requiredBackingStores", "store names must not be blank");
      }
      result.add(store);
    }
    return Collections.unmodifiableSet(result);
  }

  private static int parseInt(String field, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException(field, "not an integer: " + value);
    }
  }

  private static boolean parseBoolean(String field, String value) {
    String v = value.trim();
    if (v.equalsIgnoreCase("true")) {
      return true;
    }
    if (v.equalsIgnoreCase("false")) {
      return false;
    }
    throw new ConfigurationException(field, "not a boolean: " + value);
  }

  /** Builder for {@link WorkQueueConfig}. */
  public static final class Builder {
    private int batchSize = 100;
    private int cleanupTimeoutHours = 1;
    private int maxRetries = 3;
    private int healthCheckIntervalSeconds = 300;
    private boolean enabled = true;
    private Collection<String> requiredBackingStores = List.of(QUEUE_STORE);

    private Builder() {}

    /**
     * Sets the default number of rows taken per claim.
     *
     * <p>Optional. Defaults to {@code 100}. Must be within 1..1000.
     *
     * @param batchSize rows per claim
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets how long a row may stay {@code processing} before it counts as orphaned.
     *
     * <p>Optional. Defaults to {@code 1}. Must be within 1..24.
     *
     * @param cleanupTimeoutHours orphan timeout in hours
     * @return this builder
     */
    public Builder cleanupTimeoutHours(int cleanupTimeoutHours) {
      this.cleanupTimeoutHours = cleanupTimeoutHours;
      return this;
    }

    /**
     * Sets the number of failed attempts after which a row is terminally failed.
     *
     * <p>Optional. Defaults to {@code 3}. Must be within 1..10.
     *
     * @param maxRetries retry budget
     * @return this builder
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Sets the interval of the background health monitor.
     *
     * <p>Optional. Defaults to {@code 300}. Must be within 60..3600.
     *
     * @param healthCheckIntervalSeconds interval in seconds
     * @return this builder
     */
    public Builder healthCheckIntervalSeconds(int healthCheckIntervalSeconds) {
      this.healthCheckIntervalSeconds = healthCheckIntervalSeconds;
      return this;
    }

    /**
     * Enables or disables claiming. A disabled queue still accepts work and reports status.
     *
     * <p>Optional. Defaults to {@code true}.
     *
     * @param enabled whether claims hand out rows
     * @return this builder
     */
    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    /**
     * Sets the backing stores whose failure makes the instance unhealthy.
     * Each name needs a registered {@link workqueue.spi.BackingStoreCheck}.
     *
     * <p>Optional. Defaults to {@code [queue]}.
     *
     * @param requiredBackingStores store names
     * @return this builder
     */
    public Builder requiredBackingStores(Collection<String> requiredBackingStores) {
      this.requiredBackingStores = requiredBackingStores == null ? null : new ArrayList<>(requiredBackingStores);
      return this;
    }

    /**
     * @return a validated configuration
     * @throws ConfigurationException if any setting is out of range
     */
    public WorkQueueConfig build() {
      return new WorkQueueConfig(this);
    }
  }
}
