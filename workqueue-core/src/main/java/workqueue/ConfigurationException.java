package workqueue;

/**
 * Thrown when a configuration value is outside its allowed range or a required
 * collaborator is missing. Values are never clamped silently.
 */
public final class ConfigurationException extends WorkQueueException {
  private final String field;

  public ConfigurationException(String field, String message) {
    super(field + ": " + message);
    this.field = field;
  }

  /** Name of the offending setting. */
  public String field() {
    return field;
  }
}
