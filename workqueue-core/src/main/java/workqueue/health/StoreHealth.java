package workqueue.health;

/**
 * Outcome of probing one backing store.
 *
 * @param name           store name
 * @param connected      whether the probe succeeded
 * @param responseTimeMs probe duration in milliseconds
 * @param error          failure description, {@code null} when connected
 */
public record StoreHealth(String name, boolean connected, long responseTimeMs, String error) {

  public static StoreHealth up(String name, long responseTimeMs) {
    return new StoreHealth(name, true, responseTimeMs, null);
  }

  public static StoreHealth down(String name, long responseTimeMs, String error) {
    return new StoreHealth(name, false, responseTimeMs, error);
  }

  public boolean isSlow(long thresholdMs) {
    return responseTimeMs > thresholdMs;
  }
}
