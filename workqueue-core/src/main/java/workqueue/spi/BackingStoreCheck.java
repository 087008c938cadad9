package workqueue.spi;

import workqueue.health.StoreHealth;

/**
 * Health probe for one backing store the queue depends on.
 *
 * <p>The store name is matched against {@code required_backing_stores}; a failing
 * required store makes the whole instance unhealthy.
 *
 * @see workqueue.health.ConnectionHealthCheck
 */
public interface BackingStoreCheck {

  /** Unique store name, e.g. {@code "queue"}. */
  String name();

  /**
   * Probes the store. Implementations report failures in the returned
   * {@link StoreHealth} rather than throwing.
   */
  StoreHealth check();
}
