package workqueue.health;

import workqueue.spi.BackingStoreCheck;
import workqueue.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Probes a JDBC store by opening a connection and calling {@link Connection#isValid(int)}.
 */
public final class ConnectionHealthCheck implements BackingStoreCheck {
  private static final Logger logger = Logger.getLogger(ConnectionHealthCheck.class.getName());
  private static final int VALIDATION_TIMEOUT_SECONDS = 5;

  private final String name;
  private final ConnectionProvider connectionProvider;

  public ConnectionHealthCheck(String name, ConnectionProvider connectionProvider) {
    this.name = Objects.requireNonNull(name, "name");
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public StoreHealth check() {
    long start = System.nanoTime();
    try (Connection conn = connectionProvider.getConnection()) {
      boolean valid = conn.isValid(VALIDATION_TIMEOUT_SECONDS);
      long elapsed = elapsedMs(start);
      return valid
          ? StoreHealth.up(name, elapsed)
          : StoreHealth.down(name, elapsed, "Connection validation failed");
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.FINE, "Health probe failed for store " + name, e);
      String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      return StoreHealth.down(name, elapsedMs(start), message);
    }
  }

  private static long elapsedMs(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }
}
