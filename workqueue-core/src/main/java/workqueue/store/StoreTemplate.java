package workqueue.store;

import workqueue.QueueUnavailableException;
import workqueue.WorkQueueException;
import workqueue.spi.ConnectionProvider;
import workqueue.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs store work on a connection from a {@link ConnectionProvider} and translates
 * every failure into {@link QueueUnavailableException}.
 *
 * <p>This is the only place where {@link SQLException} and store runtime exceptions
 * are converted. {@link WorkQueueException}s raised by the work itself pass through
 * unchanged (after rollback).
 */
public final class StoreTemplate {
  private static final Logger logger = Logger.getLogger(StoreTemplate.class.getName());

  /** Unit of work executed against an open connection. */
  @FunctionalInterface
  public interface SqlWork<T> {
    T execute(Connection conn) throws SQLException;
  }

  private final ConnectionProvider connectionProvider;
  private final MetricsExporter metrics;

  public StoreTemplate(ConnectionProvider connectionProvider, MetricsExporter metrics) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Executes {@code work} in a single transaction, committing on success and rolling
   * back on any failure. The connection's auto-commit mode is restored afterwards.
   *
   * @param operation operation name used in error messages
   * @throws QueueUnavailableException if the connection or any statement fails
   */
  public <T> T inTransaction(String operation, SqlWork<T> work) {
    try (Connection conn = connectionProvider.getConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        T result = work.execute(conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException | Error e) {
        rollback(conn, e);
        throw e;
      } finally {
        restoreAutoCommit(conn, autoCommit);
      }
    } catch (WorkQueueException e) {
      throw e;
    } catch (SQLException | RuntimeException e) {
      throw translate(operation, e);
    }
  }

  /**
   * Executes {@code work} on a connection in auto-commit mode, for single-statement
   * writes and reads.
   *
   * @param operation operation name used in error messages
   * @throws QueueUnavailableException if the connection or any statement fails
   */
  public <T> T withConnection(String operation, SqlWork<T> work) {
    try (Connection conn = connectionProvider.getConnection()) {
      if (!conn.getAutoCommit()) {
        conn.setAutoCommit(true);
      }
      return work.execute(conn);
    } catch (WorkQueueException e) {
      throw e;
    } catch (SQLException | RuntimeException e) {
      throw translate(operation, e);
    }
  }

  private QueueUnavailableException translate(String operation, Exception e) {
    metrics.incrementStoreErrors();
    logger.log(Level.FINE, "Store operation failed: " + operation, e);
    String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    return new QueueUnavailableException(operation, "Queue store unavailable during " + operation + ": " + detail, e);
  }

  private static void rollback(Connection conn, Throwable failure) {
    try {
      conn.rollback();
    } catch (SQLException rollbackFailure) {
      failure.addSuppressed(rollbackFailure);
    }
  }

  private static void restoreAutoCommit(Connection conn, boolean autoCommit) {
    try {
      conn.setAutoCommit(autoCommit);
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Failed to restore auto-commit mode", e);
    }
  }
}
