package workqueue.benchmark;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.h2.jdbcx.JdbcDataSource;
import workqueue.jdbc.store.AbstractJdbcQueueStore;
import workqueue.jdbc.store.H2QueueStore;
import workqueue.jdbc.store.MySqlQueueStore;
import workqueue.jdbc.store.PostgresQueueStore;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates a {@link DatabaseSetup} for the requested database type.
 *
 * <p>Supported types: {@code "h2"} (in-memory), {@code "mysql"}, and {@code "postgresql"} (external servers).
 * External database connection details are read from system properties:
 * <ul>
 *   <li>{@code bench.mysql.url} - default {@code jdbc:mysql://localhost:3306/workqueue_bench}</li>
 *   <li>{@code bench.mysql.user} - default {@code root}</li>
 *   <li>{@code bench.mysql.password} - default {@code ""} (empty)</li>
 *   <li>{@code bench.pg.url} - default {@code jdbc:postgresql://localhost:5432/workqueue_bench}</li>
 *   <li>{@code bench.pg.user} - default {@code postgres}</li>
 *   <li>{@code bench.pg.password} - default {@code postgres}</li>
 * </ul>
 * The schema is created from the DDL shipped in {@code workqueue-jdbc}.
 */
final class BenchmarkDataSourceFactory {

  record DatabaseSetup(DataSource dataSource, AbstractJdbcQueueStore store) {}

  static DatabaseSetup create(String database, String dbName) {
    return switch (database) {
      case "h2" -> createH2(dbName);
      case "mysql" -> createPooled(
          System.getProperty("bench.mysql.url", "jdbc:mysql://localhost:3306/workqueue_bench"),
          System.getProperty("bench.mysql.user", "root"),
          System.getProperty("bench.mysql.password", ""),
          "/schema/mysql.sql", new MySqlQueueStore());
      case "postgresql" -> createPooled(
          System.getProperty("bench.pg.url", "jdbc:postgresql://localhost:5432/workqueue_bench"),
          System.getProperty("bench.pg.user", "postgres"),
          System.getProperty("bench.pg.password", "postgres"),
          "/schema/postgresql.sql", new PostgresQueueStore());
      default -> throw new IllegalArgumentException("Unsupported database: " + database);
    };
  }

  private static DatabaseSetup createH2(String dbName) {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + dbName + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
    initSchema(ds, "/schema/h2.sql");
    return new DatabaseSetup(ds, new H2QueueStore());
  }

  private static DatabaseSetup createPooled(String url, String user, String password,
                                            String schema, AbstractJdbcQueueStore store) {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(url);
    config.setUsername(user);
    config.setPassword(password);
    config.setPoolName("bench-" + store.name());
    config.setMaximumPoolSize(10);
    config.setMinimumIdle(2);
    HikariDataSource ds = new HikariDataSource(config);
    initSchema(ds, schema);
    return new DatabaseSetup(ds, store);
  }

  private static void initSchema(DataSource ds, String resource) {
    try (Connection conn = ds.getConnection(); Statement stmt = conn.createStatement()) {
      for (String sql : load(resource).split(";")) {
        if (!sql.isBlank()) {
          stmt.execute(sql.trim());
        }
      }
    } catch (SQLException | IOException e) {
      throw new IllegalStateException("Failed to initialize benchmark schema", e);
    }
  }

  private static String load(String resource) throws IOException {
    try (InputStream is = BenchmarkDataSourceFactory.class.getResourceAsStream(resource)) {
      if (is == null) throw new IOException("Resource not found: " + resource);
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  static void truncate(DataSource ds) {
    try (Connection conn = ds.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute("DELETE FROM work_queue");
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to clear benchmark table", e);
    }
  }

  private BenchmarkDataSourceFactory() {}
}
