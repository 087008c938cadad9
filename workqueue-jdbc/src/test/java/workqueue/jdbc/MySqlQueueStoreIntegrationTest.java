package workqueue.jdbc;

import org.junit.jupiter.api.BeforeAll;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import workqueue.jdbc.store.AbstractJdbcQueueStore;
import workqueue.jdbc.store.MySqlQueueStore;

import javax.sql.DataSource;

@DockerAvailable
@Testcontainers
class MySqlQueueStoreIntegrationTest extends AbstractQueueStoreIntegrationTest {

  @Container
  static final MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
      .withDatabaseName("workqueue_test");

  private static final MySqlQueueStore STORE = new MySqlQueueStore();
  private static SimpleDataSource dataSource;

  @BeforeAll
  static void initSchema() throws Exception {
    dataSource = new SimpleDataSource(mysql.getJdbcUrl(), mysql.getUsername(), mysql.getPassword());
    Schemas.create(dataSource, "/schema/mysql.sql");
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  AbstractJdbcQueueStore store() {
    return STORE;
  }
}
