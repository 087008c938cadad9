package workqueue.jdbc;

import org.junit.jupiter.api.BeforeAll;
import workqueue.jdbc.store.AbstractJdbcQueueStore;
import workqueue.jdbc.store.H2QueueStore;

import javax.sql.DataSource;

class H2QueueStoreIntegrationTest extends AbstractQueueStoreIntegrationTest {

  private static final H2QueueStore STORE = new H2QueueStore();
  private static DataSource dataSource;

  @BeforeAll
  static void initSchema() throws Exception {
    dataSource = Schemas.h2();
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  AbstractJdbcQueueStore store() {
    return STORE;
  }

  @Override
  boolean skipsLockedRows() {
    return false;
  }
}
