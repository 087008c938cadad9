package workqueue.jdbc.store;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;
import workqueue.jdbc.SimpleDataSource;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcQueueStoresTest {

  @Test
  void allReturnsBuiltInQueueStores() {
    List<AbstractJdbcQueueStore> stores = JdbcQueueStores.all();

    assertTrue(stores.size() >= 3);
    assertTrue(stores.stream().anyMatch(s -> s.name().equals("mysql")));
    assertTrue(stores.stream().anyMatch(s -> s.name().equals("postgresql")));
    assertTrue(stores.stream().anyMatch(s -> s.name().equals("h2")));
  }

  @Test
  void getByNameIsCaseInsensitive() {
    assertEquals("mysql", JdbcQueueStores.get("MySQL").name());
    assertEquals("postgresql", JdbcQueueStores.get("POSTGRESQL").name());
    assertEquals("h2", JdbcQueueStores.get("h2").name());
  }

  @Test
  void getByNameThrowsForUnknown() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> JdbcQueueStores.get("oracle"));
    assertTrue(ex.getMessage().contains("Unknown queue store"));
    assertTrue(ex.getMessage().contains("oracle"));
  }

  @Test
  void detectFromJdbcUrl() {
    assertInstanceOf(MySqlQueueStore.class, JdbcQueueStores.detect("jdbc:mysql://localhost:3306/app"));
    assertInstanceOf(MySqlQueueStore.class, JdbcQueueStores.detect("jdbc:tidb://localhost:4000/app"));
    assertInstanceOf(PostgresQueueStore.class, JdbcQueueStores.detect("jdbc:postgresql://localhost:5432/app"));
    assertInstanceOf(H2QueueStore.class, JdbcQueueStores.detect("JDBC:H2:mem:test"));
  }

  @Test
  void detectFromJdbcUrlThrowsForUnknown() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> JdbcQueueStores.detect("jdbc:oracle:thin:@localhost:1521:xe"));
    assertTrue(ex.getMessage().contains("No queue store found"));
    assertTrue(ex.getMessage().contains("jdbc:postgresql:"));
  }

  @Test
  void detectRejectsEmptyUrl() {
    assertThrows(IllegalArgumentException.class, () -> JdbcQueueStores.detect((String) null));
    assertThrows(IllegalArgumentException.class, () -> JdbcQueueStores.detect(""));
  }

  @Test
  void detectWithTableNameBindsTable() {
    AbstractJdbcQueueStore store = JdbcQueueStores.detect("jdbc:postgresql://localhost/app", "jobs");

    assertInstanceOf(PostgresQueueStore.class, store);
    assertEquals("jobs", store.tableName());
    assertEquals("work_queue", JdbcQueueStores.get("postgresql").tableName());
  }

  @Test
  void detectWithInvalidTableNameThrows() {
    assertThrows(IllegalArgumentException.class,
        () -> JdbcQueueStores.detect("jdbc:h2:mem:x", "bad-name"));
  }

  @Test
  void detectFromDataSource() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:detect_test;DB_CLOSE_DELAY=-1");

    assertEquals("h2", JdbcQueueStores.detect(ds).name());
    assertEquals("custom_queue", JdbcQueueStores.detect(ds, "custom_queue").tableName());
  }

  @Test
  void detectFromUnreachableDataSourceThrowsIllegalState() {
    DataSource broken = new SimpleDataSource("jdbc:unknown:nowhere", "sa", "");

    IllegalStateException ex = assertThrows(IllegalStateException.class,
        () -> JdbcQueueStores.detect(broken));
    assertInstanceOf(SQLException.class, ex.getCause());
  }
}
