package workqueue.jdbc.store;

import workqueue.jdbc.JdbcTemplate;
import workqueue.model.ClaimedItem;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * PostgreSQL queue store.
 *
 * <p>Uses {@code FOR UPDATE SKIP LOCKED} with {@code RETURNING} for
 * single-round-trip claim.
 */
public final class PostgresQueueStore extends AbstractJdbcQueueStore {

  public PostgresQueueStore() {
    super();
  }

  public PostgresQueueStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public AbstractJdbcQueueStore withTableName(String tableName) {
    return new PostgresQueueStore(tableName);
  }

  @Override
  public List<ClaimedItem> claim(Connection conn, String category, String ownerId, Instant now, int limit) {
    Objects.requireNonNull(ownerId, "ownerId");
    String sql = "UPDATE " + tableName() +
        " SET state=" + PROCESSING + ", claimed_by=?, claimed_at=?" +
        " WHERE id IN (" +
        "SELECT id FROM " + tableName() +
        " WHERE category=? AND state=" + PENDING +
        " ORDER BY created_at, id LIMIT ?" +
        " FOR UPDATE SKIP LOCKED" +
        ") RETURNING " + CLAIMED_COLUMNS;
    List<ClaimedItem> claimed = new ArrayList<>(JdbcTemplate.updateReturning(conn, sql, CLAIMED_ROW_MAPPER,
        ownerId, timestamp(now), category, limit));
    // RETURNING order is unspecified
    claimed.sort(OLDEST_FIRST);
    return claimed;
  }
}
