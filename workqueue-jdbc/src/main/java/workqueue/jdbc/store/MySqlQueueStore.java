package workqueue.jdbc.store;

import workqueue.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * MySQL queue store. Also compatible with TiDB.
 *
 * <p>Claims in three steps inside the caller's transaction: lock candidates with
 * {@code SELECT ... FOR UPDATE SKIP LOCKED}, mark them processing, then read them back.
 * Requires MySQL 8.0+.
 */
public final class MySqlQueueStore extends AbstractJdbcQueueStore {

  public MySqlQueueStore() {
    super();
  }

  public MySqlQueueStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public AbstractJdbcQueueStore withTableName(String tableName) {
    return new MySqlQueueStore(tableName);
  }

  @Override
  protected String candidateLockClause() {
    return " FOR UPDATE SKIP LOCKED";
  }

  @Override
  protected List<Long> takeOwnership(Connection conn, List<Long> candidates, String ownerId, Instant now) {
    // candidates are row-locked by this transaction
    String sql = "UPDATE " + tableName() +
        " SET state=" + PROCESSING + ", claimed_by=?, claimed_at=?" +
        " WHERE id IN (" + placeholders(candidates.size()) + ")";
    List<Object> params = new ArrayList<>(candidates.size() + 2);
    params.add(ownerId);
    params.add(timestamp(now));
    params.addAll(candidates);
    JdbcTemplate.update(conn, sql, params.toArray());
    return candidates;
  }
}
