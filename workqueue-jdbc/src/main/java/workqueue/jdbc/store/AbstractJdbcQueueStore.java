package workqueue.jdbc.store;

import workqueue.jdbc.JdbcTemplate;
import workqueue.jdbc.TableNames;
import workqueue.model.ClaimedItem;
import workqueue.model.ItemState;
import workqueue.model.QueueItem;
import workqueue.model.QueueStatus;
import workqueue.spi.QueueStore;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC queue store with standard SQL implementations.
 *
 * <p>The default claim selects candidate ids, then takes each one with a conditional
 * {@code UPDATE ... WHERE id=? AND state='pending'} in ascending id order. Only rows whose
 * update count is 1 are returned, so a row taken by a concurrent transaction is skipped.
 * Subclasses lock candidates with {@link #candidateLockClause()} or replace {@link #claim}
 * entirely. Register custom implementations via
 * {@code META-INF/services/workqueue.jdbc.store.AbstractJdbcQueueStore}.
 *
 * @see JdbcQueueStores
 */
public abstract class AbstractJdbcQueueStore implements QueueStore {
  protected static final String DEFAULT_TABLE = TableNames.DEFAULT_TABLE;
  private static final int MAX_ERROR_LENGTH = 4000;

  protected static final String CLAIMED_COLUMNS = "id, category, payload, retry_count, created_at";
  protected static final String ITEM_COLUMNS = "id, category, payload, state, retry_count, " +
      "claimed_by, claimed_at, created_at, completed_at, result, error";

  protected static final String PENDING = "'" + ItemState.PENDING.dbValue() + "'";
  protected static final String PROCESSING = "'" + ItemState.PROCESSING.dbValue() + "'";
  protected static final String COMPLETED = "'" + ItemState.COMPLETED.dbValue() + "'";
  protected static final String FAILED = "'" + ItemState.FAILED.dbValue() + "'";

  protected static final Comparator<ClaimedItem> OLDEST_FIRST =
      Comparator.comparing(ClaimedItem::createdAt).thenComparingLong(ClaimedItem::id);

  protected static final JdbcTemplate.RowMapper<ClaimedItem> CLAIMED_ROW_MAPPER = rs -> new ClaimedItem(
      rs.getLong("id"),
      rs.getString("category"),
      rs.getString("payload"),
      rs.getInt("retry_count"),
      rs.getTimestamp("created_at").toInstant());

  protected static final JdbcTemplate.RowMapper<QueueItem> ITEM_ROW_MAPPER = rs -> new QueueItem(
      rs.getLong("id"),
      rs.getString("category"),
      rs.getString("payload"),
      ItemState.fromDbValue(rs.getString("state")),
      rs.getInt("retry_count"),
      rs.getString("claimed_by"),
      instant(rs, "claimed_at"),
      rs.getTimestamp("created_at").toInstant(),
      instant(rs, "completed_at"),
      rs.getString("result"),
      rs.getString("error"));

  private final String tableName;

  protected AbstractJdbcQueueStore() {
    this(DEFAULT_TABLE);
  }

  protected AbstractJdbcQueueStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * Unique identifier for this queue store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this queue store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same dialect bound to another table.
   */
  public abstract AbstractJdbcQueueStore withTableName(String tableName);

  public String tableName() {
    return tableName;
  }

  @Override
  public int insertBatch(Connection conn, String category, List<String> payloads, Instant now) {
    String sql = "INSERT INTO " + tableName() +
        " (category, payload, state, retry_count, created_at) VALUES (?,?," + PENDING + ",0,?)";
    Timestamp createdAt = timestamp(now);
    List<Object[]> rows = new ArrayList<>(payloads.size());
    for (String payload : payloads) {
      rows.add(new Object[]{category, payload, createdAt});
    }
    return JdbcTemplate.batchUpdate(conn, sql, rows);
  }

  @Override
  public List<ClaimedItem> claim(Connection conn, String category, String ownerId, Instant now, int limit) {
    Objects.requireNonNull(ownerId, "ownerId");
    List<Long> candidates = selectCandidates(conn, category, limit);
    if (candidates.isEmpty()) {
      return List.of();
    }
    List<Long> owned = takeOwnership(conn, candidates, ownerId, now);
    if (owned.isEmpty()) {
      return List.of();
    }
    return selectByIds(conn, owned);
  }

  /**
   * Selects up to {@code limit} pending ids of a category, oldest first, appending
   * {@link #candidateLockClause()}.
   */
  protected List<Long> selectCandidates(Connection conn, String category, int limit) {
    String sql = "SELECT id FROM " + tableName() +
        " WHERE category=? AND state=" + PENDING +
        " ORDER BY created_at, id LIMIT ?" + candidateLockClause();
    return JdbcTemplate.query(conn, sql, rs -> rs.getLong(1), category, limit);
  }

  /**
   * Locking suffix for the candidate query, e.g. {@code " FOR UPDATE SKIP LOCKED"}.
   * Empty by default.
   */
  protected String candidateLockClause() {
    return "";
  }

  /**
   * Marks candidates as processing under {@code ownerId} and returns the ids actually taken.
   * The default updates one row at a time, re-checking {@code state='pending'}, in ascending
   * id order so concurrent claimers acquire row locks in the same order.
   */
  protected List<Long> takeOwnership(Connection conn, List<Long> candidates, String ownerId, Instant now) {
    String sql = "UPDATE " + tableName() +
        " SET state=" + PROCESSING + ", claimed_by=?, claimed_at=?" +
        " WHERE id=? AND state=" + PENDING;
    Timestamp claimedAt = timestamp(now);
    List<Long> ordered = new ArrayList<>(candidates);
    ordered.sort(null);
    List<Long> owned = new ArrayList<>(ordered.size());
    for (Long id : ordered) {
      if (JdbcTemplate.update(conn, sql, ownerId, claimedAt, id) == 1) {
        owned.add(id);
      }
    }
    return owned;
  }

  protected List<ClaimedItem> selectByIds(Connection conn, List<Long> ids) {
    String sql = "SELECT " + CLAIMED_COLUMNS + " FROM " + tableName() +
        " WHERE id IN (" + placeholders(ids.size()) + ") ORDER BY created_at, id";
    return JdbcTemplate.query(conn, sql, CLAIMED_ROW_MAPPER, ids.toArray());
  }

  @Override
  public int markCompleted(Connection conn, long id, String ownerId, String resultJson, Instant now) {
    String sql = "UPDATE " + tableName() +
        " SET state=" + COMPLETED + ", result=?, completed_at=?, claimed_by=NULL" +
        " WHERE id=? AND state=" + PROCESSING + " AND claimed_by=?";
    return JdbcTemplate.update(conn, sql, resultJson, timestamp(now), id, ownerId);
  }

  @Override
  public int markFailed(Connection conn, long id, String ownerId, String error, int maxRetries, Instant now) {
    // retry_count is assigned last: MySQL evaluates SET assignments left to right
    String sql = "UPDATE " + tableName() + " SET" +
        " state=CASE WHEN retry_count + 1 < ? THEN " + PENDING + " ELSE " + FAILED + " END," +
        " claimed_at=CASE WHEN retry_count + 1 < ? THEN NULL ELSE claimed_at END," +
        " completed_at=CASE WHEN retry_count + 1 < ? THEN completed_at ELSE ? END," +
        " claimed_by=NULL," +
        " error=?," +
        " retry_count=retry_count + 1" +
        " WHERE id=? AND state=" + PROCESSING + " AND claimed_by=?";
    return JdbcTemplate.update(conn, sql,
        maxRetries, maxRetries, maxRetries, timestamp(now), truncateError(error), id, ownerId);
  }

  @Override
  public Optional<ItemState> findState(Connection conn, long id) {
    String sql = "SELECT state FROM " + tableName() + " WHERE id=?";
    return JdbcTemplate.query(conn, sql, rs -> ItemState.fromDbValue(rs.getString(1)), id)
        .stream().findFirst();
  }

  @Override
  public Optional<QueueItem> findById(Connection conn, long id) {
    String sql = "SELECT " + ITEM_COLUMNS + " FROM " + tableName() + " WHERE id=?";
    return JdbcTemplate.query(conn, sql, ITEM_ROW_MAPPER, id).stream().findFirst();
  }

  @Override
  public int reclaimOrphans(Connection conn, Instant cutoff) {
    String sql = "UPDATE " + tableName() +
        " SET state=" + PENDING + ", claimed_by=NULL, claimed_at=NULL" +
        " WHERE state=" + PROCESSING;
    if (cutoff == null) {
      return JdbcTemplate.update(conn, sql);
    }
    return JdbcTemplate.update(conn, sql + " AND claimed_at < ?", timestamp(cutoff));
  }

  @Override
  public QueueStatus countByState(Connection conn, String category) {
    String sql = "SELECT state, COUNT(*) AS cnt FROM " + tableName() +
        " WHERE category=? GROUP BY state";
    QueueStatus status = QueueStatus.EMPTY;
    for (StateCount count : JdbcTemplate.query(conn, sql, StateCount::withoutCategory, category)) {
      status = status.plus(count.state(), count.count());
    }
    return status;
  }

  @Override
  public Map<String, QueueStatus> countByCategory(Connection conn) {
    String sql = "SELECT category, state, COUNT(*) AS cnt FROM " + tableName() +
        " GROUP BY category, state ORDER BY category";
    Map<String, QueueStatus> result = new LinkedHashMap<>();
    for (StateCount count : JdbcTemplate.query(conn, sql, StateCount::withCategory)) {
      result.merge(count.category(), QueueStatus.EMPTY.plus(count.state(), count.count()), QueueStatus::plus);
    }
    return result;
  }

  @Override
  public List<QueueItem> queryFailed(Connection conn, String category, int limit) {
    String sql = "SELECT " + ITEM_COLUMNS + " FROM " + tableName() +
        " WHERE category=? AND state=" + FAILED +
        " ORDER BY created_at, id LIMIT ?";
    return JdbcTemplate.query(conn, sql, ITEM_ROW_MAPPER, category, limit);
  }

  @Override
  public int replayFailed(Connection conn, long id) {
    String sql = "UPDATE " + tableName() +
        " SET state=" + PENDING + ", retry_count=0, claimed_by=NULL, claimed_at=NULL," +
        " completed_at=NULL, error=NULL" +
        " WHERE id=? AND state=" + FAILED;
    return JdbcTemplate.update(conn, sql, id);
  }

  @Override
  public long countFailed(Connection conn, String category) {
    String sql = "SELECT COUNT(*) FROM " + tableName() + " WHERE category=? AND state=" + FAILED;
    return JdbcTemplate.queryForLong(conn, sql, category);
  }

  /** Millisecond timestamp, so stored values compare equal across drivers that drop nanos. */
  protected static Timestamp timestamp(Instant instant) {
    return Timestamp.from(instant.truncatedTo(ChronoUnit.MILLIS));
  }

  protected static String placeholders(int count) {
    StringBuilder sb = new StringBuilder(count * 2);
    for (int i = 0; i < count; i++) {
      if (i > 0) {
        sb.append(',');
      }
      sb.append('?');
    }
    return sb.toString();
  }

  private static Instant instant(ResultSet rs, String column) throws SQLException {
    Timestamp ts = rs.getTimestamp(column);
    return ts == null ? null : ts.toInstant();
  }

  static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }

  private record StateCount(String category, ItemState state, long count) {

    static StateCount withoutCategory(ResultSet rs) throws SQLException {
      return new StateCount(null, ItemState.fromDbValue(rs.getString("state")), rs.getLong("cnt"));
    }

    static StateCount withCategory(ResultSet rs) throws SQLException {
      return new StateCount(rs.getString("category"),
          ItemState.fromDbValue(rs.getString("state")), rs.getLong("cnt"));
    }
  }
}
