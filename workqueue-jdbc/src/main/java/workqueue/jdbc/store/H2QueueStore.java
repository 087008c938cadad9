package workqueue.jdbc.store;

import java.util.List;

/**
 * H2 queue store for tests and embedded use.
 *
 * <p>H2 parses {@code FOR UPDATE SKIP LOCKED} but applies {@code LIMIT} before skipping, so
 * claims use the inherited per-row conditional update, which re-evaluates
 * {@code state='pending'} after waiting on a row lock. Ownership stays exclusive, but a claim
 * that overlaps another open claim transaction may block and return fewer rows than are
 * pending, possibly none. Use PostgreSQL or MySQL where claimers must not wait on each other.
 */
public final class H2QueueStore extends AbstractJdbcQueueStore {

  public H2QueueStore() {
    super();
  }

  public H2QueueStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public AbstractJdbcQueueStore withTableName(String tableName) {
    return new H2QueueStore(tableName);
  }
}
