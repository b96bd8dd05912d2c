package journal.jdbc.store;

import journal.jdbc.JdbcTemplate;
import journal.spi.ListenerRecord;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * PostgreSQL listener store.
 *
 * <p>Upserts with {@code INSERT ... ON CONFLICT (destination_id, path) DO UPDATE}.
 */
public final class PostgresListenerStore extends AbstractJdbcListenerStore {

  public PostgresListenerStore() {
    super();
  }

  public PostgresListenerStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcListenerStore withTableName(String tableName) {
    return new PostgresListenerStore(tableName);
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
  public void upsert(Connection conn, ListenerRecord record) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ", created_at) VALUES (?,?,?,?,?)" +
        " ON CONFLICT (destination_id, path)" +
        " DO UPDATE SET scope=EXCLUDED.scope, is_recursive=EXCLUDED.is_recursive";
    JdbcTemplate.update(conn, sql,
        record.scope(), record.destinationId(), record.path(), record.recursive(),
        Timestamp.from(Instant.now()));
  }
}
