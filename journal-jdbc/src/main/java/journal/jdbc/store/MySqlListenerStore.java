package journal.jdbc.store;

import journal.jdbc.JdbcTemplate;
import journal.spi.ListenerRecord;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * MySQL listener store (also TiDB).
 *
 * <p>Upserts with {@code INSERT ... ON DUPLICATE KEY UPDATE}.
 */
public final class MySqlListenerStore extends AbstractJdbcListenerStore {

  public MySqlListenerStore() {
    super();
  }

  public MySqlListenerStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcListenerStore withTableName(String tableName) {
    return new MySqlListenerStore(tableName);
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
  public void upsert(Connection conn, ListenerRecord record) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ", created_at) VALUES (?,?,?,?,?)" +
        " ON DUPLICATE KEY UPDATE scope=VALUES(scope), is_recursive=VALUES(is_recursive)";
    JdbcTemplate.update(conn, sql,
        record.scope(), record.destinationId(), record.path(), record.recursive(),
        Timestamp.from(Instant.now()));
  }
}
