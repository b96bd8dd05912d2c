package journal.jdbc.store;

import journal.jdbc.JdbcTemplate;
import journal.spi.ListenerRecord;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * H2 listener store. Primarily for testing.
 *
 * <p>Upserts with {@code MERGE INTO ... KEY (destination_id, path)}.
 */
public final class H2ListenerStore extends AbstractJdbcListenerStore {

  public H2ListenerStore() {
    super();
  }

  public H2ListenerStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcListenerStore withTableName(String tableName) {
    return new H2ListenerStore(tableName);
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
  public void upsert(Connection conn, ListenerRecord record) {
    String sql = "MERGE INTO " + tableName() + " (" + COLUMNS + ", created_at)" +
        " KEY (destination_id, path) VALUES (?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        record.scope(), record.destinationId(), record.path(), record.recursive(),
        Timestamp.from(Instant.now()));
  }
}
