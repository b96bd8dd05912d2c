package journal.jdbc.store;

import journal.jdbc.JdbcTemplate;
import journal.jdbc.TableNames;
import journal.spi.ListenerRecord;
import journal.spi.ListenerStore;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Base JDBC listener store with standard SQL implementations.
 *
 * <p>Expected schema (column types vary per database):
 * <pre>
 * CREATE TABLE journal_output (
 *   scope          VARCHAR(64),
 *   destination_id VARCHAR(255) NOT NULL,
 *   path           VARCHAR(512) NOT NULL,
 *   is_recursive   BOOLEAN      NOT NULL,
 *   created_at     TIMESTAMP    NOT NULL,
 *   PRIMARY KEY (destination_id, path)
 * )
 * </pre>
 *
 * <p>Ready-made DDL ships on the classpath as {@code journal/schema/h2.sql},
 * {@code journal/schema/mysql.sql} and {@code journal/schema/postgresql.sql}.
 *
 * <p>Subclasses override {@link #upsert} with a database-specific single statement.
 * Register custom implementations via
 * {@code META-INF/services/journal.jdbc.store.AbstractJdbcListenerStore}.
 *
 * @see JdbcListenerStores
 */
public abstract class AbstractJdbcListenerStore implements ListenerStore {

  protected static final String COLUMNS = "scope, destination_id, path, is_recursive";

  protected static final JdbcTemplate.RowMapper<ListenerRecord> RECORD_ROW_MAPPER = rs -> new ListenerRecord(
      rs.getString("scope"),
      rs.getString("destination_id"),
      rs.getString("path"),
      rs.getBoolean("is_recursive"));

  private final String tableName;

  protected AbstractJdbcListenerStore() {
    this(TableNames.DEFAULT_TABLE);
  }

  protected AbstractJdbcListenerStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * Unique identifier for this listener store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this listener store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same kind bound to another table.
   *
   * @param tableName the table name
   * @return a new store
   * @throws IllegalArgumentException if the table name is invalid
   */
  public abstract AbstractJdbcListenerStore withTableName(String tableName);

  public String tableName() {
    return tableName;
  }

  @Override
  public List<ListenerRecord> listListeners(Connection conn, String scope) {
    if (scope == null) {
      String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
          " WHERE scope IS NULL ORDER BY path, destination_id";
      return JdbcTemplate.query(conn, sql, RECORD_ROW_MAPPER);
    }
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE scope=? ORDER BY path, destination_id";
    return JdbcTemplate.query(conn, sql, RECORD_ROW_MAPPER, scope);
  }

  @Override
  public List<ListenerRecord> listAll(Connection conn) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " ORDER BY scope, path, destination_id";
    return JdbcTemplate.query(conn, sql, RECORD_ROW_MAPPER);
  }

  @Override
  public List<ListenerRecord> listByDestination(Connection conn, String destinationId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE destination_id=? ORDER BY path";
    return JdbcTemplate.query(conn, sql, RECORD_ROW_MAPPER, destinationId);
  }

  @Override
  public boolean exists(Connection conn, String destinationId, String path) {
    String sql = "SELECT COUNT(*) FROM " + tableName() + " WHERE destination_id=? AND path=?";
    List<Integer> counts = JdbcTemplate.query(conn, sql, rs -> rs.getInt(1), destinationId, path);
    return !counts.isEmpty() && counts.get(0) > 0;
  }

  @Override
  public void insert(Connection conn, ListenerRecord record) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ", created_at) VALUES (?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        record.scope(), record.destinationId(), record.path(), record.recursive(),
        Timestamp.from(Instant.now()));
  }

  @Override
  public int update(Connection conn, ListenerRecord record) {
    String sql = "UPDATE " + tableName() + " SET scope=?, is_recursive=?" +
        " WHERE destination_id=? AND path=?";
    return JdbcTemplate.update(conn, sql,
        record.scope(), record.recursive(), record.destinationId(), record.path());
  }

  @Override
  public int delete(Connection conn, String destinationId, String path) {
    String sql = "DELETE FROM " + tableName() + " WHERE destination_id=? AND path=?";
    return JdbcTemplate.update(conn, sql, destinationId, path);
  }
}
