/**
 * JDBC-based {@link journal.spi.ListenerStore} implementations.
 *
 * <p>{@link journal.jdbc.store.AbstractJdbcListenerStore} provides shared SQL and row
 * mapping; subclasses supply database-specific upserts: H2 ({@code MERGE ... KEY}),
 * MySQL ({@code ON DUPLICATE KEY UPDATE}) and PostgreSQL ({@code ON CONFLICT}).
 *
 * @see journal.jdbc.store.AbstractJdbcListenerStore
 * @see journal.jdbc.store.H2ListenerStore
 * @see journal.jdbc.store.MySqlListenerStore
 * @see journal.jdbc.store.PostgresListenerStore
 * @see journal.jdbc.store.JdbcListenerStores
 */
package journal.jdbc.store;
