/**
 * JDBC support shared by the journal listener stores: the statement helper, table name
 * validation and a {@link javax.sql.DataSource}-backed connection provider.
 *
 * @see journal.jdbc.store.AbstractJdbcListenerStore
 * @see journal.jdbc.tx.JdbcTransactionManager
 */
package journal.jdbc;
