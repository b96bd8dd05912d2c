/**
 * Manual JDBC transaction management.
 *
 * <p>{@link journal.jdbc.tx.JdbcTransactionManager} provides a lightweight
 * try-with-resources API for callers that own the transaction around journal output
 * administration.
 *
 * @see journal.jdbc.tx.JdbcTransactionManager
 */
package journal.jdbc.tx;
