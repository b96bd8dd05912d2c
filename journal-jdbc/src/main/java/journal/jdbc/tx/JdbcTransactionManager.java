package journal.jdbc.tx;

import journal.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Lightweight transaction manager for manual JDBC usage. Obtains a connection and
 * disables auto-commit; the connection is handed to the journal administration calls.
 *
 * <p>Use via try-with-resources on the returned {@link Transaction}:
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *     outputs.add(tx.connection(), guildId, channel, "/journal", true);
 *     tx.commit();
 * }
 * }</pre>
 */
public final class JdbcTransactionManager {
  private final ConnectionProvider connectionProvider;

  public JdbcTransactionManager(ConnectionProvider connectionProvider) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
  }

  /**
   * Begins a new transaction by obtaining a connection with auto-commit disabled.
   *
   * @return a new {@link Transaction} handle (use with try-with-resources)
   * @throws SQLException if a connection cannot be obtained
   */
  public Transaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
    } catch (SQLException e) {
      try {
        connection.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
    return new Transaction(connection);
  }

  /**
   * An active transaction handle. Supports explicit {@link #commit()} and {@link #rollback()}.
   * If neither is called, {@link #close()} triggers a rollback automatically.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private boolean completed;

    private Transaction(Connection connection) {
      this.connection = connection;
    }

    public Connection connection() {
      if (completed) {
        throw new IllegalStateException("Transaction already completed");
      }
      return connection;
    }

    public boolean isCompleted() {
      return completed;
    }

    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      SQLException failure = null;
      try {
        connection.commit();
      } catch (SQLException e) {
        failure = e;
        try {
          connection.rollback();
        } catch (SQLException rollbackFailure) {
          e.addSuppressed(rollbackFailure);
        }
      }
      finalizeTx(failure);
    }

    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      SQLException failure = null;
      try {
        connection.rollback();
      } catch (SQLException e) {
        failure = e;
      }
      finalizeTx(failure);
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    private void finalizeTx(SQLException pending) throws SQLException {
      completed = true;
      try {
        connection.setAutoCommit(true);
      } catch (SQLException e) {
        if (pending != null) {
          pending.addSuppressed(e);
        } else {
          pending = e;
        }
      } finally {
        connection.close();
      }
      if (pending != null) {
        throw pending;
      }
    }
  }
}
