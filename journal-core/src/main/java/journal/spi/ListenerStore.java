package journal.spi;

import java.sql.Connection;
import java.util.List;

/**
 * Persistence for output listener configuration as {@code (destination, path, recursive)}
 * tuples.
 *
 * <p>All methods run on the caller's connection. Transaction boundaries (auto-commit,
 * commit, rollback) belong to the caller.
 *
 * @see ListenerRecord
 */
public interface ListenerStore {

  /**
   * Lists the outputs of one scope. A {@code null} scope lists global outputs.
   *
   * @param conn the JDBC connection
   * @param scope the scope
   * @return outputs ordered by path, then destination
   */
  List<ListenerRecord> listListeners(Connection conn, String scope);

  /**
   * Lists all outputs across every scope.
   *
   * @param conn the JDBC connection
   * @return outputs ordered by scope, path, then destination
   */
  List<ListenerRecord> listAll(Connection conn);

  /**
   * Lists the outputs mounted on one destination.
   *
   * @param conn the JDBC connection
   * @param destinationId the destination id
   * @return outputs ordered by path
   */
  List<ListenerRecord> listByDestination(Connection conn, String destinationId);

  boolean exists(Connection conn, String destinationId, String path);

  /**
   * Inserts a new output.
   *
   * @param conn the JDBC connection
   * @param record the output
   */
  void insert(Connection conn, ListenerRecord record);

  /**
   * Updates the recursive flag and scope of an existing output.
   *
   * @param conn the JDBC connection
   * @param record the output
   * @return rows affected
   */
  int update(Connection conn, ListenerRecord record);

  /**
   * Deletes an output.
   *
   * @param conn the JDBC connection
   * @param destinationId the destination id
   * @param path the listener path
   * @return rows affected
   */
  int delete(Connection conn, String destinationId, String path);

  /**
   * Inserts the output, or updates it if {@code (destinationId, path)} already exists.
   *
   * <p>The default implementation checks {@link #exists} first; stores with a native
   * upsert statement override it.
   *
   * @param conn the JDBC connection
   * @param record the output
   */
  default void upsert(Connection conn, ListenerRecord record) {
    if (exists(conn, record.destinationId(), record.path())) {
      update(conn, record);
    } else {
      insert(conn, record);
    }
  }
}
