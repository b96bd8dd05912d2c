package journal.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by the listener stores in
 * {@link journal.jdbc.store}.
 */
public final class ListenerStoreException extends RuntimeException {
  public ListenerStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
