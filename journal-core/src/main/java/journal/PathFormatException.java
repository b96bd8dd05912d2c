package journal;

/**
 * Thrown when a journal path is malformed, or when an event is published on a path
 * that cannot carry events (the root).
 *
 * <p>Paths are never normalised: a path with a trailing slash, an empty segment or a
 * relative segment is rejected rather than repaired.
 */
public final class PathFormatException extends IllegalArgumentException {

  private final String path;

  public PathFormatException(String path, String reason) {
    super("Invalid journal path '" + path + "': " + reason);
    this.path = path;
  }

  /**
   * Returns the rejected input, possibly {@code null}.
   *
   * @return the offending path string
   */
  public String path() {
    return path;
  }
}
