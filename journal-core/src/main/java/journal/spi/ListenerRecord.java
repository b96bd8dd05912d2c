package journal.spi;

import java.util.Objects;

/**
 * Persisted form of an output listener: which destination receives which path.
 *
 * @param scope tenant owning the output, or {@code null} for global outputs
 * @param destinationId {@link journal.Destination#id()} of the sink
 * @param path listener path
 * @param recursive whether descendants of {@code path} are delivered too
 */
public record ListenerRecord(String scope, String destinationId, String path, boolean recursive) {
  public ListenerRecord {
    Objects.requireNonNull(destinationId, "destinationId");
    Objects.requireNonNull(path, "path");
  }
}
