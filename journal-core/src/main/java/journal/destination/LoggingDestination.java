package journal.destination;

import journal.Destination;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Destination that writes rendered entries to a {@link java.util.logging.Logger}.
 */
public final class LoggingDestination implements Destination {

  private final String id;
  private final Logger target;
  private final Level level;

  public LoggingDestination(String loggerName) {
    this("log:" + loggerName, Logger.getLogger(loggerName), Level.INFO);
  }

  public LoggingDestination(String id, Logger target, Level level) {
    this.id = Objects.requireNonNull(id, "id");
    this.target = Objects.requireNonNull(target, "target");
    this.level = Objects.requireNonNull(level, "level");
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public void send(String content) {
    target.log(level, content);
  }
}
