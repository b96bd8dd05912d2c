package journal.registry;

import journal.Destination;
import journal.JournalPath;
import journal.listener.OutputListener;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe copy-on-write {@link ListenerRegistry}.
 *
 * <p>Mutations are serialized and publish a new immutable entry list; {@link #snapshot()}
 * returns the current list without copying.
 *
 * @see ListenerRegistry
 */
public final class DefaultListenerRegistry implements ListenerRegistry {
  private static final Logger logger = Logger.getLogger(DefaultListenerRegistry.class.getName());

  private final Object writeLock = new Object();
  private volatile List<Registration> entries = Collections.emptyList();

  @Override
  public Optional<OutputListener> register(OutputListener listener, long sequence) {
    Objects.requireNonNull(listener, "listener");
    synchronized (writeLock) {
      List<Registration> next = new ArrayList<>(entries);
      String destinationId = listener.destination().id();
      for (int i = 0; i < next.size(); i++) {
        Registration existing = next.get(i);
        if (existing.listener().sameSlot(listener.path(), destinationId)) {
          next.set(i, new Registration(listener, existing.sequence()));
          entries = Collections.unmodifiableList(next);
          logger.log(Level.FINE, "Updated listener {0}", listener);
          return Optional.of(existing.listener());
        }
      }
      next.add(new Registration(listener, sequence));
      entries = Collections.unmodifiableList(next);
      logger.log(Level.FINE, "Registered listener {0}", listener);
      return Optional.empty();
    }
  }

  @Override
  public boolean unregister(OutputListener listener) {
    Objects.requireNonNull(listener, "listener");
    synchronized (writeLock) {
      String destinationId = listener.destination().id();
      List<Registration> next = new ArrayList<>(entries);
      boolean removed = next.removeIf(r -> r.listener().sameSlot(listener.path(), destinationId));
      if (removed) {
        entries = Collections.unmodifiableList(next);
        logger.log(Level.FINE, "Unregistered listener {0}", listener);
      }
      return removed;
    }
  }

  @Override
  public Optional<OutputListener> get(JournalPath path, String destinationId) {
    Objects.requireNonNull(path, "path");
    for (Registration registration : entries) {
      OutputListener listener = registration.listener();
      if (destinationId == null ? listener.path().equals(path) : listener.sameSlot(path, destinationId)) {
        return Optional.of(listener);
      }
    }
    return Optional.empty();
  }

  @Override
  public boolean relocate(OutputListener listener, Destination destination) {
    Objects.requireNonNull(listener, "listener");
    Objects.requireNonNull(destination, "destination");
    synchronized (writeLock) {
      List<Registration> next = new ArrayList<>(entries);
      boolean registered = next.stream().anyMatch(r -> r.listener() == listener);
      if (!registered) {
        return false;
      }
      next.removeIf(r -> r.listener() != listener
          && r.listener().sameSlot(listener.path(), destination.id()));
      listener.relocate(destination);
      entries = Collections.unmodifiableList(next);
      logger.log(Level.FINE, "Relocated listener {0}", listener);
      return true;
    }
  }

  @Override
  public List<Registration> snapshot() {
    return entries;
  }

  @Override
  public List<OutputListener> listeners() {
    List<OutputListener> result = new ArrayList<>();
    for (Registration registration : entries) {
      result.add(registration.listener());
    }
    return Collections.unmodifiableList(result);
  }

  @Override
  public List<OutputListener> listenersAt(JournalPath path) {
    Objects.requireNonNull(path, "path");
    List<OutputListener> result = new ArrayList<>();
    for (Registration registration : entries) {
      if (registration.listener().path().equals(path)) {
        result.add(registration.listener());
      }
    }
    return Collections.unmodifiableList(result);
  }
}
