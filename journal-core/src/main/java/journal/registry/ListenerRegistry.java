package journal.registry;

import journal.Destination;
import journal.JournalPath;
import journal.listener.OutputListener;

import java.util.List;
import java.util.Optional;

/**
 * Registry of output listeners, keyed by {@code (path, destination id)}.
 *
 * <p>At most one listener occupies each key. Registering a listener for an occupied key
 * replaces the previous one (an update, not a fault).
 *
 * <p>Implementations must tolerate mutation concurrently with {@link #snapshot()} reads
 * from the router's dispatch task. A snapshot is never affected by later mutations.
 *
 * @see DefaultListenerRegistry
 */
public interface ListenerRegistry {

  /**
   * Registers a listener, replacing any listener at the same {@code (path, destination)}.
   * A replacement keeps the sequence stamp of the listener it replaces.
   *
   * @param listener the listener
   * @param sequence registration stamp
   * @return the replaced listener, or empty if the key was free
   */
  Optional<OutputListener> register(OutputListener listener, long sequence);

  /**
   * Removes the listener at {@code (listener.path(), listener.destination().id())}.
   *
   * @param listener the listener (or an equivalent one for the same key)
   * @return {@code true} if a listener was removed
   */
  boolean unregister(OutputListener listener);

  /**
   * Looks up a listener by path and, optionally, destination id.
   *
   * @param path listener path
   * @param destinationId destination id, or {@code null} to return the first listener at the path
   * @return the listener, or empty
   */
  Optional<OutputListener> get(JournalPath path, String destinationId);

  /**
   * Moves a registered listener to another destination. A different listener already
   * occupying {@code (listener.path(), destination)} is removed.
   *
   * @param listener a registered listener
   * @param destination the new destination
   * @return {@code true} if the listener was registered and has been moved
   */
  boolean relocate(OutputListener listener, Destination destination);

  /**
   * Returns an immutable, point-in-time view of all registrations in registration order.
   *
   * @return the registrations
   */
  List<Registration> snapshot();

  /**
   * Returns all registered listeners, in registration order.
   *
   * @return immutable list of listeners
   */
  List<OutputListener> listeners();

  /**
   * Returns the listeners mounted exactly at {@code path}.
   *
   * @param path the path
   * @return immutable list, may be empty
   */
  List<OutputListener> listenersAt(JournalPath path);
}
