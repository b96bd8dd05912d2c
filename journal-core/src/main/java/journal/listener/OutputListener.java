package journal.listener;

import journal.DeliveryResult;
import journal.Destination;
import journal.JournalEvent;
import journal.JournalPath;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Subscription of a {@link Destination} to a subtree of the journal path hierarchy.
 *
 * <p>A listener matches an event when the event path equals the listener path, or when
 * the listener is recursive and the event path lies strictly below it. A listener bound
 * to a scope only matches events of that scope; an unscoped listener matches all scopes,
 * including global events.
 *
 * <p>{@link #deliver} never throws. Rendering and destination failures are logged and
 * reported as {@link DeliveryResult.Failed}, so one bad destination cannot stall the
 * router.
 *
 * <p>The destination is mutable to support relocating a subscription; relocate through
 * {@link journal.dispatch.Router#move} so the registry stays consistent.
 *
 * @see ChannelOutputListener
 * @see RawOutputListener
 */
public abstract class OutputListener {
  private static final Logger logger = Logger.getLogger(OutputListener.class.getName());

  private final JournalPath path;
  private final boolean recursive;
  private final String scope;
  private volatile Destination destination;

  protected OutputListener(JournalPath path, boolean recursive, String scope, Destination destination) {
    this.path = Objects.requireNonNull(path, "path");
    this.recursive = recursive;
    this.scope = scope;
    this.destination = Objects.requireNonNull(destination, "destination");
  }

  public final JournalPath path() {
    return path;
  }

  public final boolean recursive() {
    return recursive;
  }

  /**
   * Returns the scope this listener is restricted to, or {@code null} if it listens to all.
   *
   * @return the scope, or {@code null}
   */
  public final String scope() {
    return scope;
  }

  public final Destination destination() {
    return destination;
  }

  /**
   * Rebinds this listener to another destination. Prefer {@link journal.dispatch.Router#move},
   * which also keeps the {@code (path, destination)} slot unique.
   *
   * @param destination the new destination
   */
  public final void relocate(Destination destination) {
    this.destination = Objects.requireNonNull(destination, "destination");
  }

  /**
   * Returns {@code true} if this listener should receive the event.
   *
   * @param event the candidate event
   * @return whether the event path and scope match this subscription
   */
  public final boolean matches(JournalEvent event) {
    if (scope != null && !scope.equals(event.scope())) {
      return false;
    }
    JournalPath eventPath = event.path();
    return path.equals(eventPath) || (recursive && eventPath.isDescendantOf(path));
  }

  /**
   * Returns {@code true} if this listener occupies the registry slot
   * {@code (path, destinationId)}.
   *
   * @param path listener path
   * @param destinationId destination id
   * @return whether both match
   */
  public final boolean sameSlot(JournalPath path, String destinationId) {
    return this.path.equals(path) && destination.id().equals(destinationId);
  }

  /**
   * Renders the event and sends it to the current destination.
   *
   * @param event the event to deliver
   * @return the delivery outcome; never {@code null}
   */
  public final DeliveryResult deliver(JournalEvent event) {
    Destination target = destination;
    try {
      target.send(render(event));
      return DeliveryResult.delivered();
    } catch (Throwable t) {
      // Errors from a destination stay with that destination too
      if (t instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      logger.log(Level.WARNING, "Delivery of " + event.eventId() + " (" + event.path()
          + ") to destination " + target.id() + " failed", t);
      return DeliveryResult.failed(t);
    }
  }

  /**
   * Renders an event into the text sent to the destination.
   *
   * @param event the event
   * @return rendered content
   */
  protected abstract String render(JournalEvent event);

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{path=" + path + ", recursive=" + recursive
        + (scope == null ? "" : ", scope=" + scope)
        + ", destination=" + destination.id() + '}';
  }
}
