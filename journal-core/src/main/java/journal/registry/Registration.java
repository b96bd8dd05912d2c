package journal.registry;

import journal.listener.OutputListener;

import java.util.Objects;

/**
 * A registered listener with the router sequence number at which it was registered.
 *
 * <p>The router only offers a listener events whose own sequence number is greater than
 * the registration's, so events already queued when a listener was added are not
 * delivered to it retroactively.
 *
 * @param listener the registered listener
 * @param sequence registration stamp drawn from the router's event sequence
 */
public record Registration(OutputListener listener, long sequence) {
  public Registration {
    Objects.requireNonNull(listener, "listener");
  }
}
