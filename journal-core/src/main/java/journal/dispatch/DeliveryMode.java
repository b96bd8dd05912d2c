package journal.dispatch;

/**
 * How the router fans one event out to its matching listeners.
 *
 * <p>In both modes every delivery for event N completes before event N+1 is processed, so
 * each listener observes its events in publish order.
 */
public enum DeliveryMode {
  /** Deliver to matching listeners one after another on the dispatch thread. */
  SEQUENTIAL,
  /** Deliver to matching listeners in parallel on a delivery pool and await all of them. */
  CONCURRENT
}
