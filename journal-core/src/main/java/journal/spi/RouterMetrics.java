package journal.spi;

/**
 * Observability hook for exporting router counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything. {@code journal-micrometer} provides
 * a Micrometer implementation.
 */
public interface RouterMetrics {

    /**
     * No-op instance that discards all metrics.
     */
    RouterMetrics NOOP = new Noop();

    /**
     * Increments the count of events accepted for dispatch.
     */
    void incrementPublished();

    /**
     * Increments the count of events that were recorded in history but not queued because
     * the queue was full or the router closed.
     */
    void incrementDropped();

    /**
     * Increments the count of successful deliveries (one per listener).
     */
    void incrementDeliverySuccess();

    /**
     * Increments the count of failed deliveries (one per listener).
     */
    void incrementDeliveryFailure();

    /**
     * Increments the count of dispatched events that matched no listener.
     */
    default void incrementUnmatched() {
    }

    /**
     * Records the current depth of the pending-event queue.
     *
     * @param depth number of queued events
     */
    void recordQueueDepth(int depth);

    /**
     * Records the current number of events retained in history.
     *
     * @param size history size
     */
    default void recordHistorySize(int size) {
    }

    /**
     * Records the time spent delivering one event to all matching listeners.
     *
     * @param durationMs fan-out duration in milliseconds (always non-negative)
     */
    default void recordDeliveryDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements RouterMetrics {
        @Override
        public void incrementPublished() {
        }

        @Override
        public void incrementDropped() {
        }

        @Override
        public void incrementDeliverySuccess() {
        }

        @Override
        public void incrementDeliveryFailure() {
        }

        @Override
        public void recordQueueDepth(int depth) {
        }
    }
}
