package journal.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import journal.spi.RouterMetrics;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link RouterMetrics}.
 *
 * <p>Registers counters, gauges and a timer with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code journal.events.published}: events queued for dispatch</li>
 *   <li>{@code journal.events.dropped}: events kept in history but not queued</li>
 *   <li>{@code journal.events.unmatched}: dispatched events no listener matched</li>
 *   <li>{@code journal.delivery.success}: successful deliveries, one per listener</li>
 *   <li>{@code journal.delivery.failure}: failed deliveries, one per listener</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code journal.queue.depth}: events waiting for dispatch</li>
 *   <li>{@code journal.history.size}: events retained in history</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code journal.delivery.duration}: time to deliver one event to all its listeners</li>
 * </ul>
 *
 * @see RouterMetrics
 */
public final class MicrometerRouterMetrics implements RouterMetrics, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter published;
  private final Counter dropped;
  private final Counter unmatched;
  private final Counter deliverySuccess;
  private final Counter deliveryFailure;
  private final Gauge queueDepthGauge;
  private final Gauge historySizeGauge;
  private final Timer deliveryDuration;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private final AtomicInteger historySize = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates metrics with the default name prefix {@code "journal"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerRouterMetrics(MeterRegistry registry) {
    this(registry, "journal");
  }

  /**
   * Creates metrics with a custom name prefix for multi-router use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "bot.journal"})
   */
  public MicrometerRouterMetrics(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.published = Counter.builder(namePrefix + ".events.published")
        .description("Events queued for dispatch")
        .register(registry);
    this.dropped = Counter.builder(namePrefix + ".events.dropped")
        .description("Events recorded in history but not queued (queue full or router closed)")
        .register(registry);
    this.unmatched = Counter.builder(namePrefix + ".events.unmatched")
        .description("Dispatched events that matched no output listener")
        .register(registry);
    this.deliverySuccess = Counter.builder(namePrefix + ".delivery.success")
        .description("Successful deliveries to output listeners")
        .register(registry);
    this.deliveryFailure = Counter.builder(namePrefix + ".delivery.failure")
        .description("Failed deliveries to output listeners")
        .register(registry);

    this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
        .register(registry);
    this.historySizeGauge = Gauge.builder(namePrefix + ".history.size", historySize, AtomicInteger::get)
        .register(registry);
    this.deliveryDuration = Timer.builder(namePrefix + ".delivery.duration")
        .description("Time to deliver one event to all matching listeners")
        .register(registry);
  }

  @Override
  public void incrementPublished() {
    if (closed) return;
    published.increment();
  }

  @Override
  public void incrementDropped() {
    if (closed) return;
    dropped.increment();
  }

  @Override
  public void incrementDeliverySuccess() {
    if (closed) return;
    deliverySuccess.increment();
  }

  @Override
  public void incrementDeliveryFailure() {
    if (closed) return;
    deliveryFailure.increment();
  }

  @Override
  public void incrementUnmatched() {
    if (closed) return;
    unmatched.increment();
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  @Override
  public void recordHistorySize(int size) {
    if (closed) return;
    historySize.set(size);
  }

  @Override
  public void recordDeliveryDurationMs(long durationMs) {
    if (closed) return;
    deliveryDuration.record(durationMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Removes all meters registered by this instance from the registry.
   *
   * <p>Call this when the router is closed to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(published, dropped, unmatched, deliverySuccess, deliveryFailure,
        queueDepthGauge, historySizeGauge, deliveryDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
