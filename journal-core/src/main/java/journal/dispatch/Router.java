package journal.dispatch;

import journal.Broadcaster;
import journal.DeliveryResult;
import journal.Destination;
import journal.JournalEvent;
import journal.JournalPath;
import journal.history.History;
import journal.listener.OutputListener;
import journal.registry.DefaultListenerRegistry;
import journal.registry.ListenerRegistry;
import journal.registry.Registration;
import journal.spi.RouterMetrics;
import journal.util.NamedThreadFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Routes journal events from producers to the output listeners mounted on their paths.
 *
 * <p>The router owns the {@linkplain ListenerRegistry listener registry}, the
 * {@linkplain History history} and the pending-event queue. {@link #publish} appends the
 * event to history and offers it to the queue without blocking. A single dispatch task
 * drains the queue in FIFO order; for each event it takes a registry snapshot, selects the
 * matching listeners and delivers to all of them before moving on to the next event.
 *
 * <h2>Ordering</h2>
 * <ul>
 *   <li>Events are dispatched in publish order, and every listener observes the events it
 *       matches in that order.</li>
 *   <li>A listener registered before an event was published receives it; events already
 *       queued when a listener is registered are not delivered to it.</li>
 *   <li>A listener unregistered before an event's dispatch begins does not receive it. A
 *       delivery already in progress completes.</li>
 * </ul>
 *
 * <h2>Failures</h2>
 * <p>Delivery failures are logged by the listener and counted; they never stop the
 * dispatch loop or reach the producer. There is no retry, and the event stays in history.
 *
 * <p>Create instances via {@link #builder()} and call {@link #start()} once. This class is
 * thread-safe and implements {@link AutoCloseable} for graceful shutdown with a bounded
 * drain period.
 *
 * @see Router.Builder
 * @see Broadcaster
 */
public final class Router implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Router.class.getName());

  private static final long QUEUE_POLL_TIMEOUT_MS = 50;

  private final ListenerRegistry registry;
  private final History history;
  private final BlockingQueue<QueuedEvent> queue;
  private final DeliveryMode deliveryMode;
  private final int deliveryWorkerCount;
  private final RouterMetrics metrics;
  private final long drainTimeoutMs;

  private final Object publishLock = new Object();
  private final Map<JournalPath, Broadcaster> broadcasters = new ConcurrentHashMap<>();
  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private final CountDownLatch loopExited = new CountDownLatch(1);
  private long sequence;

  private volatile boolean running;
  private volatile boolean aborted;
  private boolean started;
  private boolean closed;
  private ExecutorService ownedDispatchExecutor;
  private ExecutorService deliveryExecutor;

  private Router(Builder builder) {
    this.registry = builder.registry != null ? builder.registry : new DefaultListenerRegistry();
    this.metrics = builder.metrics != null ? builder.metrics : RouterMetrics.NOOP;
    this.deliveryMode = Objects.requireNonNull(builder.deliveryMode, "deliveryMode");

    if (builder.historyCapacity < 0) {
      throw new IllegalArgumentException("historyCapacity must be >= 0");
    }
    if (builder.queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be > 0");
    }
    if (builder.deliveryWorkerCount <= 0) {
      throw new IllegalArgumentException("deliveryWorkerCount must be > 0");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.history = new History(builder.historyCapacity);
    this.queue = new ArrayBlockingQueue<>(builder.queueCapacity);
    this.deliveryWorkerCount = builder.deliveryWorkerCount;
    this.drainTimeoutMs = builder.drainTimeoutMs;
  }

  public static Builder builder() {
    return new Builder();
  }

  // ── Lifecycle ───────────────────────────────────────────────────

  /**
   * Starts the dispatch task on a dedicated daemon thread. Subsequent calls are no-ops
   * while the router is running.
   *
   * @throws IllegalStateException if the router has been closed or the task cannot be launched
   */
  public synchronized void start() {
    start(null);
  }

  /**
   * Starts the dispatch task on the given executor. The task occupies one executor thread
   * until the router is closed. Subsequent calls are no-ops while the router is running.
   *
   * @param executor executor to run the dispatch task on, or {@code null} for a dedicated thread
   * @throws IllegalStateException if the router has been closed or the executor rejects the task
   */
  public synchronized void start(Executor executor) {
    if (closed) {
      throw new IllegalStateException("Router has been closed");
    }
    if (started) {
      logger.fine("Router already started; ignoring start()");
      return;
    }
    Executor target = executor;
    if (target == null) {
      ownedDispatchExecutor = Executors.newSingleThreadExecutor(new NamedThreadFactory("journal-router-"));
      target = ownedDispatchExecutor;
    }
    if (deliveryMode == DeliveryMode.CONCURRENT) {
      deliveryExecutor = Executors.newFixedThreadPool(deliveryWorkerCount,
          new NamedThreadFactory("journal-delivery-"));
    }
    running = true;
    try {
      target.execute(this::dispatchLoop);
    } catch (RejectedExecutionException e) {
      running = false;
      shutdownExecutors();
      throw new IllegalStateException("Failed to launch journal dispatch task", e);
    }
    started = true;
    logger.log(Level.INFO, "Journal router started (deliveryMode={0}, queueCapacity={1}, historyCapacity={2})",
        new Object[]{deliveryMode, queue.remainingCapacity() + queue.size(), history.capacity()});
  }

  public synchronized boolean isRunning() {
    return started && !closed;
  }

  /**
   * Stops accepting events, dispatches what is still queued within the drain timeout, then
   * stops the dispatch task. Events left over after the timeout are discarded. Idempotent.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    accepting.set(false);
    running = false;
    if (started) {
      try {
        if (!loopExited.await(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
          logger.log(Level.WARNING, "Drain timeout exceeded; discarding {0} queued journal events",
              queue.size());
          aborted = true;
          if (ownedDispatchExecutor != null) {
            ownedDispatchExecutor.shutdownNow();
          }
        }
      } catch (InterruptedException e) {
        aborted = true;
        Thread.currentThread().interrupt();
      }
    } else if (!queue.isEmpty()) {
      logger.log(Level.WARNING, "Router closed before start; discarding {0} queued journal events",
          queue.size());
    }
    queue.clear();
    shutdownExecutors();
    logger.info("Journal router closed");
  }

  private void shutdownExecutors() {
    if (ownedDispatchExecutor != null) {
      ownedDispatchExecutor.shutdown();
    }
    if (deliveryExecutor != null) {
      deliveryExecutor.shutdown();
      try {
        if (!deliveryExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
          deliveryExecutor.shutdownNow();
        }
      } catch (InterruptedException e) {
        deliveryExecutor.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
  }

  // ── Administration ──────────────────────────────────────────────

  /**
   * Registers a listener. If a listener for the same {@code (path, destination)} exists it
   * is replaced. The listener receives events published after this call returns.
   *
   * @param listener the listener
   * @return the replaced listener, or empty
   */
  public Optional<OutputListener> register(OutputListener listener) {
    Objects.requireNonNull(listener, "listener");
    Optional<OutputListener> replaced;
    synchronized (publishLock) {
      replaced = registry.register(listener, ++sequence);
    }
    logger.log(Level.INFO, "{0} journal output {1}",
        new Object[]{replaced.isPresent() ? "Updated" : "Registered", listener});
    return replaced;
  }

  /**
   * Unregisters the listener at {@code (listener.path(), listener.destination())}.
   * Idempotent.
   *
   * @param listener the listener
   * @return {@code true} if a listener was removed
   */
  public boolean unregister(OutputListener listener) {
    Objects.requireNonNull(listener, "listener");
    boolean removed = registry.unregister(listener);
    if (removed) {
      logger.log(Level.INFO, "Unregistered journal output {0}", listener);
    }
    return removed;
  }

  /**
   * Looks up a listener by path and destination.
   *
   * @param path the listener path
   * @param destination the destination, or {@code null} for any destination at the path
   * @return the listener, or empty
   * @throws journal.PathFormatException if the path is malformed
   */
  public Optional<OutputListener> get(String path, Destination destination) {
    return get(JournalPath.of(path), destination == null ? null : destination.id());
  }

  public Optional<OutputListener> get(String path) {
    return get(JournalPath.of(path), null);
  }

  public Optional<OutputListener> get(JournalPath path, String destinationId) {
    return registry.get(path, destinationId);
  }

  /**
   * Moves a registered listener to another destination.
   *
   * @param listener a registered listener
   * @param destination the new destination
   * @return {@code true} if the listener was registered and has been moved
   */
  public boolean move(OutputListener listener, Destination destination) {
    String from = listener.destination().id();
    boolean moved = registry.relocate(listener, destination);
    if (moved) {
      logger.log(Level.INFO, "Moved journal output {0} from {1}", new Object[]{listener, from});
    }
    return moved;
  }

  public List<OutputListener> listeners() {
    return registry.listeners();
  }

  public List<OutputListener> listenersAt(String path) {
    return registry.listenersAt(JournalPath.of(path));
  }

  // ── Producers ───────────────────────────────────────────────────

  /**
   * Returns the broadcaster bound to {@code rootPath}, creating it on first use.
   *
   * @param rootPath the broadcaster root
   * @return the shared broadcaster for this root
   */
  public Broadcaster broadcaster(String rootPath) {
    return broadcasters.computeIfAbsent(JournalPath.of(rootPath), root -> new Broadcaster(this, root));
  }

  /**
   * Returns the number of cached broadcasters. Cached broadcasters are never evicted.
   *
   * @return broadcaster count
   */
  public int broadcasterCount() {
    return broadcasters.size();
  }

  /**
   * Appends the event to history and queues it for dispatch. Never blocks.
   *
   * <p>Returns {@code false} if the queue is full or the router is closed; the event is
   * still recorded in history.
   *
   * @param event the event
   * @return {@code true} if the event was queued
   */
  public boolean publish(JournalEvent event) {
    Objects.requireNonNull(event, "event");
    boolean enqueued;
    synchronized (publishLock) {
      history.append(event);
      enqueued = accepting.get() && queue.offer(new QueuedEvent(event, ++sequence));
    }
    metrics.recordHistorySize(history.size());
    metrics.recordQueueDepth(queue.size());
    if (enqueued) {
      metrics.incrementPublished();
    } else {
      metrics.incrementDropped();
      logger.log(Level.WARNING, "Journal event {0} on {1} not queued ({2})",
          new Object[]{event.eventId(), event.path(), accepting.get() ? "queue full" : "router closed"});
    }
    return enqueued;
  }

  public History history() {
    return history;
  }

  public int queueDepth() {
    return queue.size();
  }

  // ── Dispatch ────────────────────────────────────────────────────

  private void dispatchLoop() {
    try {
      while (!aborted && !Thread.currentThread().isInterrupted()) {
        try {
          if (!running && queue.isEmpty()) {
            break;
          }
          QueuedEvent next = queue.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
          if (next == null) {
            if (!running) break;
            continue;
          }
          dispatch(next);
          metrics.recordQueueDepth(queue.size());
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        } catch (Throwable t) {
          logger.log(Level.SEVERE, "Journal dispatch loop error", t);
        }
      }
    } finally {
      loopExited.countDown();
    }
  }

  private void dispatch(QueuedEvent queued) throws InterruptedException {
    JournalEvent event = queued.event();
    List<OutputListener> targets = matching(queued);
    if (targets.isEmpty()) {
      metrics.incrementUnmatched();
      logger.log(Level.FINEST, "No journal output for {0}", event.path());
      return;
    }
    long startNanos = System.nanoTime();
    if (deliveryMode == DeliveryMode.SEQUENTIAL || targets.size() == 1) {
      for (OutputListener listener : targets) {
        record(listener.deliver(event));
      }
    } else {
      deliverConcurrently(event, targets);
    }
    metrics.recordDeliveryDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
  }

  private List<OutputListener> matching(QueuedEvent queued) {
    List<OutputListener> targets = new ArrayList<>();
    for (Registration registration : registry.snapshot()) {
      if (registration.sequence() < queued.sequence() && registration.listener().matches(queued.event())) {
        targets.add(registration.listener());
      }
    }
    return targets;
  }

  private void deliverConcurrently(JournalEvent event, List<OutputListener> targets)
      throws InterruptedException {
    List<Future<DeliveryResult>> futures = new ArrayList<>(targets.size());
    for (OutputListener listener : targets) {
      futures.add(deliveryExecutor.submit(() -> listener.deliver(event)));
    }
    for (int i = 0; i < futures.size(); i++) {
      try {
        record(futures.get(i).get());
      } catch (ExecutionException e) {
        logger.log(Level.WARNING, "Delivery of " + event.eventId() + " to " + targets.get(i) + " failed",
            e.getCause());
        record(DeliveryResult.failed(e.getCause()));
      }
    }
  }

  private void record(DeliveryResult result) {
    if (result.isSuccess()) {
      metrics.incrementDeliverySuccess();
    } else {
      metrics.incrementDeliveryFailure();
    }
  }

  /** Builder for {@link Router}. */
  public static final class Builder {
    private ListenerRegistry registry;
    private int historyCapacity = 1000;
    private int queueCapacity = 10_000;
    private DeliveryMode deliveryMode = DeliveryMode.SEQUENTIAL;
    private int deliveryWorkerCount = 4;
    private long drainTimeoutMs = 5000;
    private RouterMetrics metrics;

    private Builder() {}

    /**
     * Sets the listener registry.
     *
     * <p>Optional. Defaults to a new {@link DefaultListenerRegistry}.
     *
     * @param registry the registry
     * @return this builder
     */
    public Builder registry(ListenerRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the number of events retained in history.
     *
     * <p>Optional. Defaults to {@code 1000}. {@code 0} keeps every event.
     *
     * @param historyCapacity history capacity
     * @return this builder
     */
    public Builder historyCapacity(int historyCapacity) {
      this.historyCapacity = historyCapacity;
      return this;
    }

    /**
     * Sets the bounded capacity of the pending-event queue. Events published while the
     * queue is full are recorded in history but not delivered.
     *
     * <p>Optional. Defaults to {@code 10000}. Must be &gt; 0.
     *
     * @param queueCapacity maximum number of queued events
     * @return this builder
     */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    /**
     * Sets how one event fans out to its listeners.
     *
     * <p>Optional. Defaults to {@link DeliveryMode#SEQUENTIAL}.
     *
     * @param deliveryMode the delivery mode
     * @return this builder
     */
    public Builder deliveryMode(DeliveryMode deliveryMode) {
      this.deliveryMode = deliveryMode;
      return this;
    }

    /**
     * Sets the number of delivery threads used in {@link DeliveryMode#CONCURRENT} mode.
     *
     * <p>Optional. Defaults to {@code 4}. Must be &gt; 0.
     *
     * @param deliveryWorkerCount delivery pool size
     * @return this builder
     */
    public Builder deliveryWorkerCount(int deliveryWorkerCount) {
      this.deliveryWorkerCount = deliveryWorkerCount;
      return this;
    }

    /**
     * Sets the maximum time in milliseconds {@link Router#close()} waits for queued events.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link RouterMetrics#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(RouterMetrics metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the router. Call {@link Router#start()} to begin dispatching.
     *
     * @return a new router
     * @throws NullPointerException if {@code deliveryMode} is null
     * @throws IllegalArgumentException if a capacity, worker count or timeout is out of range
     */
    public Router build() {
      return new Router(this);
    }
  }
}
