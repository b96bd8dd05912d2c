package journal.history;

import journal.JournalEvent;
import journal.filter.EventFilter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory, append-only buffer of published journal events.
 *
 * <p>Events are stored in insertion order and read most-recent-first. A bounded history
 * evicts its oldest entries once {@link #capacity()} is reached; a capacity of {@code 0}
 * means unbounded. Contents are lost on restart.
 *
 * <p>This class is thread-safe.
 *
 * @see HistoryQuery
 */
public final class History {
  public static final int UNBOUNDED = 0;

  private final int capacity;
  private final ArrayDeque<JournalEvent> events = new ArrayDeque<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  public History() {
    this(UNBOUNDED);
  }

  /**
   * Creates a history.
   *
   * @param capacity maximum number of retained events, or {@link #UNBOUNDED}
   * @throws IllegalArgumentException if {@code capacity < 0}
   */
  public History(int capacity) {
    if (capacity < 0) {
      throw new IllegalArgumentException("capacity must be >= 0");
    }
    this.capacity = capacity;
  }

  /**
   * Appends an event, evicting the oldest entry when the history is full.
   *
   * @param event the event
   */
  public void append(JournalEvent event) {
    Objects.requireNonNull(event, "event");
    lock.writeLock().lock();
    try {
      events.addLast(event);
      if (capacity != UNBOUNDED && events.size() > capacity) {
        events.removeFirst();
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  public int size() {
    lock.readLock().lock();
    try {
      return events.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  public int capacity() {
    return capacity;
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  /**
   * Returns the most recent event, or {@code null} if the history is empty.
   *
   * @return the latest event, or {@code null}
   */
  public JournalEvent latest() {
    lock.readLock().lock();
    try {
      return events.peekLast();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Returns every retained event, most recent first.
   *
   * @return an immutable snapshot
   */
  public List<JournalEvent> snapshot() {
    return query(HistoryQuery.unlimited());
  }

  /**
   * Returns retained events that satisfy the query, most recent first.
   *
   * <p>The scope filter and the structured filter are applied before the limit, so the
   * result holds at most {@code limit} <em>matching</em> events.
   *
   * @param query the query
   * @return an immutable list of matching events
   */
  public List<JournalEvent> query(HistoryQuery query) {
    Objects.requireNonNull(query, "query");
    EventFilter filter = query.filter();
    int limit = query.limit();
    List<JournalEvent> result = new ArrayList<>();
    lock.readLock().lock();
    try {
      Iterator<JournalEvent> it = events.descendingIterator();
      while (it.hasNext() && (limit == HistoryQuery.NO_LIMIT || result.size() < limit)) {
        JournalEvent event = it.next();
        if (query.hasScope() && !Objects.equals(query.scope(), event.scope())) {
          continue;
        }
        if (filter.test(event)) {
          result.add(event);
        }
      }
    } finally {
      lock.readLock().unlock();
    }
    return Collections.unmodifiableList(result);
  }

  public void clear() {
    lock.writeLock().lock();
    try {
      events.clear();
    } finally {
      lock.writeLock().unlock();
    }
  }
}
