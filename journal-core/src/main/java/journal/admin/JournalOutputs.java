package journal.admin;

import journal.Broadcaster;
import journal.Destination;
import journal.JournalEvent;
import journal.JournalPath;
import journal.PathFormatException;
import journal.dispatch.Router;
import journal.filter.EventFilters;
import journal.history.HistoryQuery;
import journal.listener.ChannelOutputListener;
import journal.listener.OutputListener;
import journal.spi.DestinationResolver;
import journal.spi.ListenerRecord;
import journal.spi.ListenerStore;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Administrative operations on journal outputs: mounting destinations on paths, keeping the
 * persisted configuration in sync with the router, and searching recent history.
 *
 * <p>Every change is written to the {@link ListenerStore} on the caller's connection before
 * the router is updated, so a failing store leaves the router untouched. Commit and
 * rollback belong to the caller. Each successful change is announced on the
 * {@code /journal/channel/*} paths and a summary of the destination's current paths is
 * sent to the affected destinations.
 *
 * <pre>{@code
 * JournalOutputs outputs = new JournalOutputs(router, store, resolver);
 * try (Connection conn = dataSource.getConnection()) {
 *   outputs.restoreAll(conn);
 * }
 * }</pre>
 */
public final class JournalOutputs {
  private static final Logger logger = Logger.getLogger(JournalOutputs.class.getName());

  public static final String JOURNAL_ROOT = "/journal";
  public static final String ICON = "journal";
  public static final int SEARCH_LIMIT = HistoryQuery.DEFAULT_LIMIT;

  private final Router router;
  private final ListenerStore store;
  private final DestinationResolver resolver;
  private final Broadcaster journal;

  public JournalOutputs(Router router, ListenerStore store, DestinationResolver resolver) {
    this.router = Objects.requireNonNull(router, "router");
    this.store = Objects.requireNonNull(store, "store");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.journal = router.broadcaster(JOURNAL_ROOT);
  }

  // ── Startup ─────────────────────────────────────────────────────

  /**
   * Registers the persisted outputs of one scope with the router. Outputs whose
   * destination no longer resolves, or whose path is malformed, are logged and skipped.
   *
   * @param conn the JDBC connection
   * @param scope the scope, {@code null} for global outputs
   * @return number of listeners registered
   */
  public int restore(Connection conn, String scope) {
    return restoreRecords(store.listListeners(conn, scope));
  }

  /**
   * Registers every persisted output with the router.
   *
   * @param conn the JDBC connection
   * @return number of listeners registered
   */
  public int restoreAll(Connection conn) {
    return restoreRecords(store.listAll(conn));
  }

  private int restoreRecords(List<ListenerRecord> records) {
    int restored = 0;
    for (ListenerRecord record : records) {
      Optional<Destination> destination = resolver.resolve(record.destinationId());
      if (destination.isEmpty()) {
        logger.log(Level.WARNING, "Skipping journal output {0} on {1}: destination not found",
            new Object[]{record.path(), record.destinationId()});
        continue;
      }
      JournalPath path;
      try {
        path = JournalPath.of(record.path());
      } catch (PathFormatException e) {
        logger.log(Level.WARNING, "Skipping journal output on " + record.destinationId(), e);
        continue;
      }
      logger.log(Level.INFO, "Registering journal output {0} for path ''{1}''",
          new Object[]{record.destinationId(), record.path()});
      router.register(listener(path, record.recursive(), record.scope(), destination.get()));
      restored++;
    }
    return restored;
  }

  // ── Changes ─────────────────────────────────────────────────────

  /**
   * Mounts a destination on a path, or updates the recursive flag of an existing mount.
   *
   * @param conn the JDBC connection
   * @param scope the owning scope; the listener only receives events of this scope
   * @param destination the destination
   * @param path the listener path
   * @param recursive whether events below {@code path} are delivered too
   * @return the registered listener
   * @throws PathFormatException if the path is malformed
   */
  public OutputListener add(Connection conn, String scope, Destination destination, String path,
      boolean recursive) {
    Objects.requireNonNull(destination, "destination");
    JournalPath journalPath = JournalPath.of(path);
    logger.log(Level.INFO, "Adding journal output {0} on path ''{1}''",
        new Object[]{destination.id(), journalPath});

    store.upsert(conn, new ListenerRecord(scope, destination.id(), journalPath.value(), recursive));
    OutputListener listener = listener(journalPath, recursive, scope, destination);
    router.register(listener);

    notifyUpdated(conn, destination);
    Map<String, Object> attrs = new LinkedHashMap<>();
    attrs.put("destination", destination.id());
    attrs.put("path", journalPath.value());
    attrs.put("recursive", recursive);
    journal.send(journal.resolve("channel/add"), scope,
        "Added journal logger to " + destination.id() + " for `" + journalPath + "`", attrs, ICON);
    return listener;
  }

  /**
   * Unmounts a destination from a path.
   *
   * @param conn the JDBC connection
   * @param scope the owning scope
   * @param destination the destination
   * @param path the listener path
   * @return {@code false} if no output of {@code scope} is mounted there
   * @throws PathFormatException if the path is malformed
   */
  public boolean remove(Connection conn, String scope, Destination destination, String path) {
    Objects.requireNonNull(destination, "destination");
    JournalPath journalPath = JournalPath.of(path);
    Optional<OutputListener> listener = owned(journalPath, destination, scope);
    if (listener.isEmpty()) {
      logger.log(Level.FINE, "No journal output on {0} for {1}", new Object[]{journalPath, destination.id()});
      return false;
    }
    logger.log(Level.INFO, "Removing journal output {0} from path ''{1}''",
        new Object[]{destination.id(), journalPath});

    store.delete(conn, destination.id(), journalPath.value());
    router.unregister(listener.get());

    notifyUpdated(conn, destination);
    Map<String, Object> attrs = new LinkedHashMap<>();
    attrs.put("destination", destination.id());
    attrs.put("path", journalPath.value());
    journal.send(journal.resolve("channel/remove"), scope,
        "Removed journal logger to " + destination.id() + " for `" + journalPath + "`", attrs, ICON);
    return true;
  }

  /**
   * Moves the output on {@code path} from one destination to another.
   *
   * @param conn the JDBC connection
   * @param scope the owning scope
   * @param from the current destination
   * @param to the new destination
   * @param path the listener path
   * @param recursive recursive flag of the moved output
   * @return {@code false} if no output of {@code scope} is mounted on {@code from} for the path
   * @throws PathFormatException if the path is malformed
   */
  public boolean move(Connection conn, String scope, Destination from, Destination to, String path,
      boolean recursive) {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
    JournalPath journalPath = JournalPath.of(path);
    Optional<OutputListener> found = owned(journalPath, from, scope);
    if (found.isEmpty()) {
      logger.log(Level.FINE, "No journal output on {0} for {1}", new Object[]{journalPath, from.id()});
      return false;
    }
    logger.log(Level.INFO, "Moving journal output from {0} to {1} for path ''{2}''",
        new Object[]{from.id(), to.id(), journalPath});

    store.delete(conn, from.id(), journalPath.value());
    store.upsert(conn, new ListenerRecord(scope, to.id(), journalPath.value(), recursive));

    OutputListener listener = found.get();
    if (listener.recursive() == recursive) {
      router.move(listener, to);
    } else {
      router.unregister(listener);
      router.register(listener(journalPath, recursive, scope, to));
    }

    notifyUpdated(conn, from);
    notifyUpdated(conn, to);
    Map<String, Object> attrs = new LinkedHashMap<>();
    attrs.put("old_destination", from.id());
    attrs.put("new_destination", to.id());
    attrs.put("path", journalPath.value());
    attrs.put("recursive", recursive);
    journal.send(journal.resolve("channel/move"), scope,
        "Moved journal logger from " + from.id() + " to " + to.id() + " for `" + journalPath + "`",
        attrs, ICON);
    return true;
  }

  // Outputs of another scope are invisible to the caller
  private Optional<OutputListener> owned(JournalPath path, Destination destination, String scope) {
    return router.get(path, destination.id())
        .filter(listener -> Objects.equals(listener.scope(), scope));
  }

  private void notifyUpdated(Connection conn, Destination destination) {
    List<ListenerRecord> mounted = outputsOn(conn, destination);
    StringBuilder paths = new StringBuilder();
    for (ListenerRecord record : mounted) {
      if (paths.length() > 0) {
        paths.append(' ');
      }
      paths.append('`').append(record.path()).append('`');
    }
    String message = "Channel outputs updated! Current journal paths: "
        + (mounted.isEmpty() ? "(none)" : paths);
    try {
      destination.send(message);
    } catch (Exception e) {
      logger.log(Level.WARNING, "Failed to notify journal destination " + destination.id(), e);
    }
  }

  // ── Queries ─────────────────────────────────────────────────────

  /**
   * Lists the persisted outputs of a scope, sorted by path.
   *
   * @param conn the JDBC connection
   * @param scope the scope
   * @return the outputs
   */
  public List<ListenerRecord> outputs(Connection conn, String scope) {
    List<ListenerRecord> records = new ArrayList<>(store.listListeners(conn, scope));
    records.sort(Comparator.comparing(ListenerRecord::path).thenComparing(ListenerRecord::destinationId));
    return records;
  }

  public List<ListenerRecord> outputsOn(Connection conn, Destination destination) {
    List<ListenerRecord> records = new ArrayList<>(store.listByDestination(conn, destination.id()));
    records.sort(Comparator.comparing(ListenerRecord::path));
    return records;
  }

  /**
   * Returns the most recent events of a scope matching a filter expression, newest first.
   *
   * @param scope the scope
   * @param filterExpression expression in {@link EventFilters#parse} syntax; blank matches all
   * @return at most {@link #SEARCH_LIMIT} events
   * @throws journal.filter.FilterSyntaxException if the expression is malformed
   */
  public List<JournalEvent> search(String scope, String filterExpression) {
    HistoryQuery query = HistoryQuery.builder()
        .scope(scope)
        .filter(EventFilters.parse(filterExpression))
        .limit(SEARCH_LIMIT)
        .build();
    return router.history().query(query);
  }

  // ── Manual events ───────────────────────────────────────────────

  /**
   * Publishes an event by hand, for testing outputs.
   *
   * @param scope the scope
   * @param path the event path
   * @param content the content
   * @param attributes the attributes, may be {@code null}
   * @return the published event
   * @throws PathFormatException if the path is malformed or the root path
   */
  public JournalEvent sendManual(String scope, String path, String content, Map<String, ?> attributes) {
    JournalPath journalPath = JournalPath.of(path);
    if (journalPath.isRoot()) {
      throw new PathFormatException(path, "cannot broadcast on the root path");
    }
    logger.log(Level.INFO, "Sending manual journal event on {0}: ''{1}'' (attrs: {2})",
        new Object[]{journalPath, content, attributes});
    return journal.send(journalPath, scope, content, attributes, null);
  }

  /**
   * Parses {@code KEY=VALUE} pairs into an attribute map. Later keys overwrite earlier ones.
   *
   * @param pairs the pairs
   * @return the attributes, in input order
   * @throws IllegalArgumentException if a pair has no {@code =} or an empty key
   */
  public static Map<String, Object> parseAttributes(Collection<String> pairs) {
    Map<String, Object> attributes = new LinkedHashMap<>();
    for (String pair : pairs) {
      int eq = pair.indexOf('=');
      if (eq <= 0) {
        throw new IllegalArgumentException("All attributes must be in the form KEY=VALUE: " + pair);
      }
      attributes.put(pair.substring(0, eq), pair.substring(eq + 1));
    }
    return attributes;
  }

  private static OutputListener listener(JournalPath path, boolean recursive, String scope,
      Destination destination) {
    return new ChannelOutputListener(path, recursive, scope, destination, true);
  }
}
