package journal;

import journal.dispatch.Router;
import journal.history.History;

import java.util.Map;
import java.util.Objects;

/**
 * Producer facade bound to a root path.
 *
 * <p>Components publish journal entries through a broadcaster obtained from
 * {@link Router#broadcaster(String)}. Paths passed to {@code send} are used verbatim; use
 * {@link #resolve(String)} to build a path under the broadcaster's root.
 *
 * <pre>{@code
 * Broadcaster journal = router.broadcaster("/journal");
 * journal.send("/journal/channel/add", guildId, "Added journal logger", attrs, "journal");
 * }</pre>
 *
 * <p>{@code send} never blocks and never fails because of a listener.
 */
public final class Broadcaster {

  private final Router router;
  private final JournalPath root;

  public Broadcaster(Router router, JournalPath root) {
    this.router = Objects.requireNonNull(router, "router");
    this.root = Objects.requireNonNull(root, "root");
  }

  public JournalPath root() {
    return root;
  }

  /**
   * Builds a path below this broadcaster's root.
   *
   * @param relative relative path, e.g. {@code "channel/add"}
   * @return the absolute path
   * @throws PathFormatException if {@code relative} is malformed
   */
  public JournalPath resolve(String relative) {
    return root.resolve(relative);
  }

  /**
   * Publishes an event.
   *
   * @param path the event path
   * @param scope the tenant, or {@code null} for a global event
   * @param content the text payload
   * @param attributes the event attributes, may be {@code null}
   * @param icon the icon tag, may be {@code null}
   * @return the published event
   * @throws PathFormatException if the path is malformed or the root path
   */
  public JournalEvent send(String path, String scope, String content, Map<String, ?> attributes,
      String icon) {
    return send(JournalPath.of(path), scope, content, attributes, icon);
  }

  public JournalEvent send(String path, String scope, String content, Map<String, ?> attributes) {
    return send(path, scope, content, attributes, null);
  }

  public JournalEvent send(String path, String scope, String content) {
    return send(path, scope, content, null, null);
  }

  public JournalEvent send(JournalPath path, String scope, String content, Map<String, ?> attributes,
      String icon) {
    JournalEvent event = JournalEvent.builder(path)
        .scope(scope)
        .content(content)
        .attributes(attributes)
        .icon(icon)
        .build();
    router.publish(event);
    return event;
  }

  /**
   * Returns the router's history shared by every broadcaster.
   *
   * @return the history
   */
  public History history() {
    return router.history();
  }

  @Override
  public String toString() {
    return "Broadcaster{root=" + root + '}';
  }
}
