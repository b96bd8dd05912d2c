package journal;

/**
 * Sink that receives rendered journal output: a chat channel, a file, a log, a webhook.
 *
 * <p>Destinations are identified by {@link #id()}. Two destinations with the same id are
 * considered the same sink by the listener registry and by persistence.
 *
 * <p>The destination owns its own timeout policy. A failing {@link #send} is caught by the
 * {@linkplain journal.listener.OutputListener output listener} and never reaches the router.
 */
public interface Destination {

  /**
   * Stable identifier of this sink, used for registry lookups and persistence.
   *
   * @return the destination id
   */
  String id();

  /**
   * Delivers rendered content.
   *
   * @param content the rendered text
   * @throws Exception if the sink is unreachable, unauthorized, gone, or rejects the content
   */
  void send(String content) throws Exception;
}
