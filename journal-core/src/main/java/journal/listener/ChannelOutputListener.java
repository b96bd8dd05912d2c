package journal.listener;

import journal.Destination;
import journal.JournalEvent;
import journal.JournalPath;

import java.util.Map;

/**
 * Output listener for chat-channel style destinations.
 *
 * <p>Renders the event content, prefixed with its icon tag when present, followed by an
 * attribute summary with one {@code key: value} line per attribute when
 * {@code showAttributes} is set.
 *
 * <pre>
 * [journal] Added journal logger to #mod-log for /journal
 * path: /journal/channel/add
 * channel: mod-log
 * recursive: true
 * </pre>
 */
public final class ChannelOutputListener extends OutputListener {

  private final boolean showAttributes;

  public ChannelOutputListener(String path, Destination destination) {
    this(JournalPath.of(path), true, null, destination, true);
  }

  public ChannelOutputListener(String path, boolean recursive, Destination destination) {
    this(JournalPath.of(path), recursive, null, destination, true);
  }

  public ChannelOutputListener(JournalPath path, boolean recursive, String scope,
      Destination destination, boolean showAttributes) {
    super(path, recursive, scope, destination);
    this.showAttributes = showAttributes;
  }

  @Override
  protected String render(JournalEvent event) {
    StringBuilder sb = new StringBuilder();
    if (event.icon() != null && !event.icon().isEmpty()) {
      sb.append('[').append(event.icon()).append("] ");
    }
    sb.append(event.content());
    if (showAttributes) {
      sb.append("\npath: ").append(event.path());
      for (Map.Entry<String, Object> attr : event.attributes().entrySet()) {
        sb.append('\n').append(attr.getKey()).append(": ").append(attr.getValue());
      }
    }
    return sb.toString();
  }
}
