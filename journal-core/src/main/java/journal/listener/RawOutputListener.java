package journal.listener;

import journal.Destination;
import journal.JournalEvent;
import journal.JournalPath;

/**
 * Output listener that forwards the event content verbatim.
 */
public final class RawOutputListener extends OutputListener {

  public RawOutputListener(String path, boolean recursive, Destination destination) {
    this(JournalPath.of(path), recursive, null, destination);
  }

  public RawOutputListener(JournalPath path, boolean recursive, String scope, Destination destination) {
    super(path, recursive, scope, destination);
  }

  @Override
  protected String render(JournalEvent event) {
    return event.content();
  }
}
