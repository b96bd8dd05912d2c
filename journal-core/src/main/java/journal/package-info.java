/**
 * Journal event model and producer API.
 *
 * <p>Producers obtain a {@link journal.Broadcaster} from a {@link journal.dispatch.Router}
 * and publish {@link journal.JournalEvent}s on hierarchical {@link journal.JournalPath}s.
 * Output listeners mounted on a path receive the events published on it and, when
 * recursive, on every path below it.
 *
 * @see journal.dispatch.Router
 * @see journal.listener.OutputListener
 */
package journal;
