package journal.dispatch;

import journal.JournalEvent;

/**
 * Internal wrapper pairing a {@link JournalEvent} with the router sequence number assigned
 * when it was enqueued. Listeners registered at a higher sequence never see it.
 */
record QueuedEvent(JournalEvent event, long sequence) {
}
