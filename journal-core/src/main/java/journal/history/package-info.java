/**
 * Best-effort replay buffer of published journal events.
 *
 * @see journal.history.History
 * @see journal.history.HistoryQuery
 */
package journal.history;
