/**
 * Event routing: the bounded pending-event queue and the single dispatch task that fans
 * each event out to its matching output listeners.
 *
 * @see journal.dispatch.Router
 */
package journal.dispatch;
