/**
 * Output listeners: subscriptions that render journal events for a destination.
 *
 * @see journal.listener.OutputListener
 */
package journal.listener;
