/**
 * Listener registry keyed by {@code (path, destination)}.
 *
 * @see journal.registry.ListenerRegistry
 * @see journal.registry.DefaultListenerRegistry
 */
package journal.registry;
