/**
 * Built-in {@link journal.Destination} implementations.
 */
package journal.destination;
