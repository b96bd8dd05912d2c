/**
 * Service provider interfaces: listener persistence, destination resolution, JDBC
 * connections and metrics export.
 *
 * @see journal.spi.ListenerStore
 * @see journal.spi.DestinationResolver
 * @see journal.spi.RouterMetrics
 */
package journal.spi;
