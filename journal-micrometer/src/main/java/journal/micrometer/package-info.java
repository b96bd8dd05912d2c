/**
 * Micrometer bridge for journal router metrics.
 *
 * @see journal.micrometer.MicrometerRouterMetrics
 */
package journal.micrometer;
