/**
 * Attempt metrics.
 *
 * <p>{@link fr.lapetina.genrouter.infrastructure.metrics.AttemptMetricsCollector} keeps a bounded
 * window of attempts for the admin view; {@link fr.lapetina.genrouter.infrastructure.metrics.MetricsRegistry}
 * publishes the same events to Micrometer for Prometheus scraping.
 */
package fr.lapetina.genrouter.infrastructure.metrics;
