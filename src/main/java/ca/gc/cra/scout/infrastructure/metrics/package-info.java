/**
 * Metrics adapters that bridge the scout {@code MetricsPort} to OpenTelemetry.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Concurrency:</strong> Implementations are thread-safe; watchers, evidence tasks and the
 * aggregator consumer update metrics concurrently.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code session.*}, {@code aggregator.*},
 * {@code watcher.*} and {@code evidence.*} namespaces.</p>
 * <p><strong>Security:</strong> Never exports matched log content; only counts and durations.</p>
 */
package ca.gc.cra.scout.infrastructure.metrics;
