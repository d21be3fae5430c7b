/**
 * Metrics adapters bridging {@link jp.naoj.pfs.redaction.application.port.MetricsPort} to OpenTelemetry.
 * <p><strong>Concurrency:</strong> Thread-safe; instruments are cached per metric key.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code redaction.*} namespace.</p>
 */
package jp.naoj.pfs.redaction.infrastructure.metrics;
