package jp.naoj.pfs.redaction.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for redaction runs.
 * <p><strong>Why:</strong> Lets the engine record counts and latencies without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from redaction workers.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code redaction.proposal.latencyNanos}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code redaction.proposals}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., nanoseconds, row counts)
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates; useful for tests. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
