package jp.naoj.pfs.redaction.config;

import java.util.Objects;
import jp.naoj.pfs.redaction.application.pipeline.ProposalListingUseCase;
import jp.naoj.pfs.redaction.application.pipeline.RedactionUseCase;
import jp.naoj.pfs.redaction.application.port.ConfigurationSetReader;
import jp.naoj.pfs.redaction.application.port.MetricsPort;
import jp.naoj.pfs.redaction.application.port.RedactedConfigurationWriter;
import jp.naoj.pfs.redaction.application.port.RedactionListener;
import jp.naoj.pfs.redaction.application.redaction.RedactionEngine;
import jp.naoj.pfs.redaction.infrastructure.events.LoggingRedactionListener;
import jp.naoj.pfs.redaction.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import jp.naoj.pfs.redaction.infrastructure.persistence.json.JsonConfigurationSetReader;
import jp.naoj.pfs.redaction.infrastructure.persistence.json.JsonRedactedConfigurationWriter;

/**
 * <strong>What:</strong> Central composition root that wires use cases to concrete adapters.
 * <p><strong>Why:</strong> Keeps configuration-to-adapter translation in one place.</p>
 * <p><strong>Role:</strong> Builds the JSON reader and writer, the metrics adapter, the logging listener and
 * the redaction engine for a command.</p>
 * <p><strong>Thread-safety:</strong> Construct and use on the CLI thread.</p>
 *
 * @since 0.1.0
 * @see RedactionUseCase
 * @see ProposalListingUseCase
 */
public final class CompositionRoot {
  private final MetricsPort metrics;
  private final RedactionListener listener;

  /** Creates a composition root with a logging listener and the supplied metrics sink. */
  public CompositionRoot(MetricsPort metrics) {
    this(metrics, new LoggingRedactionListener());
  }

  /**
   * Creates a composition root with explicit metrics and listener.
   *
   * @param metrics metrics sink handed to the engine and use cases
   * @param listener per-proposal observer
   */
  public CompositionRoot(MetricsPort metrics, RedactionListener listener) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.listener = Objects.requireNonNull(listener, "listener");
  }

  /**
   * Creates the metrics adapter described by {@code config}; callers own and close it.
   *
   * @param config run configuration
   * @return OpenTelemetry-backed metrics adapter
   */
  public static OpenTelemetryMetricsAdapter metricsFor(RedactConfig config) {
    return new OpenTelemetryMetricsAdapter(config.metrics());
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Builds the redaction engine for a run.
   *
   * @param config run configuration supplying worker count and sequence base
   * @return engine reporting to this root's metrics and listener
   */
  public RedactionEngine redactionEngine(RedactConfig config) {
    return new RedactionEngine(metrics, listener, config.workers(), config.sequenceBase());
  }

  public ConfigurationSetReader reader(SourceSelection source) {
    return new JsonConfigurationSetReader(source.inputDirectory());
  }

  public RedactedConfigurationWriter writer(RedactConfig config) {
    return new JsonRedactedConfigurationWriter(config.outputDirectory());
  }

  /**
   * Wires the redaction use case.
   *
   * @param config validated run configuration
   * @return use case ready to {@link RedactionUseCase#run()}
   */
  public RedactionUseCase redactionUseCase(RedactConfig config) {
    Objects.requireNonNull(config, "config");
    return new RedactionUseCase(
        config, reader(config.source()), writer(config), redactionEngine(config), metrics);
  }

  public ProposalListingUseCase proposalListingUseCase(SourceSelection source) {
    Objects.requireNonNull(source, "source");
    return new ProposalListingUseCase(source, reader(source));
  }
}
