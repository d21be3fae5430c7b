package jp.naoj.pfs.redaction.application.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import jp.naoj.pfs.redaction.application.port.ConfigurationSetReader;
import jp.naoj.pfs.redaction.application.port.MetricsPort;
import jp.naoj.pfs.redaction.application.port.RedactedConfigurationWriter;
import jp.naoj.pfs.redaction.application.redaction.ConfigurationSetValidator;
import jp.naoj.pfs.redaction.application.redaction.ProposalGrouper;
import jp.naoj.pfs.redaction.application.redaction.RedactionEngine;
import jp.naoj.pfs.redaction.config.RedactConfig;
import jp.naoj.pfs.redaction.config.SourceSelection;
import jp.naoj.pfs.redaction.domain.fiber.ConfigurationSet;
import jp.naoj.pfs.redaction.domain.redaction.RedactionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Reads one fiber configuration, redacts it per proposal and writes the views.
 * <p><strong>Why:</strong> Gives the CLI a single entry point for the load, redact and persist flow.</p>
 * <p><strong>Role:</strong> Application-layer use case coordinating the reader and writer ports around
 * {@link RedactionEngine}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; call {@link #run()} once per invocation.</p>
 * <p><strong>Observability:</strong> Emits {@code redaction.input.fibers} and {@code redaction.files.written}
 * and tags log lines with the {@code redaction.in} MDC key.</p>
 *
 * <p>Nothing is written unless every proposal passed its consistency check, so a failed run leaves no partial
 * set of views behind.</p>
 *
 * @since 0.1.0
 */
public final class RedactionUseCase {
  private static final Logger log = LoggerFactory.getLogger(RedactionUseCase.class);
  static final String MDC_INPUT = "redaction.in";

  private final RedactConfig config;
  private final ConfigurationSetReader reader;
  private final RedactedConfigurationWriter writer;
  private final RedactionEngine engine;
  private final MetricsPort metrics;
  private final ConfigurationSetValidator validator = new ConfigurationSetValidator();
  private final ProposalGrouper grouper = new ProposalGrouper();

  /**
   * Creates the use case.
   *
   * @param config run configuration
   * @param reader source of the configuration to redact
   * @param writer sink for redacted views
   * @param engine redaction engine
   * @param metrics metrics sink for run-level counters
   */
  public RedactionUseCase(
      RedactConfig config,
      ConfigurationSetReader reader,
      RedactedConfigurationWriter writer,
      RedactionEngine engine,
      MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.reader = Objects.requireNonNull(reader, "reader");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Loads and validates the input and reports the files a run would write, without writing anything.
   *
   * @return plan describing input and outputs
   * @throws IOException when the input cannot be read
   * @throws jp.naoj.pfs.redaction.domain.redaction.InputValidationException when the input is malformed
   */
  public RedactionPlan plan() throws IOException {
    SourceSelection source = config.source();
    Path file = reader.resolve(source.design(), source.visit());
    ConfigurationSet input = reader.read(source.design(), source.visit());
    validator.validate(input);
    List<String> proposals = new ArrayList<>(grouper.proposals(input));
    String prefix = config.effectivePrefix();
    List<Path> targets = new ArrayList<>(proposals.size());
    for (String proposalId : proposals) {
      targets.add(writer.target(prefix, proposalId));
    }
    return new RedactionPlan(file, input.size(), proposals, targets);
  }

  /**
   * Runs the redaction and writes one file per proposal.
   *
   * @return written files in ascending proposal order
   * @throws IOException when reading the input or writing an output fails
   * @throws jp.naoj.pfs.redaction.domain.redaction.InputValidationException when the input is malformed
   * @throws IllegalArgumentException when a proposal id or the prefix cannot form a safe file name; nothing is
   *     written in that case
   * @throws jp.naoj.pfs.redaction.domain.redaction.ConsistencyException when a view fails its consistency check
   */
  public List<Path> run() throws IOException {
    SourceSelection source = config.source();
    String previous = MDC.get(MDC_INPUT);
    MDC.put(MDC_INPUT, source.inputDirectory().toString());
    try {
      ConfigurationSet input = reader.read(source.design(), source.visit());
      metrics.observe("redaction.input.fibers", input.size());
      log.info("Redacting {} ({} fibers) with {} worker(s)", input, input.size(), engine.workers());

      List<RedactionResult> results = engine.redact(input, config.policy());
      if (results.isEmpty()) {
        log.warn("No proposal ids found in {}; nothing written", source.fileName());
        return List.of();
      }

      String prefix = config.effectivePrefix();
      // every name is checked before the first file lands on disk
      for (RedactionResult result : results) {
        writer.target(prefix, result.proposalId());
      }
      List<Path> written = new ArrayList<>(results.size());
      for (RedactionResult result : results) {
        written.add(writer.write(prefix, result));
        metrics.increment("redaction.files.written");
      }
      log.info("Redaction complete: {} file(s) written to {}", written.size(), config.outputDirectory());
      return List.copyOf(written);
    } finally {
      if (previous == null) {
        MDC.remove(MDC_INPUT);
      } else {
        MDC.put(MDC_INPUT, previous);
      }
    }
  }
}
