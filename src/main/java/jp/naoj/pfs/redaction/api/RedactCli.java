package jp.naoj.pfs.redaction.api;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import jp.naoj.pfs.redaction.application.pipeline.RedactionUseCase;
import jp.naoj.pfs.redaction.config.CompositionRoot;
import jp.naoj.pfs.redaction.config.RedactConfig;
import jp.naoj.pfs.redaction.domain.redaction.InputValidationException;
import jp.naoj.pfs.redaction.domain.redaction.MaskingConfigurationException;
import jp.naoj.pfs.redaction.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import jp.naoj.pfs.redaction.logging.Logs;
import jp.naoj.pfs.redaction.logging.LoggingConfigurator;
import jp.naoj.pfs.redaction.validation.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for redacting a fiber configuration into one file per proposal.
 *
 * @since 0.1.0
 */
public final class RedactCli {
  private static final Logger log = LoggerFactory.getLogger(RedactCli.class);
  static final String MODE = "redact";
  private static final String SUMMARY_USAGE =
      "usage: redact design=ID|FILE [idType=auto|int|hex|file] [visit=N] [in=PATH] [out=PATH] [prefix=NAME] "
          + "[objIdStrategy=SALTED_HASH|NEGATED_FIBER_ID] [saltEnv=VAR] [workers=N] [config=YAML] "
          + "[--dry-run] [--allow-overwrite]";
  private static final String HELP_TEXT = """
      PFS fiber configuration redaction

      Usage:
        redact design=0x4f966fa98c958b91 in=./designs out=./redacted [options]

      Required:
        design=ID|FILE           Design id (decimal or 0x hex) or file name under in=

      Optional:
        idType=auto|int|hex|file How to read design= (default auto)
        visit=N                  Read pfsConfig-0x...-NNNNNN.json instead of the design
        in=PATH                  Input directory (default .)
        out=PATH                 Output directory (default ./redacted)
        prefix=NAME              Output file prefix (default: input file name without extension)
        objIdStrategy=NAME       SALTED_HASH (default) or NEGATED_FIBER_ID
        saltEnv=VAR              Environment variable holding the salt (default PFS_REDACTION_SALT)
        mask.<field>=VALUE       Override a masking value, e.g. mask.catId=9000 mask.ra=-99
        fluxFields=a,b|none      Photometry columns filled when masking (default all)
        fluxFill=NUMBER|NaN      Fill value for masked photometry (default NaN)
        filterFill=TEXT          Filter name for masked photometry (default none)
        workers=N                Proposals redacted concurrently (default 1)
        sequenceBase=N           First result is numbered N+1 (default 0)
        config=PATH              YAML file with common: and redact: sections
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --dry-run                Validate the input and print the files that would be written
        --allow-overwrite        Permit writing into a non-empty output directory
        --verbose                Enable DEBUG logging
        --help                   Show this message

      Exit codes:
        0 success, 2 invalid arguments, 3 I/O error, 4 masking configuration error,
        5 unexpected failure, 6 malformed input, 7 consistency check failed
      """;

  private RedactCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs the redact command.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for redact CLI");
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String configPath = ConfigCliUtils.extractConfigPath(kv);

    Map<String, String> effective;
    try {
      effective = ConfigCliUtils.effectiveConfig(MODE, kv, configPath, log::warn);
    } catch (MaskingConfigurationException ex) {
      log.error("Invalid masking configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid redact arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", configPath, ex);
      return ExitCode.IO_ERROR;
    }

    boolean dryRun = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(effective, "dryRun");
    boolean allowOverwrite =
        input.hasFlag("--allow-overwrite") || ConfigCliUtils.parseBoolean(effective, "allowOverwrite");

    RedactConfig config;
    try {
      config = RedactConfig.fromMap(effective);
      Paths.validateReadableDir(config.source().inputDirectory());
      Paths.validateWritableDir(config.outputDirectory(), !dryRun, allowOverwrite);
    } catch (MaskingConfigurationException ex) {
      log.error("Invalid masking configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid redact arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    log.debug("Effective configuration: {}", config);

    try (OpenTelemetryMetricsAdapter metrics = CompositionRoot.metricsFor(config)) {
      RedactionUseCase useCase = new CompositionRoot(metrics).redactionUseCase(config);
      if (dryRun) {
        CliPrinter.printDryRunPlan(config, useCase.plan(), allowOverwrite);
        return ExitCode.SUCCESS;
      }
      log.info("Configured redaction: input={}, output={}, workers={}, objIdStrategy={}, metricsExporter={}",
          config.source().fileName(), config.outputDirectory(), config.workers(),
          config.policy().objIdStrategy(), config.metrics().exporter());
      CliPrinter.printWritten(useCase.run());
      return ExitCode.SUCCESS;
    } catch (IOException | RuntimeException ex) {
      return reportFailure(config, ex);
    }
  }

  private static ExitCode reportFailure(RedactConfig config, Exception failure) {
    ExitCode exit = ExitCode.forFailure(failure);
    String input = config.source().fileName();
    switch (exit) {
      case INPUT_ERROR -> log.error("Input {} is malformed: {}", input,
          Logs.abbreviate(((InputValidationException) failure).problems(), 10));
      case CONSISTENCY_FAILURE -> log.error("Redaction aborted; no files written: {}", failure.getMessage());
      case CONFIG_ERROR -> log.error("Invalid masking configuration: {}", failure.getMessage());
      case IO_ERROR -> log.error("Redaction I/O failure for {}", input, failure);
      case INTERRUPTED -> {
        Thread.currentThread().interrupt();
        log.error("Redaction interrupted; shutting down", failure);
      }
      default -> log.error("Unexpected runtime failure during redaction of {}", input, failure);
    }
    return exit;
  }
}
