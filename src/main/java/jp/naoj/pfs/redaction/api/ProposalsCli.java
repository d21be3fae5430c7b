package jp.naoj.pfs.redaction.api;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import jp.naoj.pfs.redaction.application.pipeline.ProposalListingUseCase;
import jp.naoj.pfs.redaction.application.port.MetricsPort;
import jp.naoj.pfs.redaction.config.CompositionRoot;
import jp.naoj.pfs.redaction.config.SourceSelection;
import jp.naoj.pfs.redaction.logging.LoggingConfigurator;
import jp.naoj.pfs.redaction.validation.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the proposals found in a configuration, one per line, with the catalogs each one uses.
 *
 * @since 0.1.0
 */
public final class ProposalsCli {
  private static final Logger log = LoggerFactory.getLogger(ProposalsCli.class);
  static final String MODE = "proposals";
  private static final String SUMMARY_USAGE =
      "usage: proposals design=ID|FILE [idType=auto|int|hex|file] [visit=N] [in=PATH] [config=YAML]";
  private static final String HELP_TEXT = """
      List proposals in a PFS fiber configuration

      Usage:
        proposals design=0x4f966fa98c958b91 in=./designs

      Output:
        one line per proposal: <proposalId><TAB><catId>,<catId>,...
      """;

  private ProposalsCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    SourceSelection source;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      String configPath = ConfigCliUtils.extractConfigPath(kv);
      source = SourceSelection.fromMap(ConfigCliUtils.effectiveConfig(MODE, kv, configPath, log::warn));
      Paths.validateReadableDir(source.inputDirectory());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid proposals arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    ProposalListingUseCase useCase = new CompositionRoot(MetricsPort.NO_OP).proposalListingUseCase(source);
    try {
      SortedMap<String, SortedSet<Integer>> listing = useCase.list();
      if (listing.isEmpty()) {
        log.info("No proposal ids found in {}", source.fileName());
      }
      CliPrinter.printProposalListing(listing);
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to read {}", source.fileName(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure listing proposals", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
