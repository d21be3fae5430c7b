package jp.naoj.pfs.redaction.application.pipeline;

import java.io.IOException;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import jp.naoj.pfs.redaction.application.port.ConfigurationSetReader;
import jp.naoj.pfs.redaction.application.redaction.ProposalGrouper;
import jp.naoj.pfs.redaction.config.SourceSelection;
import jp.naoj.pfs.redaction.domain.fiber.ConfigurationSet;

/**
 * Lists the proposals present in a configuration together with the catalogs each one uses.
 *
 * @since 0.1.0
 */
public final class ProposalListingUseCase {
  private final SourceSelection source;
  private final ConfigurationSetReader reader;
  private final ProposalGrouper grouper = new ProposalGrouper();

  public ProposalListingUseCase(SourceSelection source, ConfigurationSetReader reader) {
    this.source = Objects.requireNonNull(source, "source");
    this.reader = Objects.requireNonNull(reader, "reader");
  }

  /**
   * Reads the configuration and groups catalog ids by proposal.
   *
   * @return proposal id to sorted catalog ids, proposals ascending
   * @throws IOException when the input cannot be read
   */
  public SortedMap<String, SortedSet<Integer>> list() throws IOException {
    ConfigurationSet input = reader.read(source.design(), source.visit());
    return grouper.catalogsByProposal(input);
  }
}
