package jp.naoj.pfs.redaction.domain.fiber;

import java.util.Locale;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Header metadata of a fiber configuration.
 *
 * @param frameId frame identifier, e.g. {@code PFSF00012300}; may be empty for a design
 * @param pfsDesignId 64-bit design identifier
 * @param designName human readable design name
 * @param proposalId header-level proposal identifier, {@link FiberRecord#NO_PROPOSAL} when shared
 * @param visit exposure visit for a per-exposure configuration; empty for a design
 * @since 0.1.0
 */
public record DesignHeader(
    String frameId, long pfsDesignId, String designName, String proposalId, OptionalInt visit) {

  public DesignHeader {
    frameId = frameId == null ? "" : frameId;
    designName = designName == null ? "" : designName;
    proposalId = proposalId == null ? FiberRecord.NO_PROPOSAL : proposalId;
    visit = Objects.requireNonNullElse(visit, OptionalInt.empty());
    if (visit.isPresent() && visit.getAsInt() < 0) {
      throw new IllegalArgumentException("visit must not be negative (was " + visit.getAsInt() + ")");
    }
  }

  /**
   * Returns the design identifier in the {@code 0x%016x} form used in file names.
   *
   * @return lower-case hexadecimal design identifier
   */
  public String designIdHex() {
    return String.format(Locale.ROOT, "0x%016x", pfsDesignId);
  }
}
