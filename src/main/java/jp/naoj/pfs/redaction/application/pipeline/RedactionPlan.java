package jp.naoj.pfs.redaction.application.pipeline;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a dry run: what a redaction would read and write.
 *
 * @param source resolved input file
 * @param fibers number of fiber rows in the input
 * @param proposals proposal identifiers in ascending order
 * @param targets output files, one per proposal, in the same order
 * @since 0.1.0
 */
public record RedactionPlan(Path source, int fibers, List<String> proposals, List<Path> targets) {
  public RedactionPlan {
    Objects.requireNonNull(source, "source");
    proposals = List.copyOf(proposals);
    targets = List.copyOf(targets);
    if (proposals.size() != targets.size()) {
      throw new IllegalArgumentException("one target per proposal expected");
    }
  }
}
