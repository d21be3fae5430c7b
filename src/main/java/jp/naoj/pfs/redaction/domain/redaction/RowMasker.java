package jp.naoj.pfs.redaction.domain.redaction;

import java.util.Arrays;
import java.util.Collections;
import java.util.Objects;
import jp.naoj.pfs.redaction.domain.fiber.FiberRecord;
import jp.naoj.pfs.redaction.domain.fiber.FluxField;

/**
 * Applies a {@link MaskingPolicy} to single rows.
 *
 * <p>The predicate is the only place that decides whether a row is masked for a given proposal:
 * a row is masked when it belongs to a real proposal other than the requester and is a
 * {@link jp.naoj.pfs.redaction.domain.fiber.TargetType#SCIENCE} fiber. Everything else passes
 * through untouched. Masking keeps the length of every flux and filter sequence.</p>
 *
 * <p>Thread-safe when the supplied {@link ObjectIdDeriver} is.</p>
 *
 * @since 0.1.0
 */
public final class RowMasker {
  private final MaskingPolicy policy;
  private final ObjectIdDeriver objectIds;

  /**
   * Creates a masker and resolves the policy's identifier strategy.
   *
   * @param policy masking policy
   * @throws MaskingConfigurationException when the policy cannot produce an identifier deriver
   */
  public RowMasker(MaskingPolicy policy) {
    this(policy, policy.objectIdDeriver());
  }

  public RowMasker(MaskingPolicy policy, ObjectIdDeriver objectIds) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.objectIds = Objects.requireNonNull(objectIds, "objectIds");
  }

  /**
   * Decides whether {@code row} must be obscured in the output produced for {@code proposalId}.
   *
   * @param row source row
   * @param proposalId requesting proposal
   * @return {@code true} for science rows owned by a different, real proposal
   */
  public static boolean shouldMask(FiberRecord row, String proposalId) {
    return row.hasProposal() && !row.proposalId().equals(proposalId) && row.isScience();
  }

  /**
   * Produces the masked version of a row. The original is not modified.
   *
   * @param original row as read from the source
   * @return new row with every policy field replaced
   */
  public FiberRecord mask(FiberRecord original) {
    FiberRecord.Builder builder = original.toBuilder();
    policy.overrides().forEach((field, value) -> field.apply(builder, value));
    builder.objId(objectIds.derive(original));
    for (FluxField field : policy.fluxFields()) {
      double[] filled = new double[original.fluxLength(field)];
      Arrays.fill(filled, policy.fluxFill());
      builder.flux(field, filled);
    }
    builder.filterNames(Collections.nCopies(original.filterNames().size(), policy.filterFill()));
    return builder.build();
  }

  /**
   * Masks the row when {@link #shouldMask(FiberRecord, String)} holds, otherwise returns it as is.
   *
   * @param row source row
   * @param proposalId requesting proposal
   * @return masked row, or {@code row} itself
   */
  public FiberRecord apply(FiberRecord row, String proposalId) {
    return shouldMask(row, proposalId) ? mask(row) : row;
  }

  public MaskingPolicy policy() {
    return policy;
  }
}
