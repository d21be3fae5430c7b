package jp.naoj.pfs.redaction.domain.fiber;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> One fiber row of a PFS design or configuration.
 * <p><strong>Why:</strong> Gives the redaction engine a typed view of every column it may overwrite.</p>
 * <p><strong>Role:</strong> Domain value held by {@link ConfigurationSet}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; flux arrays are copied on the way in and on the way out.</p>
 * <p><strong>Performance:</strong> Each accessor of a flux column clones the array; use
 * {@link #fluxLength(FluxField)} when only the cardinality matters.</p>
 *
 * @param fiberId physical fiber identifier, unique within a configuration
 * @param proposalId owning proposal, or {@link #NO_PROPOSAL} for calibration and sky fibers
 * @param catId catalog the target was drawn from
 * @param objId catalog-internal object identifier
 * @param targetType what the fiber observes
 * @param tract sky-tiling tract
 * @param patch sky-tiling patch, e.g. {@code "1,3"}
 * @param ra right ascension in degrees
 * @param dec declination in degrees
 * @param pmRa proper motion in right ascension
 * @param pmDec proper motion in declination
 * @param parallax parallax
 * @param obCode observer-assigned code
 * @param pfiNominal intended focal-plane position
 * @param pfiCenter achieved focal-plane position
 * @param fiberFlux fiber flux per band
 * @param psfFlux PSF flux per band
 * @param totalFlux total flux per band
 * @param fiberFluxErr fiber flux error per band
 * @param psfFluxErr PSF flux error per band
 * @param totalFluxErr total flux error per band
 * @param filterNames filter name per band
 * @since 0.1.0
 */
public record FiberRecord(
    int fiberId,
    String proposalId,
    int catId,
    long objId,
    TargetType targetType,
    int tract,
    String patch,
    double ra,
    double dec,
    double pmRa,
    double pmDec,
    double parallax,
    String obCode,
    FocalPlanePoint pfiNominal,
    FocalPlanePoint pfiCenter,
    double[] fiberFlux,
    double[] psfFlux,
    double[] totalFlux,
    double[] fiberFluxErr,
    double[] psfFluxErr,
    double[] totalFluxErr,
    List<String> filterNames) {

  /** Proposal identifier carried by fibers that belong to no proposal. */
  public static final String NO_PROPOSAL = "N/A";

  /**
   * Rejects missing values and copies mutable inputs.
   *
   * @throws NullPointerException when any reference column is {@code null}
   */
  public FiberRecord {
    Objects.requireNonNull(proposalId, "proposalId");
    Objects.requireNonNull(targetType, "targetType");
    Objects.requireNonNull(patch, "patch");
    Objects.requireNonNull(obCode, "obCode");
    Objects.requireNonNull(pfiNominal, "pfiNominal");
    Objects.requireNonNull(pfiCenter, "pfiCenter");
    fiberFlux = Objects.requireNonNull(fiberFlux, "fiberFlux").clone();
    psfFlux = Objects.requireNonNull(psfFlux, "psfFlux").clone();
    totalFlux = Objects.requireNonNull(totalFlux, "totalFlux").clone();
    fiberFluxErr = Objects.requireNonNull(fiberFluxErr, "fiberFluxErr").clone();
    psfFluxErr = Objects.requireNonNull(psfFluxErr, "psfFluxErr").clone();
    totalFluxErr = Objects.requireNonNull(totalFluxErr, "totalFluxErr").clone();
    filterNames = List.copyOf(Objects.requireNonNull(filterNames, "filterNames"));
  }

  /**
   * Indicates whether this fiber belongs to a real proposal.
   *
   * @return {@code false} for calibration/sky fibers carrying {@link #NO_PROPOSAL}
   */
  public boolean hasProposal() {
    return !NO_PROPOSAL.equals(proposalId);
  }

  /**
   * Indicates whether this fiber is an unmasked science fiber.
   *
   * @return {@code true} when {@link #targetType()} is {@link TargetType#SCIENCE}
   */
  public boolean isScience() {
    return targetType == TargetType.SCIENCE;
  }

  @Override
  public double[] fiberFlux() {
    return fiberFlux.clone();
  }

  @Override
  public double[] psfFlux() {
    return psfFlux.clone();
  }

  @Override
  public double[] totalFlux() {
    return totalFlux.clone();
  }

  @Override
  public double[] fiberFluxErr() {
    return fiberFluxErr.clone();
  }

  @Override
  public double[] psfFluxErr() {
    return psfFluxErr.clone();
  }

  @Override
  public double[] totalFluxErr() {
    return totalFluxErr.clone();
  }

  /**
   * Returns a copy of the named flux sequence.
   *
   * @param field flux column
   * @return copy of the values
   */
  public double[] flux(FluxField field) {
    return column(field).clone();
  }

  /**
   * Returns the number of bands stored in the named flux sequence.
   *
   * @param field flux column
   * @return sequence length
   */
  public int fluxLength(FluxField field) {
    return column(field).length;
  }

  /**
   * Returns copies of all flux sequences keyed by column.
   *
   * @return mutable map owned by the caller
   */
  public Map<FluxField, double[]> fluxes() {
    Map<FluxField, double[]> map = new EnumMap<>(FluxField.class);
    for (FluxField field : FluxField.values()) {
      map.put(field, flux(field));
    }
    return map;
  }

  /**
   * Produces an independent copy of this record; all arrays are freshly allocated.
   *
   * @return deep copy equal to this record
   */
  public FiberRecord deepCopy() {
    return toBuilder().build();
  }

  /**
   * Starts a builder pre-populated with this record's values.
   *
   * @return builder owned by the caller
   */
  public Builder toBuilder() {
    Builder builder = new Builder()
        .fiberId(fiberId)
        .proposalId(proposalId)
        .catId(catId)
        .objId(objId)
        .targetType(targetType)
        .tract(tract)
        .patch(patch)
        .ra(ra)
        .dec(dec)
        .pmRa(pmRa)
        .pmDec(pmDec)
        .parallax(parallax)
        .obCode(obCode)
        .pfiNominal(pfiNominal)
        .pfiCenter(pfiCenter)
        .filterNames(filterNames);
    for (FluxField field : FluxField.values()) {
      builder.flux(field, column(field));
    }
    return builder;
  }

  /**
   * Creates an empty builder. Reference columns default to empty values and
   * {@link TargetType#UNASSIGNED}.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  private double[] column(FluxField field) {
    return switch (field) {
      case FIBER_FLUX -> fiberFlux;
      case PSF_FLUX -> psfFlux;
      case TOTAL_FLUX -> totalFlux;
      case FIBER_FLUX_ERR -> fiberFluxErr;
      case PSF_FLUX_ERR -> psfFluxErr;
      case TOTAL_FLUX_ERR -> totalFluxErr;
    };
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FiberRecord that)) {
      return false;
    }
    return fiberId == that.fiberId
        && catId == that.catId
        && objId == that.objId
        && tract == that.tract
        && Double.compare(ra, that.ra) == 0
        && Double.compare(dec, that.dec) == 0
        && Double.compare(pmRa, that.pmRa) == 0
        && Double.compare(pmDec, that.pmDec) == 0
        && Double.compare(parallax, that.parallax) == 0
        && targetType == that.targetType
        && proposalId.equals(that.proposalId)
        && patch.equals(that.patch)
        && obCode.equals(that.obCode)
        && pfiNominal.equals(that.pfiNominal)
        && pfiCenter.equals(that.pfiCenter)
        && Arrays.equals(fiberFlux, that.fiberFlux)
        && Arrays.equals(psfFlux, that.psfFlux)
        && Arrays.equals(totalFlux, that.totalFlux)
        && Arrays.equals(fiberFluxErr, that.fiberFluxErr)
        && Arrays.equals(psfFluxErr, that.psfFluxErr)
        && Arrays.equals(totalFluxErr, that.totalFluxErr)
        && filterNames.equals(that.filterNames);
  }

  @Override
  public int hashCode() {
    int result = Integer.hashCode(fiberId);
    result = 31 * result + proposalId.hashCode();
    result = 31 * result + Integer.hashCode(catId);
    result = 31 * result + Long.hashCode(objId);
    result = 31 * result + targetType.hashCode();
    result = 31 * result + Integer.hashCode(tract);
    result = 31 * result + patch.hashCode();
    result = 31 * result + Double.hashCode(ra);
    result = 31 * result + Double.hashCode(dec);
    result = 31 * result + Double.hashCode(pmRa);
    result = 31 * result + Double.hashCode(pmDec);
    result = 31 * result + Double.hashCode(parallax);
    result = 31 * result + obCode.hashCode();
    result = 31 * result + pfiNominal.hashCode();
    result = 31 * result + pfiCenter.hashCode();
    result = 31 * result + Arrays.hashCode(fiberFlux);
    result = 31 * result + Arrays.hashCode(psfFlux);
    result = 31 * result + Arrays.hashCode(totalFlux);
    result = 31 * result + Arrays.hashCode(fiberFluxErr);
    result = 31 * result + Arrays.hashCode(psfFluxErr);
    result = 31 * result + Arrays.hashCode(totalFluxErr);
    result = 31 * result + filterNames.hashCode();
    return result;
  }

  @Override
  public String toString() {
    return "FiberRecord{"
        + "fiberId=" + fiberId
        + ", proposalId='" + proposalId + '\''
        + ", catId=" + catId
        + ", objId=" + objId
        + ", targetType=" + targetType
        + ", tract=" + tract
        + ", patch='" + patch + '\''
        + ", ra=" + ra
        + ", dec=" + dec
        + ", obCode='" + obCode + '\''
        + ", filterNames=" + filterNames
        + ", fiberFlux=" + Arrays.toString(fiberFlux)
        + '}';
  }

  /**
   * Mutable builder used by loaders and by the masking step.
   *
   * <p>Not thread-safe. Flux arrays are copied when the record is built.</p>
   */
  public static final class Builder {
    private int fiberId;
    private String proposalId = NO_PROPOSAL;
    private int catId;
    private long objId;
    private TargetType targetType = TargetType.UNASSIGNED;
    private int tract;
    private String patch = "";
    private double ra;
    private double dec;
    private double pmRa;
    private double pmDec;
    private double parallax;
    private String obCode = "";
    private FocalPlanePoint pfiNominal = FocalPlanePoint.NAN;
    private FocalPlanePoint pfiCenter = FocalPlanePoint.NAN;
    private final Map<FluxField, double[]> fluxes = new EnumMap<>(FluxField.class);
    private List<String> filterNames = List.of();

    private Builder() {
      for (FluxField field : FluxField.values()) {
        fluxes.put(field, new double[0]);
      }
    }

    public Builder fiberId(int value) {
      this.fiberId = value;
      return this;
    }

    public Builder proposalId(String value) {
      this.proposalId = value;
      return this;
    }

    public Builder catId(int value) {
      this.catId = value;
      return this;
    }

    public Builder objId(long value) {
      this.objId = value;
      return this;
    }

    public Builder targetType(TargetType value) {
      this.targetType = value;
      return this;
    }

    public Builder tract(int value) {
      this.tract = value;
      return this;
    }

    public Builder patch(String value) {
      this.patch = value;
      return this;
    }

    public Builder ra(double value) {
      this.ra = value;
      return this;
    }

    public Builder dec(double value) {
      this.dec = value;
      return this;
    }

    public Builder pmRa(double value) {
      this.pmRa = value;
      return this;
    }

    public Builder pmDec(double value) {
      this.pmDec = value;
      return this;
    }

    public Builder parallax(double value) {
      this.parallax = value;
      return this;
    }

    public Builder obCode(String value) {
      this.obCode = value;
      return this;
    }

    public Builder pfiNominal(FocalPlanePoint value) {
      this.pfiNominal = value;
      return this;
    }

    public Builder pfiCenter(FocalPlanePoint value) {
      this.pfiCenter = value;
      return this;
    }

    public Builder flux(FluxField field, double[] values) {
      fluxes.put(Objects.requireNonNull(field, "field"), values);
      return this;
    }

    public Builder filterNames(List<String> value) {
      this.filterNames = value;
      return this;
    }

    /**
     * Sets every flux sequence and the filter names from one band list, which keeps the row's
     * cardinality consistent. Mostly useful for fixtures.
     *
     * @param filters filter name per band
     * @param flux value written to every flux sequence at the matching band
     * @return this builder
     */
    public Builder photometry(List<String> filters, double... flux) {
      if (filters.size() != flux.length) {
        throw new IllegalArgumentException("filters and flux must have the same length");
      }
      this.filterNames = filters;
      for (FluxField field : FluxField.values()) {
        fluxes.put(field, flux.clone());
      }
      return this;
    }

    public FiberRecord build() {
      return new FiberRecord(
          fiberId,
          proposalId,
          catId,
          objId,
          targetType,
          tract,
          patch,
          ra,
          dec,
          pmRa,
          pmDec,
          parallax,
          obCode,
          pfiNominal,
          pfiCenter,
          fluxes.get(FluxField.FIBER_FLUX),
          fluxes.get(FluxField.PSF_FLUX),
          fluxes.get(FluxField.TOTAL_FLUX),
          fluxes.get(FluxField.FIBER_FLUX_ERR),
          fluxes.get(FluxField.PSF_FLUX_ERR),
          fluxes.get(FluxField.TOTAL_FLUX_ERR),
          filterNames);
    }
  }
}
