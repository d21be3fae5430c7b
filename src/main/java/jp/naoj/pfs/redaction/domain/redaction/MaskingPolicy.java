package jp.naoj.pfs.redaction.domain.redaction;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import jp.naoj.pfs.redaction.domain.fiber.FluxField;
import jp.naoj.pfs.redaction.domain.fiber.FocalPlanePoint;
import jp.naoj.pfs.redaction.domain.fiber.TargetType;
import jp.naoj.pfs.redaction.logging.Logs;

/**
 * <strong>What:</strong> Describes which columns of a masked fiber are overwritten and with what.
 * <p><strong>Why:</strong> Keeps every replacement value in one typed table that callers can override
 * field by field.</p>
 * <p><strong>Role:</strong> Immutable configuration consumed by {@link RowMasker} and the redaction engine.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hold a complete override for every {@link MaskedField}, defaulting the ones callers omit.</li>
 *   <li>Name the flux columns to blank, the flux fill value, and the filter fill token.</li>
 *   <li>Select the {@link ObjectIdStrategy} and carry its secret salt.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; share freely between redaction workers.</p>
 *
 * @param overrides replacement value per masked field; always complete after construction
 * @param fluxFields flux columns replaced element-wise by {@code fluxFill}
 * @param fluxFill value written into every element of the listed flux columns
 * @param filterFill token written into every element of {@code filterNames}
 * @param objIdStrategy how the masked {@code objId} is derived
 * @param secretSalt salt for {@link ObjectIdStrategy#SALTED_HASH}; never logged
 * @since 0.1.0
 */
public record MaskingPolicy(
    Map<MaskedField, Object> overrides,
    Set<FluxField> fluxFields,
    double fluxFill,
    String filterFill,
    ObjectIdStrategy objIdStrategy,
    Optional<String> secretSalt) {

  public static final int DEFAULT_CAT_ID = 9000;
  public static final String DEFAULT_FILTER_FILL = "none";
  public static final String MASKED_TEXT = "masked";

  private static final Map<MaskedField, Object> DEFAULT_OVERRIDES = defaultOverrides();

  /**
   * Completes the override table with defaults and validates every value.
   *
   * @throws MaskingConfigurationException when a value has the wrong type or the filter token is blank
   */
  public MaskingPolicy {
    Map<MaskedField, Object> merged = new EnumMap<>(DEFAULT_OVERRIDES);
    if (overrides != null) {
      overrides.forEach((field, value) -> merged.put(
          Objects.requireNonNull(field, "override field"), field.coerce(value)));
    }
    overrides = Collections.unmodifiableMap(merged);
    fluxFields = fluxFields == null
        ? Collections.unmodifiableSet(EnumSet.allOf(FluxField.class))
        : Collections.unmodifiableSet(fluxFields.isEmpty() ? EnumSet.noneOf(FluxField.class) : EnumSet.copyOf(fluxFields));
    if (filterFill == null || filterFill.isBlank()) {
      throw new MaskingConfigurationException("filterFill must be a non-blank string");
    }
    objIdStrategy = Objects.requireNonNullElse(objIdStrategy, ObjectIdStrategy.SALTED_HASH);
    secretSalt = Objects.requireNonNullElse(secretSalt, Optional.<String>empty()).filter(s -> !s.isBlank());
  }

  /**
   * Default policy: every field masked with its documented value, NaN flux fill, {@code "none"}
   * filters, salted-hash identifiers without a salt.
   *
   * <p>A salt must still be supplied before use with {@link ObjectIdStrategy#SALTED_HASH}; see
   * {@link #objectIdDeriver()}.</p>
   *
   * @return default policy
   */
  public static MaskingPolicy defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the replacement for one field.
   *
   * @param field masked field
   * @return coerced replacement value
   */
  public Object override(MaskedField field) {
    return overrides.get(field);
  }

  public int catIdOverride() {
    return (Integer) overrides.get(MaskedField.CAT_ID);
  }

  /**
   * Builds the object-identifier deriver this policy selects.
   *
   * @return deriver ready for use
   * @throws MaskingConfigurationException when the salted-hash strategy lacks a salt
   */
  public ObjectIdDeriver objectIdDeriver() {
    return objIdStrategy.deriver(secretSalt);
  }

  public Builder toBuilder() {
    Builder builder = new Builder()
        .fluxFields(fluxFields)
        .fluxFill(fluxFill)
        .filterFill(filterFill)
        .objIdStrategy(objIdStrategy);
    secretSalt.ifPresent(builder::secretSalt);
    overrides.forEach(builder::override);
    return builder;
  }

  @Override
  public String toString() {
    return "MaskingPolicy{overrides=" + overrides
        + ", fluxFields=" + fluxFields
        + ", fluxFill=" + fluxFill
        + ", filterFill='" + filterFill + '\''
        + ", objIdStrategy=" + objIdStrategy
        + ", secretSalt=" + secretSalt.map(Logs::redact).orElse("<unset>") + '}';
  }

  private static Map<MaskedField, Object> defaultOverrides() {
    Map<MaskedField, Object> map = new EnumMap<>(MaskedField.class);
    map.put(MaskedField.CAT_ID, DEFAULT_CAT_ID);
    map.put(MaskedField.TRACT, -1);
    map.put(MaskedField.PATCH, "-1,-1");
    map.put(MaskedField.RA, -99.0);
    map.put(MaskedField.DEC, -99.0);
    map.put(MaskedField.PM_RA, 0.0);
    map.put(MaskedField.PM_DEC, 0.0);
    map.put(MaskedField.PARALLAX, 1.0e-7);
    map.put(MaskedField.PROPOSAL_ID, MASKED_TEXT);
    map.put(MaskedField.OB_CODE, MASKED_TEXT);
    map.put(MaskedField.PFI_NOMINAL, FocalPlanePoint.NAN);
    map.put(MaskedField.PFI_CENTER, FocalPlanePoint.NAN);
    map.put(MaskedField.TARGET_TYPE, TargetType.SCIENCE_MASKED);
    return Collections.unmodifiableMap(map);
  }

  /** Mutable builder; values are validated by {@link #build()}. */
  public static final class Builder {
    private final Map<MaskedField, Object> overrides = new EnumMap<>(MaskedField.class);
    private Set<FluxField> fluxFields;
    private double fluxFill = Double.NaN;
    private String filterFill = DEFAULT_FILTER_FILL;
    private ObjectIdStrategy objIdStrategy = ObjectIdStrategy.SALTED_HASH;
    private String secretSalt;

    private Builder() {}

    public Builder override(MaskedField field, Object value) {
      overrides.put(Objects.requireNonNull(field, "field"), value);
      return this;
    }

    public Builder catIdOverride(int catId) {
      return override(MaskedField.CAT_ID, catId);
    }

    public Builder fluxFields(Collection<FluxField> fields) {
      this.fluxFields = fields == null ? null : (fields.isEmpty() ? EnumSet.noneOf(FluxField.class) : EnumSet.copyOf(fields));
      return this;
    }

    public Builder fluxFill(double value) {
      this.fluxFill = value;
      return this;
    }

    public Builder filterFill(String value) {
      this.filterFill = value;
      return this;
    }

    public Builder objIdStrategy(ObjectIdStrategy value) {
      this.objIdStrategy = value;
      return this;
    }

    public Builder secretSalt(String value) {
      this.secretSalt = value;
      return this;
    }

    public MaskingPolicy build() {
      return new MaskingPolicy(
          overrides, fluxFields, fluxFill, filterFill, objIdStrategy, Optional.ofNullable(secretSalt));
    }
  }
}
