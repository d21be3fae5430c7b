package jp.naoj.pfs.redaction.domain.fiber;

import java.util.Locale;

/**
 * Per-band photometry sequences carried by a {@link FiberRecord}.
 *
 * <p>Each sequence holds one value per entry of {@link FiberRecord#filterNames()}; the length may
 * differ from fiber to fiber.</p>
 *
 * @since 0.1.0
 */
public enum FluxField {
  FIBER_FLUX("fiberFlux"),
  PSF_FLUX("psfFlux"),
  TOTAL_FLUX("totalFlux"),
  FIBER_FLUX_ERR("fiberFluxErr"),
  PSF_FLUX_ERR("psfFluxErr"),
  TOTAL_FLUX_ERR("totalFluxErr");

  private final String columnName;

  FluxField(String columnName) {
    this.columnName = columnName;
  }

  /**
   * Returns the datamodel column name, e.g. {@code psfFluxErr}.
   *
   * @return column name used in configuration files
   */
  public String columnName() {
    return columnName;
  }

  /**
   * Resolves a flux field from its column name or enum name, ignoring case.
   *
   * @param raw value such as {@code fiberFlux} or {@code FIBER_FLUX}
   * @return matching field
   * @throws IllegalArgumentException when nothing matches
   */
  public static FluxField parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("flux field must not be blank");
    }
    String trimmed = raw.trim();
    for (FluxField field : values()) {
      if (field.columnName.equalsIgnoreCase(trimmed) || field.name().equals(trimmed.toUpperCase(Locale.ROOT))) {
        return field;
      }
    }
    throw new IllegalArgumentException("unknown flux field: " + raw);
  }
}
