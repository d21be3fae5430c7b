package jp.naoj.pfs.redaction.domain.redaction;

import java.util.Locale;
import jp.naoj.pfs.redaction.domain.fiber.FiberRecord;
import jp.naoj.pfs.redaction.domain.fiber.FocalPlanePoint;
import jp.naoj.pfs.redaction.domain.fiber.TargetType;

/**
 * Scalar columns a masking policy may overwrite, each with the type its replacement must have.
 *
 * <p>Replacement values are held as plain objects inside {@link MaskingPolicy}; {@link #coerce(Object)}
 * normalizes them once when the policy is built so that {@link #apply(FiberRecord.Builder, Object)}
 * never sees a value of the wrong type. {@code objId} is absent: it is always derived by an
 * {@link ObjectIdDeriver}.</p>
 *
 * @since 0.1.0
 */
public enum MaskedField {
  CAT_ID("catId", ValueKind.INT),
  TRACT("tract", ValueKind.INT),
  PATCH("patch", ValueKind.STRING),
  RA("ra", ValueKind.DOUBLE),
  DEC("dec", ValueKind.DOUBLE),
  PM_RA("pmRa", ValueKind.DOUBLE),
  PM_DEC("pmDec", ValueKind.DOUBLE),
  PARALLAX("parallax", ValueKind.DOUBLE),
  PROPOSAL_ID("proposalId", ValueKind.STRING),
  OB_CODE("obCode", ValueKind.STRING),
  PFI_NOMINAL("pfiNominal", ValueKind.POINT),
  PFI_CENTER("pfiCenter", ValueKind.POINT),
  TARGET_TYPE("targetType", ValueKind.TARGET_TYPE);

  /** Java type a replacement value is normalized to. */
  public enum ValueKind {
    INT,
    DOUBLE,
    STRING,
    POINT,
    TARGET_TYPE
  }

  private final String columnName;
  private final ValueKind kind;

  MaskedField(String columnName, ValueKind kind) {
    this.columnName = columnName;
    this.kind = kind;
  }

  public String columnName() {
    return columnName;
  }

  public ValueKind kind() {
    return kind;
  }

  /**
   * Normalizes a replacement value to this field's type.
   *
   * <p>Numbers are accepted for numeric fields as long as no precision is lost; strings are parsed,
   * which lets configuration files supply every override as text.</p>
   *
   * @param value candidate replacement
   * @return value of the field's {@link ValueKind}
   * @throws MaskingConfigurationException when the value is {@code null} or cannot be converted
   */
  public Object coerce(Object value) {
    if (value == null) {
      throw new MaskingConfigurationException("mask." + columnName + " must not be null");
    }
    try {
      return switch (kind) {
        case INT -> toInt(value);
        case DOUBLE -> toDouble(value);
        case STRING -> toText(value);
        case POINT -> value instanceof FocalPlanePoint point ? point : FocalPlanePoint.parse(toText(value));
        case TARGET_TYPE -> value instanceof TargetType type ? type : TargetType.parse(toText(value));
      };
    } catch (MaskingConfigurationException ex) {
      throw ex;
    } catch (IllegalArgumentException ex) {
      throw new MaskingConfigurationException(
          "mask." + columnName + " expects " + kind.name().toLowerCase(Locale.ROOT) + " (was " + value + ")", ex);
    }
  }

  /**
   * Writes a coerced replacement value into a row builder.
   *
   * @param builder builder of the row being masked
   * @param value value previously returned by {@link #coerce(Object)}
   */
  public void apply(FiberRecord.Builder builder, Object value) {
    switch (this) {
      case CAT_ID -> builder.catId((Integer) value);
      case TRACT -> builder.tract((Integer) value);
      case PATCH -> builder.patch((String) value);
      case RA -> builder.ra((Double) value);
      case DEC -> builder.dec((Double) value);
      case PM_RA -> builder.pmRa((Double) value);
      case PM_DEC -> builder.pmDec((Double) value);
      case PARALLAX -> builder.parallax((Double) value);
      case PROPOSAL_ID -> builder.proposalId((String) value);
      case OB_CODE -> builder.obCode((String) value);
      case PFI_NOMINAL -> builder.pfiNominal((FocalPlanePoint) value);
      case PFI_CENTER -> builder.pfiCenter((FocalPlanePoint) value);
      case TARGET_TYPE -> builder.targetType((TargetType) value);
    }
  }

  /**
   * Resolves a field from its column name ({@code pmRa}) or enum name ({@code PM_RA}).
   *
   * @param raw field name
   * @return matching field
   * @throws MaskingConfigurationException when nothing matches
   */
  public static MaskedField parse(String raw) {
    if (raw != null) {
      String trimmed = raw.trim();
      for (MaskedField field : values()) {
        if (field.columnName.equalsIgnoreCase(trimmed) || field.name().equalsIgnoreCase(trimmed)) {
          return field;
        }
      }
    }
    throw new MaskingConfigurationException("unknown masked field: " + raw);
  }

  private static Integer toInt(Object value) {
    if (value instanceof Integer i) {
      return i;
    }
    if (value instanceof Number n) {
      double d = n.doubleValue();
      if (d != Math.rint(d) || d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) {
        throw new IllegalArgumentException("not an integer: " + value);
      }
      return (int) d;
    }
    if (value instanceof String s) {
      return Integer.valueOf(s.trim());
    }
    throw new IllegalArgumentException("not an integer: " + value);
  }

  private static Double toDouble(Object value) {
    if (value instanceof Number n) {
      return n.doubleValue();
    }
    if (value instanceof String s) {
      return Double.valueOf(s.trim());
    }
    throw new IllegalArgumentException("not a number: " + value);
  }

  private static String toText(Object value) {
    if (value instanceof String s) {
      return s;
    }
    throw new IllegalArgumentException("not a string: " + value);
  }
}
