package jp.naoj.pfs.redaction.domain.fiber;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Ordered fiber table plus header of one design or exposure configuration.
 * <p><strong>Why:</strong> The unit the redaction engine reads from and produces per proposal.</p>
 * <p><strong>Role:</strong> Domain aggregate passed between loaders, the engine and writers.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share between redaction workers.</p>
 *
 * <p>Row index is the fiber position in the source file and is not necessarily sorted by
 * {@link FiberRecord#fiberId()}.</p>
 *
 * @since 0.1.0
 */
public final class ConfigurationSet {
  private final DesignHeader header;
  private final List<FiberRecord> rows;

  /**
   * Creates a configuration from a header and rows. The row list is copied.
   *
   * @param header header metadata; must not be {@code null}
   * @param rows fiber rows in file order; must not be {@code null} or contain {@code null}
   */
  public ConfigurationSet(DesignHeader header, List<FiberRecord> rows) {
    this.header = Objects.requireNonNull(header, "header");
    this.rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
  }

  public DesignHeader header() {
    return header;
  }

  /**
   * Returns the rows in file order.
   *
   * @return unmodifiable row list
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Rows are held in an unmodifiable List.copyOf; each FiberRecord copies its arrays.")
  public List<FiberRecord> rows() {
    return rows;
  }

  public int size() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public FiberRecord row(int index) {
    return rows.get(index);
  }

  /**
   * Produces a fully independent copy: every row is rebuilt with freshly allocated arrays.
   *
   * @return mutable row list owned by the caller, in file order
   */
  public List<FiberRecord> copyRows() {
    List<FiberRecord> copy = new ArrayList<>(rows.size());
    for (FiberRecord row : rows) {
      copy.add(row.deepCopy());
    }
    return copy;
  }

  /**
   * Produces an independent copy of this configuration.
   *
   * @return configuration equal to this one sharing no arrays with it
   */
  public ConfigurationSet deepCopy() {
    return new ConfigurationSet(header, copyRows());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ConfigurationSet that)) {
      return false;
    }
    return header.equals(that.header) && rows.equals(that.rows);
  }

  @Override
  public int hashCode() {
    return Objects.hash(header, rows);
  }

  @Override
  public String toString() {
    return "ConfigurationSet{design=" + header.designIdHex()
        + ", frameId='" + header.frameId() + '\''
        + ", fibers=" + rows.size() + '}';
  }

  /**
   * Empty configuration with a zeroed header; used by tests and dry runs.
   *
   * @return configuration without rows
   */
  public static ConfigurationSet empty() {
    return new ConfigurationSet(
        new DesignHeader("", 0L, "", FiberRecord.NO_PROPOSAL, OptionalInt.empty()),
        Collections.emptyList());
  }
}
