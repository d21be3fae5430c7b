package jp.naoj.pfs.redaction.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import jp.naoj.pfs.redaction.domain.fiber.FluxField;
import jp.naoj.pfs.redaction.domain.redaction.MaskingPolicy;
import jp.naoj.pfs.redaction.domain.redaction.ObjectIdStrategy;

/**
 * Supplies flattened default configuration maps for each CLI command.
 *
 * <p>The defaults are the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param mode command name ({@code redact} or {@code proposals})
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "redact" -> buildRedactDefaults();
      case "proposals" -> Map.of();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("design", "");
    map.put("idType", "auto");
    map.put("visit", "");
    map.put("in", ".");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildRedactDefaults() {
    MaskingPolicy policy = MaskingPolicy.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("out", "./redacted");
    map.put("prefix", "");
    map.put("workers", "1");
    map.put("sequenceBase", "0");
    map.put("objIdStrategy", ObjectIdStrategy.SALTED_HASH.name());
    map.put("salt", "");
    map.put("saltEnv", RedactConfig.DEFAULT_SALT_ENV);
    map.put("mask.catId", Integer.toString(policy.catIdOverride()));
    map.put("fluxFields", joinFluxFields());
    map.put("fluxFill", Double.toString(policy.fluxFill()));
    map.put("filterFill", policy.filterFill());
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return map;
  }

  private static String joinFluxFields() {
    StringBuilder joined = new StringBuilder();
    for (FluxField field : FluxField.values()) {
      if (joined.length() > 0) {
        joined.append(',');
      }
      joined.append(field.columnName());
    }
    return joined.toString();
  }
}
