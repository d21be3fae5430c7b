package jp.naoj.pfs.redaction.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import jp.naoj.pfs.redaction.domain.redaction.ObjectIdStrategy;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; defaults.
   *
   * @param mode active command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    // an explicit salt on the command line replaces any environment indirection from YAML
    if (cliCopy.containsKey("salt") && !cliCopy.containsKey("saltEnv")) {
      merged.remove("saltEnv");
    }
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if (trim(effective.get("design")).isEmpty()) {
      throw new IllegalArgumentException("design is required for " + mode.toLowerCase(Locale.ROOT));
    }
    String strategy = trim(effective.get("objIdStrategy"));
    if (!strategy.isEmpty()
        && ObjectIdStrategy.parse(strategy) == ObjectIdStrategy.NEGATED_FIBER_ID
        && !trim(effective.get("salt")).isEmpty()) {
      throw new IllegalArgumentException("salt has no effect with objIdStrategy=NEGATED_FIBER_ID; remove it");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
