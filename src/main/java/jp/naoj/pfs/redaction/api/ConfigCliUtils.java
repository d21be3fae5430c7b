package jp.naoj.pfs.redaction.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import jp.naoj.pfs.redaction.config.ConfigMerger;
import jp.naoj.pfs.redaction.config.DefaultsForMode;
import jp.naoj.pfs.redaction.config.YamlConfigLoader;

/**
 * Shared helpers for layering CLI arguments over YAML and defaults.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config=PATH} argument.
   *
   * @param args mutable argument map
   * @return config path, or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Resolves the effective configuration for a command: CLI over YAML over defaults.
   *
   * @param mode command name
   * @param cli CLI arguments with {@code config} already removed
   * @param configPath optional YAML path
   * @param warn receives override warnings
   * @return merged configuration
   * @throws IllegalArgumentException when the YAML file is missing or invalid, or validation fails
   * @throws IOException when the YAML file cannot be read
   */
  static Map<String, String> effectiveConfig(
      String mode, Map<String, String> cli, String configPath, Consumer<String> warn) throws IOException {
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
    }
    return ConfigMerger.buildEffectiveConfig(mode, yaml, cli, DefaultsForMode.asFlatMap(mode), warn);
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }
}
