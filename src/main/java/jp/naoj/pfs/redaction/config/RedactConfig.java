package jp.naoj.pfs.redaction.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import jp.naoj.pfs.redaction.domain.design.DesignIdentifier;
import jp.naoj.pfs.redaction.domain.fiber.FluxField;
import jp.naoj.pfs.redaction.domain.redaction.MaskedField;
import jp.naoj.pfs.redaction.domain.redaction.MaskingConfigurationException;
import jp.naoj.pfs.redaction.domain.redaction.MaskingPolicy;
import jp.naoj.pfs.redaction.domain.redaction.ObjectIdStrategy;
import jp.naoj.pfs.redaction.infrastructure.metrics.MetricsSettings;
import jp.naoj.pfs.redaction.validation.Numbers;
import jp.naoj.pfs.redaction.validation.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Configuration of one {@code redact} run.
 * <p><strong>Why:</strong> Consolidates CLI flags, YAML and defaults into one validated value so a run is
 * reproducible.</p>
 * <p><strong>Role:</strong> Input of {@link CompositionRoot} and
 * {@link jp.naoj.pfs.redaction.application.pipeline.RedactionUseCase}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param source which configuration to read
 * @param outputDirectory directory receiving one file per proposal
 * @param prefix output file prefix; empty derives it from the input file name
 * @param workers proposals redacted concurrently
 * @param sequenceBase results are numbered from {@code sequenceBase + 1}
 * @param policy masking policy, including the secret salt when one is needed
 * @param metrics metrics exporter settings
 * @since 0.1.0
 * @see DefaultsForMode
 */
public record RedactConfig(
    SourceSelection source,
    Path outputDirectory,
    Optional<String> prefix,
    int workers,
    long sequenceBase,
    MaskingPolicy policy,
    MetricsSettings metrics) {

  private static final Logger log = LoggerFactory.getLogger(RedactConfig.class);

  /** Environment variable consulted for the salt when {@code saltEnv} is not set. */
  public static final String DEFAULT_SALT_ENV = "PFS_REDACTION_SALT";
  static final int MAX_WORKERS = 256;
  private static final String MASK_PREFIX = "mask.";

  public RedactConfig {
    Objects.requireNonNull(source, "source");
    outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory").toAbsolutePath().normalize();
    prefix = Objects.requireNonNullElse(prefix, Optional.<String>empty())
        .map(value -> Strings.sanitizeFileToken("prefix", value));
    Numbers.requireRange("workers", workers, 1, MAX_WORKERS);
    Numbers.requireRange("sequenceBase", sequenceBase, 0, Long.MAX_VALUE - 1_000_000L);
    Objects.requireNonNull(policy, "policy");
    Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Builds a configuration from flattened key/value pairs, reading the salt from the process environment.
   *
   * @param options merged configuration
   * @return validated configuration
   * @throws MaskingConfigurationException when the masking policy is unusable, including a missing salt
   * @throws IllegalArgumentException when any other value is invalid
   */
  public static RedactConfig fromMap(Map<String, String> options) {
    return fromMap(options, System::getenv);
  }

  /**
   * Builds a configuration from flattened key/value pairs.
   *
   * @param options merged configuration
   * @param environment environment lookup used for {@code saltEnv}
   * @return validated configuration
   * @throws MaskingConfigurationException when the masking policy is unusable, including a missing salt
   * @throws IllegalArgumentException when any other value is invalid
   */
  public static RedactConfig fromMap(Map<String, String> options, UnaryOperator<String> environment) {
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(environment, "environment");
    SourceSelection source = SourceSelection.fromMap(options);
    Path output = parsePath("out", options.getOrDefault("out", "./redacted"));
    Optional<String> prefix = optionalString(options.get("prefix"));
    int workers = (int) Numbers.requireRange("workers",
        Numbers.parseLong("workers", options.getOrDefault("workers", "1")), 1, MAX_WORKERS);
    long sequenceBase = Numbers.parseLong("sequenceBase", options.getOrDefault("sequenceBase", "0"));
    MaskingPolicy policy = parsePolicy(options, environment);
    MetricsSettings metrics = MetricsSettings.resolve(
        options.get("metricsExporter"), options.get("otelEndpoint"), options.get("otelResourceAttributes"));
    return new RedactConfig(source, output, prefix, workers, sequenceBase, policy, metrics);
  }

  /**
   * Returns the output prefix, falling back to the stem of the input file name.
   *
   * @return file-name safe prefix
   */
  public String effectivePrefix() {
    return prefix.orElseGet(() -> {
      String fileName = source.fileName();
      int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
      String base = fileName.substring(slash + 1);
      int dot = base.lastIndexOf('.');
      return Strings.sanitizeFileToken("prefix", dot > 0 ? base.substring(0, dot) : base);
    });
  }

  static MaskingPolicy parsePolicy(Map<String, String> options, UnaryOperator<String> environment) {
    MaskingPolicy.Builder builder = MaskingPolicy.builder();
    for (Map.Entry<String, String> entry : options.entrySet()) {
      String key = entry.getKey();
      if (!key.startsWith(MASK_PREFIX)) {
        continue;
      }
      String fieldName = key.substring(MASK_PREFIX.length());
      if (fieldName.equalsIgnoreCase("objId")) {
        throw new MaskingConfigurationException("mask.objId cannot be set; choose objIdStrategy instead");
      }
      String value = entry.getValue();
      if (value != null && !value.isEmpty()) {
        builder.override(MaskedField.parse(fieldName), value);
      }
    }

    optionalString(options.get("fluxFields")).ifPresent(raw -> builder.fluxFields(parseFluxFields(raw)));
    optionalString(options.get("fluxFill"))
        .ifPresent(raw -> builder.fluxFill(parseFill(raw)));
    String filterFill = options.get("filterFill");
    if (filterFill != null) {
      builder.filterFill(filterFill.trim());
    }

    ObjectIdStrategy strategy = optionalString(options.get("objIdStrategy"))
        .map(ObjectIdStrategy::parse)
        .orElse(ObjectIdStrategy.SALTED_HASH);
    builder.objIdStrategy(strategy);
    if (strategy == ObjectIdStrategy.SALTED_HASH) {
      builder.secretSalt(resolveSalt(options, environment));
    }
    MaskingPolicy policy = builder.build();
    // resolves the deriver now so a missing salt fails during configuration
    policy.objectIdDeriver();
    return policy;
  }

  private static String resolveSalt(Map<String, String> options, UnaryOperator<String> environment) {
    Optional<String> literal = optionalString(options.get("salt"));
    if (literal.isPresent()) {
      log.warn("Secret salt supplied as a literal option; prefer saltEnv so it stays out of shell history");
      return literal.get();
    }
    String variable = optionalString(options.get("saltEnv")).orElse(DEFAULT_SALT_ENV);
    // same trimming as the literal option
    return optionalString(environment.apply(variable)).orElseThrow(() -> new MaskingConfigurationException(
        "objIdStrategy=SALTED_HASH needs a secret salt: set environment variable " + variable
            + " or choose objIdStrategy=NEGATED_FIBER_ID"));
  }

  private static List<FluxField> parseFluxFields(String raw) {
    List<FluxField> fields = new ArrayList<>();
    if (raw.trim().equalsIgnoreCase("none")) {
      return fields;
    }
    for (String token : raw.split(",")) {
      if (token.isBlank()) {
        continue;
      }
      try {
        fields.add(FluxField.parse(token));
      } catch (IllegalArgumentException ex) {
        throw new MaskingConfigurationException("fluxFields: " + ex.getMessage(), ex);
      }
    }
    return fields;
  }

  private static double parseFill(String raw) {
    String normalized = raw.trim();
    if (normalized.toLowerCase(Locale.ROOT).equals("nan")) {
      return Double.NaN;
    }
    try {
      return Double.parseDouble(normalized);
    } catch (NumberFormatException ex) {
      throw new MaskingConfigurationException("fluxFill must be a number or NaN (was " + raw + ")", ex);
    }
  }

  private static Path parsePath(String key, String raw) {
    String value = raw == null || raw.isBlank() ? "." : raw.trim();
    try {
      return Path.of(value);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " must be a valid path (was " + raw + ")", ex);
    }
  }

  private static Optional<String> optionalString(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }

  @Override
  public String toString() {
    return "RedactConfig{design=" + describe(source.design())
        + ", visit=" + source.visit()
        + ", in=" + source.inputDirectory()
        + ", out=" + outputDirectory
        + ", prefix=" + prefix.orElse("<derived>")
        + ", workers=" + workers
        + ", sequenceBase=" + sequenceBase
        + ", policy=" + policy
        + ", metricsExporter=" + metrics.exporter() + '}';
  }

  private static String describe(DesignIdentifier design) {
    return design.fileName().orElseGet(() -> String.format(Locale.ROOT, "0x%016x", design.designId().getAsLong()));
  }
}
