package jp.naoj.pfs.redaction.infrastructure.metrics;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;

/**
 * Exporter settings for the OpenTelemetry metrics pipeline.
 *
 * <p>Values come from the {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes}
 * configuration keys; anything left blank falls back to the standard {@code otel.*} system properties,
 * then to the {@code OTEL_*} environment variables, then to the defaults.</p>
 *
 * @param exporter exporter to install
 * @param endpoint OTLP gRPC endpoint
 * @param resourceAttributes extra resource attributes as {@code k=v,k2=v2}; may be empty
 * @since 0.1.0
 */
public record MetricsSettings(ExporterMode exporter, String endpoint, String resourceAttributes) {
  static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  /** Supported exporters. */
  public enum ExporterMode {
    OTLP,
    NONE;

    /**
     * Parses an exporter name.
     *
     * @param raw {@code otlp} or {@code none}, any case
     * @return exporter mode
     * @throws IllegalArgumentException for any other value
     */
    public static ExporterMode parse(String raw) {
      String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
      return switch (normalized) {
        case "otlp" -> OTLP;
        case "none" -> NONE;
        default -> throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none' (was " + raw + ")");
      };
    }
  }

  public MetricsSettings {
    Objects.requireNonNull(exporter, "exporter");
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
    if (exporter == ExporterMode.OTLP) {
      validateEndpoint(endpoint);
    }
  }

  /**
   * Resolves settings from explicit values with system property and environment fallbacks.
   *
   * @param exporter configured exporter name; blank to fall back
   * @param endpoint configured endpoint; blank to fall back
   * @param resourceAttributes configured attributes; blank to fall back
   * @return resolved settings
   * @throws IllegalArgumentException when the exporter or endpoint is invalid
   */
  public static MetricsSettings resolve(String exporter, String endpoint, String resourceAttributes) {
    String exporterValue = firstNonBlank(exporter,
        System.getProperty("otel.metrics.exporter"), System.getenv("OTEL_METRICS_EXPORTER"), "otlp");
    String endpointValue = firstNonBlank(endpoint,
        System.getProperty("otel.exporter.otlp.endpoint"), System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"),
        DEFAULT_ENDPOINT);
    String attributes = firstNonBlank(resourceAttributes,
        System.getProperty("otel.resource.attributes"), System.getenv("OTEL_RESOURCE_ATTRIBUTES"), "");
    return new MetricsSettings(ExporterMode.parse(exporterValue), endpointValue, attributes);
  }

  /**
   * Settings that disable export entirely.
   *
   * @return settings with {@link ExporterMode#NONE}
   */
  public static MetricsSettings disabled() {
    return new MetricsSettings(ExporterMode.NONE, DEFAULT_ENDPOINT, "");
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme (was " + raw + ")");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host (was " + raw + ")");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI (was " + raw + ")", ex);
    }
  }

  private static String firstNonBlank(String... values) {
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return "";
  }
}
