package ca.gc.cra.noodles.config;

import ca.gc.cra.noodles.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;

/**
 * Metrics exporter settings handed to the OpenTelemetry bootstrap.
 *
 * @param exporter {@code otlp} or {@code none}
 * @param endpoint OTLP endpoint; blank falls back to {@code OTEL_EXPORTER_OTLP_ENDPOINT} or the SDK default
 * @param resourceAttributes comma-separated {@code key=value} pairs; may be blank
 * @since 0.1.0
 */
public record TelemetrySettings(String exporter, String endpoint, String resourceAttributes) {
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  public TelemetrySettings {
    exporter = Objects.requireNonNull(exporter, "exporter").trim().toLowerCase(Locale.ROOT);
    if (!exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none' (was '" + exporter + "')");
    }
    endpoint = endpoint == null ? "" : endpoint.trim();
    if (!endpoint.isEmpty()) {
      requireHttpUri(endpoint);
    }
    resourceAttributes = resourceAttributes == null || resourceAttributes.isBlank()
        ? ""
        : Strings.requirePrintableAscii("otelResourceAttributes", resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
  }

  public boolean enabled() {
    return exporter.equals("otlp");
  }

  private static void requireHttpUri(String raw) {
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
  }
}
