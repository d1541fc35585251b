package ca.gc.cra.noodles.config;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Every setting the {@code serve} command understands, with its CLI key, its path in the YAML
 * file, its default and its help line.
 *
 * <p>An empty default means "derived" (the asset port) or "library default" (the OTLP endpoint).</p>
 *
 * @since 0.1.0
 */
public enum ServerOption {
  HOST("host", "server.host", "ADDR", "0.0.0.0", "Bind address for both listeners"),
  PORT("port", "server.port", "0-65535", "50000", "WebSocket port; 0 picks a free port"),
  ASSET_PORT("assetPort", "server.assetPort", "0-65535", "", "HTTP asset port; blank means port+1"),
  MAX_FRAME_PAYLOAD("maxFramePayload", "server.maxFramePayload", "BYTES", "100000000",
      "Largest accepted inbound frame or message"),
  HANDSHAKE_TIMEOUT_MILLIS("handshakeTimeoutMillis", "server.handshakeTimeoutMillis", "MS", "10000",
      "Time a client has to finish its upgrade request"),
  CLIENT_QUEUE_CAPACITY("clientQueueCapacity", "server.clientQueueCapacity", "N", "4096",
      "Outbound messages queued per client before it is evicted"),
  SHUTDOWN_DRAIN_MILLIS("shutdownDrainMillis", "server.shutdownDrainMillis", "MS", "5000",
      "Bound on flushing queued output at shutdown"),
  SCENE("scene", "scene.name", "orbit|none", "orbit", "Scene driven on the tick thread"),
  TICK_MILLIS("tickMillis", "scene.tickMillis", "1-60000", "16", "Tick period"),
  INLINE_BUFFER_LIMIT("inlineBufferLimit", "scene.inlineBufferLimit", "BYTES", "1024",
      "Largest buffer sent inline; larger ones are hosted over HTTP"),
  METRICS_EXPORTER("metricsExporter", "telemetry.exporter", "otlp|none", "otlp", "Metrics exporter"),
  OTEL_ENDPOINT("otelEndpoint", "telemetry.endpoint", "URL", "", "OTLP endpoint when the exporter is otlp"),
  OTEL_RESOURCE_ATTRIBUTES("otelResourceAttributes", "telemetry.resourceAttributes", "K=V,...", "",
      "Extra OpenTelemetry resource attributes"),
  VERBOSE("verbose", "logging.verbose", "true|false", "false", "DEBUG logging");

  private static final Map<String, ServerOption> BY_KEY = index(ServerOption::key);
  private static final Map<String, ServerOption> BY_YAML_PATH = index(ServerOption::yamlPath);

  private final String key;
  private final String yamlPath;
  private final String placeholder;
  private final String defaultValue;
  private final String description;

  ServerOption(String key, String yamlPath, String placeholder, String defaultValue, String description) {
    this.key = key;
    this.yamlPath = yamlPath;
    this.placeholder = placeholder;
    this.defaultValue = defaultValue;
    this.description = description;
  }

  public String key() {
    return key;
  }

  public String yamlPath() {
    return yamlPath;
  }

  public String defaultValue() {
    return defaultValue;
  }

  public static Optional<ServerOption> forKey(String key) {
    return Optional.ofNullable(BY_KEY.get(key));
  }

  public static Optional<ServerOption> forYamlPath(String path) {
    return Optional.ofNullable(BY_YAML_PATH.get(path));
  }

  /**
   * Returns every default keyed by CLI key, in declaration order.
   *
   * @return unmodifiable defaults
   */
  public static Map<String, String> defaults() {
    Map<String, String> defaults = new LinkedHashMap<>();
    for (ServerOption option : values()) {
      defaults.put(option.key, option.defaultValue);
    }
    return Collections.unmodifiableMap(defaults);
  }

  /**
   * Formats the option for help output, e.g. {@code port=0-65535  WebSocket port... (default 50000)}.
   *
   * @param width column the description starts at
   * @return help line without indentation
   */
  public String helpLine(int width) {
    String syntax = key + "=" + placeholder;
    String padded = syntax.length() >= width ? syntax + " " : String.format("%-" + width + "s", syntax);
    return padded + description + (defaultValue.isEmpty() ? "" : " (default " + defaultValue + ")");
  }

  private static Map<String, ServerOption> index(Function<ServerOption, String> keyOf) {
    return Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(keyOf, Function.identity()));
  }
}
