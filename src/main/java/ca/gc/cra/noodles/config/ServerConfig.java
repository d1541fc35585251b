package ca.gc.cra.noodles.config;

import ca.gc.cra.noodles.application.pipeline.ReplicationServer;
import ca.gc.cra.noodles.infrastructure.scene.Scenes;
import ca.gc.cra.noodles.infrastructure.websocket.WebSocketFrames;
import ca.gc.cra.noodles.validation.Net;
import ca.gc.cra.noodles.validation.Numbers;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Validated settings for the {@code serve} command.
 * <p><strong>Role:</strong> Immutable configuration value consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param host bind host for both listeners
 * @param port WebSocket port; {@code 0} picks a free port
 * @param assetPort HTTP asset port; {@code 0} picks a free port
 * @param maxFramePayload largest accepted inbound frame or message, in bytes
 * @param handshakeTimeoutMillis budget for a client's whole upgrade request
 * @param clientQueueCapacity per-client outbound queue bound
 * @param inlineBufferLimit largest buffer sent inline instead of through the asset host
 * @param tickInterval period of the tick thread
 * @param shutdownDrainTimeout bound on draining queued output at shutdown
 * @param scene scene name understood by {@link Scenes#create(String)}
 * @param telemetry metrics exporter settings
 * @param verbose whether DEBUG logging was requested through configuration
 * @since 0.1.0
 */
public record ServerConfig(
    String host,
    int port,
    int assetPort,
    long maxFramePayload,
    int handshakeTimeoutMillis,
    int clientQueueCapacity,
    int inlineBufferLimit,
    Duration tickInterval,
    Duration shutdownDrainTimeout,
    String scene,
    TelemetrySettings telemetry,
    boolean verbose) {

  /** Largest {@code maxFramePayload} the WebSocket transport accepts. */
  public static final long MAX_FRAME_PAYLOAD_CEILING = WebSocketFrames.MAX_PAYLOAD_LIMIT;

  public ServerConfig {
    host = Net.requireBindHost(host);
    Net.requirePort("port", port, true);
    Net.requirePort("assetPort", assetPort, true);
    if (port != 0 && port == assetPort) {
      throw new IllegalArgumentException("assetPort must differ from port (both " + port + ")");
    }
    Numbers.requireRange("maxFramePayload", maxFramePayload, 1, MAX_FRAME_PAYLOAD_CEILING);
    Numbers.requireRange("handshakeTimeoutMillis", handshakeTimeoutMillis, 1, 600_000);
    Numbers.requireRange("clientQueueCapacity", clientQueueCapacity, 1, 1_000_000);
    Numbers.requireRange("inlineBufferLimit", inlineBufferLimit, 0, 64L * 1024 * 1024);
    Objects.requireNonNull(tickInterval, "tickInterval");
    Numbers.requireRange("tickMillis", tickInterval.toMillis(), 1, 60_000);
    Numbers.requireRange("shutdownDrainMillis", shutdownDrainTimeout.toMillis(), 0, 600_000);
    scene = Objects.requireNonNull(scene, "scene").trim().toLowerCase(Locale.ROOT);
    if (!Scenes.names().contains(scene)) {
      throw new IllegalArgumentException("scene must be one of " + Scenes.names() + " (was '" + scene + "')");
    }
    Objects.requireNonNull(telemetry, "telemetry");
  }

  /**
   * Returns the built-in defaults: all interfaces, port 50000, assets on 50001, 16 ms ticks and the
   * orbit demo scene.
   *
   * @return default configuration
   */
  public static ServerConfig defaults() {
    return fromMap(Map.of());
  }

  /**
   * Parses an effective configuration map keyed by {@link ServerOption#key()}. Missing or blank
   * values take the option's default.
   *
   * @param values flattened key/value pairs
   * @return validated configuration
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static ServerConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    int port = (int) number(values, ServerOption.PORT, 0, 65535);
    String rawAssetPort = value(values, ServerOption.ASSET_PORT);
    int assetPort = rawAssetPort.isEmpty()
        ? derivedAssetPort(port)
        : (int) Numbers.parseInRange("assetPort", rawAssetPort, 0, 65535);
    return new ServerConfig(
        value(values, ServerOption.HOST),
        port,
        assetPort,
        number(values, ServerOption.MAX_FRAME_PAYLOAD, 1, MAX_FRAME_PAYLOAD_CEILING),
        (int) number(values, ServerOption.HANDSHAKE_TIMEOUT_MILLIS, 1, 600_000),
        (int) number(values, ServerOption.CLIENT_QUEUE_CAPACITY, 1, 1_000_000),
        (int) number(values, ServerOption.INLINE_BUFFER_LIMIT, 0, 64L * 1024 * 1024),
        Duration.ofMillis(number(values, ServerOption.TICK_MILLIS, 1, 60_000)),
        Duration.ofMillis(number(values, ServerOption.SHUTDOWN_DRAIN_MILLIS, 0, 600_000)),
        value(values, ServerOption.SCENE),
        new TelemetrySettings(
            value(values, ServerOption.METRICS_EXPORTER),
            value(values, ServerOption.OTEL_ENDPOINT),
            value(values, ServerOption.OTEL_RESOURCE_ATTRIBUTES)),
        Boolean.parseBoolean(value(values, ServerOption.VERBOSE)));
  }

  /**
   * Projects the pipeline tuning parameters.
   *
   * @return settings for {@link ReplicationServer}
   */
  public ReplicationServer.Settings serverSettings() {
    return new ReplicationServer.Settings(
        clientQueueCapacity, inlineBufferLimit, tickInterval, shutdownDrainTimeout);
  }

  private static int derivedAssetPort(int port) {
    if (port == 0) {
      return 0;
    }
    if (port == 65535) {
      throw new IllegalArgumentException("assetPort must be set explicitly when port is 65535");
    }
    return port + 1;
  }

  private static String value(Map<String, String> values, ServerOption option) {
    String raw = values.get(option.key());
    return raw == null || raw.isBlank() ? option.defaultValue() : raw.trim();
  }

  private static long number(Map<String, String> values, ServerOption option, long min, long max) {
    return Numbers.parseInRange(option.key(), value(values, option), min, max);
  }
}
