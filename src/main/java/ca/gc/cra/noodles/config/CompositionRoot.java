package ca.gc.cra.noodles.config;

import ca.gc.cra.noodles.application.pipeline.ReplicationServer;
import ca.gc.cra.noodles.application.port.MetricsPort;
import ca.gc.cra.noodles.infrastructure.asset.HttpAssetServer;
import ca.gc.cra.noodles.infrastructure.codec.CborMessageCodec;
import ca.gc.cra.noodles.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.noodles.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.noodles.infrastructure.scene.Scenes;
import ca.gc.cra.noodles.infrastructure.websocket.WebSocketServer;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the replication server to its concrete adapters.
 * <p><strong>Role:</strong> Composition root between configuration and the application layer.</p>
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Bind the WebSocket listener and the HTTP asset host.</li>
 *   <li>Select the scene authority and the metrics adapter.</li>
 *   <li>Release the listeners and flush metrics on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Intended for the CLI thread only.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final ServerConfig config;
  private final Supplier<MetricsPort> metricsFactory;
  private MetricsPort metrics;
  private WebSocketServer webSocketServer;
  private HttpAssetServer assetServer;
  private ReplicationServer server;

  /**
   * Creates a root whose metrics go to the OpenTelemetry exporter named in {@code config}.
   *
   * @param config validated server configuration
   */
  public CompositionRoot(ServerConfig config) {
    this(config, () -> new OpenTelemetryMetricsAdapter(
        config.telemetry().exporter(), config.telemetry().endpoint(), config.telemetry().resourceAttributes()));
  }

  /**
   * Creates a root with an explicit metrics factory.
   *
   * @param config validated server configuration
   * @param metricsFactory invoked once, on the first call to {@link #replicationServer()}
   */
  public CompositionRoot(ServerConfig config, Supplier<MetricsPort> metricsFactory) {
    this.config = Objects.requireNonNull(config, "config");
    this.metricsFactory = Objects.requireNonNull(metricsFactory, "metricsFactory");
  }

  /**
   * Binds both listeners and builds the server. Later calls return the same instance.
   *
   * @return ready-to-run replication server
   * @throws IOException if either listener cannot be bound
   */
  public synchronized ReplicationServer replicationServer() throws IOException {
    if (server != null) {
      return server;
    }
    metrics = metricsFactory.get();
    assetServer = new HttpAssetServer(
        new InetSocketAddress(config.host(), config.assetPort()),
        ExecutorFactories.newClientPool("noodles-asset",
            (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex)));
    assetServer.start();
    webSocketServer = new WebSocketServer(
        new InetSocketAddress(config.host(), config.port()),
        config.maxFramePayload(),
        config.handshakeTimeoutMillis(),
        metrics);
    webSocketServer.start();
    server = new ReplicationServer(
        webSocketServer,
        new CborMessageCodec(),
        assetServer,
        Scenes.create(config.scene()),
        metrics,
        config.serverSettings());
    return server;
  }

  /**
   * Returns the bound asset port, or {@code -1} before {@link #replicationServer()}.
   *
   * @return asset port
   */
  public synchronized int assetPort() {
    return assetServer == null ? -1 : assetServer.port();
  }

  @Override
  public synchronized void close() {
    if (webSocketServer != null) {
      webSocketServer.close();
    }
    if (assetServer != null) {
      assetServer.close();
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }
}
