package ca.gc.cra.noodles.infrastructure.asset;

import ca.gc.cra.noodles.application.port.AssetHost;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Serves large buffers over plain HTTP so they never travel through client queues.
 * <p><strong>Role:</strong> Adapter implementing {@link AssetHost} on the JDK's built-in HTTP server.</p>
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Answer {@code GET /<identity>} with the stored bytes as {@code application/octet-stream}.</li>
 *   <li>Answer CORS pre-flight {@code OPTIONS} requests so browser clients may fetch cross-origin.</li>
 *   <li>Return 404 for unknown identities or unsupported methods.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Assets live in a concurrent map; installs and removals may race with
 * requests.</p>
 *
 * @since 0.1.0
 */
public final class HttpAssetServer implements AssetHost, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(HttpAssetServer.class);
  private static final String CORS_MAX_AGE_SECONDS = "3600";
  private static final int STOP_DELAY_SECONDS = 0;

  private final InetSocketAddress bindAddress;
  private final ExecutorService executor;
  private final ConcurrentMap<String, byte[]> assets = new ConcurrentHashMap<>();
  private volatile HttpServer server;

  /**
   * Creates an unbound asset server.
   *
   * @param bindAddress address and port to listen on; port 0 picks a free port
   * @param executor executor for request handling, or {@code null} for the calling thread of the HTTP
   *     dispatcher
   */
  public HttpAssetServer(InetSocketAddress bindAddress, ExecutorService executor) {
    this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
    this.executor = executor;
  }

  /**
   * Binds and starts serving.
   *
   * @throws IOException if the address cannot be bound
   */
  public void start() throws IOException {
    if (server != null) {
      throw new IllegalStateException("Asset server already started");
    }
    HttpServer http = HttpServer.create(bindAddress, 0);
    http.createContext("/", this::handle);
    http.setExecutor(executor);
    http.start();
    server = http;
    log.info("Asset server listening on {}", http.getAddress());
  }

  @Override
  public AssetReference install(String identity, byte[] bytes) {
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(bytes, "bytes");
    if (identity.isEmpty() || identity.indexOf('/') >= 0) {
      throw new IllegalArgumentException("asset identity must be a single non-empty path segment");
    }
    assets.put(identity, bytes.clone());
    log.debug("Hosting asset {} ({} bytes)", identity, bytes.length);
    return new AssetReference(identity, port());
  }

  @Override
  public void remove(String identity) {
    if (identity != null && assets.remove(identity) != null) {
      log.debug("Withdrew asset {}", identity);
    }
  }

  public int assetCount() {
    return assets.size();
  }

  /**
   * Returns the bound port, or the configured one before {@link #start()}.
   *
   * @return listening port
   */
  public int port() {
    HttpServer http = server;
    return http == null ? bindAddress.getPort() : http.getAddress().getPort();
  }

  @Override
  public void close() {
    if (executor != null) {
      executor.shutdownNow();
    }
    HttpServer http = server;
    if (http == null) {
      return;
    }
    server = null;
    http.stop(STOP_DELAY_SECONDS);
    assets.clear();
    log.info("Asset server stopped");
  }

  private void handle(HttpExchange exchange) throws IOException {
    try {
      exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
      String method = exchange.getRequestMethod();
      if ("OPTIONS".equalsIgnoreCase(method)) {
        exchange.getResponseHeaders().set("Access-Control-Max-Age", CORS_MAX_AGE_SECONDS);
        exchange.sendResponseHeaders(200, -1);
        return;
      }
      String identity = identityOf(exchange.getRequestURI().getPath());
      byte[] body = "GET".equalsIgnoreCase(method) ? assets.get(identity) : null;
      if (body == null) {
        log.debug("Asset request {} {} not found", method, identity);
        exchange.sendResponseHeaders(404, -1);
        return;
      }
      exchange.getResponseHeaders().set("Content-Type", "application/octet-stream");
      exchange.sendResponseHeaders(200, body.length == 0 ? -1 : body.length);
      if (body.length > 0) {
        try (OutputStream out = exchange.getResponseBody()) {
          out.write(body);
        }
      }
    } finally {
      exchange.close();
    }
  }

  static String identityOf(String path) {
    if (path == null) {
      return "";
    }
    return path.startsWith("/") ? path.substring(1) : path;
  }
}
