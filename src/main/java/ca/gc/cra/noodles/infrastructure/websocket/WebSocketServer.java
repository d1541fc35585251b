package ca.gc.cra.noodles.infrastructure.websocket;

import ca.gc.cra.noodles.application.port.ClientConnection;
import ca.gc.cra.noodles.application.port.ConnectionAcceptor;
import ca.gc.cra.noodles.application.port.MetricsPort;
import ca.gc.cra.noodles.infrastructure.exec.ExecutorFactories;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.lang.Thread.UncaughtExceptionHandler;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Listening socket that turns TCP connections into WebSocket connections.
 * <p><strong>Role:</strong> Adapter implementing {@link ConnectionAcceptor}.</p>
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Bind the listening socket on {@link #start()} and accept on a dedicated listener thread.</li>
 *   <li>Run each opening handshake on its own pooled thread under an overall deadline.</li>
 *   <li>Hand completed connections to {@link #accept()} in completion order.</li>
 *   <li>Drop failed handshakes without disturbing the listener or other handshakes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #accept()} from the accept loop only; {@link #close()} from any
 * thread.</p>
 * <p><strong>Observability:</strong> Emits {@code ws.handshake.failed}.</p>
 *
 * @since 0.1.0
 */
public final class WebSocketServer implements ConnectionAcceptor {
  private static final Logger log = LoggerFactory.getLogger(WebSocketServer.class);
  private static final int BACKLOG = 50;
  private static final long READY_POLL_MILLIS = 50L;

  private final InetSocketAddress bindAddress;
  private final long maxFramePayload;
  private final Duration handshakeTimeout;
  private final MetricsPort metrics;
  private final AtomicBoolean closed = new AtomicBoolean();
  private final BlockingQueue<WebSocketConnection> ready = new LinkedBlockingQueue<>();
  private final Set<Socket> handshaking = ConcurrentHashMap.newKeySet();
  private volatile ServerSocket serverSocket;
  private volatile ExecutorService listenerThread;
  private volatile ExecutorService handshakePool;
  private volatile IOException listenerFailure;

  /**
   * Creates an unbound server.
   *
   * @param bindAddress address and port to listen on; port 0 picks a free port
   * @param maxFramePayload largest accepted frame or message, in bytes
   * @param handshakeTimeoutMillis budget for a client's whole upgrade request
   * @param metrics metrics sink
   */
  public WebSocketServer(
      InetSocketAddress bindAddress, long maxFramePayload, int handshakeTimeoutMillis, MetricsPort metrics) {
    this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
    if (maxFramePayload <= 0 || maxFramePayload > WebSocketFrames.MAX_PAYLOAD_LIMIT) {
      throw new IllegalArgumentException(
          "maxFramePayload must be between 1 and " + WebSocketFrames.MAX_PAYLOAD_LIMIT + " (was " + maxFramePayload + ")");
    }
    if (handshakeTimeoutMillis <= 0) {
      throw new IllegalArgumentException("handshakeTimeoutMillis must be positive");
    }
    this.maxFramePayload = maxFramePayload;
    this.handshakeTimeout = Duration.ofMillis(handshakeTimeoutMillis);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Binds the listening socket and starts accepting in the background.
   *
   * @throws IOException if the address cannot be bound
   */
  public synchronized void start() throws IOException {
    if (serverSocket != null) {
      throw new IllegalStateException("WebSocket server already started");
    }
    ServerSocket socket = new ServerSocket();
    socket.setReuseAddress(true);
    try {
      socket.bind(bindAddress, BACKLOG);
    } catch (IOException ex) {
      socket.close();
      throw ex;
    }
    UncaughtExceptionHandler handler =
        (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex);
    handshakePool = ExecutorFactories.newClientPool("noodles-handshake", handler);
    listenerThread = ExecutorFactories.newSingleWorker("noodles-ws-listener", handler);
    serverSocket = socket;
    listenerThread.execute(() -> listen(socket));
    log.info("WebSocket server listening on {}", socket.getLocalSocketAddress());
  }

  @Override
  public ClientConnection accept() throws IOException {
    if (serverSocket == null) {
      throw new IllegalStateException("WebSocket server not started");
    }
    try {
      while (true) {
        WebSocketConnection connection = ready.poll(READY_POLL_MILLIS, TimeUnit.MILLISECONDS);
        if (connection != null) {
          return connection;
        }
        IOException failure = listenerFailure;
        if (failure != null) {
          throw failure;
        }
        if (closed.get()) {
          throw new SocketException("WebSocket server closed");
        }
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("interrupted while waiting for a client");
    }
  }

  @Override
  public int localPort() {
    ServerSocket listener = serverSocket;
    return listener == null ? -1 : listener.getLocalPort();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    ServerSocket listener = serverSocket;
    if (listener == null) {
      return;
    }
    try {
      listener.close();
    } catch (IOException ex) {
      log.warn("Failed to close listening socket", ex);
    }
    for (Socket socket : handshaking) {
      closeQuietly(socket);
    }
    WebSocketConnection unclaimed;
    while ((unclaimed = ready.poll()) != null) {
      unclaimed.abort();
    }
    listenerThread.shutdownNow();
    handshakePool.shutdownNow();
    log.info("WebSocket server stopped");
  }

  private void listen(ServerSocket listener) {
    MDC.put("pipeline", "ws-listen");
    try {
      while (!closed.get()) {
        Socket socket = listener.accept();
        try {
          handshakePool.execute(() -> handshake(socket));
        } catch (RejectedExecutionException ex) {
          closeQuietly(socket);
        }
      }
    } catch (IOException ex) {
      if (!closed.get()) {
        listenerFailure = ex;
        log.error("WebSocket listener failed", ex);
      }
    } finally {
      MDC.remove("pipeline");
    }
  }

  private void handshake(Socket socket) {
    handshaking.add(socket);
    try {
      DataInputStream in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
      OutputStream out = new BufferedOutputStream(socket.getOutputStream());
      WebSocketHandshake.perform(socket, in, out, handshakeTimeout);
      socket.setSoTimeout(0);
      WebSocketConnection connection = new WebSocketConnection(socket, in, out, maxFramePayload);
      handshaking.remove(socket);
      ready.add(connection);
      if (closed.get() && ready.remove(connection)) {
        connection.abort();
      }
    } catch (IOException ex) {
      handshaking.remove(socket);
      if (closed.get()) {
        log.debug("Handshake with {} abandoned on shutdown", socket.getRemoteSocketAddress());
      } else {
        metrics.increment("ws.handshake.failed");
        log.warn("Handshake with {} failed: {}", socket.getRemoteSocketAddress(), ex.toString());
      }
      closeQuietly(socket);
    }
  }

  private static void closeQuietly(Socket socket) {
    try {
      socket.close();
    } catch (IOException ex) {
      log.debug("Socket close after failed handshake: {}", ex.toString());
    }
  }
}
