package ca.gc.cra.noodles.application.pipeline;

import ca.gc.cra.noodles.application.port.ClientConnection;
import ca.gc.cra.noodles.application.port.MessageCodec;
import ca.gc.cra.noodles.application.port.MetricsPort;
import ca.gc.cra.noodles.application.session.ClientHandle;
import ca.gc.cra.noodles.application.session.ConnectionRegistry;
import ca.gc.cra.noodles.domain.msg.MalformedMessageException;
import ca.gc.cra.noodles.domain.value.Value;
import ca.gc.cra.noodles.logging.Logs;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Reader and writer tasks for one client. Either task ending for any reason disconnects the
 * client; other clients are unaffected.
 *
 * @since 0.1.0
 */
final class ClientSession {
  private static final Logger log = LoggerFactory.getLogger(ClientSession.class);
  private static final long WRITER_POLL_MILLIS = 50L;
  private static final int MALFORMED_PREVIEW_BYTES = 32;

  private final ClientHandle handle;
  private final ConnectionRegistry registry;
  private final MessageCodec codec;
  private final InboundRouter router;
  private final MetricsPort metrics;

  ClientSession(
      ClientHandle handle,
      ConnectionRegistry registry,
      MessageCodec codec,
      InboundRouter router,
      MetricsPort metrics) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.router = Objects.requireNonNull(router, "router");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  void start(ExecutorService pool) {
    pool.execute(this::readLoop);
    pool.execute(this::writeLoop);
  }

  void readLoop() {
    MDC.put("client", handle.id().toString());
    ClientConnection connection = handle.connection();
    try {
      while (!Thread.currentThread().isInterrupted()) {
        Optional<byte[]> next = connection.readMessage();
        if (next.isEmpty()) {
          log.debug("Peer closed the connection");
          break;
        }
        byte[] bytes = next.get();
        if (bytes.length == 0) {
          continue;
        }
        List<Value> elements;
        try {
          elements = codec.decode(bytes);
        } catch (MalformedMessageException ex) {
          metrics.increment("inbound.message.malformed");
          log.warn("Closing connection after malformed message ({}): {}",
              ex.getMessage(), Logs.hexPreview(bytes, MALFORMED_PREVIEW_BYTES));
          break;
        }
        metrics.increment("inbound.message.received");
        router.submit(new InboundMessage(handle.id(), elements));
      }
    } catch (IOException ex) {
      if (!handle.isClosed()) {
        log.info("Transport lost while reading: {}", ex.toString());
      }
    } finally {
      registry.disconnect(handle.id());
      MDC.remove("client");
    }
  }

  void writeLoop() {
    MDC.put("client", handle.id().toString());
    ClientConnection connection = handle.connection();
    try {
      while (!handle.isClosed()) {
        byte[] message = handle.poll(WRITER_POLL_MILLIS, TimeUnit.MILLISECONDS);
        if (message == null) {
          continue;
        }
        connection.send(message);
        handle.delivered();
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    } catch (IOException ex) {
      if (!handle.isClosed()) {
        log.info("Transport lost while writing: {}", ex.toString());
      }
    } finally {
      registry.disconnect(handle.id());
      MDC.remove("client");
    }
  }
}
