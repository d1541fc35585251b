package ca.gc.cra.noodles.application.port;

import java.io.IOException;
import java.util.Optional;

/**
 * <strong>What:</strong> One established, message-oriented client connection.
 * <p><strong>Why:</strong> Keeps the dispatch pipeline independent of WebSocket framing so sessions can be
 * driven by in-memory fakes in tests.</p>
 * <p><strong>Role:</strong> Port implemented by {@code WebSocketConnection}.</p>
 * <p><strong>Thread-safety:</strong> One reader thread calls {@link #readMessage()} while one writer thread calls
 * {@link #send(byte[])}; {@link #close()} may be called from any thread.</p>
 *
 * @since 0.1.0
 */
public interface ClientConnection extends AutoCloseable {
  /**
   * Blocks until a complete application message has arrived.
   *
   * @return message bytes, or empty once the peer has closed the connection
   * @throws IOException when the transport fails or the peer violates the framing rules
   */
  Optional<byte[]> readMessage() throws IOException;

  /**
   * Sends one complete application message.
   *
   * @param payload message bytes
   * @throws IOException when the transport fails
   */
  void send(byte[] payload) throws IOException;

  /**
   * Describes the remote peer for logs.
   *
   * @return remote address text
   */
  String remoteAddress();

  /** Closes the connection; repeated calls are no-ops. */
  @Override
  void close();

  /**
   * Drops the transport at once without a closing handshake. Must not block on the peer, so it is
   * safe to call from a thread that serves other clients. Repeated calls, or a call after
   * {@link #close()}, are no-ops.
   */
  void abort();
}
