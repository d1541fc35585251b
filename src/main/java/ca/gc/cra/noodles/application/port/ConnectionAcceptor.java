package ca.gc.cra.noodles.application.port;

import java.io.IOException;

/**
 * Source of newly handshaken client connections.
 *
 * <p>{@link #accept()} is called from the accept loop only. {@link #close()} may be called from
 * another thread to unblock it.</p>
 *
 * @since 0.1.0
 */
public interface ConnectionAcceptor extends AutoCloseable {
  /**
   * Blocks until a client completes the opening handshake. Failed handshakes are handled
   * internally and never surface here.
   *
   * @return established connection
   * @throws IOException when the listening socket fails or has been closed
   */
  ClientConnection accept() throws IOException;

  /**
   * Returns the bound local port.
   *
   * @return listening port
   */
  int localPort();

  /** Stops listening; idempotent. */
  @Override
  void close();
}
