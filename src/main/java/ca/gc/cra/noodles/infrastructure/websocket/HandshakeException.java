package ca.gc.cra.noodles.infrastructure.websocket;

/**
 * The opening HTTP upgrade request was missing, malformed or too large.
 *
 * @since 0.1.0
 */
public final class HandshakeException extends WebSocketException {
  public HandshakeException(String message) {
    super(message);
  }
}
