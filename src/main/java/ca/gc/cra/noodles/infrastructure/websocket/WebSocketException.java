package ca.gc.cra.noodles.infrastructure.websocket;

import java.io.IOException;

/**
 * Base class for WebSocket protocol violations. Each one ends the affected connection only.
 *
 * @since 0.1.0
 */
public class WebSocketException extends IOException {
  public WebSocketException(String message) {
    super(message);
  }

  public WebSocketException(String message, Throwable cause) {
    super(message, cause);
  }
}
