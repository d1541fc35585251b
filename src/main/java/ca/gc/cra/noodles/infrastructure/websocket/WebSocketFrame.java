package ca.gc.cra.noodles.infrastructure.websocket;

import java.util.Objects;

/**
 * One decoded frame with its payload already unmasked.
 *
 * @param type what the reader should do with the frame
 * @param opcode raw opcode from the header
 * @param fin whether this frame ends its message
 * @param payload unmasked payload
 * @since 0.1.0
 */
public record WebSocketFrame(FrameType type, int opcode, boolean fin, byte[] payload) {
  public WebSocketFrame {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(payload, "payload");
  }

  /** Reader-facing classification of a frame. */
  public enum FrameType {
    /** Text, binary or continuation data. */
    MESSAGE,
    /** Peer started the closing handshake. */
    CLOSING,
    /** Peer expects a pong echoing the payload. */
    PING
  }
}
