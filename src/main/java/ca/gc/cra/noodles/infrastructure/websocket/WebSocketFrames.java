package ca.gc.cra.noodles.infrastructure.websocket;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * RFC 6455 frame codec over blocking streams.
 *
 * <p>Frame layout: FIN and opcode in the first byte; MASK and a 7-bit length in the second;
 * length 126 and 127 extend through 2 and 8 big-endian bytes; an optional 4-byte masking key
 * precedes the payload.</p>
 *
 * <p>Stateless; callers serialize writes to a given stream.</p>
 *
 * @since 0.1.0
 */
public final class WebSocketFrames {
  public static final int OPCODE_CONTINUATION = 0x0;
  public static final int OPCODE_TEXT = 0x1;
  public static final int OPCODE_BINARY = 0x2;
  public static final int OPCODE_CLOSE = 0x8;
  public static final int OPCODE_PING = 0x9;
  public static final int OPCODE_PONG = 0xA;

  /** Largest payload ceiling a reader accepts; payloads are buffered in one array. */
  public static final long MAX_PAYLOAD_LIMIT = Integer.MAX_VALUE - 8L;

  /** Status code sent with the close frame on a normal shutdown. */
  public static final int CLOSE_NORMAL = 1000;

  private static final int FIN_BIT = 0x80;
  private static final int MASK_BIT = 0x80;
  private static final int LENGTH_16 = 126;
  private static final int LENGTH_64 = 127;
  private static final int MAX_SHORT_LENGTH = 125;
  private static final int MAX_16_BIT_LENGTH = 0xFFFF;

  private WebSocketFrames() {}

  /**
   * Reads the next frame that needs the caller's attention. Pong frames are consumed silently.
   *
   * @param in source stream positioned at a frame boundary
   * @param maxPayload largest accepted payload length
   * @return decoded frame with its payload unmasked
   * @throws FrameTooLargeException if the declared length exceeds {@code maxPayload}
   * @throws UnknownOpcodeException for reserved opcodes
   * @throws EOFException if the stream ends before a frame is complete
   * @throws IOException on any other read failure
   */
  public static WebSocketFrame readFrame(DataInputStream in, long maxPayload) throws IOException {
    long ceiling = Math.min(maxPayload, MAX_PAYLOAD_LIMIT);
    while (true) {
      int b0 = in.readUnsignedByte();
      int b1 = in.readUnsignedByte();
      boolean fin = (b0 & FIN_BIT) != 0;
      int opcode = b0 & 0x0F;
      boolean masked = (b1 & MASK_BIT) != 0;

      long length = b1 & 0x7F;
      if (length == LENGTH_16) {
        length = in.readUnsignedShort();
      } else if (length == LENGTH_64) {
        length = in.readLong();
      }
      if (length < 0 || length > ceiling) {
        throw new FrameTooLargeException(length, ceiling);
      }

      WebSocketFrame.FrameType type = classify(opcode);

      byte[] key = null;
      if (masked) {
        key = new byte[4];
        in.readFully(key);
      }
      byte[] payload = new byte[(int) length];
      in.readFully(payload);
      if (key != null) {
        mask(payload, key);
      }

      if (type != null) {
        return new WebSocketFrame(type, opcode, fin, payload);
      }
    }
  }

  /**
   * Writes {@code payload} as one or more unmasked binary frames, each carrying at most
   * {@code chunkLimit} bytes. FIN is set only on the final frame and only when {@code lastMessage}
   * holds. An empty payload is written as a single empty frame.
   *
   * @param out destination stream
   * @param payload message bytes
   * @param lastMessage whether this call completes the message
   * @param chunkLimit largest payload per frame
   * @return number of frames written
   * @throws IOException on write failure
   */
  public static int writeMessage(OutputStream out, byte[] payload, boolean lastMessage, int chunkLimit)
      throws IOException {
    Objects.requireNonNull(payload, "payload");
    if (chunkLimit <= 0) {
      throw new IllegalArgumentException("chunkLimit must be positive");
    }
    if (payload.length == 0) {
      writeFrame(out, lastMessage, OPCODE_BINARY, payload, 0, 0, null);
      return 1;
    }
    int frames = 0;
    int offset = 0;
    while (offset < payload.length) {
      int chunk = Math.min(chunkLimit, payload.length - offset);
      boolean fin = lastMessage && offset + chunk == payload.length;
      writeFrame(out, fin, OPCODE_BINARY, payload, offset, chunk, null);
      offset += chunk;
      frames++;
    }
    return frames;
  }

  /**
   * Writes a single frame using the smallest length encoding that fits.
   *
   * @param out destination stream
   * @param fin FIN flag
   * @param opcode frame opcode
   * @param payload source array
   * @param offset first payload byte
   * @param length payload byte count
   * @param maskKey 4-byte masking key, or {@code null} for an unmasked server frame
   * @throws IOException on write failure
   */
  public static void writeFrame(
      OutputStream out, boolean fin, int opcode, byte[] payload, int offset, int length, byte[] maskKey)
      throws IOException {
    if (maskKey != null && maskKey.length != 4) {
      throw new IllegalArgumentException("mask key must be 4 bytes");
    }
    byte[] header = header(fin, opcode, length, maskKey != null);
    out.write(header);
    if (maskKey == null) {
      out.write(payload, offset, length);
      return;
    }
    out.write(maskKey);
    byte[] masked = new byte[length];
    System.arraycopy(payload, offset, masked, 0, length);
    mask(masked, maskKey);
    out.write(masked);
  }

  /**
   * Writes the close frame carrying {@code status}.
   *
   * @param out destination stream
   * @param status close status code
   * @throws IOException on write failure
   */
  public static void writeClose(OutputStream out, int status) throws IOException {
    byte[] body = {(byte) ((status >>> 8) & 0xFF), (byte) (status & 0xFF)};
    writeFrame(out, true, OPCODE_CLOSE, body, 0, body.length, null);
  }

  /**
   * XORs {@code data} in place with the repeating 4-byte {@code key}. Applying it twice restores
   * the original bytes.
   *
   * @param data bytes to mask or unmask
   * @param key masking key
   */
  public static void mask(byte[] data, byte[] key) {
    for (int i = 0; i < data.length; i++) {
      data[i] = (byte) (data[i] ^ key[i & 3]);
    }
  }

  static byte[] header(boolean fin, int opcode, long length, boolean masked) {
    int first = (fin ? FIN_BIT : 0) | (opcode & 0x0F);
    int maskFlag = masked ? MASK_BIT : 0;
    if (length <= MAX_SHORT_LENGTH) {
      return new byte[] {(byte) first, (byte) (maskFlag | length)};
    }
    if (length <= MAX_16_BIT_LENGTH) {
      return new byte[] {(byte) first, (byte) (maskFlag | LENGTH_16), (byte) (length >>> 8), (byte) length};
    }
    byte[] header = new byte[10];
    header[0] = (byte) first;
    header[1] = (byte) (maskFlag | LENGTH_64);
    for (int i = 0; i < 8; i++) {
      header[9 - i] = (byte) (length >>> (8 * i));
    }
    return header;
  }

  private static WebSocketFrame.FrameType classify(int opcode) throws UnknownOpcodeException {
    switch (opcode) {
      case OPCODE_CONTINUATION:
      case OPCODE_TEXT:
      case OPCODE_BINARY:
        return WebSocketFrame.FrameType.MESSAGE;
      case OPCODE_CLOSE:
        return WebSocketFrame.FrameType.CLOSING;
      case OPCODE_PING:
        return WebSocketFrame.FrameType.PING;
      case OPCODE_PONG:
        return null;
      default:
        throw new UnknownOpcodeException(opcode);
    }
  }
}
