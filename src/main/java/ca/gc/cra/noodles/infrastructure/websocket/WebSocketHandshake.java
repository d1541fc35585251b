package ca.gc.cra.noodles.infrastructure.websocket;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Server side of the RFC 6455 opening handshake.
 *
 * <p>Reads the HTTP upgrade request up to the blank line that ends its header block, validates
 * the {@code Upgrade} and {@code Sec-WebSocket-Key} headers, and answers with
 * {@code 101 Switching Protocols}. Header names match case-insensitively.</p>
 *
 * @since 0.1.0
 */
public final class WebSocketHandshake {
  /** Fixed GUID appended to the client key before hashing. */
  public static final String ACCEPT_GUID = "258EAFA5-E914-47DA-95CA-C5AB0DC85B11";

  /** Ceiling on the request header block. */
  public static final int MAX_HEADER_BYTES = 8 * 1024;

  private static final ReadGuard UNGUARDED = () -> {};

  private WebSocketHandshake() {}

  /**
   * Runs the handshake on a freshly accepted connection.
   *
   * @param in request stream; left positioned at the first frame byte
   * @param out response stream; flushed before returning
   * @return the {@code Sec-WebSocket-Key} the client sent
   * @throws HandshakeException if the request is not a valid WebSocket upgrade
   * @throws IOException if the socket fails or times out
   */
  public static String perform(InputStream in, OutputStream out) throws IOException {
    return perform(in, out, UNGUARDED);
  }

  /**
   * Runs the handshake under an overall deadline. Each read may block only for the time left, so a
   * peer that trickles its request cannot hold the handshake open past {@code timeout}.
   *
   * @param socket socket whose read timeout is adjusted before every read
   * @param in request stream over {@code socket}
   * @param out response stream over {@code socket}
   * @param timeout budget for the whole request
   * @return the {@code Sec-WebSocket-Key} the client sent
   * @throws HandshakeException if the request is invalid or the deadline passes
   * @throws IOException if the socket fails or a read times out
   */
  public static String perform(Socket socket, InputStream in, OutputStream out, Duration timeout)
      throws IOException {
    long deadline = System.nanoTime() + timeout.toNanos();
    return perform(in, out, () -> {
      long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
      if (remainingMillis <= 0) {
        throw new HandshakeException("handshake not completed within " + timeout.toMillis() + " ms");
      }
      socket.setSoTimeout((int) Math.min(Integer.MAX_VALUE, remainingMillis));
    });
  }

  private static String perform(InputStream in, OutputStream out, ReadGuard guard) throws IOException {
    Map<String, String> headers = parseHeaders(readHeaderBlock(in, guard));
    String upgrade = headers.get("upgrade");
    if (upgrade == null || !upgrade.toLowerCase(Locale.ROOT).contains("websocket")) {
      throw new HandshakeException("missing Upgrade: websocket header");
    }
    String key = headers.get("sec-websocket-key");
    if (key == null || key.isEmpty()) {
      throw new HandshakeException("missing Sec-WebSocket-Key header");
    }
    out.write(response(acceptKey(key)).getBytes(StandardCharsets.US_ASCII));
    out.flush();
    return key;
  }

  /**
   * Computes {@code base64(SHA-1(key + GUID))}.
   *
   * @param key client's {@code Sec-WebSocket-Key}
   * @return value for {@code Sec-WebSocket-Accept}
   */
  public static String acceptKey(String key) {
    try {
      MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
      byte[] digest = sha1.digest((key + ACCEPT_GUID).getBytes(StandardCharsets.US_ASCII));
      return Base64.getEncoder().encodeToString(digest);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-1 unavailable", ex);
    }
  }

  static String response(String acceptKey) {
    return "HTTP/1.1 101 Switching Protocols\r\n"
        + "Connection: Upgrade\r\n"
        + "Upgrade: websocket\r\n"
        + "Sec-WebSocket-Accept: " + acceptKey + "\r\n\r\n";
  }

  static String readHeaderBlock(InputStream in) throws IOException {
    return readHeaderBlock(in, UNGUARDED);
  }

  static String readHeaderBlock(InputStream in, ReadGuard guard) throws IOException {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream(512);
    int matched = 0;
    while (true) {
      guard.beforeRead();
      int b = in.read();
      if (b < 0) {
        throw new HandshakeException("connection closed during handshake");
      }
      if (buffer.size() >= MAX_HEADER_BYTES) {
        throw new HandshakeException("request headers exceed " + MAX_HEADER_BYTES + " bytes");
      }
      buffer.write(b);
      matched = advance(matched, b);
      if (matched == 4) {
        return buffer.toString(StandardCharsets.ISO_8859_1);
      }
    }
  }

  static Map<String, String> parseHeaders(String block) {
    Map<String, String> headers = new LinkedHashMap<>();
    String[] lines = block.split("\r\n");
    // Line 0 is the request line.
    for (int i = 1; i < lines.length; i++) {
      String line = lines[i];
      int colon = line.indexOf(':');
      if (colon <= 0) {
        continue;
      }
      String name = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
      headers.putIfAbsent(name, line.substring(colon + 1).trim());
    }
    return headers;
  }

  // Tracks progress through the CR LF CR LF terminator.
  private static int advance(int matched, int b) {
    if (b == '\r') {
      return (matched == 0 || matched == 2) ? matched + 1 : 1;
    }
    if (b == '\n' && (matched == 1 || matched == 3)) {
      return matched + 1;
    }
    return 0;
  }

  /** Runs before every read of the request. */
  @FunctionalInterface
  interface ReadGuard {
    void beforeRead() throws IOException;
  }
}
