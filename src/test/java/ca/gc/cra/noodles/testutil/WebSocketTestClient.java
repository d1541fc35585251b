package ca.gc.cra.noodles.testutil;

import ca.gc.cra.noodles.infrastructure.websocket.WebSocketFrames;
import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/** Minimal blocking WebSocket client for loopback tests; frames it sends are masked. */
public final class WebSocketTestClient implements AutoCloseable {
  public static final String SAMPLE_KEY = "dGhlIHNhbXBsZSBub25jZQ==";
  private static final byte[] MASK = {0x0A, 0x0B, 0x0C, 0x0D};

  private final Socket socket;
  private final DataInputStream in;
  private final OutputStream out;
  private String handshakeResponse;

  private WebSocketTestClient(Socket socket) throws IOException {
    this.socket = socket;
    this.socket.setSoTimeout(5_000);
    this.in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
    this.out = socket.getOutputStream();
  }

  /** Connects and completes the opening handshake. */
  public static WebSocketTestClient connect(int port) throws IOException {
    Socket socket = new Socket();
    socket.connect(new InetSocketAddress("127.0.0.1", port), 5_000);
    WebSocketTestClient client = new WebSocketTestClient(socket);
    client.handshake();
    return client;
  }

  private void handshake() throws IOException {
    String request = "GET / HTTP/1.1\r\n"
        + "Host: localhost\r\n"
        + "Upgrade: websocket\r\n"
        + "Connection: Upgrade\r\n"
        + "Sec-WebSocket-Key: " + SAMPLE_KEY + "\r\n"
        + "Sec-WebSocket-Version: 13\r\n\r\n";
    out.write(request.getBytes(StandardCharsets.US_ASCII));
    out.flush();
    ByteArrayOutputStream response = new ByteArrayOutputStream();
    int matched = 0;
    while (matched < 4) {
      int b = in.read();
      if (b < 0) {
        throw new IOException("server closed during handshake");
      }
      response.write(b);
      boolean expectCr = matched % 2 == 0;
      if ((expectCr && b == '\r') || (!expectCr && b == '\n')) {
        matched++;
      } else {
        matched = b == '\r' ? 1 : 0;
      }
    }
    handshakeResponse = response.toString(StandardCharsets.US_ASCII);
  }

  public String handshakeResponse() {
    return handshakeResponse;
  }

  /** Sends one masked binary message in a single frame. */
  public void sendBinary(byte[] payload) throws IOException {
    sendFrame(true, WebSocketFrames.OPCODE_BINARY, payload);
  }

  public void sendFrame(boolean fin, int opcode, byte[] payload) throws IOException {
    WebSocketFrames.writeFrame(out, fin, opcode, payload, 0, payload.length, MASK);
    out.flush();
  }

  /** Reads one raw frame and returns its opcode and payload. */
  public RawFrame readRawFrame() throws IOException {
    int b0 = in.readUnsignedByte();
    int b1 = in.readUnsignedByte();
    long length = b1 & 0x7F;
    if (length == 126) {
      length = in.readUnsignedShort();
    } else if (length == 127) {
      length = in.readLong();
    }
    byte[] payload = new byte[(int) length];
    in.readFully(payload);
    return new RawFrame((b0 & 0x80) != 0, b0 & 0x0F, payload);
  }

  /** Reads frames until a complete data message has been assembled. */
  public byte[] readMessage() throws IOException {
    ByteArrayOutputStream message = new ByteArrayOutputStream();
    while (true) {
      RawFrame frame = readRawFrame();
      if (frame.opcode() == WebSocketFrames.OPCODE_CLOSE) {
        throw new IOException("server sent close");
      }
      message.write(frame.payload());
      if (frame.fin()) {
        return message.toByteArray();
      }
    }
  }

  /** Returns {@code true} once the server has closed the TCP stream. */
  public boolean readsEndOfStream() throws IOException {
    try {
      while (true) {
        if (in.read() < 0) {
          return true;
        }
      }
    } catch (java.net.SocketTimeoutException ex) {
      return false;
    }
  }

  @Override
  public void close() throws IOException {
    socket.close();
  }

  /** One frame as seen on the wire. */
  public record RawFrame(boolean fin, int opcode, byte[] payload) {}
}
