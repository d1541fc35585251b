package ca.gc.cra.noodles.infrastructure.websocket;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.noodles.application.port.ClientConnection;
import ca.gc.cra.noodles.testutil.RecordingMetricsPort;
import ca.gc.cra.noodles.testutil.WebSocketTestClient;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WebSocketServerTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final ExecutorService acceptThread = Executors.newSingleThreadExecutor();
  private WebSocketServer server;

  @BeforeEach
  void setUp() throws IOException {
    server = new WebSocketServer(new InetSocketAddress("127.0.0.1", 0), 1_024, 2_000, metrics);
    server.start();
  }

  @AfterEach
  void tearDown() {
    server.close();
    acceptThread.shutdownNow();
  }

  @Test
  void handshakeProducesConnectionThatReassemblesFragments() throws Exception {
    Future<ClientConnection> accepted = acceptThread.submit(server::accept);
    try (WebSocketTestClient client = WebSocketTestClient.connect(server.localPort())) {
      assertTrue(client.handshakeResponse().contains("s3pPLMBiTxaQ9kYGzzhZRbK+xOo="));
      ClientConnection connection = accepted.get(5, TimeUnit.SECONDS);

      client.sendFrame(false, WebSocketFrames.OPCODE_BINARY, new byte[] {1, 2});
      client.sendFrame(true, WebSocketFrames.OPCODE_CONTINUATION, new byte[] {3});

      Optional<byte[]> message = connection.readMessage();
      assertArrayEquals(new byte[] {1, 2, 3}, message.orElseThrow());
      connection.close();
    }
  }

  @Test
  void pingIsAnsweredWithMatchingPong() throws Exception {
    Future<ClientConnection> accepted = acceptThread.submit(server::accept);
    try (WebSocketTestClient client = WebSocketTestClient.connect(server.localPort())) {
      ClientConnection connection = accepted.get(5, TimeUnit.SECONDS);

      client.sendFrame(true, WebSocketFrames.OPCODE_PING, new byte[] {42});
      client.sendBinary(new byte[] {7});

      assertArrayEquals(new byte[] {7}, connection.readMessage().orElseThrow());
      WebSocketTestClient.RawFrame pong = client.readRawFrame();
      assertEquals(WebSocketFrames.OPCODE_PONG, pong.opcode());
      assertArrayEquals(new byte[] {42}, pong.payload());
      connection.close();
    }
  }

  @Test
  void peerCloseEndsTheStreamAndIsAcknowledged() throws Exception {
    Future<ClientConnection> accepted = acceptThread.submit(server::accept);
    try (WebSocketTestClient client = WebSocketTestClient.connect(server.localPort())) {
      ClientConnection connection = accepted.get(5, TimeUnit.SECONDS);

      client.sendFrame(true, WebSocketFrames.OPCODE_CLOSE, new byte[] {0x03, (byte) 0xE8});

      assertTrue(connection.readMessage().isEmpty());
      WebSocketTestClient.RawFrame close = client.readRawFrame();
      assertEquals(WebSocketFrames.OPCODE_CLOSE, close.opcode());
      assertArrayEquals(new byte[] {0x03, (byte) 0xE8}, close.payload());
    }
  }

  @Test
  void sendSplitsAtSocketBufferSizeAndClientReassembles() throws Exception {
    Future<ClientConnection> accepted = acceptThread.submit(server::accept);
    try (WebSocketTestClient client = WebSocketTestClient.connect(server.localPort())) {
      WebSocketConnection connection = (WebSocketConnection) accepted.get(5, TimeUnit.SECONDS);
      byte[] payload = new byte[connection.chunkLimit() * 2 + 1];
      payload[payload.length - 1] = 9;

      Future<Integer> frames = acceptThread.submit(() -> connection.send(payload, true));
      byte[] received = client.readMessage();

      assertEquals(3, frames.get(5, TimeUnit.SECONDS));
      assertArrayEquals(payload, received);
      connection.close();
    }
  }

  @Test
  void oversizedMessageFailsTheRead() throws Exception {
    Future<ClientConnection> accepted = acceptThread.submit(server::accept);
    try (WebSocketTestClient client = WebSocketTestClient.connect(server.localPort())) {
      ClientConnection connection = accepted.get(5, TimeUnit.SECONDS);

      client.sendFrame(false, WebSocketFrames.OPCODE_BINARY, new byte[1_000]);
      client.sendFrame(true, WebSocketFrames.OPCODE_CONTINUATION, new byte[100]);

      assertThrows(FrameTooLargeException.class, connection::readMessage);
      connection.close();
    }
  }

  @Test
  void failedHandshakeIsCountedAndListenerKeepsAccepting() throws Exception {
    Future<ClientConnection> accepted = acceptThread.submit(server::accept);
    try (Socket plain = new Socket("127.0.0.1", server.localPort())) {
      OutputStream out = plain.getOutputStream();
      out.write("GET / HTTP/1.1\r\nHost: x\r\n\r\n".getBytes(StandardCharsets.US_ASCII));
      out.flush();
      assertEquals(-1, plain.getInputStream().read());
    }
    try (WebSocketTestClient client = WebSocketTestClient.connect(server.localPort())) {
      accepted.get(5, TimeUnit.SECONDS).close();
    }
    assertEquals(1, metrics.count("ws.handshake.failed"));
  }

  @Test
  void tricklingPeerDoesNotDelayOtherHandshakes() throws Exception {
    WebSocketServer strict =
        new WebSocketServer(new InetSocketAddress("127.0.0.1", 0), 1_024, 1_000, metrics);
    strict.start();
    ExecutorService trickler = Executors.newSingleThreadExecutor();
    try (Socket slow = new Socket("127.0.0.1", strict.localPort())) {
      Future<?> dripping = trickler.submit(() -> {
        OutputStream out = slow.getOutputStream();
        for (int i = 0; i < 20; i++) {
          out.write('G');
          out.flush();
          Thread.sleep(300);
        }
        return null;
      });
      Thread.sleep(100);

      long begin = System.nanoTime();
      Future<ClientConnection> accepted = acceptThread.submit(strict::accept);
      try (WebSocketTestClient client = WebSocketTestClient.connect(strict.localPort())) {
        accepted.get(5, TimeUnit.SECONDS).close();
      }
      long waitedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin);
      assertTrue(waitedMillis < 900, "second client waited " + waitedMillis + " ms");

      slow.setSoTimeout(5_000);
      long dripStart = System.nanoTime();
      assertEquals(-1, slow.getInputStream().read());
      assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - dripStart) < 3_000);
      dripping.cancel(true);
    } finally {
      trickler.shutdownNow();
      strict.close();
    }
    assertEquals(1, metrics.count("ws.handshake.failed"));
  }

  @Test
  void payloadCeilingAboveArrayLimitIsRejected() {
    InetSocketAddress address = new InetSocketAddress("127.0.0.1", 0);

    assertThrows(IllegalArgumentException.class,
        () -> new WebSocketServer(address, WebSocketFrames.MAX_PAYLOAD_LIMIT + 1, 1_000, metrics));
    assertThrows(IllegalArgumentException.class,
        () -> new WebSocketServer(address, 0, 1_000, metrics));
    new WebSocketServer(address, WebSocketFrames.MAX_PAYLOAD_LIMIT, 1_000, metrics).close();
  }

  @Test
  void closeUnblocksAccept() throws Exception {
    Future<ClientConnection> accepted = acceptThread.submit(server::accept);
    Thread.sleep(50);

    server.close();

    ExecutionException ex =
        assertThrows(ExecutionException.class, () -> accepted.get(5, TimeUnit.SECONDS));
    assertTrue(ex.getCause() instanceof IOException);
  }
}
