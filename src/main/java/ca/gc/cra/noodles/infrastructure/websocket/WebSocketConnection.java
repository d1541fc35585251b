package ca.gc.cra.noodles.infrastructure.websocket;

import ca.gc.cra.noodles.application.port.ClientConnection;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Established WebSocket connection over a raw socket.
 * <p><strong>Role:</strong> Adapter implementing {@link ClientConnection}; created by {@link WebSocketServer}
 * after a successful handshake.</p>
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Reassemble messages across frames and answer pings.</li>
 *   <li>Split outgoing messages into frames no larger than the socket send buffer.</li>
 *   <li>Send one close frame and release the socket, once.</li>
 *   <li>Abort without a close frame when the caller cannot wait on the peer.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> One reader thread; writes from the writer task and pong replies from the
 * reader share one write lock. {@link #close()} is safe from any thread.</p>
 *
 * @since 0.1.0
 */
public final class WebSocketConnection implements ClientConnection {
  private static final Logger log = LoggerFactory.getLogger(WebSocketConnection.class);
  private static final long CLOSE_LOCK_WAIT_MILLIS = 200L;

  private final Socket socket;
  private final DataInputStream in;
  private final OutputStream out;
  private final long maxPayload;
  private final int chunkLimit;
  private final String remoteAddress;
  private final ReentrantLock writeLock = new ReentrantLock();
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Wraps a socket whose handshake already completed on {@code in} and {@code out}.
   *
   * @param socket connected socket
   * @param in buffered input positioned at the first frame
   * @param out output stream; flushed after every message
   * @param maxPayload largest accepted frame or assembled message, in bytes
   * @throws IOException if socket options cannot be read or set
   */
  public WebSocketConnection(Socket socket, DataInputStream in, OutputStream out, long maxPayload)
      throws IOException {
    this.socket = Objects.requireNonNull(socket, "socket");
    this.in = Objects.requireNonNull(in, "in");
    this.out = Objects.requireNonNull(out, "out");
    this.maxPayload = maxPayload;
    this.socket.setTcpNoDelay(true);
    this.chunkLimit = Math.max(1, socket.getSendBufferSize());
    this.remoteAddress = String.valueOf(socket.getRemoteSocketAddress());
  }

  @Override
  public Optional<byte[]> readMessage() throws IOException {
    ByteArrayOutputStream assembled = new ByteArrayOutputStream();
    while (true) {
      WebSocketFrame frame = WebSocketFrames.readFrame(in, maxPayload);
      switch (frame.type()) {
        case MESSAGE:
          if ((long) assembled.size() + frame.payload().length > maxPayload) {
            throw new FrameTooLargeException((long) assembled.size() + frame.payload().length, maxPayload);
          }
          assembled.write(frame.payload());
          if (frame.fin()) {
            return Optional.of(assembled.toByteArray());
          }
          break;
        case CLOSING:
          log.debug("Peer {} sent close", remoteAddress);
          close();
          return Optional.empty();
        case PING:
          pong(frame.payload());
          break;
        default:
          throw new IllegalStateException("unhandled frame type " + frame.type());
      }
    }
  }

  @Override
  public void send(byte[] payload) throws IOException {
    send(payload, true);
  }

  /**
   * Sends {@code payload} as binary frames.
   *
   * @param payload message bytes
   * @param lastMessage {@code false} to leave the message open for further calls
   * @return number of frames written
   * @throws IOException if the connection is closed or the write fails
   */
  public int send(byte[] payload, boolean lastMessage) throws IOException {
    writeLock.lock();
    try {
      ensureOpen();
      int frames = WebSocketFrames.writeMessage(out, payload, lastMessage, chunkLimit);
      out.flush();
      return frames;
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public String remoteAddress() {
    return remoteAddress;
  }

  /**
   * Returns the per-frame payload ceiling measured from the socket send buffer.
   *
   * @return chunk size in bytes
   */
  public int chunkLimit() {
    return chunkLimit;
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    boolean locked = false;
    try {
      locked = writeLock.tryLock(CLOSE_LOCK_WAIT_MILLIS, TimeUnit.MILLISECONDS);
      if (locked) {
        WebSocketFrames.writeClose(out, WebSocketFrames.CLOSE_NORMAL);
        out.flush();
      }
    } catch (IOException ex) {
      log.debug("Close frame to {} not delivered: {}", remoteAddress, ex.toString());
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    } finally {
      if (locked) {
        writeLock.unlock();
      }
      closeSocket();
    }
  }

  private void closeSocket() {
    try {
      socket.close();
    } catch (IOException ex) {
      log.debug("Socket close for {} failed: {}", remoteAddress, ex.toString());
    }
  }

  @Override
  public void abort() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    closeSocket();
  }

  private void pong(byte[] payload) throws IOException {
    writeLock.lock();
    try {
      ensureOpen();
      WebSocketFrames.writeFrame(out, true, WebSocketFrames.OPCODE_PONG, payload, 0, payload.length, null);
      out.flush();
    } finally {
      writeLock.unlock();
    }
  }

  private void ensureOpen() throws IOException {
    if (closed.get()) {
      throw new WebSocketException("connection to " + remoteAddress + " is closed");
    }
  }
}
