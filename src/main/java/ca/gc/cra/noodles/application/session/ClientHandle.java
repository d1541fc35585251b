package ca.gc.cra.noodles.application.session;

import ca.gc.cra.noodles.application.port.ClientConnection;
import ca.gc.cra.noodles.domain.client.ClientId;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Registry entry for one client: its connection plus the bounded queue of encoded messages its
 * writer task drains.
 *
 * @since 0.1.0
 */
public final class ClientHandle {
  private final ClientId id;
  private final ClientConnection connection;
  private final BlockingQueue<byte[]> outbound;
  private final AtomicBoolean closed = new AtomicBoolean();
  // Counts messages queued or taken by the writer but not yet written.
  private final AtomicInteger unsent = new AtomicInteger();

  ClientHandle(ClientId id, ClientConnection connection, int queueCapacity) {
    this.id = Objects.requireNonNull(id, "id");
    this.connection = Objects.requireNonNull(connection, "connection");
    this.outbound = new LinkedBlockingQueue<>(queueCapacity);
  }

  public ClientId id() {
    return id;
  }

  public ClientConnection connection() {
    return connection;
  }

  /**
   * Queues encoded bytes for the writer without blocking.
   *
   * @param message encoded message, shared between clients and never mutated
   * @return {@code false} if the queue is full or the client is closed
   */
  public boolean offer(byte[] message) {
    if (closed.get()) {
      return false;
    }
    unsent.incrementAndGet();
    if (outbound.offer(message)) {
      return true;
    }
    unsent.decrementAndGet();
    return false;
  }

  /** Called by the writer after a polled message reached the transport. */
  public void delivered() {
    unsent.decrementAndGet();
  }

  /**
   * Indicates whether queued output is still waiting for, or held by, the writer.
   *
   * @return {@code true} while some offered message has not been written
   */
  public boolean hasUnsent() {
    return unsent.get() > 0;
  }

  /**
   * Waits up to {@code timeout} for the next message.
   *
   * @param timeout maximum wait
   * @param unit unit of {@code timeout}
   * @return next message or {@code null} on timeout
   * @throws InterruptedException if the writer is interrupted
   */
  public byte[] poll(long timeout, TimeUnit unit) throws InterruptedException {
    return outbound.poll(timeout, unit);
  }

  public int queued() {
    return outbound.size();
  }

  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Closes the connection once; later calls return {@code false}.
   *
   * @return {@code true} if this call closed the client
   */
  boolean close() {
    if (!closed.compareAndSet(false, true)) {
      return false;
    }
    connection.close();
    return true;
  }

  /**
   * Aborts the connection once without waiting on the peer.
   *
   * @return {@code true} if this call closed the client
   */
  boolean abort() {
    if (!closed.compareAndSet(false, true)) {
      return false;
    }
    connection.abort();
    return true;
  }

  @Override
  public String toString() {
    return "Client[" + id + " " + connection.remoteAddress() + "]";
  }
}
