package ca.gc.cra.noodles.testutil;

import ca.gc.cra.noodles.application.port.ClientConnection;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/** In-memory connection: tests feed inbound messages and inspect what was sent. */
public final class FakeConnection implements ClientConnection {
  private static final Optional<byte[]> END = Optional.empty();

  private final String remoteAddress;
  private final BlockingQueue<Optional<byte[]>> inbound = new LinkedBlockingQueue<>();
  private final List<byte[]> sent = new CopyOnWriteArrayList<>();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final AtomicInteger closeCalls = new AtomicInteger();
  private final AtomicInteger abortCalls = new AtomicInteger();
  private volatile IOException sendFailure;
  private volatile CountDownLatch closeGate;

  public FakeConnection() {
    this("fake:0");
  }

  public FakeConnection(String remoteAddress) {
    this.remoteAddress = remoteAddress;
  }

  public void feed(byte[] message) {
    inbound.add(Optional.of(message));
  }

  public void endOfStream() {
    inbound.add(END);
  }

  public void failSendsWith(IOException failure) {
    this.sendFailure = failure;
  }

  /** Makes {@link #close()} block until {@code gate} opens, like a peer that stopped reading. */
  public void blockCloseUntil(CountDownLatch gate) {
    this.closeGate = gate;
  }

  @Override
  public Optional<byte[]> readMessage() throws IOException {
    try {
      while (true) {
        if (closed.get() && inbound.isEmpty()) {
          throw new IOException("connection closed");
        }
        Optional<byte[]> next = inbound.poll(10, TimeUnit.MILLISECONDS);
        if (next != null) {
          return next;
        }
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new IOException("interrupted", ie);
    }
  }

  @Override
  public void send(byte[] payload) throws IOException {
    if (closed.get()) {
      throw new IOException("connection closed");
    }
    IOException failure = sendFailure;
    if (failure != null) {
      throw failure;
    }
    sent.add(payload);
  }

  @Override
  public String remoteAddress() {
    return remoteAddress;
  }

  @Override
  public void close() {
    closeCalls.incrementAndGet();
    CountDownLatch gate = closeGate;
    if (gate != null) {
      try {
        gate.await();
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
      }
    }
    closed.set(true);
  }

  @Override
  public void abort() {
    abortCalls.incrementAndGet();
    closed.set(true);
  }

  public List<byte[]> sent() {
    return List.copyOf(sent);
  }

  public boolean isClosed() {
    return closed.get();
  }

  public int closeCalls() {
    return closeCalls.get();
  }

  public int abortCalls() {
    return abortCalls.get();
  }
}
