package ca.gc.cra.noodles.application.pipeline;

import ca.gc.cra.noodles.application.port.MessageCodec;
import ca.gc.cra.noodles.application.port.MetricsPort;
import ca.gc.cra.noodles.application.session.ClientHandle;
import ca.gc.cra.noodles.application.session.ConnectionRegistry;
import ca.gc.cra.noodles.domain.component.MessageSink;
import ca.gc.cra.noodles.domain.msg.MessageEncodingException;
import ca.gc.cra.noodles.domain.msg.ProtocolMessage;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Single consumer of the global outbound queue; serializes each envelope once and fans
 * the bytes out to per-client queues.
 * <p><strong>Why:</strong> Encoding once keeps broadcast cost independent of the client count, and a single
 * consumer preserves enqueue order for every client.</p>
 * <p><strong>Role:</strong> Application pipeline stage between the component store and client writers.</p>
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Promote the target of a snapshot envelope before delivering it.</li>
 *   <li>Deliver targeted envelopes to active targets only and broadcasts to every active client.</li>
 *   <li>Evict clients whose queues overflow without waiting on their transport.</li>
 *   <li>Drop envelopes that cannot be encoded and keep going.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #submit(OutboundEnvelope)} accepts any producer; {@link #run()} must
 * run on exactly one thread.</p>
 * <p><strong>Observability:</strong> Emits {@code dispatch.envelope.sent}, {@code dispatch.encode.failed},
 * {@code dispatch.encode.bytes} and {@code dispatch.client.overflow}.</p>
 *
 * @since 0.1.0
 */
public final class OutboundDispatcher implements MessageSink, Runnable {
  private static final Logger log = LoggerFactory.getLogger(OutboundDispatcher.class);
  private static final long IDLE_POLL_MILLIS = 10L;

  private final BlockingQueue<OutboundEnvelope> queue = new LinkedBlockingQueue<>();
  private final AtomicInteger inFlight = new AtomicInteger();
  private final ConnectionRegistry registry;
  private final MessageCodec codec;
  private final MetricsPort metrics;

  /**
   * Creates a dispatcher.
   *
   * @param registry clients to deliver to
   * @param codec wire encoder
   * @param metrics metrics sink
   */
  public OutboundDispatcher(ConnectionRegistry registry, MessageCodec codec, MetricsPort metrics) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Queues an envelope for delivery; never blocks.
   *
   * @param envelope envelope to deliver
   */
  public void submit(OutboundEnvelope envelope) {
    Objects.requireNonNull(envelope, "envelope");
    inFlight.incrementAndGet();
    queue.add(envelope);
  }

  @Override
  public void broadcast(ProtocolMessage message) {
    submit(OutboundEnvelope.broadcast(List.of(message)));
  }

  /** Delivers envelopes until the thread is interrupted. */
  @Override
  public void run() {
    MDC.put("pipeline", "dispatch");
    try {
      while (!Thread.currentThread().isInterrupted()) {
        OutboundEnvelope envelope = queue.take();
        deliver(envelope);
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    } finally {
      log.debug("Outbound dispatcher stopped with {} envelopes queued", queue.size());
      MDC.remove("pipeline");
    }
  }

  /**
   * Delivers every envelope queued at the time of the call on the calling thread.
   *
   * @return number of envelopes processed
   */
  public int dispatchQueued() {
    int processed = 0;
    OutboundEnvelope envelope;
    while ((envelope = queue.poll()) != null) {
      deliver(envelope);
      processed++;
    }
    return processed;
  }

  /**
   * Waits until every submitted envelope has been delivered or dropped.
   *
   * @param timeout maximum wait
   * @return {@code true} if the dispatcher went idle in time
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitIdle(Duration timeout) throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (inFlight.get() > 0) {
      if (System.nanoTime() - deadline >= 0) {
        return false;
      }
      TimeUnit.MILLISECONDS.sleep(IDLE_POLL_MILLIS);
    }
    return true;
  }

  public int queued() {
    return queue.size();
  }

  private void deliver(OutboundEnvelope envelope) {
    try {
      byte[] bytes;
      try {
        bytes = codec.encode(envelope.messages());
      } catch (MessageEncodingException ex) {
        metrics.increment("dispatch.encode.failed");
        log.error("Dropping envelope of {} messages that failed to encode", envelope.messages().size(), ex);
        return;
      }
      metrics.observe("dispatch.encode.bytes", bytes.length);

      if (envelope.target() != null) {
        if (envelope.promote()) {
          registry.promote(envelope.target());
        }
        registry.findActive(envelope.target()).ifPresent(handle -> enqueue(handle, bytes));
      } else {
        for (ClientHandle handle : registry.activeClients()) {
          enqueue(handle, bytes);
        }
      }
      metrics.increment("dispatch.envelope.sent");
    } finally {
      inFlight.decrementAndGet();
    }
  }

  private void enqueue(ClientHandle handle, byte[] bytes) {
    if (handle.offer(bytes) || handle.isClosed()) {
      return;
    }
    metrics.increment("dispatch.client.overflow");
    log.warn("Outbound queue full for {}; evicting", handle);
    registry.evict(handle.id());
  }
}
