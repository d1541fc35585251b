package ca.gc.cra.noodles.application.pipeline;

import ca.gc.cra.noodles.application.port.MetricsPort;
import ca.gc.cra.noodles.application.port.SceneAuthority;
import ca.gc.cra.noodles.application.scene.ReplicationContext;
import ca.gc.cra.noodles.domain.client.ClientId;
import ca.gc.cra.noodles.domain.msg.ProtocolMessage;
import ca.gc.cra.noodles.domain.value.Value;
import ca.gc.cra.noodles.logging.Logs;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes decoded client messages by message type. Readers enqueue from their own threads;
 * {@link #drain()} runs on the tick thread so handlers may touch the world directly.
 *
 * @since 0.1.0
 */
public final class InboundRouter {
  private static final Logger log = LoggerFactory.getLogger(InboundRouter.class);
  private static final int MAX_LOGGED_NAME = 64;

  private final BlockingQueue<InboundMessage> queue = new LinkedBlockingQueue<>();
  private final OutboundDispatcher outbound;
  private final SceneAuthority scene;
  private final ReplicationContext context;
  private final MetricsPort metrics;

  /**
   * Creates a router.
   *
   * @param outbound destination for snapshot envelopes
   * @param scene receiver of invoke messages
   * @param context world and publishing collaborators
   * @param metrics metrics sink
   */
  public InboundRouter(
      OutboundDispatcher outbound, SceneAuthority scene, ReplicationContext context, MetricsPort metrics) {
    this.outbound = Objects.requireNonNull(outbound, "outbound");
    this.scene = Objects.requireNonNull(scene, "scene");
    this.context = Objects.requireNonNull(context, "context");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Queues a message for the next drain; safe from any thread.
   *
   * @param message decoded message
   */
  public void submit(InboundMessage message) {
    queue.add(Objects.requireNonNull(message, "message"));
  }

  /**
   * Routes every message queued at the time of the call.
   *
   * @return number of messages routed
   */
  public int drain() {
    List<InboundMessage> batch = new ArrayList<>();
    queue.drainTo(batch);
    for (InboundMessage message : batch) {
      try {
        route(message);
      } catch (RuntimeException ex) {
        metrics.increment("inbound.handler.failed");
        log.error("Handler failed for message from client {}", message.client(), ex);
      }
    }
    return batch.size();
  }

  public int queued() {
    return queue.size();
  }

  private void route(InboundMessage message) {
    List<Value> elements = message.elements();
    for (int i = 0; i < elements.size(); i += 2) {
      if (i + 1 >= elements.size()) {
        metrics.increment("inbound.message.truncated");
        log.warn("Client {} sent a message with a dangling type element; ignoring the rest", message.client());
        return;
      }
      if (!(elements.get(i) instanceof Value.Int type)) {
        metrics.increment("inbound.message.truncated");
        log.warn("Client {} sent a non-integer message type {}; ignoring the rest", message.client(), elements.get(i));
        return;
      }
      handle(type.value(), message.client(), elements.get(i + 1));
    }
  }

  private void handle(long type, ClientId client, Value payload) {
    if (type == ProtocolMessage.INTRODUCTION) {
      introduce(client, ProtocolMessage.Introduction.fromPayload(payload));
    } else if (type == ProtocolMessage.INVOKE) {
      scene.onInvoke(context, client, payload);
    } else {
      metrics.increment("inbound.message.unknown");
      log.debug("Ignoring message type {} from client {}", type, client);
    }
  }

  private void introduce(ClientId client, ProtocolMessage.Introduction introduction) {
    log.info("Client {} introduced as '{}'", client, Logs.truncate(introduction.clientName(), MAX_LOGGED_NAME));
    List<ProtocolMessage> messages = new ArrayList<>(context.world().snapshot());
    messages.add(new ProtocolMessage.DocumentReady());
    outbound.submit(OutboundEnvelope.targeted(client, messages, true));
  }
}
