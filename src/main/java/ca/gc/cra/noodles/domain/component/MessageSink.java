package ca.gc.cra.noodles.domain.component;

import ca.gc.cra.noodles.domain.msg.ProtocolMessage;

/**
 * Receives lifecycle messages emitted by the component store for delivery to every active client.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface MessageSink {
  /** Sink that discards everything; useful for stores that are not replicated. */
  MessageSink DISCARD = message -> {};

  /**
   * Queues one message for broadcast.
   *
   * @param message lifecycle message
   */
  void broadcast(ProtocolMessage message);
}
