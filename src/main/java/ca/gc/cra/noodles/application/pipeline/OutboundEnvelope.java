package ca.gc.cra.noodles.application.pipeline;

import ca.gc.cra.noodles.domain.client.ClientId;
import ca.gc.cra.noodles.domain.msg.ProtocolMessage;
import java.util.List;
import java.util.Objects;

/**
 * Unit of outbound work: messages serialized together into one wire message.
 *
 * @param messages messages in delivery order
 * @param target receiving client, or {@code null} to broadcast to every active client
 * @param promote whether delivery promotes a pending {@code target} to active first
 * @since 0.1.0
 */
public record OutboundEnvelope(List<ProtocolMessage> messages, ClientId target, boolean promote) {
  public OutboundEnvelope {
    messages = List.copyOf(Objects.requireNonNull(messages, "messages"));
    if (promote && target == null) {
      throw new IllegalArgumentException("promote requires a target client");
    }
  }

  /**
   * Envelope delivered to every active client.
   *
   * @param messages messages in delivery order
   * @return broadcast envelope
   */
  public static OutboundEnvelope broadcast(List<ProtocolMessage> messages) {
    return new OutboundEnvelope(messages, null, false);
  }

  /**
   * Envelope delivered to one client.
   *
   * @param target receiving client
   * @param messages messages in delivery order
   * @param promote whether to promote the client before delivery
   * @return targeted envelope
   */
  public static OutboundEnvelope targeted(ClientId target, List<ProtocolMessage> messages, boolean promote) {
    return new OutboundEnvelope(messages, Objects.requireNonNull(target, "target"), promote);
  }
}
