package ca.gc.cra.noodles.application.pipeline;

import ca.gc.cra.noodles.domain.client.ClientId;
import ca.gc.cra.noodles.domain.value.Value;
import java.util.List;
import java.util.Objects;

/**
 * Decoded top-level array received from one client, awaiting routing on the tick thread.
 *
 * @param client sender
 * @param elements flat {@code [type, payload, ...]} elements
 * @since 0.1.0
 */
public record InboundMessage(ClientId client, List<Value> elements) {
  public InboundMessage {
    Objects.requireNonNull(client, "client");
    elements = List.copyOf(Objects.requireNonNull(elements, "elements"));
  }
}
