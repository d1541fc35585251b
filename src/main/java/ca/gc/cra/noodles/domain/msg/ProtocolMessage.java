package ca.gc.cra.noodles.domain.msg;

import ca.gc.cra.noodles.domain.component.ComponentKind;
import ca.gc.cra.noodles.domain.id.ObjectId;
import ca.gc.cra.noodles.domain.value.Value;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Closed set of protocol messages exchanged with clients.
 * <p><strong>Why:</strong> Producers build typed messages instead of raw maps so a malformed envelope cannot be
 * queued; the codec flattens them into {@code [type, payload]} pairs.</p>
 * <p><strong>Role:</strong> Domain model consumed by the component store, the inbound router and the codec.</p>
 * <p><strong>Thread-safety:</strong> All variants are immutable.</p>
 *
 * @since 0.1.0
 */
public sealed interface ProtocolMessage
    permits ProtocolMessage.Introduction,
        ProtocolMessage.Invoke,
        ProtocolMessage.ComponentCreated,
        ProtocolMessage.ComponentUpdated,
        ProtocolMessage.ComponentDeleted,
        ProtocolMessage.DocumentReady {

  /** Client introduces itself; sent once per connection. */
  int INTRODUCTION = 0;

  /** Client invokes a method on the scene. */
  int INVOKE = 1;

  /** Server marks the end of the initial snapshot. */
  int DOCUMENT_READY = 35;

  /**
   * Returns the protocol message-type number.
   *
   * @return message type
   */
  int messageType();

  /**
   * Returns the payload half of the {@code [type, payload]} pair.
   *
   * @return payload value
   */
  Value payload();

  /**
   * Client greeting carrying its display name.
   *
   * @param clientName name the client reported
   */
  record Introduction(String clientName) implements ProtocolMessage {
    public Introduction {
      Objects.requireNonNull(clientName, "clientName");
    }

    /**
     * Reads an introduction payload. A payload without a textual {@code client_name} yields an
     * empty name rather than an error.
     *
     * @param payload decoded payload
     * @return introduction message
     */
    public static Introduction fromPayload(Value payload) {
      if (payload instanceof Value.Mapping mapping && mapping.get("client_name") instanceof Value.Text name) {
        return new Introduction(name.value());
      }
      return new Introduction("");
    }

    @Override
    public int messageType() {
      return INTRODUCTION;
    }

    @Override
    public Value payload() {
      return new Value.Mapping(Map.of("client_name", Value.of(clientName)));
    }
  }

  /**
   * Method invocation forwarded untouched to the scene authority.
   *
   * @param payload opaque invocation payload
   */
  record Invoke(Value payload) implements ProtocolMessage {
    public Invoke {
      Objects.requireNonNull(payload, "payload");
    }

    @Override
    public int messageType() {
      return INVOKE;
    }
  }

  /**
   * A component came into existence; carries its full content including {@code id}.
   *
   * @param kind component category
   * @param content full content
   */
  record ComponentCreated(ComponentKind kind, Value.Mapping content) implements ProtocolMessage {
    public ComponentCreated {
      Objects.requireNonNull(kind, "kind");
      Objects.requireNonNull(content, "content");
    }

    @Override
    public int messageType() {
      return kind.createType();
    }

    @Override
    public Value payload() {
      return content;
    }
  }

  /**
   * A component changed; carries only the changed keys plus {@code id}.
   *
   * @param kind component category, which must be updatable
   * @param delta changed keys plus id
   */
  record ComponentUpdated(ComponentKind kind, Value.Mapping delta) implements ProtocolMessage {
    public ComponentUpdated {
      Objects.requireNonNull(kind, "kind");
      Objects.requireNonNull(delta, "delta");
      if (!kind.updatable()) {
        throw new IllegalStateException(kind.label() + " components have no update message");
      }
    }

    @Override
    public int messageType() {
      return kind.updateType().getAsInt();
    }

    @Override
    public Value payload() {
      return delta;
    }
  }

  /**
   * A component was destroyed.
   *
   * @param kind component category
   * @param id identity of the destroyed component
   */
  record ComponentDeleted(ComponentKind kind, ObjectId id) implements ProtocolMessage {
    public ComponentDeleted {
      Objects.requireNonNull(kind, "kind");
      Objects.requireNonNull(id, "id");
    }

    @Override
    public int messageType() {
      return kind.deleteType();
    }

    @Override
    public Value payload() {
      Map<String, Value> entries = new LinkedHashMap<>();
      entries.put("id", id.toValue());
      return new Value.Mapping(entries);
    }
  }

  /** End-of-snapshot marker; its payload is always {@code true}. */
  record DocumentReady() implements ProtocolMessage {
    @Override
    public int messageType() {
      return DOCUMENT_READY;
    }

    @Override
    public Value payload() {
      return Value.TRUE;
    }
  }
}
