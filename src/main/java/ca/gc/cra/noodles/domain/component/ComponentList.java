package ca.gc.cra.noodles.domain.component;

import ca.gc.cra.noodles.domain.id.IdAllocator;
import ca.gc.cra.noodles.domain.id.ObjectId;
import ca.gc.cra.noodles.domain.msg.ProtocolMessage;
import ca.gc.cra.noodles.domain.value.Value;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Live components of one category together with the allocator that names them.
 * <p><strong>Why:</strong> Every create, patch and delete must be mirrored by exactly one protocol message so
 * clients can rebuild the same state incrementally.</p>
 * <p><strong>Role:</strong> Domain aggregate; emits lifecycle messages through a {@link MessageSink}.</p>
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Inject the allocated id into stored content under the {@code id} key.</li>
 *   <li>Merge patches key by key and broadcast only the delta.</li>
 *   <li>Release identifiers back to the allocator on delete.</li>
 *   <li>Produce insertion-ordered create messages for late-joining clients.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Confined to the tick thread, which is the only writer of
 * replicated content.</p>
 *
 * @since 0.1.0
 */
public final class ComponentList {
  static final String ID_KEY = "id";

  private final ComponentKind kind;
  private final MessageSink sink;
  private final IdAllocator allocator = new IdAllocator();
  private final Map<ObjectId, Component> active = new LinkedHashMap<>();

  /**
   * Creates an empty list for one category.
   *
   * @param kind component category
   * @param sink destination for lifecycle messages
   */
  public ComponentList(ComponentKind kind, MessageSink sink) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.sink = Objects.requireNonNull(sink, "sink");
  }

  public ComponentKind kind() {
    return kind;
  }

  /**
   * Creates a component from {@code content}. The caller's map is copied and never retained; an
   * {@code id} entry in it is replaced by the allocated identifier.
   *
   * @param content initial content
   * @return handle whose {@code close()} deletes the component
   */
  public Component register(Map<String, Value> content) {
    Objects.requireNonNull(content, "content");
    ObjectId id = allocator.allocate();
    Value.Mapping stored = withId(id, content);
    Component component = new Component(id, this, stored);
    active.put(id, component);
    sink.broadcast(new ProtocolMessage.ComponentCreated(kind, stored));
    return component;
  }

  void patch(Component component, Map<String, Value> delta) {
    Objects.requireNonNull(delta, "delta");
    if (!kind.updatable()) {
      throw new IllegalStateException(kind.label() + " components cannot be patched");
    }
    if (component.owner() != this) {
      throw new IllegalArgumentException(component + " is not owned by the " + kind.label() + " list");
    }
    if (component.isClosed()) {
      throw new IllegalStateException(component + " is closed");
    }
    Map<String, Value> merged = new LinkedHashMap<>(component.content().entries());
    delta.forEach((key, value) -> {
      if (!ID_KEY.equals(key)) {
        merged.put(key, Objects.requireNonNull(value, key));
      }
    });
    component.replaceContent(new Value.Mapping(merged));
    sink.broadcast(new ProtocolMessage.ComponentUpdated(kind, withId(component.id(), delta)));
  }

  void delete(Component component) {
    if (active.remove(component.id()) == null) {
      return;
    }
    allocator.release(component.id());
    sink.broadcast(new ProtocolMessage.ComponentDeleted(kind, component.id()));
  }

  /**
   * Returns one create message per live component, in insertion order.
   *
   * @return create messages carrying content snapshots
   */
  public List<ProtocolMessage> snapshot() {
    List<ProtocolMessage> out = new ArrayList<>(active.size());
    for (Component component : active.values()) {
      out.add(new ProtocolMessage.ComponentCreated(kind, component.content()));
    }
    return out;
  }

  public int size() {
    return active.size();
  }

  public Optional<Component> find(ObjectId id) {
    return Optional.ofNullable(active.get(id));
  }

  /**
   * Closes every live component, emitting one delete message each.
   */
  public void closeAll() {
    for (Component component : new ArrayList<>(active.values())) {
      component.close();
    }
  }

  private static Value.Mapping withId(ObjectId id, Map<String, Value> entries) {
    Map<String, Value> out = new LinkedHashMap<>();
    out.put(ID_KEY, id.toValue());
    entries.forEach((key, value) -> {
      if (!ID_KEY.equals(key)) {
        out.put(key, Objects.requireNonNull(value, key));
      }
    });
    return new Value.Mapping(out);
  }
}
