package ca.gc.cra.noodles.domain.component;

import ca.gc.cra.noodles.domain.msg.ProtocolMessage;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregates one {@link ComponentList} per category.
 *
 * <p>Confined to the tick thread, like the lists it owns.</p>
 *
 * @since 0.1.0
 */
public final class World implements AutoCloseable {
  private final Map<ComponentKind, ComponentList> lists = new EnumMap<>(ComponentKind.class);

  /**
   * Creates an empty world whose lists all report to {@code sink}.
   *
   * @param sink destination for lifecycle messages
   */
  public World(MessageSink sink) {
    Objects.requireNonNull(sink, "sink");
    for (ComponentKind kind : ComponentKind.values()) {
      lists.put(kind, new ComponentList(kind, sink));
    }
  }

  public ComponentList list(ComponentKind kind) {
    return lists.get(Objects.requireNonNull(kind, "kind"));
  }

  public ComponentList entities() {
    return list(ComponentKind.ENTITY);
  }

  public ComponentList materials() {
    return list(ComponentKind.MATERIAL);
  }

  public ComponentList geometries() {
    return list(ComponentKind.GEOMETRY);
  }

  public ComponentList buffers() {
    return list(ComponentKind.BUFFER);
  }

  public ComponentList bufferViews() {
    return list(ComponentKind.BUFFER_VIEW);
  }

  public ComponentList images() {
    return list(ComponentKind.IMAGE);
  }

  public ComponentList textures() {
    return list(ComponentKind.TEXTURE);
  }

  /**
   * Returns create messages for every live component, dependencies first: buffers, buffer views,
   * images, textures, materials, geometry, entities.
   *
   * @return ordered snapshot
   */
  public List<ProtocolMessage> snapshot() {
    List<ProtocolMessage> out = new ArrayList<>();
    for (ComponentKind kind : ComponentKind.values()) {
      out.addAll(lists.get(kind).snapshot());
    }
    return out;
  }

  /**
   * Returns the number of live components across all categories.
   *
   * @return component count
   */
  public int size() {
    int total = 0;
    for (ComponentList list : lists.values()) {
      total += list.size();
    }
    return total;
  }

  /** Deletes every live component in reverse snapshot order, entities first and buffers last. */
  @Override
  public void close() {
    ComponentKind[] kinds = ComponentKind.values();
    for (int i = kinds.length - 1; i >= 0; i--) {
      lists.get(kinds[i]).closeAll();
    }
  }
}
