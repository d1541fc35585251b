package ca.gc.cra.noodles.domain.component;

import ca.gc.cra.noodles.domain.id.ObjectId;
import ca.gc.cra.noodles.domain.value.Value;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle to one replicated object owned by a {@link ComponentList}.
 *
 * <p>Closing the handle deletes the object and announces the deletion exactly once; later calls are
 * no-ops. Content is replaced wholesale on every patch and never mutated in place.</p>
 *
 * @since 0.1.0
 */
public final class Component implements AutoCloseable {
  private final ObjectId id;
  private final ComponentList owner;
  private final AtomicBoolean closed = new AtomicBoolean();
  private volatile Value.Mapping content;

  Component(ObjectId id, ComponentList owner, Value.Mapping content) {
    this.id = Objects.requireNonNull(id, "id");
    this.owner = Objects.requireNonNull(owner, "owner");
    this.content = Objects.requireNonNull(content, "content");
  }

  public ObjectId id() {
    return id;
  }

  public ComponentKind kind() {
    return owner.kind();
  }

  /**
   * Returns the current content, including the {@code id} entry.
   *
   * @return immutable content snapshot
   */
  public Value.Mapping content() {
    return content;
  }

  /**
   * Merges {@code delta} into this component and broadcasts the change.
   *
   * @param delta keys to upsert
   * @throws IllegalStateException if the category is not updatable or the component is closed
   */
  public void patch(Map<String, Value> delta) {
    owner.patch(this, delta);
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      owner.delete(this);
    }
  }

  ComponentList owner() {
    return owner;
  }

  void replaceContent(Value.Mapping next) {
    this.content = next;
  }

  @Override
  public String toString() {
    return "Component[" + owner.kind().label() + " " + id + "]";
  }
}
