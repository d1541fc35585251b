package ca.gc.cra.noodles.domain.component;

import java.util.OptionalInt;

/**
 * Replicated component categories with their protocol message-type numbers.
 *
 * <p>Declaration order is snapshot order: a client must see buffers before the views that slice
 * them, views before images, and so on up to entities.</p>
 *
 * @since 0.1.0
 */
public enum ComponentKind {
  BUFFER("buffer", 10, -1, 11),
  BUFFER_VIEW("buffer-view", 12, -1, 13),
  IMAGE("image", 17, -1, 18),
  TEXTURE("texture", 19, -1, 20),
  MATERIAL("material", 14, 15, 16),
  GEOMETRY("geometry", 26, -1, 27),
  ENTITY("entity", 4, 5, 6);

  private final String label;
  private final int createType;
  private final int updateType;
  private final int deleteType;

  ComponentKind(String label, int createType, int updateType, int deleteType) {
    this.label = label;
    this.createType = createType;
    this.updateType = updateType;
    this.deleteType = deleteType;
  }

  /**
   * Returns the human-readable category name used in logs.
   *
   * @return category label
   */
  public String label() {
    return label;
  }

  public int createType() {
    return createType;
  }

  /**
   * Returns the update message type, empty for categories that cannot be patched.
   *
   * @return update message type if any
   */
  public OptionalInt updateType() {
    return updateType < 0 ? OptionalInt.empty() : OptionalInt.of(updateType);
  }

  public int deleteType() {
    return deleteType;
  }

  public boolean updatable() {
    return updateType >= 0;
  }
}
