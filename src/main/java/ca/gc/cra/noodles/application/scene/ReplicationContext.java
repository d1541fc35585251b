package ca.gc.cra.noodles.application.scene;

import ca.gc.cra.noodles.application.asset.BufferPublisher;
import ca.gc.cra.noodles.domain.component.World;
import java.util.Objects;

/**
 * Collaborators a scene authority may use; passed explicitly to every callback.
 *
 * @param world replicated component store
 * @param buffers buffer publisher bound to the same world
 * @since 0.1.0
 */
public record ReplicationContext(World world, BufferPublisher buffers) {
  public ReplicationContext {
    Objects.requireNonNull(world, "world");
    Objects.requireNonNull(buffers, "buffers");
  }
}
