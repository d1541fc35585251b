package ca.gc.cra.noodles.infrastructure.scene;

import ca.gc.cra.noodles.application.port.SceneAuthority;
import ca.gc.cra.noodles.application.scene.ReplicationContext;
import java.time.Duration;

/**
 * Scene that replicates nothing; clients receive an empty snapshot.
 *
 * @since 0.1.0
 */
public final class IdleScene implements SceneAuthority {
  @Override
  public void onStart(ReplicationContext context) {}

  @Override
  public void onTick(ReplicationContext context, Duration elapsed) {}
}
